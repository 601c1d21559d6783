package org.dxworks.mdblocks.parser;

/** Container blocks whose content is parsed again as a nested document. */
enum ContainerKind {
    BLOCKQUOTE,
    LIST_ITEM
}
