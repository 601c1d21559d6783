package org.dxworks.mdblocks.parser;

enum BlockKind {
    FENCED_CODE,
    THEMATIC_BREAK,
    BLOCKQUOTE,
    ATX_HEADING,
    SETEXT_UNDERLINE,
    LIST_ITEM,
    INDENTED_CODE,
    PARAGRAPH
}
