package org.dxworks.mdblocks.parser;

/** The kind of block a line starts, with the header its classifier parsed. */
final class BlockStart {

    final BlockKind kind;
    private final Object header;

    BlockStart(BlockKind kind, Object header) {
        this.kind = kind;
        this.header = header;
    }

    FenceStart fence() {
        return (FenceStart) header;
    }

    char thematicBreakMarker() {
        return (Character) header;
    }

    /** Blockquote content with the marker removed. */
    String quotedContent() {
        return (String) header;
    }

    AtxHeadingStart atxHeading() {
        return (AtxHeadingStart) header;
    }

    int setextLevel() {
        return (Integer) header;
    }

    ListMarker listMarker() {
        return (ListMarker) header;
    }

    /** Indented code line with the code indent removed. */
    String codeLine() {
        return (String) header;
    }
}
