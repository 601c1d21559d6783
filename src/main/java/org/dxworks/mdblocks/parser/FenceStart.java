package org.dxworks.mdblocks.parser;

/** Opening fence of a fenced code block. */
final class FenceStart {

    final char fenceChar;
    final int length;
    final int indent;
    final String info; // null when absent

    FenceStart(char fenceChar, int length, int indent, String info) {
        this.fenceChar = fenceChar;
        this.length = length;
        this.indent = indent;
        this.info = info;
    }
}
