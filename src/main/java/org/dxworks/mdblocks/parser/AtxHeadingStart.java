package org.dxworks.mdblocks.parser;

final class AtxHeadingStart {

    final int level;
    final String content;

    AtxHeadingStart(int level, String content) {
        this.level = level;
        this.content = content;
    }
}
