package org.dxworks.mdblocks.model;

public final class IndentedCodeBlock extends Node {

    public final String content;

    public IndentedCodeBlock(String content) {
        this.content = content;
    }
}
