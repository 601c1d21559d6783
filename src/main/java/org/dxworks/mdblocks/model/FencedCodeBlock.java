package org.dxworks.mdblocks.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Optional;

@JsonPropertyOrder({"info", "content"})
public final class FencedCodeBlock extends Node {

    public final String info; // null when the fence has no info string
    public final String content;

    public FencedCodeBlock(String info, String content) {
        this.info = info == null || info.isEmpty() ? null : info;
        this.content = content;
    }

    public Optional<String> info() {
        return Optional.ofNullable(info);
    }
}
