package org.dxworks.mdblocks.model;

/**
 * Unparsed inline Markdown, exactly as it remains after block-level stripping.
 */
public final class Text extends Node {

    public final String literal;

    public Text(String literal) {
        this.literal = literal;
    }
}
