package org.dxworks.mdblocks.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * A block of the parsed document. Nodes are immutable once built.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Document.class, name = "document"),
        @JsonSubTypes.Type(value = Paragraph.class, name = "paragraph"),
        @JsonSubTypes.Type(value = Heading.class, name = "heading"),
        @JsonSubTypes.Type(value = Blockquote.class, name = "blockquote"),
        @JsonSubTypes.Type(value = ListBlock.class, name = "list"),
        @JsonSubTypes.Type(value = ListItem.class, name = "list_item"),
        @JsonSubTypes.Type(value = FencedCodeBlock.class, name = "code_block_fenced"),
        @JsonSubTypes.Type(value = IndentedCodeBlock.class, name = "code_block_indented"),
        @JsonSubTypes.Type(value = ThematicBreak.class, name = "thematic_break"),
        @JsonSubTypes.Type(value = Text.class, name = "text")
})
public abstract class Node {

    /**
     * Child blocks in document order; empty for leaves.
     */
    public List<? extends Node> children() {
        return List.of();
    }
}
