package org.dxworks.mdblocks.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"level", "children"})
public final class Heading extends ParentNode {

    public final int level;

    public Heading(int level, String literal) {
        super(List.of(new Text(literal)));
        if (level < 1 || level > 6) {
            throw new IllegalArgumentException("Heading level must be in 1..6: " + level);
        }
        this.level = level;
    }

    public String literal() {
        return ((Text) children.get(0)).literal;
    }
}
