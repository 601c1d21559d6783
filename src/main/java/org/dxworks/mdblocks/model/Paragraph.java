package org.dxworks.mdblocks.model;

import java.util.List;

/** Paragraph leaf; its single {@link Text} child holds the raw inline source. */
public final class Paragraph extends ParentNode {

    public Paragraph(String literal) {
        super(List.of(new Text(literal)));
    }

    public String literal() {
        return ((Text) children.get(0)).literal;
    }
}
