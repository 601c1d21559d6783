package org.dxworks.mdblocks.model;

import java.util.List;

/** A node whose content is a sequence of child nodes. */
public abstract class ParentNode extends Node {

    public final List<Node> children;

    protected ParentNode(List<? extends Node> children) {
        this.children = List.copyOf(children);
    }

    @Override
    public List<Node> children() {
        return children;
    }
}
