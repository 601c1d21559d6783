package org.dxworks.mdblocks.model;

import java.util.List;

public final class Blockquote extends ParentNode {

    public Blockquote(List<? extends Node> children) {
        super(children);
    }
}
