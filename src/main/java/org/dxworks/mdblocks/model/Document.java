package org.dxworks.mdblocks.model;

import java.util.List;

public final class Document extends ParentNode {

    public Document(List<? extends Node> children) {
        super(children);
    }
}
