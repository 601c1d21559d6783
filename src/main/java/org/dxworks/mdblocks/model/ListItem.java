package org.dxworks.mdblocks.model;

import java.util.List;

public final class ListItem extends ParentNode {

    public ListItem(List<? extends Node> children) {
        super(children);
    }
}
