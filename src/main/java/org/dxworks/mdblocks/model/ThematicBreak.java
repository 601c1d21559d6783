package org.dxworks.mdblocks.model;

public final class ThematicBreak extends Node {

    public final String marker; // "-", "*" or "_"

    public ThematicBreak(char marker) {
        this.marker = String.valueOf(marker);
    }
}
