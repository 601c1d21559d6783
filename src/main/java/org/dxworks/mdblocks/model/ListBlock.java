package org.dxworks.mdblocks.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * A bullet or ordered list.
 * <p>
 * {@code marker} is the bullet character for bullet lists and the delimiter ({@code .} or {@code )})
 * for ordered lists; {@code start} is only set for ordered lists. A tight list's items are meant to be
 * rendered without paragraph wrappers; the paragraphs are kept in the tree either way.
 */
@JsonPropertyOrder({"ordered", "start", "marker", "tight", "items"})
public final class ListBlock extends Node {

    public final boolean ordered;
    public final Integer start;
    public final String marker;
    public final boolean tight;
    public final List<ListItem> items;

    public ListBlock(boolean ordered, Integer start, char marker, boolean tight, List<ListItem> items) {
        this.ordered = ordered;
        this.start = ordered ? start : null;
        this.marker = String.valueOf(marker);
        this.tight = tight;
        this.items = List.copyOf(items);
    }

    @Override
    public List<ListItem> children() {
        return items;
    }
}
