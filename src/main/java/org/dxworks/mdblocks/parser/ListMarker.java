package org.dxworks.mdblocks.parser;

/**
 * A list item marker line.
 * <p>
 * {@code marker} is the bullet character or, for ordered items, the delimiter. {@code contentIndent} is the
 * column at which the item's content starts; later lines must reach it to continue the item.
 */
final class ListMarker {

    final boolean ordered;
    final char marker;
    final int start;
    final int contentIndent;
    final String content;
    final boolean empty;

    ListMarker(boolean ordered, char marker, int start, int contentIndent, String content) {
        this.ordered = ordered;
        this.marker = marker;
        this.start = start;
        this.contentIndent = contentIndent;
        this.content = content;
        this.empty = content.isEmpty();
    }

    boolean sameKindAs(ListMarker other) {
        return ordered == other.ordered && marker == other.marker;
    }
}
