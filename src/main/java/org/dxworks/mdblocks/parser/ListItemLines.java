package org.dxworks.mdblocks.parser;

import java.util.ArrayList;
import java.util.List;

/** Content lines of one list item, with the item's content indent already removed. */
final class ListItemLines {

    final int contentIndent;
    private final boolean startedEmpty;
    private final List<SourceLine> lines = new ArrayList<>();
    private ParagraphProbe probe;

    ListItemLines(ListMarker marker) {
        this.contentIndent = marker.contentIndent;
        this.startedEmpty = marker.empty;
        lines.add(SourceLine.of(marker.content));
    }

    void add(String content) {
        lines.add(SourceLine.of(content));
    }

    void addBlank() {
        lines.add(SourceLine.of(""));
    }

    void addTextOnly(String text) {
        lines.add(SourceLine.textOnly(text));
    }

    /**
     * An item whose marker line was empty may only be continued directly; after a blank line it is over.
     */
    boolean acceptsContentAfter(int pendingBlankLines) {
        if (pendingBlankLines == 0 || !startedEmpty) {
            return true;
        }
        for (SourceLine line : lines) {
            if (!line.isBlank()) {
                return true;
            }
        }
        return false;
    }

    boolean endsInOpenParagraph(ContainerExtractor extractor) {
        if (probe == null) {
            probe = extractor.probe();
        }
        return probe.endsInOpenParagraph(lines);
    }

    List<SourceLine> lines() {
        return lines;
    }
}
