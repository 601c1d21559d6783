package org.dxworks.mdblocks.parser;

import org.dxworks.mdblocks.model.ListBlock;
import org.dxworks.mdblocks.model.ListItem;

import java.util.ArrayList;
import java.util.List;

/**
 * An open list. Lines indented to the current item's content indent continue that item, a marker of the
 * same kind starts the next item, and blank lines are held back until the next line shows which applies.
 */
final class ListContext extends ParsingContext {

    private final ContainerExtractor extractor;
    private final ListMarker first;
    private final List<ListItemLines> items = new ArrayList<>();
    private ListItemLines current;
    private int pendingBlankLines;
    private boolean blankBetweenItems;

    ListContext(ContainerExtractor extractor, ListMarker first) {
        this.extractor = extractor;
        this.first = first;
        this.current = new ListItemLines(first);
    }

    @Override
    Continuation accept(SourceLine line) {
        if (line.textOnly) {
            flushPendingBlankLines();
            current.addTextOnly(line.text);
            return Continuation.CONTINUE;
        }
        if (line.isBlank()) {
            pendingBlankLines++;
            return Continuation.DEFER_BLANK;
        }

        String text = line.text;
        if (Indentation.columns(text) >= current.contentIndent && current.acceptsContentAfter(pendingBlankLines)) {
            flushPendingBlankLines();
            current.add(Indentation.strip(text, current.contentIndent));
            return Continuation.CONTINUE;
        }
        if (LineClassifiers.thematicBreak(text).applies()) {
            return Continuation.CLOSE_AND_REPROCESS;
        }
        Classification<ListMarker> marker = LineClassifiers.listMarker(text);
        if (marker.applies() && marker.header().sameKindAs(first)) {
            if (pendingBlankLines > 0) {
                blankBetweenItems = true;
            }
            pendingBlankLines = 0;
            items.add(current);
            current = new ListItemLines(marker.header());
            return Continuation.CONTINUE;
        }
        if (pendingBlankLines == 0
                && !BlockStarts.endsLazyContinuation(text)
                && current.endsInOpenParagraph(extractor)) {
            current.addTextOnly(text);
            return Continuation.CONTINUE;
        }
        return Continuation.CLOSE_AND_REPROCESS;
    }

    @Override
    void close(BlockSequence out) {
        List<ListItemLines> all = items();
        List<BlockSequence> contents = new ArrayList<>(all.size());
        List<ListItem> nodes = new ArrayList<>(all.size());
        for (ListItemLines item : all) {
            BlockSequence content = extractor.reparse(ContainerKind.LIST_ITEM, item.lines());
            contents.add(content);
            nodes.add(new ListItem(content.nodes()));
        }
        boolean tight = ListTightness.isTight(blankBetweenItems, contents);
        out.add(new ListBlock(first.ordered, first.start, first.marker, tight, nodes));
    }

    @Override
    int pendingBlankLines() {
        return pendingBlankLines;
    }

    @Override
    boolean endsInOpenParagraph() {
        return pendingBlankLines == 0 && current.endsInOpenParagraph(extractor);
    }

    /** Items collected so far, the open one last. */
    List<ListItemLines> items() {
        List<ListItemLines> all = new ArrayList<>(items);
        all.add(current);
        return all;
    }

    private void flushPendingBlankLines() {
        for (; pendingBlankLines > 0; pendingBlankLines--) {
            current.addBlank();
        }
    }
}
