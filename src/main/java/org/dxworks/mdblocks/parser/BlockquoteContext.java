package org.dxworks.mdblocks.parser;

import org.dxworks.mdblocks.model.Blockquote;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects blockquote content with the {@code >} markers stripped. Marker-less lines join only as lazy
 * continuation of an open paragraph.
 */
final class BlockquoteContext extends ParsingContext {

    private final ContainerExtractor extractor;
    private final List<SourceLine> lines = new ArrayList<>();
    private ParagraphProbe probe;

    BlockquoteContext(ContainerExtractor extractor, String firstContent) {
        this.extractor = extractor;
        lines.add(SourceLine.of(firstContent));
    }

    @Override
    Continuation accept(SourceLine line) {
        if (line.textOnly) {
            lines.add(SourceLine.textOnly(line.text));
            return Continuation.CONTINUE;
        }
        if (line.isBlank()) {
            return Continuation.CLOSE_AND_REPROCESS;
        }
        Classification<String> marker = LineClassifiers.blockquoteMarker(line.text);
        if (marker.applies()) {
            lines.add(SourceLine.of(marker.header()));
            return Continuation.CONTINUE;
        }
        if (!BlockStarts.endsLazyContinuation(line.text) && endsInOpenParagraph()) {
            lines.add(SourceLine.textOnly(line.text));
            return Continuation.CONTINUE;
        }
        return Continuation.CLOSE_AND_REPROCESS;
    }

    @Override
    void close(BlockSequence out) {
        out.add(new Blockquote(extractor.reparse(ContainerKind.BLOCKQUOTE, lines).nodes()));
    }

    @Override
    boolean endsInOpenParagraph() {
        if (probe == null) {
            probe = extractor.probe();
        }
        return probe.endsInOpenParagraph(lines);
    }
}
