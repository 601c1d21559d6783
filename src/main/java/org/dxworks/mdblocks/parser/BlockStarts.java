package org.dxworks.mdblocks.parser;

import java.util.List;

import static org.dxworks.mdblocks.parser.BlockKind.ATX_HEADING;
import static org.dxworks.mdblocks.parser.BlockKind.BLOCKQUOTE;
import static org.dxworks.mdblocks.parser.BlockKind.FENCED_CODE;
import static org.dxworks.mdblocks.parser.BlockKind.INDENTED_CODE;
import static org.dxworks.mdblocks.parser.BlockKind.LIST_ITEM;
import static org.dxworks.mdblocks.parser.BlockKind.SETEXT_UNDERLINE;
import static org.dxworks.mdblocks.parser.BlockKind.THEMATIC_BREAK;

/**
 * Runs the line classifiers in a fixed order; the first one that applies decides the block kind.
 * Lines no classifier claims are paragraph text.
 */
final class BlockStarts {

    /** Order used when no paragraph is open. */
    static final List<BlockKind> AT_BLOCK_BOUNDARY = List.of(
            FENCED_CODE, THEMATIC_BREAK, BLOCKQUOTE, ATX_HEADING, LIST_ITEM, INDENTED_CODE);

    /** Order used on the line after an open paragraph; an underline settles it before anything else. */
    static final List<BlockKind> WITHIN_PARAGRAPH = List.of(
            SETEXT_UNDERLINE, FENCED_CODE, THEMATIC_BREAK, BLOCKQUOTE, ATX_HEADING, LIST_ITEM, INDENTED_CODE);

    /** Kinds that rule out lazy continuation of a paragraph inside an enclosing container. */
    static final List<BlockKind> LAZY_INTERRUPTERS = List.of(
            FENCED_CODE, THEMATIC_BREAK, BLOCKQUOTE, ATX_HEADING, LIST_ITEM);

    private BlockStarts() {
    }

    static BlockStart detect(String line, boolean paragraphOpen) {
        return firstMatch(paragraphOpen ? WITHIN_PARAGRAPH : AT_BLOCK_BOUNDARY, line, paragraphOpen);
    }

    /**
     * Whether the line starts a block of its own in a container whose innermost paragraph is still open, so
     * it cannot be a lazy continuation line. That paragraph is not the line's direct parent, so any list
     * marker counts, empty or with any ordinal.
     */
    static boolean endsLazyContinuation(String line) {
        return firstMatch(LAZY_INTERRUPTERS, line, false).kind != BlockKind.PARAGRAPH;
    }

    private static BlockStart firstMatch(List<BlockKind> order, String line, boolean paragraphOpen) {
        for (BlockKind kind : order) {
            Classification<?> result = classify(kind, line, paragraphOpen);
            if (result.applies()) {
                return new BlockStart(kind, result.header());
            }
        }
        return new BlockStart(BlockKind.PARAGRAPH, line);
    }

    private static Classification<?> classify(BlockKind kind, String line, boolean paragraphOpen) {
        return switch (kind) {
            case FENCED_CODE -> LineClassifiers.fencedCodeStart(line);
            case THEMATIC_BREAK -> LineClassifiers.thematicBreak(line);
            case BLOCKQUOTE -> LineClassifiers.blockquoteMarker(line);
            case ATX_HEADING -> LineClassifiers.atxHeading(line);
            case SETEXT_UNDERLINE -> LineClassifiers.setextUnderline(line, paragraphOpen);
            case LIST_ITEM -> paragraphOpen
                    ? LineClassifiers.listMarkerInterruptingParagraph(line)
                    : LineClassifiers.listMarker(line);
            case INDENTED_CODE -> LineClassifiers.indentedCodeStart(line, paragraphOpen);
            case PARAGRAPH -> throw new IllegalArgumentException("Paragraph is the fallback, not a classifier");
        };
    }
}
