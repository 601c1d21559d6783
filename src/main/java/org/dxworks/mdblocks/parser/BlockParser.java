package org.dxworks.mdblocks.parser;

import org.dxworks.mdblocks.MdBlocksConfig;
import org.dxworks.mdblocks.NestingTooDeepException;
import org.dxworks.mdblocks.model.Heading;
import org.dxworks.mdblocks.model.ThematicBreak;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The line dispatcher. At most one block is open at a time; nested containers are handled by
 * {@link ContainerExtractor}, which runs a fresh dispatcher over their content.
 */
final class BlockParser {

    private static final Logger log = LoggerFactory.getLogger(BlockParser.class);

    private final ContainerExtractor extractor;
    private final BlockSequence blocks = new BlockSequence();
    private ParsingContext open;

    BlockParser(MdBlocksConfig config, int depth) {
        if (depth > config.getMaxNestingDepth()) {
            log.debug("Refusing to parse container content at depth {}", depth);
            throw new NestingTooDeepException(depth, config.getMaxNestingDepth());
        }
        this.extractor = new ContainerExtractor(config, depth + 1);
    }

    static BlockSequence parse(List<SourceLine> lines, MdBlocksConfig config, int depth) {
        BlockParser parser = new BlockParser(config, depth);
        for (SourceLine line : lines) {
            parser.feed(line);
        }
        return parser.finish();
    }

    void feed(SourceLine line) {
        if (open != null) {
            switch (open.accept(line)) {
                case CONTINUE, DEFER_BLANK -> {
                    return;
                }
                case CLOSE_CONSUMED -> {
                    closeOpen();
                    return;
                }
                case CLOSE_AND_REPROCESS -> closeOpen();
            }
        }
        start(line);
    }

    /** Closes whatever is still open and returns everything emitted. */
    BlockSequence finish() {
        if (open != null) {
            closeOpen();
        }
        return blocks;
    }

    boolean endsInOpenParagraph() {
        return open != null && open.endsInOpenParagraph();
    }

    /**
     * True when a blank line fed next would leave nothing open: no block is open, or the open one is a
     * paragraph or blockquote, which a blank line closes.
     */
    boolean isAtChunkBoundary() {
        return open == null || open instanceof ParagraphContext || open instanceof BlockquoteContext;
    }

    private void closeOpen() {
        ParsingContext closing = open;
        open = null;
        closing.close(blocks);
        if (closing.pendingBlankLines() > 0) {
            blocks.markGap();
        }
    }

    private void start(SourceLine line) {
        if (line.isBlank()) {
            blocks.markGap();
            return;
        }
        if (line.textOnly) {
            open = new ParagraphContext(line.text);
            return;
        }
        BlockStart start = BlockStarts.detect(line.text, false);
        switch (start.kind) {
            case FENCED_CODE -> open = new FencedCodeContext(start.fence());
            case THEMATIC_BREAK -> blocks.add(new ThematicBreak(start.thematicBreakMarker()));
            case BLOCKQUOTE -> open = new BlockquoteContext(extractor, start.quotedContent());
            case ATX_HEADING -> {
                AtxHeadingStart heading = start.atxHeading();
                blocks.add(new Heading(heading.level, heading.content));
            }
            case LIST_ITEM -> open = new ListContext(extractor, start.listMarker());
            case INDENTED_CODE -> open = new IndentedCodeContext(start.codeLine());
            default -> open = new ParagraphContext(line.text);
        }
    }
}
