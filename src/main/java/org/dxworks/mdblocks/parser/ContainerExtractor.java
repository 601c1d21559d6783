package org.dxworks.mdblocks.parser;

import org.dxworks.mdblocks.MdBlocksConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the children of a blockquote or list item by running a nested dispatcher over the container's
 * stripped lines, one nesting level deeper than the dispatcher that owns the container.
 */
final class ContainerExtractor {

    private static final Logger log = LoggerFactory.getLogger(ContainerExtractor.class);

    private final MdBlocksConfig config;
    private final int childDepth;

    ContainerExtractor(MdBlocksConfig config, int childDepth) {
        this.config = config;
        this.childDepth = childDepth;
    }

    BlockSequence reparse(ContainerKind kind, List<SourceLine> lines) {
        ReparsePolicy policy = ReparsePolicy.select(lines);
        log.trace("Reparsing {} ({} lines) at depth {} as {}", kind, lines.size(), childDepth, policy);
        return switch (policy) {
            case WHOLE_BLOCK -> reparseJoined(lines);
            case BLANK_LINE_CHUNKS -> reparseChunks(lines);
        };
    }

    /** A probe running one nesting level deeper, fed as the container grows. */
    ParagraphProbe probe() {
        return new ParagraphProbe(new BlockParser(config, childDepth));
    }

    private BlockSequence reparseJoined(List<SourceLine> lines) {
        return BlockParser.parse(SourceLines.split(SourceLines.join(lines)), config, childDepth);
    }

    private BlockSequence reparseChunks(List<SourceLine> lines) {
        BlockSequence result = new BlockSequence();
        BlockParser boundaries = new BlockParser(config, childDepth);
        List<SourceLine> chunk = new ArrayList<>();
        for (SourceLine line : lines) {
            if (line.isBlank() && boundaries.isAtChunkBoundary()) {
                if (!chunk.isEmpty()) {
                    result.appendAll(BlockParser.parse(chunk, config, childDepth));
                    chunk = new ArrayList<>();
                }
                result.markGap();
            } else {
                chunk.add(line);
            }
            boundaries.feed(line);
        }
        if (!chunk.isEmpty()) {
            result.appendAll(BlockParser.parse(chunk, config, childDepth));
        }
        return result;
    }
}
