package org.dxworks.mdblocks.parser;

import org.dxworks.mdblocks.MdBlocksConfig;
import org.dxworks.mdblocks.NestingTooDeepException;
import org.dxworks.mdblocks.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Parses Markdown text into a tree of block nodes. Inline content is left as raw text in the leaves.
 * <p>
 * Instances hold no per-document state and may be shared between threads.
 */
public class MarkdownBlockParser {

    private static final Logger log = LoggerFactory.getLogger(MarkdownBlockParser.class);

    private final MdBlocksConfig config;

    public MarkdownBlockParser() {
        this(MdBlocksConfig.defaults());
    }

    public MarkdownBlockParser(MdBlocksConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Parses with the default configuration.
     */
    public static Document parseDocument(String text) {
        return new MarkdownBlockParser().parse(text);
    }

    /**
     * Builds the block tree of {@code text}. Any text is valid Markdown, so this only fails when
     * containers nest deeper than the configured limit.
     *
     * @throws NestingTooDeepException if the nesting limit is exceeded
     */
    public Document parse(String text) {
        Objects.requireNonNull(text, "text");
        List<SourceLine> lines = SourceLines.split(text);
        BlockSequence blocks = BlockParser.parse(lines, config, 0);
        log.debug("Parsed {} lines into {} top-level blocks", lines.size(), blocks.size());
        return new Document(blocks.nodes());
    }
}
