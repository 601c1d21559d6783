package org.dxworks.mdblocks.parser;

import java.util.List;

/**
 * Tracks whether a container's content ends in an open paragraph. Lines reach the nested dispatcher once,
 * as the container collects them.
 */
final class ParagraphProbe {

    private final BlockParser parser;
    private int fed;

    ParagraphProbe(BlockParser parser) {
        this.parser = parser;
    }

    /** {@code lines} must extend the list passed on earlier calls. */
    boolean endsInOpenParagraph(List<SourceLine> lines) {
        for (; fed < lines.size(); fed++) {
            parser.feed(lines.get(fed));
        }
        return parser.endsInOpenParagraph();
    }
}
