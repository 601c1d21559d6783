package org.dxworks.mdblocks.parser;

import java.util.List;

/**
 * How a container's extracted lines are parsed again.
 */
enum ReparsePolicy {
    /**
     * Join the lines and parse the resulting text in one pass. Only valid when no line is text-only, since
     * joining loses that tag.
     */
    WHOLE_BLOCK,
    /**
     * Parse blank-line delimited chunks one at a time, keeping text-only tags. A chunk only ends at a blank
     * line that leaves no code block or list open.
     */
    BLANK_LINE_CHUNKS;

    static ReparsePolicy select(List<SourceLine> lines) {
        for (SourceLine line : lines) {
            if (line.textOnly) {
                return BLANK_LINE_CHUNKS;
            }
        }
        return WHOLE_BLOCK;
    }
}
