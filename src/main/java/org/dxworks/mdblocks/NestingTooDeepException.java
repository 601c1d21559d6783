package org.dxworks.mdblocks;

/**
 * Thrown when container blocks nest deeper than {@link MdBlocksConfig#getMaxNestingDepth()}.
 */
public final class NestingTooDeepException extends MarkdownBlockException {

    private final int depth;
    private final int limit;

    public NestingTooDeepException(int depth, int limit) {
        super("Container nesting depth " + depth + " exceeds the limit of " + limit);
        this.depth = depth;
        this.limit = limit;
    }

    public int getDepth() {
        return depth;
    }

    public int getLimit() {
        return limit;
    }
}
