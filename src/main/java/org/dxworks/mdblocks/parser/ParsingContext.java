package org.dxworks.mdblocks.parser;

/**
 * The block currently open in a dispatcher, with the continuation rule for its kind.
 */
abstract class ParsingContext {

    /** Offers the next line to the open block. */
    abstract Continuation accept(SourceLine line);

    /** Converts the collected lines into nodes. */
    abstract void close(BlockSequence out);

    /** Blank lines still held back; they are dropped when the context closes. */
    int pendingBlankLines() {
        return 0;
    }

    /** Whether the innermost block still open inside this context is a paragraph. */
    boolean endsInOpenParagraph() {
        return false;
    }
}
