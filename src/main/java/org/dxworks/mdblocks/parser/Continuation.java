package org.dxworks.mdblocks.parser;

/** What an open context did with the line it was offered. */
enum Continuation {
    /** The line was added to the context. */
    CONTINUE,
    /** A blank line was held back until a following line shows whether the context goes on. */
    DEFER_BLANK,
    /** The line completed the context (closing fence, setext underline) and was consumed. */
    CLOSE_CONSUMED,
    /** The context is finished; the line must be dispatched again as the start of a new block. */
    CLOSE_AND_REPROCESS
}
