package org.dxworks.mdblocks.parser;

/** Why a line classifier did not match. */
enum RejectReason {
    EMPTY,
    EXCESS_INDENT,
    INSUFFICIENT_INDENT,
    WRONG_MARKER_CHAR,
    TOO_FEW_MARKERS,
    TOO_MANY_MARKERS,
    MIXED_CHARS,
    MISSING_SPACE,
    BACKTICK_IN_INFO,
    ORDINAL_TOO_LONG,
    NO_OPEN_PARAGRAPH,
    INTERRUPTS_PARAGRAPH
}
