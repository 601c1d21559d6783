package org.dxworks.mdblocks.parser;

import java.util.Objects;

/**
 * Outcome of a line classifier: either the parsed header of the block the line starts, or the reason it
 * does not start one.
 */
final class Classification<T> {

    private final T header;
    private final RejectReason reason;

    private Classification(T header, RejectReason reason) {
        this.header = header;
        this.reason = reason;
    }

    static <T> Classification<T> applies(T header) {
        return new Classification<>(Objects.requireNonNull(header, "header"), null);
    }

    static <T> Classification<T> rejected(RejectReason reason) {
        return new Classification<>(null, Objects.requireNonNull(reason, "reason"));
    }

    boolean applies() {
        return header != null;
    }

    T header() {
        if (header == null) {
            throw new IllegalStateException("Classifier rejected the line: " + reason);
        }
        return header;
    }

    RejectReason reason() {
        return reason;
    }

    @Override
    public String toString() {
        return applies() ? "applies(" + header + ")" : "rejected(" + reason + ")";
    }
}
