package org.dxworks.mdblocks.parser;

/**
 * One input line as seen by a dispatcher.
 * <p>
 * A text-only line was admitted into a container by lazy continuation. It belongs to the paragraph that was
 * open when it arrived and is never classified again.
 */
final class SourceLine {

    final String text;
    final boolean textOnly;

    private SourceLine(String text, boolean textOnly) {
        this.text = text;
        this.textOnly = textOnly;
    }

    static SourceLine of(String text) {
        return new SourceLine(text, false);
    }

    static SourceLine textOnly(String text) {
        return new SourceLine(text, true);
    }

    boolean isBlank() {
        return Indentation.isBlank(text);
    }

    @Override
    public String toString() {
        return textOnly ? "~" + text : text;
    }
}
