package org.dxworks.mdblocks.parser;

/**
 * Column arithmetic over leading whitespace. Tabs advance to the next multiple of {@value #TAB_WIDTH}
 * columns.
 */
final class Indentation {

    static final int TAB_WIDTH = 4;

    private Indentation() {
    }

    static boolean isBlank(String line) {
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c != ' ' && c != '\t') {
                return false;
            }
        }
        return true;
    }

    static int columns(String line) {
        return columns(line, 0);
    }

    /** Width of the leading whitespace of {@code text} when its first character sits at {@code startColumn}. */
    static int columns(String text, int startColumn) {
        int column = startColumn;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ' ') {
                column++;
            } else if (c == '\t') {
                column = nextTabStop(column);
            } else {
                break;
            }
        }
        return column - startColumn;
    }

    static String strip(String line, int columns) {
        return strip(line, 0, columns);
    }

    /**
     * Removes up to {@code columns} columns of leading whitespace from text whose first character sits at
     * {@code startColumn}. The unused part of a tab that straddles the cut is kept as spaces. When the cut
     * is off a tab stop, the remaining leading tabs become spaces so they keep their width.
     */
    static String strip(String text, int startColumn, int columns) {
        int end = startColumn + columns;
        int column = startColumn;
        int i = 0;
        while (i < text.length() && column < end) {
            char c = text.charAt(i);
            if (c == ' ') {
                column++;
            } else if (c == '\t') {
                column = nextTabStop(column);
            } else {
                break;
            }
            i++;
        }
        String rest = text.substring(i);
        if (end % TAB_WIDTH != 0) {
            rest = expandLeadingTabs(rest, column);
        }
        return column > end ? " ".repeat(column - end) + rest : rest;
    }

    /** Removes up to {@code max} leading spaces, leaving tabs alone. */
    static String stripSpaces(String line, int max) {
        int i = 0;
        while (i < max && i < line.length() && line.charAt(i) == ' ') {
            i++;
        }
        return line.substring(i);
    }

    private static String expandLeadingTabs(String text, int startColumn) {
        StringBuilder out = new StringBuilder();
        int column = startColumn;
        int i = 0;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            int next = text.charAt(i) == ' ' ? column + 1 : nextTabStop(column);
            out.append(" ".repeat(next - column));
            column = next;
            i++;
        }
        return i == 0 ? text : out.append(text, i, text.length()).toString();
    }

    private static int nextTabStop(int column) {
        return column + TAB_WIDTH - column % TAB_WIDTH;
    }

    static String trimLeading(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return line.substring(i);
    }

    static String trimTrailing(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == ' ' || line.charAt(end - 1) == '\t')) {
            end--;
        }
        return line.substring(0, end);
    }

    static String trim(String line) {
        return trimTrailing(trimLeading(line));
    }
}
