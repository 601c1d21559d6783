package org.dxworks.mdblocks.parser;

import static org.dxworks.mdblocks.parser.Classification.applies;
import static org.dxworks.mdblocks.parser.Classification.rejected;
import static org.dxworks.mdblocks.parser.Indentation.columns;
import static org.dxworks.mdblocks.parser.Indentation.isBlank;
import static org.dxworks.mdblocks.parser.Indentation.trimLeading;
import static org.dxworks.mdblocks.parser.Indentation.trimTrailing;

/**
 * One pure check per block kind. Each answers whether a single line starts that kind of block.
 */
final class LineClassifiers {

    private static final int MAX_MARKER_INDENT = 3;
    private static final int CODE_INDENT = 4;
    private static final int MAX_HEADING_LEVEL = 6;
    private static final int MIN_FENCE_LENGTH = 3;
    private static final int MAX_ORDINAL_DIGITS = 9;
    private static final int MAX_SPACES_AFTER_MARKER = 4;

    private LineClassifiers() {
    }

    /** Returns the marker character of a thematic break line. */
    static Classification<Character> thematicBreak(String line) {
        if (isBlank(line)) {
            return rejected(RejectReason.EMPTY);
        }
        if (columns(line) > MAX_MARKER_INDENT) {
            return rejected(RejectReason.EXCESS_INDENT);
        }
        String rest = trimLeading(line);
        char marker = rest.charAt(0);
        if (marker != '-' && marker != '_' && marker != '*') {
            return rejected(RejectReason.WRONG_MARKER_CHAR);
        }
        int count = 0;
        for (int i = 0; i < rest.length(); i++) {
            char c = rest.charAt(i);
            if (c == marker) {
                count++;
            } else if (c != ' ' && c != '\t') {
                return rejected(RejectReason.MIXED_CHARS);
            }
        }
        return count >= 3 ? applies(marker) : rejected(RejectReason.TOO_FEW_MARKERS);
    }

    static Classification<AtxHeadingStart> atxHeading(String line) {
        if (isBlank(line)) {
            return rejected(RejectReason.EMPTY);
        }
        if (columns(line) > MAX_MARKER_INDENT) {
            return rejected(RejectReason.EXCESS_INDENT);
        }
        String rest = trimLeading(line);
        if (rest.charAt(0) != '#') {
            return rejected(RejectReason.WRONG_MARKER_CHAR);
        }
        int level = countLeading(rest, '#');
        if (level > MAX_HEADING_LEVEL) {
            return rejected(RejectReason.TOO_MANY_MARKERS);
        }
        String after = rest.substring(level);
        if (!after.isEmpty() && !startsWithSpaceOrTab(after)) {
            return rejected(RejectReason.MISSING_SPACE);
        }
        return applies(new AtxHeadingStart(level, stripClosingSequence(Indentation.trim(after))));
    }

    /**
     * Returns the heading level an underline gives to the open paragraph: 1 for {@code =}, 2 for {@code -}.
     */
    static Classification<Integer> setextUnderline(String line, boolean paragraphOpen) {
        if (!paragraphOpen) {
            return rejected(RejectReason.NO_OPEN_PARAGRAPH);
        }
        if (isBlank(line)) {
            return rejected(RejectReason.EMPTY);
        }
        if (columns(line) > MAX_MARKER_INDENT) {
            return rejected(RejectReason.EXCESS_INDENT);
        }
        String rest = trimTrailing(trimLeading(line));
        char marker = rest.charAt(0);
        if (marker != '=' && marker != '-') {
            return rejected(RejectReason.WRONG_MARKER_CHAR);
        }
        if (countLeading(rest, marker) != rest.length()) {
            return rejected(RejectReason.MIXED_CHARS);
        }
        return applies(marker == '=' ? 1 : 2);
    }

    static Classification<FenceStart> fencedCodeStart(String line) {
        if (isBlank(line)) {
            return rejected(RejectReason.EMPTY);
        }
        int indent = columns(line);
        if (indent > MAX_MARKER_INDENT) {
            return rejected(RejectReason.EXCESS_INDENT);
        }
        String rest = trimLeading(line);
        char fenceChar = rest.charAt(0);
        if (fenceChar != '`' && fenceChar != '~') {
            return rejected(RejectReason.WRONG_MARKER_CHAR);
        }
        int length = countLeading(rest, fenceChar);
        if (length < MIN_FENCE_LENGTH) {
            return rejected(RejectReason.TOO_FEW_MARKERS);
        }
        String info = Indentation.trim(rest.substring(length));
        if (fenceChar == '`' && info.indexOf('`') >= 0) {
            return rejected(RejectReason.BACKTICK_IN_INFO);
        }
        return applies(new FenceStart(fenceChar, length, indent, info.isEmpty() ? null : info));
    }

    /**
     * A closing fence uses the opening character, is at least as long and has nothing but whitespace after it.
     */
    static boolean closesFence(String line, FenceStart fence) {
        if (isBlank(line) || columns(line) > MAX_MARKER_INDENT) {
            return false;
        }
        String rest = trimLeading(line);
        int length = countLeading(rest, fence.fenceChar);
        return length >= fence.length && isBlank(rest.substring(length));
    }

    /** Returns the line with the four columns of code indentation removed. */
    static Classification<String> indentedCodeStart(String line, boolean paragraphOpen) {
        if (isBlank(line)) {
            return rejected(RejectReason.EMPTY);
        }
        if (columns(line) < CODE_INDENT) {
            return rejected(RejectReason.INSUFFICIENT_INDENT);
        }
        if (paragraphOpen) {
            return rejected(RejectReason.INTERRUPTS_PARAGRAPH);
        }
        return applies(Indentation.strip(line, CODE_INDENT));
    }

    /** Returns the line content after {@code >} and at most one following space. */
    static Classification<String> blockquoteMarker(String line) {
        if (isBlank(line)) {
            return rejected(RejectReason.EMPTY);
        }
        if (columns(line) > MAX_MARKER_INDENT) {
            return rejected(RejectReason.EXCESS_INDENT);
        }
        String rest = trimLeading(line);
        if (rest.charAt(0) != '>') {
            return rejected(RejectReason.WRONG_MARKER_CHAR);
        }
        return applies(Indentation.strip(rest.substring(1), columns(line) + 1, 1));
    }

    static Classification<ListMarker> listMarker(String line) {
        if (isBlank(line)) {
            return rejected(RejectReason.EMPTY);
        }
        int indent = columns(line);
        if (indent > MAX_MARKER_INDENT) {
            return rejected(RejectReason.EXCESS_INDENT);
        }
        String rest = trimLeading(line);
        char first = rest.charAt(0);
        boolean ordered;
        char marker;
        int start = 0;
        int markerWidth;
        if (first == '-' || first == '+' || first == '*') {
            ordered = false;
            marker = first;
            markerWidth = 1;
        } else if (isDigit(first)) {
            int digits = 0;
            while (digits < rest.length() && isDigit(rest.charAt(digits))) {
                digits++;
            }
            if (digits > MAX_ORDINAL_DIGITS) {
                return rejected(RejectReason.ORDINAL_TOO_LONG);
            }
            if (digits == rest.length() || (rest.charAt(digits) != '.' && rest.charAt(digits) != ')')) {
                return rejected(RejectReason.WRONG_MARKER_CHAR);
            }
            ordered = true;
            marker = rest.charAt(digits);
            start = Integer.parseInt(rest.substring(0, digits));
            markerWidth = digits + 1;
        } else {
            return rejected(RejectReason.WRONG_MARKER_CHAR);
        }

        String after = rest.substring(markerWidth);
        if (!after.isEmpty() && !startsWithSpaceOrTab(after)) {
            return rejected(RejectReason.MISSING_SPACE);
        }
        if (isBlank(after)) {
            return applies(new ListMarker(ordered, marker, start, indent + markerWidth + 1, ""));
        }
        int afterColumn = indent + markerWidth;
        int spaces = Math.min(columns(after, afterColumn), MAX_SPACES_AFTER_MARKER);
        return applies(new ListMarker(ordered, marker, start, afterColumn + spaces,
                Indentation.strip(after, afterColumn, spaces)));
    }

    /**
     * A list marker that may interrupt an open paragraph: it needs content, and an ordered one must start at 1.
     */
    static Classification<ListMarker> listMarkerInterruptingParagraph(String line) {
        Classification<ListMarker> result = listMarker(line);
        if (!result.applies()) {
            return result;
        }
        ListMarker marker = result.header();
        if (marker.empty || (marker.ordered && marker.start != 1)) {
            return rejected(RejectReason.INTERRUPTS_PARAGRAPH);
        }
        return result;
    }

    static String stripClosingSequence(String content) {
        int end = content.length();
        while (end > 0 && content.charAt(end - 1) == '#') {
            end--;
        }
        if (end == content.length()) {
            return content;
        }
        if (end == 0) {
            return "";
        }
        char before = content.charAt(end - 1);
        if (before == ' ' || before == '\t') {
            return trimTrailing(content.substring(0, end));
        }
        return content;
    }

    private static int countLeading(String text, char c) {
        int count = 0;
        while (count < text.length() && text.charAt(count) == c) {
            count++;
        }
        return count;
    }

    private static boolean startsWithSpaceOrTab(String text) {
        char c = text.charAt(0);
        return c == ' ' || c == '\t';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
