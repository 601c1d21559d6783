package org.dxworks.mdblocks.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

final class SourceLines {

    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");

    private SourceLines() {
    }

    /**
     * Splits on any of LF, CRLF and CR. A trailing line break does not start another line.
     */
    static List<SourceLine> split(String text) {
        List<SourceLine> lines = new ArrayList<>();
        if (text.isEmpty()) {
            return lines;
        }
        String[] parts = LINE_BREAK.split(text.replace('\u0000', '\uFFFD'), -1);
        int count = parts.length;
        if (parts[count - 1].isEmpty()) {
            count--;
        }
        for (int i = 0; i < count; i++) {
            lines.add(SourceLine.of(parts[i]));
        }
        return lines;
    }

    static String join(List<SourceLine> lines) {
        List<String> texts = new ArrayList<>(lines.size());
        for (SourceLine line : lines) {
            texts.add(line.text);
        }
        return String.join("\n", texts);
    }
}
