package org.dxworks.mdblocks.parser;

import org.dxworks.mdblocks.model.IndentedCodeBlock;

import java.util.ArrayList;
import java.util.List;

final class IndentedCodeContext extends ParsingContext {

    private static final int CODE_INDENT = 4;

    private final List<String> content = new ArrayList<>();
    private int pendingBlankLines;

    IndentedCodeContext(String firstLine) {
        content.add(firstLine);
    }

    @Override
    Continuation accept(SourceLine line) {
        if (!line.textOnly && Indentation.columns(line.text) >= CODE_INDENT) {
            for (; pendingBlankLines > 0; pendingBlankLines--) {
                content.add("");
            }
            content.add(Indentation.strip(line.text, CODE_INDENT));
            return Continuation.CONTINUE;
        }
        if (line.isBlank()) {
            pendingBlankLines++;
            return Continuation.DEFER_BLANK;
        }
        return Continuation.CLOSE_AND_REPROCESS;
    }

    @Override
    void close(BlockSequence out) {
        int from = 0;
        int to = content.size();
        while (from < to && Indentation.isBlank(content.get(from))) {
            from++;
        }
        while (to > from && Indentation.isBlank(content.get(to - 1))) {
            to--;
        }
        out.add(new IndentedCodeBlock(String.join("\n", content.subList(from, to))));
    }

    /** Held-back blanks plus whitespace-only lines that close() trims off the end. */
    @Override
    int pendingBlankLines() {
        int trailing = 0;
        for (int i = content.size() - 1; i > 0 && Indentation.isBlank(content.get(i)); i--) {
            trailing++;
        }
        return pendingBlankLines + trailing;
    }
}
