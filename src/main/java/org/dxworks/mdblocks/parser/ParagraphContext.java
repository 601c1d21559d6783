package org.dxworks.mdblocks.parser;

import org.dxworks.mdblocks.model.Heading;
import org.dxworks.mdblocks.model.Paragraph;

import java.util.ArrayList;
import java.util.List;

final class ParagraphContext extends ParsingContext {

    private final List<String> lines = new ArrayList<>();
    private int headingLevel;

    ParagraphContext(String firstLine) {
        lines.add(Indentation.trimLeading(firstLine));
    }

    @Override
    Continuation accept(SourceLine line) {
        if (line.textOnly) {
            lines.add(Indentation.trimLeading(line.text));
            return Continuation.CONTINUE;
        }
        if (line.isBlank()) {
            return Continuation.CLOSE_AND_REPROCESS;
        }
        BlockStart start = BlockStarts.detect(line.text, true);
        switch (start.kind) {
            case SETEXT_UNDERLINE:
                headingLevel = start.setextLevel();
                return Continuation.CLOSE_CONSUMED;
            case PARAGRAPH:
                lines.add(Indentation.trimLeading(line.text));
                return Continuation.CONTINUE;
            default:
                return Continuation.CLOSE_AND_REPROCESS;
        }
    }

    @Override
    void close(BlockSequence out) {
        String literal = Indentation.trimTrailing(String.join("\n", lines));
        out.add(headingLevel > 0 ? new Heading(headingLevel, literal) : new Paragraph(literal));
    }

    @Override
    boolean endsInOpenParagraph() {
        return true;
    }
}
