package org.dxworks.mdblocks.parser;

import org.dxworks.mdblocks.model.FencedCodeBlock;

import java.util.ArrayList;
import java.util.List;

/** Collects lines verbatim until a matching closing fence; an unclosed block runs to the end of input. */
final class FencedCodeContext extends ParsingContext {

    private final FenceStart fence;
    private final List<String> content = new ArrayList<>();

    FencedCodeContext(FenceStart fence) {
        this.fence = fence;
    }

    @Override
    Continuation accept(SourceLine line) {
        if (LineClassifiers.closesFence(line.text, fence)) {
            return Continuation.CLOSE_CONSUMED;
        }
        content.add(Indentation.stripSpaces(line.text, fence.indent));
        return Continuation.CONTINUE;
    }

    @Override
    void close(BlockSequence out) {
        out.add(new FencedCodeBlock(fence.info, String.join("\n", content)));
    }
}
