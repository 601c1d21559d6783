package org.dxworks.mdblocks.parser;

import org.dxworks.mdblocks.model.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Blocks emitted by one dispatcher, each remembering whether blank lines separated it from the previous one.
 */
final class BlockSequence {

    private final List<Node> nodes = new ArrayList<>();
    private final List<Boolean> gapBefore = new ArrayList<>();
    private boolean pendingGap;

    void add(Node node) {
        add(node, false);
    }

    /** Records that blank lines were seen; the next block added starts after a gap. */
    void markGap() {
        pendingGap = true;
    }

    void appendAll(BlockSequence other) {
        for (int i = 0; i < other.nodes.size(); i++) {
            add(other.nodes.get(i), other.gapBefore.get(i));
        }
    }

    /** True when two consecutive blocks of this sequence are separated by blank lines. */
    boolean hasGapBetweenBlocks() {
        for (int i = 1; i < gapBefore.size(); i++) {
            if (gapBefore.get(i)) {
                return true;
            }
        }
        return false;
    }

    List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    int size() {
        return nodes.size();
    }

    private void add(Node node, boolean gap) {
        nodes.add(node);
        gapBefore.add(pendingGap || gap);
        pendingGap = false;
    }
}
