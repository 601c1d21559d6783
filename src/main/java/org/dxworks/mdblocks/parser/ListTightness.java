package org.dxworks.mdblocks.parser;

import java.util.List;

/**
 * Decides whether a finished list is tight from the blank-line gaps recorded while it was parsed.
 */
final class ListTightness {

    private ListTightness() {
    }

    /**
     * A list is loose when blank lines separate two of its items, or when blank lines separate two direct
     * children of one item. Gaps inside nested containers do not count.
     */
    static boolean isTight(boolean blankBetweenItems, List<BlockSequence> itemContents) {
        if (blankBetweenItems) {
            return false;
        }
        for (BlockSequence content : itemContents) {
            if (content.hasGapBetweenBlocks()) {
                return false;
            }
        }
        return true;
    }
}
