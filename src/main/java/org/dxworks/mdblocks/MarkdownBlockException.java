package org.dxworks.mdblocks;

/** Base class for failures raised while building a block tree. */
public class MarkdownBlockException extends RuntimeException {

    public MarkdownBlockException(String message) {
        super(message);
    }
}
