package com.dfanalyzer.trace.index;

import java.io.IOException;

/**
 * The line index of a shard could not be built or used.
 */
public class LineIndexException extends IOException {

    private static final long serialVersionUID = 1L;

    public LineIndexException(String message) {
        super(message);
    }

    public LineIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
