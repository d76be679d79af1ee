package com.dfanalyzer.trace.index;

/**
 * The sidecar exists but does not describe the shard: wrong format, bad
 * checksum, stale shard length or offsets out of order. Callers rebuild the
 * sidecar instead of reading past it.
 */
public class IndexInvalidException extends LineIndexException {

    private static final long serialVersionUID = 1L;

    public IndexInvalidException(String message) {
        super(message);
    }
}
