package com.dfanalyzer.trace;

/**
 * Base class of the unchecked failures that abort an ingestion run.
 */
public class TraceIngestException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TraceIngestException(String message) {
        super(message);
    }

    public TraceIngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
