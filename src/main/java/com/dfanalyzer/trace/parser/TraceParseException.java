package com.dfanalyzer.trace.parser;

/**
 * A trace line could not be turned into a record. Always recovered by the
 * caller: the line is dropped and counted.
 */
public class TraceParseException extends Exception {

    private static final long serialVersionUID = 1L;

    public TraceParseException(String message, Throwable cause) {
        super(message, cause);
    }

    public TraceParseException(String message) {
        super(message);
    }
}
