package com.dfanalyzer.trace;

/**
 * Raised before any row level work when the run cannot be configured, for
 * example when no supported trace file matches the input path.
 */
public class ConfigurationException extends TraceIngestException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }
}
