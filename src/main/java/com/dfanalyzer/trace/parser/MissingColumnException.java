package com.dfanalyzer.trace.parser;

import java.util.List;

import com.dfanalyzer.trace.TraceIngestException;

/**
 * A declared extra column was not produced for an event. Unlike malformed
 * input this is not recovered: it aborts the run.
 */
public class MissingColumnException extends TraceIngestException {

    private static final long serialVersionUID = 1L;

    private final List<String> missingColumns;

    public MissingColumnException(List<String> missingColumns, String line) {
        super("Missing extra columns " + missingColumns + " for line: "
                + line.substring(0, Math.min(200, line.length())));
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
