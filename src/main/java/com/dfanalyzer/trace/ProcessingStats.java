package com.dfanalyzer.trace;

/**
 * Line counters reported by one parser task, summed across the run.
 */
public class ProcessingStats {
    public final long lines;
    public final long records;
    public final long skipped;
    public final long parseErrors;

    public ProcessingStats(long lines, long records, long skipped, long parseErrors) {
        this.lines = lines;
        this.records = records;
        this.skipped = skipped;
        this.parseErrors = parseErrors;
    }

    public ProcessingStats add(ProcessingStats other) {
        return new ProcessingStats(lines + other.lines, records + other.records, skipped + other.skipped,
                parseErrors + other.parseErrors);
    }

    @Override
    public String toString() {
        return lines + " lines, " + records + " records, " + skipped + " skipped, " + parseErrors + " parse errors";
    }
}
