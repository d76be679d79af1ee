package com.dfanalyzer.trace;

import java.util.Collections;
import java.util.List;

import com.dfanalyzer.trace.model.ParsedRecord;

/**
 * Records parsed from one batch, in line order.
 */
public class BatchResult {

    private final int ordinal;
    private final List<ParsedRecord> records;
    private final ProcessingStats stats;

    public BatchResult(int ordinal, List<ParsedRecord> records, ProcessingStats stats) {
        this.ordinal = ordinal;
        this.records = Collections.unmodifiableList(records);
        this.stats = stats;
    }

    public int getOrdinal() {
        return ordinal;
    }

    public List<ParsedRecord> getRecords() {
        return records;
    }

    public ProcessingStats getStats() {
        return stats;
    }
}
