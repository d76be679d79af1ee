package com.dfanalyzer.trace.batch;

import java.io.IOException;
import java.util.List;

import com.dfanalyzer.trace.index.LineIndex;

/**
 * Batch over a line range of a compressed shard, read through its index.
 */
public class IndexedLineBatch extends TraceBatch {

    private final LineIndex index;
    private final LineRange range;

    public IndexedLineBatch(int ordinal, LineIndex index, LineRange range) {
        super(ordinal, range.getFile());
        this.index = index;
        this.range = range;
    }

    public LineRange getRange() {
        return range;
    }

    @Override
    public List<String> readLines() throws IOException {
        return index.queryLines(range.getStart(), range.getEnd());
    }

    @Override
    public String toString() {
        return "#" + getOrdinal() + " " + range;
    }
}
