package com.dfanalyzer.trace.batch;

import java.io.IOException;
import java.util.List;

import com.dfanalyzer.trace.index.LineIndex;

/**
 * Batch over a whole compressed shard, inflated sequentially in one pass.
 */
public class StreamedShardBatch extends TraceBatch {

    private final LineIndex index;

    public StreamedShardBatch(int ordinal, LineIndex index) {
        super(ordinal, index.getShard());
        this.index = index;
    }

    @Override
    public List<String> readLines() throws IOException {
        return index.readAllLines();
    }

    @Override
    public String toString() {
        return "#" + getOrdinal() + " " + getFile().getFileName() + " [0, " + index.maxLine() + ")";
    }
}
