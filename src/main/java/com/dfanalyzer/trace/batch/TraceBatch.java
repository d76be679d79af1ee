package com.dfanalyzer.trace.batch;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Unit of parallel parsing work. The ordinal is the batch's position in the
 * plan and orders results independently of completion order.
 */
public abstract class TraceBatch {

    private final int ordinal;
    private final Path file;

    protected TraceBatch(int ordinal, Path file) {
        this.ordinal = ordinal;
        this.file = file;
    }

    public int getOrdinal() {
        return ordinal;
    }

    public Path getFile() {
        return file;
    }

    /**
     * Reads the raw lines of this batch in file order.
     */
    public abstract List<String> readLines() throws IOException;
}
