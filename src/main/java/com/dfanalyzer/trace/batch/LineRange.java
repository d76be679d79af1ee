package com.dfanalyzer.trace.batch;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Inclusive range of line numbers within one shard.
 */
public class LineRange {

    private final Path file;
    private final long start;
    private final long end;

    public LineRange(Path file, long start, long end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid line range [" + start + ", " + end + "]");
        }
        this.file = file;
        this.start = start;
        this.end = end;
    }

    public Path getFile() {
        return file;
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    public long getLineCount() {
        return end - start + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LineRange other = (LineRange) o;
        return start == other.start && end == other.end && Objects.equals(file, other.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, start, end);
    }

    @Override
    public String toString() {
        return file.getFileName() + "[" + start + ", " + end + "]";
    }
}
