package com.dfanalyzer.trace.batch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dfanalyzer.trace.index.LineIndex;

/**
 * Splits shards into batches and estimates how much trace volume a run will
 * ingest.
 */
public class BatchPlanner {

    private static final Logger logger = LoggerFactory.getLogger(BatchPlanner.class);

    public static final int DEFAULT_BATCH_SIZE = 1024 * 16;
    public static final long DEFAULT_BLOCK_BYTES = 32L * 1024 * 1024;
    public static final long PARTITION_BYTES = 128L * 1024 * 1024;

    /** Bytes assumed per line of a compressed shard when estimating volume. */
    public static final long BYTES_PER_INDEXED_LINE = 256;

    private final int batchSize;
    private final long blockBytes;

    public BatchPlanner() {
        this(DEFAULT_BATCH_SIZE, DEFAULT_BLOCK_BYTES);
    }

    public BatchPlanner(int batchSize, long blockBytes) {
        if (batchSize <= 0 || blockBytes <= 0) {
            throw new IllegalArgumentException("Batch size and block size must be positive");
        }
        this.batchSize = batchSize;
        this.blockBytes = blockBytes;
    }

    /**
     * Covers {@code [0, totalLines)} with contiguous ranges of at most
     * {@code batchSize} lines; the last range ends at {@code totalLines - 1}.
     */
    public static List<LineRange> planBatches(Path file, long totalLines, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        List<LineRange> ranges = new ArrayList<>();
        for (long start = 0; start < totalLines; start += batchSize) {
            long end = Math.min(start + batchSize - 1, totalLines - 1);
            logger.debug("Created a batch for {} from [{}, {}] lines", file, start, end);
            ranges.add(new LineRange(file, start, end));
        }
        return ranges;
    }

    public List<LineRange> planBatches(Path file, long totalLines) {
        return planBatches(file, totalLines, batchSize);
    }

    /**
     * Adds the line batches of an indexed shard to {@code plan}, numbering them
     * after the batches already there. A shard with a single checkpoint and
     * more than one batch of lines is planned as one streamed batch, since
     * every ranged read would inflate it from the start.
     */
    public void planIndexed(LineIndex index, List<TraceBatch> plan) {
        if (index.getCheckpointCount() <= 1 && index.maxLine() > batchSize) {
            logger.debug("{} has a single checkpoint, streaming its {} lines in one batch", index.getShard(),
                    index.maxLine());
            plan.add(new StreamedShardBatch(plan.size(), index));
            return;
        }
        for (LineRange range : planBatches(index.getShard(), index.maxLine())) {
            plan.add(new IndexedLineBatch(plan.size(), index, range));
        }
    }

    /**
     * Adds newline-aligned byte range batches of an uncompressed shard to
     * {@code plan}.
     */
    public void planPlain(Path file, List<TraceBatch> plan) throws IOException {
        long size = Files.size(file);
        for (long offset = 0; offset < size; offset += blockBytes) {
            long length = Math.min(blockBytes, size - offset);
            plan.add(new ByteRangeBatch(plan.size(), file, offset, length));
        }
    }

    /**
     * Estimated raw volume of a shard: the real size of an uncompressed shard,
     * or a fixed per-line estimate for a compressed one.
     */
    public static long estimateSize(Path file, LineIndex index) throws IOException {
        long size;
        if (index == null) {
            size = Files.size(file);
        } else {
            size = index.maxLine() * BYTES_PER_INDEXED_LINE;
        }
        logger.debug("The {} has {} GB size", file, size / (1024.0 * 1024 * 1024));
        return size;
    }

    /**
     * Number of events partitions for a corpus of {@code totalBytes}, at least 1.
     */
    public static int partitionCount(long totalBytes) {
        long count = (totalBytes + PARTITION_BYTES - 1) / PARTITION_BYTES;
        return (int) Math.max(1, Math.min(count, Integer.MAX_VALUE));
    }

    public int getBatchSize() {
        return batchSize;
    }

    public long getBlockBytes() {
        return blockBytes;
    }
}
