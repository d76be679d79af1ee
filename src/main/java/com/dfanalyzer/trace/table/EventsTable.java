package com.dfanalyzer.trace.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

import com.dfanalyzer.trace.model.EventRecord;

/**
 * Rebased events split into contiguous partitions.
 */
public class EventsTable {

    private final List<List<EventRecord>> partitions;
    private final long rowCount;

    private EventsTable(List<List<EventRecord>> partitions) {
        this.partitions = Collections.unmodifiableList(partitions);
        this.rowCount = partitions.stream().mapToLong(List::size).sum();
    }

    /**
     * Splits {@code events} in order into {@code partitionCount} contiguous
     * partitions whose sizes differ by at most one.
     */
    public static EventsTable partition(List<EventRecord> events, int partitionCount) {
        if (partitionCount < 1) {
            throw new IllegalArgumentException("Partition count must be at least 1: " + partitionCount);
        }
        List<List<EventRecord>> partitions = new ArrayList<>(partitionCount);
        int size = events.size();
        int base = size / partitionCount;
        int larger = size % partitionCount;
        int from = 0;
        for (int i = 0; i < partitionCount; i++) {
            int to = from + base + (i < larger ? 1 : 0);
            partitions.add(Collections.unmodifiableList(new ArrayList<>(events.subList(from, to))));
            from = to;
        }
        return new EventsTable(partitions);
    }

    public List<List<EventRecord>> getPartitions() {
        return partitions;
    }

    public int getPartitionCount() {
        return partitions.size();
    }

    public long getRowCount() {
        return rowCount;
    }

    public Stream<EventRecord> stream() {
        return partitions.stream().flatMap(List::stream);
    }
}
