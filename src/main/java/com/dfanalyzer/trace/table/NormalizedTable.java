package com.dfanalyzer.trace.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The resolved events table: named columns over partitioned rows.
 * Transformations return new tables and keep the partition layout.
 */
public class NormalizedTable {

    private final List<String> columns;
    private final List<List<TraceRow>> partitions;

    public NormalizedTable(List<String> columns, List<List<TraceRow>> partitions) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(columns)));
        List<List<TraceRow>> copy = new ArrayList<>(partitions.size());
        for (List<TraceRow> partition : partitions) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(partition)));
        }
        this.partitions = Collections.unmodifiableList(copy);
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /**
     * Columns of {@code required} that this table does not have.
     */
    public List<String> missingColumns(Set<String> required) {
        return required.stream().filter(c -> !columns.contains(c)).collect(Collectors.toList());
    }

    public List<List<TraceRow>> getPartitions() {
        return partitions;
    }

    public long getRowCount() {
        return partitions.stream().mapToLong(List::size).sum();
    }

    public Stream<TraceRow> rows() {
        return partitions.stream().flatMap(List::stream);
    }

    public NormalizedTable filter(Predicate<TraceRow> keep) {
        List<List<TraceRow>> filtered = new ArrayList<>(partitions.size());
        for (List<TraceRow> partition : partitions) {
            filtered.add(partition.stream().filter(keep).collect(Collectors.toList()));
        }
        return new NormalizedTable(columns, filtered);
    }

    /**
     * Maps every row, declaring the column set of the result.
     */
    public NormalizedTable map(UnaryOperator<TraceRow> mapper, List<String> resultColumns) {
        List<List<TraceRow>> mapped = new ArrayList<>(partitions.size());
        for (List<TraceRow> partition : partitions) {
            mapped.add(partition.stream().map(mapper).collect(Collectors.toList()));
        }
        return new NormalizedTable(resultColumns, mapped);
    }
}
