package com.dfanalyzer.trace.report;

import java.io.PrintStream;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import com.dfanalyzer.trace.model.IOCategory;
import com.dfanalyzer.trace.table.NormalizedTable;
import com.dfanalyzer.trace.table.TraceRow;

/**
 * Text summary of a normalized table: call time statistics per category and
 * event counts and bytes per I/O category.
 */
public class IngestSummary {

    private final Map<String, DescriptiveStatistics> timeByCat = new HashMap<>();
    private final Map<IOCategory, long[]> ioByCategory = new EnumMap<>(IOCategory.class);
    private long events;

    public IngestSummary(NormalizedTable table) {
        table.rows().forEach(this::accept);
    }

    private void accept(TraceRow row) {
        events++;
        String cat = row.getCat() == null ? "" : row.getCat();
        timeByCat.computeIfAbsent(cat, k -> new DescriptiveStatistics()).addValue(row.getTime());
        if (row.getIoCat() != null) {
            long[] totals = ioByCategory.computeIfAbsent(row.getIoCat(), k -> new long[2]);
            totals[0]++;
            if (row.getSize() != null) {
                totals[1] += row.getSize();
            }
        }
    }

    public long getEvents() {
        return events;
    }

    public DescriptiveStatistics getTimeStats(String cat) {
        return timeByCat.get(cat);
    }

    public long getIoCount(IOCategory category) {
        long[] totals = ioByCategory.get(category);
        return totals == null ? 0 : totals[0];
    }

    public long getIoBytes(IOCategory category) {
        long[] totals = ioByCategory.get(category);
        return totals == null ? 0 : totals[1];
    }

    public void report(PrintStream out) {
        out.println(String.format("%-30s %10s %12s %12s %12s %12s", "cat", "count", "total_s", "avg_s", "p95_s",
                "max_s"));
        out.println("=".repeat(93));
        timeByCat.entrySet().stream()
                .sorted(Comparator.comparingLong((Map.Entry<String, DescriptiveStatistics> e) -> e.getValue().getN())
                        .reversed())
                .forEach(e -> {
                    DescriptiveStatistics stats = e.getValue();
                    out.println(String.format("%-30s %10d %12.6f %12.6f %12.6f %12.6f", e.getKey(), stats.getN(),
                            stats.getSum(), stats.getMean(), stats.getPercentile(95), stats.getMax()));
                });
        out.println();
        out.println(String.format("%-30s %10s %16s", "io_cat", "count", "bytes"));
        out.println("=".repeat(58));
        for (Map.Entry<IOCategory, long[]> e : ioByCategory.entrySet()) {
            out.println(String.format("%-30s %10d %16d", e.getKey().getLabel(), e.getValue()[0], e.getValue()[1]));
        }
        out.println();
        out.println(String.format("%d events", events));
    }
}
