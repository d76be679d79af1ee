package com.dfanalyzer.trace.report;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import com.dfanalyzer.trace.model.Columns;
import com.dfanalyzer.trace.model.IOCategory;
import com.dfanalyzer.trace.table.NormalizedTable;
import com.dfanalyzer.trace.table.TraceRow;

public class IngestSummaryTest {

    private static TraceRow row(String cat, double time, IOCategory ioCat, Long size) {
        return new TraceRow.Builder().funcName("f").cat(cat).time(time).ioCat(ioCat).size(size).build();
    }

    @Test
    public void testSummary() {
        NormalizedTable table = new NormalizedTable(
                Arrays.asList(Columns.COL_FUNC_NAME, Columns.COL_CAT, Columns.COL_TIME, Columns.COL_IO_CAT,
                        Columns.COL_SIZE),
                Arrays.asList(
                        Arrays.asList(row("posix", 1.0, IOCategory.READ, 100L), row("posix", 3.0, IOCategory.READ, 50L)),
                        Collections.singletonList(row("app", 0.5, IOCategory.OTHER, null))));

        IngestSummary summary = new IngestSummary(table);
        assertEquals(3, summary.getEvents());
        assertEquals(2, summary.getTimeStats("posix").getN());
        assertEquals(2.0, summary.getTimeStats("posix").getMean(), 1e-12);
        assertEquals(2, summary.getIoCount(IOCategory.READ));
        assertEquals(150, summary.getIoBytes(IOCategory.READ));
        assertEquals(0, summary.getIoCount(IOCategory.WRITE));

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        summary.report(new PrintStream(bytes, true, StandardCharsets.UTF_8));
        String report = bytes.toString(StandardCharsets.UTF_8);
        assertTrue(report.contains("posix"));
        assertTrue(report.contains("read"));
        assertTrue(report.contains("3 events"));
    }
}
