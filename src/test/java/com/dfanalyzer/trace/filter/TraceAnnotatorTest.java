package com.dfanalyzer.trace.filter;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.dfanalyzer.trace.ConfigurationException;
import com.dfanalyzer.trace.model.Columns;
import com.dfanalyzer.trace.model.IOCategory;
import com.dfanalyzer.trace.table.NormalizedTable;
import com.dfanalyzer.trace.table.TraceRow;

public class TraceAnnotatorTest {

    private static final List<String> COLUMNS = Arrays.asList(Columns.COL_FUNC_NAME, Columns.COL_CAT,
            Columns.COL_TIME, Columns.COL_PID, Columns.COL_TID, Columns.COL_FILE_NAME, Columns.COL_HOST_NAME,
            Columns.COL_IO_CAT, Columns.COL_SIZE);

    private final TraceAnnotator annotator = new TraceAnnotator(new FilterConfig());

    private static TraceRow row(String funcName, String cat, String fileName, Long size) {
        return new TraceRow.Builder().funcName(funcName).cat(cat).pid(7L).tid(8L).fileName(fileName)
                .hostName("node1").ioCat(IOCategory.READ).size(size).build();
    }

    private static NormalizedTable table(TraceRow... rows) {
        return new NormalizedTable(COLUMNS, Collections.singletonList(Arrays.asList(rows)));
    }

    @Test
    public void testStorageTierFirstMatchWins() {
        assertEquals("posix_checkpoint", TraceAnnotator.storageTier("posix", "/ssd/checkpoint/model.pt"));
        assertEquals("posix_reader", TraceAnnotator.storageTier("posix", "/lustre/data/img.npz"));
        assertEquals("stdio_lustre", TraceAnnotator.storageTier("stdio", "/lustre/out.log"));
        assertEquals("posix_ssd", TraceAnnotator.storageTier("posix", "/ssd/tmp"));
        assertEquals("posix", TraceAnnotator.storageTier("posix", "/home/u/x"));
    }

    @Test
    public void testStorageTierOnlyForLowLevelIo() {
        assertEquals("app", TraceAnnotator.storageTier("app", "/data/x"));
        assertEquals("posix", TraceAnnotator.storageTier("posix", null));
        assertNull(TraceAnnotator.storageTier(null, "/data/x"));
        assertEquals("posix_ssd", TraceAnnotator.storageTier("posix_ssd", "/data/x"));
    }

    @Test
    public void testAnnotate() {
        NormalizedTable result = annotator.annotate(table(
                row("read", "posix", "/lustre/data/img_1.npz", 4096L),
                row("open64", "posix", "/ssd/checkpoint/m.pt", 0L),
                row("TorchDataset.__getitem__", "data_loader", null, null)));

        assertEquals(3, result.getRowCount());
        assertTrue(result.hasColumn(Columns.COL_PROC_NAME));
        assertTrue(result.hasColumn(Columns.COL_ACC_PAT));
        assertTrue(result.hasColumn(Columns.COL_COUNT));

        List<TraceRow> rows = result.rows().collect(Collectors.toList());
        assertEquals("posix_reader", rows.get(0).getCat());
        assertEquals(Long.valueOf(4096), rows.get(0).getSize());
        assertEquals("posix_checkpoint", rows.get(1).getCat());
        assertNull(rows.get(1).getSize());
        assertEquals("data_loader", rows.get(2).getCat());

        for (TraceRow row : rows) {
            assertEquals("app#node1#7#8", row.getProcName());
            assertEquals(Integer.valueOf(0), row.getAccessPattern());
            assertEquals(Integer.valueOf(1), row.getCount());
        }
    }

    @Test
    public void testExclusions() {
        NormalizedTable result = annotator.annotate(table(
                row("read", "posix", "/usr/lib/x86_64/libc.so", 10L),
                row("read", "posix", "/proc/self/status", 10L),
                row("TFReader.next", "reader", "/data/a", null),
                row("checkpoint_end_1", "app", null, null),
                row("read", "posix", "/data/kept", 10L)));

        List<String> files = result.rows().map(TraceRow::getFileName).collect(Collectors.toList());
        assertEquals(Collections.singletonList("/data/kept"), files);
    }

    @Test
    public void testProcNameWithMissingHost() {
        TraceRow row = new TraceRow.Builder().funcName("f").pid(1L).tid(2L).build();
        assertEquals("app#null#1#2", TraceAnnotator.procName(row));
    }

    @Test
    public void testMissingColumns() {
        NormalizedTable incomplete = new NormalizedTable(Arrays.asList(Columns.COL_FUNC_NAME, Columns.COL_CAT),
                Collections.singletonList(Collections.emptyList()));
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> annotator.annotate(incomplete));
        assertTrue(e.getMessage().contains(Columns.COL_PID));
    }
}
