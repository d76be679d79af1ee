package com.dfanalyzer.trace.table;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.dfanalyzer.trace.BatchResult;
import com.dfanalyzer.trace.ConfigurationException;
import com.dfanalyzer.trace.ProcessingStats;
import com.dfanalyzer.trace.model.Columns;
import com.dfanalyzer.trace.model.EventRecord;
import com.dfanalyzer.trace.model.HashEntry;
import com.dfanalyzer.trace.model.IOCategory;
import com.dfanalyzer.trace.model.ParsedRecord;
import com.dfanalyzer.trace.model.RecordKind;

public class DictionaryResolverTest {

    private static TraceTables tables(boolean approximate, ParsedRecord... records) {
        return new TableBuilder(1e6, approximate, null).build(Collections.singletonList(
                new BatchResult(0, Arrays.asList(records), new ProcessingStats(0, 0, 0, 0))), 0);
    }

    private static EventRecord read(long ts, String fileHash, String hostHash) {
        return new EventRecord.Builder().name("read").cat("posix").pid(1L).tid(2L).ts(ts).dur(500_000)
                .ioCategory(IOCategory.READ).size(4096L).fileHash(fileHash).hostHash(hostHash).build();
    }

    @Test
    public void testResolvesNamesAndTime() {
        TraceTables tables = tables(true,
                new HashEntry(RecordKind.FILE_HASH, "/data/x", "f1", 1L, 2L, "h1"),
                new HashEntry(RecordKind.HOST_HASH, "node1", "h1", 1L, 2L, "h1"),
                read(1000, "f1", "h1"));

        NormalizedTable table = new DictionaryResolver(1e6).resolve(tables);
        TraceRow row = table.rows().findFirst().get();

        assertEquals("/data/x", row.getFileName());
        assertEquals("node1", row.getHostName());
        assertEquals(0.5, row.getTime(), 1e-12);
        assertEquals(0, row.getTimeStart());
        assertEquals(500_000, row.getTimeEnd());
        assertEquals(IOCategory.READ, row.getIoCat());
        assertEquals(Long.valueOf(4096), row.getSize());
        assertFalse(table.hasColumn(Columns.COL_TIME_INTERVAL));
        assertEquals(Columns.COL_FUNC_NAME, table.getColumns().get(0));
    }

    @Test
    public void testUnresolvedHashKeepsRow() {
        TraceTables tables = tables(true,
                new HashEntry(RecordKind.FILE_HASH, "/data/x", "f1", 1L, 2L, null),
                read(10, "f1", null),
                read(20, "missing", null),
                read(30, null, null));

        NormalizedTable table = new DictionaryResolver(1e6).resolve(tables);
        List<String> names = table.rows().map(TraceRow::getFileName).collect(Collectors.toList());
        assertEquals(Arrays.asList("/data/x", null, null), names);
        assertNull(table.rows().findFirst().get().getHostName());
    }

    @Test
    public void testIntervalColumnWhenExact() {
        EventRecord event = new EventRecord.Builder().name("f").cat("app").ts(100).dur(25).timeInterval("[100,125]")
                .build();
        NormalizedTable table = new DictionaryResolver(1e6).resolve(tables(false, event));
        assertTrue(table.hasColumn(Columns.COL_TIME_INTERVAL));
        assertEquals("[100,125]", table.rows().findFirst().get().getTimeInterval());
    }

    @Test
    public void testHostLookupWithoutHostHashes() {
        HashDictionary hosts = new HashDictionary.Builder(RecordKind.HOST_HASH)
                .add(new HashEntry(RecordKind.HOST_HASH, "node1", "a", 1L, 1L, null))
                .add(new HashEntry(RecordKind.HOST_HASH, "node2", "b", 1L, 1L, null))
                .build();
        Map<String, String> lookup = DictionaryResolver.hostLookup(hosts);
        assertEquals("node1", lookup.get("a"));
        assertEquals("node2", lookup.get("b"));
    }

    @Test
    public void testHostLookupKeyedByHostHash() {
        HashDictionary hosts = new HashDictionary.Builder(RecordKind.HOST_HASH)
                .add(new HashEntry(RecordKind.HOST_HASH, "node1", "a", 1L, 1L, "h1"))
                .add(new HashEntry(RecordKind.HOST_HASH, "node1-alias", "b", 1L, 1L, "h1"))
                .add(new HashEntry(RecordKind.HOST_HASH, "orphan", "c", 1L, 1L, null))
                .build();
        Map<String, String> lookup = DictionaryResolver.hostLookup(hosts);
        assertEquals("node1", lookup.get("h1"));
        assertNull(lookup.get("a"));
        assertNull(lookup.get("c"));
    }

    @Test
    public void testExtraColumnsFollowBuiltIns() {
        EventRecord event = new EventRecord.Builder().name("f").cat("app").ts(1).dur(1)
                .extraColumns(Collections.singletonMap("epoch", 3)).build();
        TraceTables tables = new TableBuilder(1e6, true, Collections.singletonList("epoch")).build(
                Collections.singletonList(new BatchResult(0, Collections.singletonList(event),
                        new ProcessingStats(1, 1, 0, 0))), 0);

        NormalizedTable table = new DictionaryResolver(1e6).resolve(tables);
        assertEquals("epoch", table.getColumns().get(table.getColumns().size() - 1));
        assertEquals(3, table.rows().findFirst().get().get("epoch"));
    }

    @Test
    public void testInvalidResolution() {
        assertThrows(ConfigurationException.class, () -> new DictionaryResolver(0));
        assertThrows(ConfigurationException.class, () -> new DictionaryResolver(-1));
    }
}
