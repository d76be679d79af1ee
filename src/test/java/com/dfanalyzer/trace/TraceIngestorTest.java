package com.dfanalyzer.trace;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.dfanalyzer.trace.filter.FilterConfig;
import com.dfanalyzer.trace.index.LineIndexer;
import com.dfanalyzer.trace.model.Columns;
import com.dfanalyzer.trace.model.IOCategory;
import com.dfanalyzer.trace.parser.MissingColumnException;
import com.dfanalyzer.trace.table.NormalizedTable;
import com.dfanalyzer.trace.table.TraceRow;
import com.dfanalyzer.trace.table.TraceTables;

public class TraceIngestorTest {

    @TempDir
    Path tempDir;

    private static IngestConfig config(int threads) {
        IngestConfig config = new IngestConfig();
        config.setThreads(threads);
        config.setBatchSize(4);
        config.setBlockBytes(256);
        return config;
    }

    /**
     * Rank 0 writes a plain shard, rank 1 a compressed one. Both name the same
     * file hash and host hash; each rank also reads a file only it knows.
     */
    private void writeTwoRanks() throws IOException {
        List<String> rank0 = new ArrayList<>();
        rank0.add("[");
        rank0.add(TraceFixtures.hashEntry(1, "HH", "node1", "h1", "h1"));
        rank0.add(TraceFixtures.hashEntry(2, "FH", "/lustre/data/shared.npz", "f1", "h1"));
        rank0.add(TraceFixtures.hashEntry(3, "FH", "/ssd/checkpoint/rank0.pt", "f2", "h1"));
        rank0.add(TraceFixtures.event(4, "read", "POSIX", 2000, 100, "{\"ret\":4096,\"fhash\":\"f1\",\"hhash\":\"h1\"}"));
        rank0.add(TraceFixtures.event(5, "write", "POSIX", 2200, 50, "{\"ret\":512,\"fhash\":\"f2\",\"hhash\":\"h1\"}"));
        rank0.add(TraceFixtures.event(6, "open64", "POSIX", 1900, 10, "{\"ret\":3,\"fhash\":\"f1\",\"hhash\":\"h1\"}"));
        rank0.add("this is not json");
        TraceFixtures.writePlain(tempDir.resolve("trace-0.pfw"), rank0);

        List<String> member1 = Arrays.asList(
                TraceFixtures.hashEntry(11, "HH", "node1", "h1", "h1"),
                TraceFixtures.hashEntry(12, "FH", "/lustre/data/shared.npz", "f1", "h1"),
                TraceFixtures.hashEntry(13, "FH", "/lustre/data/rank1.npz", "f3", "h1"));
        List<String> member2 = Arrays.asList(
                TraceFixtures.event(14, "read", "POSIX", 1000, 200, "{\"ret\":-1,\"fhash\":\"f3\",\"hhash\":\"h1\"}"),
                TraceFixtures.event(15, "read", "POSIX", 3000, 300, "{\"ret\":8192,\"fhash\":\"f1\",\"hhash\":\"h1\"}"),
                TraceFixtures.event(16, "TorchFramework.init_loader", "app", 900, 10, "{\"hhash\":\"h1\"}"),
                TraceFixtures.event(17, "read", "POSIX", 3500, 10, "{\"ret\":1,\"fhash\":\"f9\",\"hhash\":\"h1\"}"));
        TraceFixtures.writeGzipMembers(tempDir.resolve("trace-1.pfw.gz"), member1, member2);
    }

    @Test
    public void testTwoShardsResolveDeterministically() throws IOException {
        writeTwoRanks();

        List<List<String>> runs = new ArrayList<>();
        for (int threads : new int[] { 1, 4 }) {
            NormalizedTable table = new TraceIngestor(config(threads), new FilterConfig())
                    .ingest(tempDir.toString());
            runs.add(table.rows().map(TraceRow::toString).collect(Collectors.toList()));

            // the init_loader call at time zero is filtered out after rebasing
            assertEquals(6, table.getRowCount());
            List<TraceRow> rows = table.rows().collect(Collectors.toList());
            assertEquals(100, rows.stream().mapToLong(TraceRow::getTimeStart).min().getAsLong());

            TraceRow firstRead = rows.stream().filter(r -> r.getTimeStart() == 1100).findFirst().get();
            assertEquals("posix_reader", firstRead.getCat());
            assertEquals("/lustre/data/shared.npz", firstRead.getFileName());
            assertEquals("node1", firstRead.getHostName());
            assertEquals(IOCategory.READ, firstRead.getIoCat());
            assertEquals(Long.valueOf(4096), firstRead.getSize());
            assertEquals(1200, firstRead.getTimeEnd());
            assertEquals(1e-4, firstRead.getTime(), 1e-12);
            assertEquals("app#node1#10#11", firstRead.getProcName());

            TraceRow write = rows.stream().filter(r -> "write".equals(r.getFuncName())).findFirst().get();
            assertEquals("posix_checkpoint", write.getCat());
            assertEquals(IOCategory.WRITE, write.getIoCat());

            TraceRow failed = rows.stream().filter(r -> r.getTimeStart() == 100).findFirst().get();
            assertEquals("/lustre/data/rank1.npz", failed.getFileName());
            assertNull(failed.getSize());

            TraceRow unknownFile = rows.stream().filter(r -> r.getTimeStart() == 2600).findFirst().get();
            assertNull(unknownFile.getFileName());
            assertEquals("posix", unknownFile.getCat());

            TraceRow open = rows.stream().filter(r -> "open64".equals(r.getFuncName())).findFirst().get();
            assertEquals(IOCategory.METADATA, open.getIoCat());
            assertNull(open.getSize());
        }
        assertEquals(runs.get(0), runs.get(1));
        assertTrue(Files.exists(LineIndexer.sidecarFor(tempDir.resolve("trace-1.pfw.gz"))));
    }

    @Test
    public void testReadTraceTables() throws IOException {
        writeTwoRanks();
        TraceTables tables = new TraceIngestor(config(2), new FilterConfig()).readTrace(tempDir.toString());

        assertEquals(7, tables.getEvents().getRowCount());
        assertEquals(3, tables.getFileHash().size());
        assertEquals(1, tables.getHostHash().size());
        assertEquals(1, tables.getStats().parseErrors);
        assertTrue(tables.getStats().skipped >= 1);
        assertEquals(1, tables.getEvents().getPartitionCount());
        assertEquals(0, tables.getEvents().stream().mapToLong(e -> e.getTs()).min().getAsLong());
    }

    @Test
    public void testGlobSelectsShards() throws IOException {
        writeTwoRanks();
        TraceTables tables = new TraceIngestor(config(2), new FilterConfig())
                .readTrace(tempDir.resolve("*.pfw.gz").toString());
        assertEquals(4, tables.getEvents().getRowCount());
    }

    @Test
    public void testDiscoverSkipsOtherFiles() throws IOException {
        writeTwoRanks();
        Files.write(tempDir.resolve("notes.pfw.txt"), Collections.singletonList("hello"));
        Files.createDirectory(tempDir.resolve("sub"));
        TraceFixtures.writePlain(tempDir.resolve("sub").resolve("trace-2.pfw"), TraceFixtures.readEvents(0, 1));

        List<Path> files = TraceIngestor.discover(tempDir.toString());
        assertEquals(Arrays.asList(tempDir.resolve("trace-0.pfw"), tempDir.resolve("trace-1.pfw.gz")), files);
    }

    @Test
    public void testNoTraceFiles() throws IOException {
        Files.write(tempDir.resolve("readme.txt"), Collections.singletonList("nothing here"));
        TraceIngestor ingestor = new TraceIngestor(config(1), new FilterConfig());
        assertThrows(ConfigurationException.class, () -> ingestor.readTrace(tempDir.toString()));
        assertThrows(ConfigurationException.class,
                () -> ingestor.readTrace(tempDir.resolve("missing").toString()));
    }

    @Test
    public void testMissingExtraColumnFailsRun() throws IOException {
        writeTwoRanks();
        Map<String, String> extra = new HashMap<>();
        extra.put("epoch", "int");
        TraceIngestor ingestor = new TraceIngestor(config(2), new FilterConfig(), extra, raw -> {
            JSONObject args = raw.optJSONObject("args");
            Map<String, Object> columns = new HashMap<>();
            if (args != null && args.has("epoch")) {
                columns.put("epoch", args.get("epoch"));
            }
            return columns;
        });
        assertThrows(MissingColumnException.class, () -> ingestor.readTrace(tempDir.toString()));
    }

    @Test
    public void testExtraColumnsAndExactTime() throws IOException {
        TraceFixtures.writePlain(tempDir.resolve("trace-0.pfw"), Arrays.asList(
                TraceFixtures.event(1, "step", "app", 500, 100, "{\"epoch\":1}"),
                TraceFixtures.event(2, "step", "app", 700, 100, "{\"epoch\":2}")));
        IngestConfig config = config(1);
        config.setTimeApproximate(false);
        Map<String, String> extra = new HashMap<>();
        extra.put("epoch", "int");
        TraceIngestor ingestor = new TraceIngestor(config, new FilterConfig(), extra,
                raw -> Collections.singletonMap("epoch", raw.getJSONObject("args").get("epoch")));

        NormalizedTable table = ingestor.ingest(tempDir.toString());
        assertTrue(table.hasColumn("epoch"));
        assertTrue(table.hasColumn(Columns.COL_TIME_INTERVAL));
        List<TraceRow> rows = table.rows().collect(Collectors.toList());
        assertEquals(1, rows.get(0).get("epoch"));
        assertEquals("[500,600]", rows.get(0).getTimeInterval());
        assertEquals(200, rows.get(1).getTimeStart());
    }

    @Test
    public void testCorruptShardFailsRun() throws IOException {
        Files.write(tempDir.resolve("trace-0.pfw.gz"), new byte[] { 0x1f, (byte) 0x8b, 8, 0, 0, 0, 0, 0, 0, 3, 1, 2 });
        TraceIngestor ingestor = new TraceIngestor(config(1), new FilterConfig());
        assertThrows(IOException.class, () -> ingestor.readTrace(tempDir.toString()));
    }
}
