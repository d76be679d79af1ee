package com.dfanalyzer.trace;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dfanalyzer.trace.batch.BatchPlanner;
import com.dfanalyzer.trace.batch.TraceBatch;
import com.dfanalyzer.trace.filter.FilterConfig;
import com.dfanalyzer.trace.filter.TraceAnnotator;
import com.dfanalyzer.trace.index.LineIndex;
import com.dfanalyzer.trace.index.LineIndexBuilder;
import com.dfanalyzer.trace.index.LineIndexer;
import com.dfanalyzer.trace.parser.ExtraColumnsFunction;
import com.dfanalyzer.trace.parser.RecordParser;
import com.dfanalyzer.trace.table.DictionaryResolver;
import com.dfanalyzer.trace.table.NormalizedTable;
import com.dfanalyzer.trace.table.TableBuilder;
import com.dfanalyzer.trace.table.TraceTables;

/**
 * Runs a whole ingestion: discovers shards, indexes the compressed ones,
 * parses all batches on a worker pool, builds the typed tables, resolves the
 * dictionaries and annotates the result.
 */
public class TraceIngestor {

    private static final Logger logger = LoggerFactory.getLogger(TraceIngestor.class);

    public static final String PLAIN_EXTENSION = ".pfw";
    public static final String COMPRESSED_EXTENSION = ".pfw.gz";
    static final String DEFAULT_SHARD_GLOB = "*.pfw*";

    private final IngestConfig config;
    private final FilterConfig filterConfig;
    private final Map<String, String> extraColumns;
    private final RecordParser parser;
    private final LineIndexer indexer;
    private final BatchPlanner planner;

    private boolean debug = false;

    public TraceIngestor(IngestConfig config, FilterConfig filterConfig) {
        this(config, filterConfig, null, null);
    }

    public TraceIngestor(IngestConfig config, FilterConfig filterConfig, Map<String, String> extraColumns,
            ExtraColumnsFunction extraColumnsFn) {
        config.validate();
        this.config = config;
        this.filterConfig = filterConfig;
        this.extraColumns = extraColumns == null ? Map.of() : new LinkedHashMap<>(extraColumns);
        this.parser = new RecordParser(config.getTimeGranularity(), config.isTimeApproximate(), this.extraColumns,
                extraColumnsFn);
        this.indexer = new LineIndexer(new LineIndexBuilder(config.getIndexPattern()));
        this.planner = new BatchPlanner(config.getBatchSize(), config.getBlockBytes());
    }

    /**
     * Reads, resolves and annotates every shard under {@code tracePath}.
     */
    public NormalizedTable ingest(String tracePath) throws IOException {
        TraceTables tables = readTrace(tracePath);
        return postRead(resolve(tables));
    }

    /**
     * Reads every shard matched by {@code tracePath} into the typed tables.
     *
     * @param tracePath a directory (all {@code *.pfw*} files in it) or a glob
     * @throws ConfigurationException if no trace file matches
     * @throws IOException if a shard cannot be read or indexed
     */
    public TraceTables readTrace(String tracePath) throws IOException {
        long start = System.currentTimeMillis();
        List<Path> files = discover(tracePath);
        if (files.isEmpty()) {
            throw new ConfigurationException("No trace files found for " + tracePath);
        }
        logger.info("Reading {} trace file(s) from {} with {} threads", files.size(), tracePath,
                config.getThreads());

        ExecutorService executor = Executors.newFixedThreadPool(config.getThreads());
        Map<Path, LineIndex> indexes = new LinkedHashMap<>();
        try {
            indexes.putAll(buildIndexes(executor, files));

            long totalBytes = 0;
            List<TraceBatch> plan = new ArrayList<>();
            for (Path file : files) {
                LineIndex index = indexes.get(file);
                totalBytes += BatchPlanner.estimateSize(file, index);
                if (index != null) {
                    planner.planIndexed(index, plan);
                } else {
                    planner.planPlain(file, plan);
                }
            }
            logger.info("Planned {} batches over {} bytes (estimated)", plan.size(), totalBytes);

            List<BatchResult> results = parseBatches(executor, plan);
            TraceTables tables = new TableBuilder(config.getTimeGranularity(), config.isTimeApproximate(),
                    new ArrayList<>(extraColumns.keySet())).build(results, totalBytes);

            long duration = System.currentTimeMillis() - start;
            logger.info("Trace read complete - Duration: {}ms | {} | Events: {} | Files: {} | Hosts: {}", duration,
                    tables.getStats(), tables.getEvents().getRowCount(), tables.getFileHash().size(),
                    tables.getHostHash().size());
            if (tables.getEvents().getRowCount() == 0) {
                logger.warn("No events were read from {}", tracePath);
            }
            return tables;
        } finally {
            cleanup(executor, indexes.values());
        }
    }

    public NormalizedTable resolve(TraceTables tables) {
        return new DictionaryResolver(config.getTimeResolution()).resolve(tables);
    }

    public NormalizedTable postRead(NormalizedTable traces) {
        return new TraceAnnotator(filterConfig).annotate(traces);
    }

    /**
     * Sorted trace shards for a directory or glob. Files with other extensions
     * are skipped with a warning.
     */
    static List<Path> discover(String tracePath) throws IOException {
        Path path = Paths.get(tracePath);
        String pattern;
        Path base;
        if (!hasWildcard(tracePath) && Files.isDirectory(path)) {
            base = path;
            pattern = DEFAULT_SHARD_GLOB;
        } else if (hasWildcard(tracePath)) {
            Path prefix = globBase(path);
            pattern = prefix.toString().isEmpty() ? tracePath : prefix.relativize(path).toString();
            base = prefix.toString().isEmpty() ? Paths.get(".") : prefix;
        } else if (Files.isRegularFile(path)) {
            return isTraceFile(path) ? List.of(path) : skip(List.of(path));
        } else {
            return List.of();
        }
        if (!Files.isDirectory(base)) {
            return List.of();
        }

        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        List<Path> matched;
        try (Stream<Path> walk = Files.walk(base)) {
            matched = walk.filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(base.relativize(p)))
                    .sorted()
                    .collect(Collectors.toList());
        }
        List<Path> traces = new ArrayList<>();
        List<Path> others = new ArrayList<>();
        for (Path file : matched) {
            if (isTraceFile(file)) {
                traces.add(file);
            } else if (!file.getFileName().toString().endsWith(LineIndexer.INDEX_SUFFIX)
                    && !file.getFileName().toString().endsWith(".lock")) {
                others.add(file);
            }
        }
        skip(others);
        return traces;
    }

    private static List<Path> skip(List<Path> files) {
        for (Path file : files) {
            logger.warn("Skipping {}: not a {} or {} trace", file, PLAIN_EXTENSION, COMPRESSED_EXTENSION);
        }
        return List.of();
    }

    static boolean isTraceFile(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(PLAIN_EXTENSION) || name.endsWith(COMPRESSED_EXTENSION);
    }

    static boolean isCompressed(Path file) {
        return file.getFileName().toString().endsWith(COMPRESSED_EXTENSION);
    }

    private static boolean hasWildcard(String path) {
        return path.indexOf('*') >= 0 || path.indexOf('?') >= 0 || path.indexOf('[') >= 0
                || path.indexOf('{') >= 0;
    }

    /** Deepest leading directory of a glob that has no wildcard in it. */
    private static Path globBase(Path glob) {
        Path base = glob.isAbsolute() ? glob.getRoot() : Paths.get("");
        for (Path part : glob) {
            if (hasWildcard(part.toString())) {
                break;
            }
            base = base.resolve(part);
        }
        return base;
    }

    private Map<Path, LineIndex> buildIndexes(ExecutorService executor, List<Path> files) throws IOException {
        Map<Path, Future<LineIndex>> pending = new LinkedHashMap<>();
        for (Path file : files) {
            if (isCompressed(file)) {
                pending.put(file, executor.submit(() -> indexer.ensureIndex(file)));
            }
        }
        Map<Path, LineIndex> indexes = new LinkedHashMap<>();
        try {
            for (Map.Entry<Path, Future<LineIndex>> entry : pending.entrySet()) {
                indexes.put(entry.getKey(), await(entry.getValue()));
            }
        } catch (IOException | RuntimeException e) {
            for (Future<LineIndex> future : pending.values()) {
                future.cancel(true);
            }
            closeAll(indexes.values());
            throw e;
        }
        logger.debug("Indexed {} compressed shard(s)", indexes.size());
        return indexes;
    }

    private List<BatchResult> parseBatches(ExecutorService executor, List<TraceBatch> plan) throws IOException {
        CompletionService<BatchResult> completionService = new ExecutorCompletionService<>(executor);
        for (TraceBatch batch : plan) {
            completionService.submit(new TraceParserTask(batch, parser, debug));
        }
        BatchResult[] ordered = new BatchResult[plan.size()];
        for (int i = 0; i < plan.size(); i++) {
            BatchResult result;
            try {
                result = await(completionService.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
                throw new TraceIngestException("Interrupted while parsing batches", e);
            } catch (IOException | RuntimeException e) {
                executor.shutdownNow();
                throw e;
            }
            ordered[result.getOrdinal()] = result;
        }
        return Arrays.asList(ordered);
    }

    /**
     * Waits for a task and rethrows its failure as thrown by the task.
     */
    private static <T> T await(Future<T> future) throws IOException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TraceIngestException("Interrupted while waiting for a worker", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new TraceIngestException("Worker failed", cause);
        }
    }

    private void cleanup(ExecutorService executor, Iterable<LineIndex> indexes) throws IOException {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                logger.warn("Executor did not terminate gracefully");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.warn("Executor interrupted");
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        closeAll(indexes);
    }

    private static void closeAll(Iterable<LineIndex> indexes) throws IOException {
        IOException failure = null;
        for (LineIndex index : indexes) {
            try {
                index.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }
}
