package com.dfanalyzer.trace;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dfanalyzer.trace.filter.FilterConfig;
import com.dfanalyzer.trace.report.IngestSummary;
import com.dfanalyzer.trace.report.TableWriter;
import com.dfanalyzer.trace.table.NormalizedTable;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Command line entry point: ingests a trace directory or glob and writes the
 * normalized events table.
 */
@Command(name = "traceIngest", mixinStandardHelpOptions = true, version = "0.1",
         description = "Ingest dftracer .pfw/.pfw.gz traces into a normalized events table")
public class TraceIngestCommand implements Callable<Integer> {

    static final Logger logger = LoggerFactory.getLogger(TraceIngestCommand.class);

    static final String LOGGER_ROOT_PACKAGE = "com.dfanalyzer";

    @Option(names = { "-t", "--trace" }, description = "Trace directory or glob", required = true)
    private String tracePath;

    @Option(names = { "--config" }, description = "Ingestion and filter configuration file")
    private String configFile;

    @Option(names = { "--granularity" }, description = "Time range bucket width, in trace time units")
    private Double granularity;

    @Option(names = { "--resolution" }, description = "Trace time units per second")
    private Double resolution;

    @Option(names = { "--exact-time" }, description = "Keep the exact [ts,te] interval of each event")
    private boolean exactTime = false;

    @Option(names = { "--threads" }, description = "Worker threads (default: available processors)")
    private Integer threads;

    @Option(names = { "--batch-size" }, description = "Lines per batch of a compressed shard")
    private Integer batchSize;

    @Option(names = { "-o", "--output" }, description = "JSON lines output file")
    private String outputFile;

    @Option(names = { "-c", "--csv" }, description = "CSV output file")
    private String csvOutputFile;

    @Option(names = { "--text" }, description = "Print a text summary to the console")
    private boolean textOutput = false;

    @Option(names = { "--debug" }, description = "Enable debug logging")
    private boolean debug = false;

    private final IngestConfig ingestConfig = new IngestConfig();
    private final FilterConfig filterConfig = new FilterConfig();

    @Override
    public Integer call() throws Exception {
        if (debug) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(LOGGER_ROOT_PACKAGE)).setLevel(Level.DEBUG);
        }

        NormalizedTable table;
        try {
            loadConfiguration();
            TraceIngestor ingestor = new TraceIngestor(ingestConfig, filterConfig);
            ingestor.setDebug(debug);
            table = ingestor.ingest(tracePath);
        } catch (ConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            return 1;
        } catch (IOException | TraceIngestException e) {
            logger.error("Ingestion of {} failed", tracePath, e);
            return 2;
        }

        if (outputFile != null) {
            TableWriter.writeJsonLines(table, Paths.get(outputFile));
            logger.info("Wrote {} events to {}", table.getRowCount(), outputFile);
        }
        if (csvOutputFile != null) {
            TableWriter.writeCsv(table, Paths.get(csvOutputFile));
            logger.info("Wrote {} events to {}", table.getRowCount(), csvOutputFile);
        }
        if (textOutput) {
            new IngestSummary(table).report(System.out);
        }
        return 0;
    }

    void loadConfiguration() throws IOException {
        if (configFile != null) {
            Properties props = new Properties();
            try (InputStream in = new FileInputStream(configFile)) {
                props.load(in);
            }
            ingestConfig.loadFromProperties(props);
            filterConfig.loadFromProperties(props);
            logger.info("Loaded configuration from: {}", configFile);
        }
        if (granularity != null) {
            ingestConfig.setTimeGranularity(granularity);
        }
        if (resolution != null) {
            ingestConfig.setTimeResolution(resolution);
        }
        if (exactTime) {
            ingestConfig.setTimeApproximate(false);
        }
        if (threads != null) {
            ingestConfig.setThreads(threads);
        }
        if (batchSize != null) {
            ingestConfig.setBatchSize(batchSize);
        }
        ingestConfig.validate();
    }

    IngestConfig getIngestConfig() {
        return ingestConfig;
    }

    FilterConfig getFilterConfig() {
        return filterConfig;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TraceIngestCommand()).execute(args);
        System.exit(exitCode);
    }
}
