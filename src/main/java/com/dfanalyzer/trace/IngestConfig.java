package com.dfanalyzer.trace;

import java.util.Properties;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.dfanalyzer.trace.batch.BatchPlanner;
import com.dfanalyzer.trace.index.LineIndexBuilder;

/**
 * Settings of an ingestion run. Defaults suit traces with microsecond
 * timestamps; every value can be overridden from a properties file.
 */
public class IngestConfig {

    public static final String TIME_GRANULARITY = "trace.time.granularity";
    public static final String TIME_APPROXIMATE = "trace.time.approximate";
    public static final String TIME_RESOLUTION = "trace.time.resolution";
    public static final String BATCH_SIZE = "trace.batch.size";
    public static final String BLOCK_BYTES = "trace.block.bytes";
    public static final String THREADS = "trace.threads";
    public static final String INDEX_PATTERN = "trace.index.pattern";

    private double timeGranularity = 1e6;
    private boolean timeApproximate = true;
    private double timeResolution = 1e6;
    private int batchSize = BatchPlanner.DEFAULT_BATCH_SIZE;
    private long blockBytes = BatchPlanner.DEFAULT_BLOCK_BYTES;
    private int threads = Runtime.getRuntime().availableProcessors();
    private String indexPattern = LineIndexBuilder.DEFAULT_RECORD_PATTERN;

    /**
     * Applies the {@code trace.*} keys present in {@code props}.
     */
    public void loadFromProperties(Properties props) {
        String value = props.getProperty(TIME_GRANULARITY);
        if (value != null) {
            timeGranularity = parseDouble(TIME_GRANULARITY, value);
        }
        value = props.getProperty(TIME_APPROXIMATE);
        if (value != null) {
            timeApproximate = Boolean.parseBoolean(value.trim());
        }
        value = props.getProperty(TIME_RESOLUTION);
        if (value != null) {
            timeResolution = parseDouble(TIME_RESOLUTION, value);
        }
        value = props.getProperty(BATCH_SIZE);
        if (value != null) {
            batchSize = parseInt(BATCH_SIZE, value);
        }
        value = props.getProperty(BLOCK_BYTES);
        if (value != null) {
            blockBytes = parseLong(BLOCK_BYTES, value);
        }
        value = props.getProperty(THREADS);
        if (value != null) {
            threads = parseInt(THREADS, value);
        }
        value = props.getProperty(INDEX_PATTERN);
        if (value != null && !value.trim().isEmpty()) {
            indexPattern = value.trim();
        }
        validate();
    }

    public void validate() {
        if (!(timeGranularity > 0)) {
            throw new ConfigurationException(TIME_GRANULARITY + " must be positive: " + timeGranularity);
        }
        if (!(timeResolution > 0)) {
            throw new ConfigurationException(TIME_RESOLUTION + " must be positive: " + timeResolution);
        }
        if (batchSize <= 0) {
            throw new ConfigurationException(BATCH_SIZE + " must be positive: " + batchSize);
        }
        if (blockBytes <= 0) {
            throw new ConfigurationException(BLOCK_BYTES + " must be positive: " + blockBytes);
        }
        if (threads <= 0) {
            throw new ConfigurationException(THREADS + " must be positive: " + threads);
        }
        if (indexPattern == null) {
            throw new ConfigurationException(INDEX_PATTERN + " must be set");
        }
        Pattern pattern;
        try {
            pattern = Pattern.compile(indexPattern);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException(INDEX_PATTERN + " is not a valid pattern: " + e.getDescription());
        }
        if (pattern.matcher("").groupCount() < 1) {
            throw new ConfigurationException(INDEX_PATTERN + " must capture the record id in a group: "
                    + indexPattern);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not a number: " + value);
        }
    }

    private static int parseInt(String key, String value) {
        long parsed = parseLong(key, value);
        if (parsed > Integer.MAX_VALUE || parsed < Integer.MIN_VALUE) {
            throw new ConfigurationException(key + " is out of range: " + value);
        }
        return (int) parsed;
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not an integer: " + value);
        }
    }

    public double getTimeGranularity() {
        return timeGranularity;
    }

    public void setTimeGranularity(double timeGranularity) {
        this.timeGranularity = timeGranularity;
    }

    public boolean isTimeApproximate() {
        return timeApproximate;
    }

    public void setTimeApproximate(boolean timeApproximate) {
        this.timeApproximate = timeApproximate;
    }

    public double getTimeResolution() {
        return timeResolution;
    }

    public void setTimeResolution(double timeResolution) {
        this.timeResolution = timeResolution;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public long getBlockBytes() {
        return blockBytes;
    }

    public void setBlockBytes(long blockBytes) {
        this.blockBytes = blockBytes;
    }

    public int getThreads() {
        return threads;
    }

    public void setThreads(int threads) {
        this.threads = threads;
    }

    public String getIndexPattern() {
        return indexPattern;
    }

    public void setIndexPattern(String indexPattern) {
        this.indexPattern = indexPattern;
    }
}
