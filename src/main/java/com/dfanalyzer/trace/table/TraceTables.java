package com.dfanalyzer.trace.table;

import java.util.Collections;
import java.util.List;

import com.dfanalyzer.trace.ProcessingStats;
import com.dfanalyzer.trace.model.MetadataEntry;

/**
 * Everything one ingestion run produces before name resolution.
 */
public class TraceTables {

    private final EventsTable events;
    private final HashDictionary fileHash;
    private final HashDictionary hostHash;
    private final HashDictionary stringHash;
    private final List<MetadataEntry> metadata;
    private final List<MetadataEntry> processMetadata;
    private final List<String> extraColumns;
    private final boolean timeApproximate;
    private final long totalEstimatedBytes;
    private final ProcessingStats stats;

    public TraceTables(EventsTable events, HashDictionary fileHash, HashDictionary hostHash,
            HashDictionary stringHash, List<MetadataEntry> metadata, List<MetadataEntry> processMetadata,
            List<String> extraColumns, boolean timeApproximate, long totalEstimatedBytes, ProcessingStats stats) {
        this.events = events;
        this.fileHash = fileHash;
        this.hostHash = hostHash;
        this.stringHash = stringHash;
        this.metadata = Collections.unmodifiableList(metadata);
        this.processMetadata = Collections.unmodifiableList(processMetadata);
        this.extraColumns = Collections.unmodifiableList(extraColumns);
        this.timeApproximate = timeApproximate;
        this.totalEstimatedBytes = totalEstimatedBytes;
        this.stats = stats;
    }

    public EventsTable getEvents() {
        return events;
    }

    public HashDictionary getFileHash() {
        return fileHash;
    }

    public HashDictionary getHostHash() {
        return hostHash;
    }

    public HashDictionary getStringHash() {
        return stringHash;
    }

    public List<MetadataEntry> getMetadata() {
        return metadata;
    }

    public List<MetadataEntry> getProcessMetadata() {
        return processMetadata;
    }

    public List<String> getExtraColumns() {
        return extraColumns;
    }

    public boolean isTimeApproximate() {
        return timeApproximate;
    }

    public long getTotalEstimatedBytes() {
        return totalEstimatedBytes;
    }

    public ProcessingStats getStats() {
        return stats;
    }
}
