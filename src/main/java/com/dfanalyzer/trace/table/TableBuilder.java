package com.dfanalyzer.trace.table;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dfanalyzer.trace.BatchResult;
import com.dfanalyzer.trace.ProcessingStats;
import com.dfanalyzer.trace.batch.BatchPlanner;
import com.dfanalyzer.trace.model.EventRecord;
import com.dfanalyzer.trace.model.HashEntry;
import com.dfanalyzer.trace.model.MetadataEntry;
import com.dfanalyzer.trace.model.ParsedRecord;
import com.dfanalyzer.trace.model.RecordKind;

/**
 * Splits parsed records by kind into the events table, the hash
 * dictionaries and the metadata tables. Needs the results of every batch.
 */
public class TableBuilder {

    private static final Logger logger = LoggerFactory.getLogger(TableBuilder.class);

    private final double timeGranularity;
    private final boolean timeApproximate;
    private final List<String> extraColumns;

    public TableBuilder(double timeGranularity, boolean timeApproximate, List<String> extraColumns) {
        this.timeGranularity = timeGranularity;
        this.timeApproximate = timeApproximate;
        this.extraColumns = extraColumns == null ? List.of() : List.copyOf(extraColumns);
    }

    /**
     * @param results batch results ordered by batch ordinal
     * @param totalEstimatedBytes estimated raw volume of the corpus, drives the
     *            partition count
     */
    public TraceTables build(List<BatchResult> results, long totalEstimatedBytes) {
        List<EventRecord> events = new ArrayList<>();
        HashDictionary.Builder fileHash = new HashDictionary.Builder(RecordKind.FILE_HASH);
        HashDictionary.Builder hostHash = new HashDictionary.Builder(RecordKind.HOST_HASH);
        HashDictionary.Builder stringHash = new HashDictionary.Builder(RecordKind.STRING_HASH);
        List<MetadataEntry> metadata = new ArrayList<>();
        List<MetadataEntry> processMetadata = new ArrayList<>();
        ProcessingStats stats = new ProcessingStats(0, 0, 0, 0);

        long minTs = Long.MAX_VALUE;
        int expectedOrdinal = 0;
        for (BatchResult result : results) {
            if (result.getOrdinal() != expectedOrdinal++) {
                throw new IllegalArgumentException("Batch results are not in ordinal order at " + result.getOrdinal());
            }
            stats = stats.add(result.getStats());
            for (ParsedRecord record : result.getRecords()) {
                switch (record.getKind()) {
                case EVENT:
                    EventRecord event = (EventRecord) record;
                    minTs = Math.min(minTs, event.getTs());
                    events.add(event);
                    break;
                case FILE_HASH:
                    fileHash.add((HashEntry) record);
                    break;
                case HOST_HASH:
                    hostHash.add((HashEntry) record);
                    break;
                case STRING_HASH:
                    stringHash.add((HashEntry) record);
                    break;
                case OTHER_METADATA:
                    metadata.add((MetadataEntry) record);
                    break;
                case PROCESS_METADATA:
                    processMetadata.add((MetadataEntry) record);
                    break;
                default:
                    throw new IllegalStateException("Unhandled record kind " + record.getKind());
                }
            }
        }

        List<EventRecord> rebased = new ArrayList<>(events.size());
        for (EventRecord event : events) {
            rebased.add(event.rebase(minTs, timeGranularity));
        }

        int partitionCount = BatchPlanner.partitionCount(totalEstimatedBytes);
        logger.debug("Number of partitions used are {}", partitionCount);
        EventsTable eventsTable = EventsTable.partition(rebased, partitionCount);

        TraceTables tables = new TraceTables(eventsTable, fileHash.build(), hostHash.build(), stringHash.build(),
                metadata, processMetadata, extraColumns, timeApproximate, totalEstimatedBytes, stats);
        logger.info("Built tables: {} events in {} partitions, {} file hashes, {} host hashes, {} string hashes, "
                + "{} metadata, {} process metadata", eventsTable.getRowCount(), partitionCount,
                tables.getFileHash().size(), tables.getHostHash().size(), tables.getStringHash().size(),
                metadata.size(), processMetadata.size());
        return tables;
    }
}
