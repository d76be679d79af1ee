package com.dfanalyzer.trace.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dfanalyzer.trace.ConfigurationException;
import com.dfanalyzer.trace.model.Columns;
import com.dfanalyzer.trace.model.EventRecord;
import com.dfanalyzer.trace.model.HashEntry;

/**
 * Left-joins the file and host dictionaries into the events table and
 * renames the event fields to the public column names.
 * <p>
 * An event whose hash has no dictionary entry keeps its row with a null
 * name.
 */
public class DictionaryResolver {

    private static final Logger logger = LoggerFactory.getLogger(DictionaryResolver.class);

    private final double timeResolution;

    public DictionaryResolver(double timeResolution) {
        if (!(timeResolution > 0) || Double.isInfinite(timeResolution)) {
            throw new ConfigurationException("Time resolution must be a positive number: " + timeResolution);
        }
        this.timeResolution = timeResolution;
    }

    public NormalizedTable resolve(TraceTables tables) {
        HashDictionary fileHash = tables.getFileHash();
        Map<String, String> hostNames = hostLookup(tables.getHostHash());

        List<String> columns = new ArrayList<>();
        columns.add(Columns.COL_FUNC_NAME);
        columns.add(Columns.COL_CAT);
        columns.add(Columns.COL_TIME);
        columns.add(Columns.COL_TIME_START);
        columns.add(Columns.COL_TIME_END);
        columns.add(Columns.COL_TIME_RANGE);
        if (!tables.isTimeApproximate()) {
            columns.add(Columns.COL_TIME_INTERVAL);
        }
        columns.add(Columns.COL_PID);
        columns.add(Columns.COL_TID);
        columns.add(Columns.COL_FILE_NAME);
        columns.add(Columns.COL_HOST_NAME);
        columns.add(Columns.COL_IO_CAT);
        columns.add(Columns.COL_SIZE);
        columns.add(Columns.COL_IMAGE_ID);
        columns.add(Columns.COL_STEP);
        columns.addAll(tables.getExtraColumns());

        long unresolvedFiles = 0;
        long unresolvedHosts = 0;
        List<List<TraceRow>> partitions = new ArrayList<>();
        for (List<EventRecord> partition : tables.getEvents().getPartitions()) {
            List<TraceRow> rows = new ArrayList<>(partition.size());
            for (EventRecord event : partition) {
                String fileName = fileHash.resolve(event.getFileHash());
                String hostName = event.getHostHash() == null ? null : hostNames.get(event.getHostHash());
                if (fileName == null && event.getFileHash() != null) {
                    unresolvedFiles++;
                }
                if (hostName == null && event.getHostHash() != null) {
                    unresolvedHosts++;
                }
                rows.add(toRow(event, fileName, hostName));
            }
            partitions.add(rows);
        }
        if (unresolvedFiles > 0 || unresolvedHosts > 0) {
            logger.warn("{} events reference an unknown file hash, {} an unknown host hash", unresolvedFiles,
                    unresolvedHosts);
        }
        return new NormalizedTable(columns, partitions);
    }

    /**
     * Host names keyed by the hash events refer to. Traces that never record
     * a host hash on their {@code HH} entries are keyed by the entry hash
     * itself; otherwise by the entry's host hash, first entry winning.
     */
    static Map<String, String> hostLookup(HashDictionary hostHash) {
        Map<String, String> lookup = new HashMap<>();
        if (hostHash.hostHashesEmpty()) {
            for (HashEntry entry : hostHash.entries()) {
                lookup.put(entry.getHash(), entry.getName());
            }
        } else {
            for (HashEntry entry : hostHash.entries()) {
                if (entry.getHostHash() != null) {
                    lookup.putIfAbsent(entry.getHostHash(), entry.getName());
                }
            }
        }
        return Collections.unmodifiableMap(lookup);
    }

    private TraceRow toRow(EventRecord event, String fileName, String hostName) {
        return new TraceRow.Builder()
                .funcName(event.getName())
                .cat(event.getCat())
                .time(event.getDur() / timeResolution)
                .timeStart(event.getTs())
                .timeEnd(event.getTe())
                .timeRange(event.getTrange())
                .timeInterval(event.getTimeInterval())
                .pid(event.getPid())
                .tid(event.getTid())
                .fileName(fileName)
                .hostName(hostName)
                .ioCat(event.getIoCategory())
                .size(event.getSize())
                .imageId(event.getImageId())
                .step(event.getStep())
                .extraColumns(event.getExtraColumns())
                .build();
    }

    public double getTimeResolution() {
        return timeResolution;
    }
}
