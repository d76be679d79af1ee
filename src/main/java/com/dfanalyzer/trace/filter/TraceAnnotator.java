package com.dfanalyzer.trace.filter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dfanalyzer.trace.ConfigurationException;
import com.dfanalyzer.trace.model.Columns;
import com.dfanalyzer.trace.table.NormalizedTable;
import com.dfanalyzer.trace.table.TraceRow;

/**
 * Final pass over the resolved events: drops excluded files and functions,
 * names processes, tags the storage tier of low-level I/O and stamps the
 * aggregation weight columns.
 */
public class TraceAnnotator {

    private static final Logger logger = LoggerFactory.getLogger(TraceAnnotator.class);

    static final Set<String> REQUIRED_COLUMNS = new LinkedHashSet<>(Arrays.asList(
            Columns.COL_FUNC_NAME, Columns.COL_CAT, Columns.COL_PID, Columns.COL_TID,
            Columns.COL_FILE_NAME, Columns.COL_HOST_NAME, Columns.COL_SIZE));

    /** Path marker and category suffix, tested in this order. */
    static final String[][] STORAGE_TIERS = {
        { "/checkpoint", "_checkpoint" },
        { "/data", "_reader" },
        { "/lustre", "_lustre" },
        { "/ssd", "_ssd" },
    };

    static final int NO_ACCESS_PATTERN = 0;

    private final FilterConfig filterConfig;

    public TraceAnnotator(FilterConfig filterConfig) {
        this.filterConfig = filterConfig;
    }

    public NormalizedTable annotate(NormalizedTable traces) {
        List<String> missing = traces.missingColumns(REQUIRED_COLUMNS);
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Events table lacks required columns " + missing);
        }
        long before = traces.getRowCount();

        NormalizedTable kept = traces.filter(row -> !filterConfig.shouldIgnoreFile(row.getFileName()));

        List<String> columns = new ArrayList<>(kept.getColumns());
        columns.add(Columns.COL_PROC_NAME);
        NormalizedTable named = kept.map(row -> row.toBuilder().procName(procName(row)).build(), columns);

        NormalizedTable calls = named.filter(row -> !filterConfig.shouldIgnoreFunction(row.getFuncName()));

        columns = new ArrayList<>(calls.getColumns());
        columns.add(Columns.COL_ACC_PAT);
        columns.add(Columns.COL_COUNT);
        NormalizedTable annotated = calls.map(row -> row.toBuilder()
                .cat(storageTier(row.getCat(), row.getFileName()))
                .size(row.getSize() != null && row.getSize() == 0 ? null : row.getSize())
                .accessPattern(NO_ACCESS_PATTERN)
                .count(1)
                .build(), columns);

        logger.info("Annotated {} of {} events ({} excluded)", annotated.getRowCount(), before,
                before - annotated.getRowCount());
        return annotated;
    }

    static String procName(TraceRow row) {
        return "app#" + row.getHostName() + "#" + row.getPid() + "#" + row.getTid();
    }

    /**
     * Appends the suffix of the first storage tier whose marker occurs in the
     * file path, for low-level I/O categories only. A category that already
     * carries a tier suffix is returned unchanged.
     */
    static String storageTier(String cat, String fileName) {
        if (cat == null || fileName == null) {
            return cat;
        }
        if (!cat.contains("posix") && !cat.contains("stdio")) {
            return cat;
        }
        for (String[] tier : STORAGE_TIERS) {
            if (cat.endsWith(tier[1])) {
                return cat;
            }
        }
        for (String[] tier : STORAGE_TIERS) {
            if (fileName.contains(tier[0])) {
                return cat + tier[1];
            }
        }
        return cat;
    }
}
