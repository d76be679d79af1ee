package com.dfanalyzer.trace.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Column names of the normalized events table.
 */
public final class Columns {

    public static final String COL_FUNC_NAME = "func_name";
    public static final String COL_CAT = "cat";
    public static final String COL_TIME = "time";
    public static final String COL_TIME_START = "time_start";
    public static final String COL_TIME_END = "time_end";
    public static final String COL_TIME_RANGE = "time_range";
    public static final String COL_TIME_INTERVAL = "time_interval";
    public static final String COL_PID = "pid";
    public static final String COL_TID = "tid";
    public static final String COL_PROC_NAME = "proc_name";
    public static final String COL_FILE_NAME = "file_name";
    public static final String COL_HOST_NAME = "host_name";
    public static final String COL_IO_CAT = "io_cat";
    public static final String COL_SIZE = "size";
    public static final String COL_IMAGE_ID = "image_id";
    public static final String COL_STEP = "step";
    public static final String COL_ACC_PAT = "access_pattern";
    public static final String COL_COUNT = "count";

    /** Built-in columns in output order. */
    public static final Set<String> BUILT_IN = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
            COL_FUNC_NAME, COL_CAT, COL_TIME, COL_TIME_START, COL_TIME_END, COL_TIME_RANGE, COL_TIME_INTERVAL,
            COL_PID, COL_TID, COL_PROC_NAME, COL_FILE_NAME, COL_HOST_NAME, COL_IO_CAT, COL_SIZE, COL_IMAGE_ID,
            COL_STEP, COL_ACC_PAT, COL_COUNT)));

    /** Raw trace field names that may not be reused as extra columns either. */
    public static final Set<String> RAW_FIELDS = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
            "name", "ts", "dur", "te", "trange", "tinterval", "fhash", "hhash", "hash", "value", "type")));

    private Columns() {
    }

    public static boolean isReserved(String column) {
        return BUILT_IN.contains(column) || RAW_FIELDS.contains(column);
    }
}
