package com.dfanalyzer.trace.table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.dfanalyzer.trace.model.Columns;
import com.dfanalyzer.trace.model.IOCategory;

/**
 * One row of the normalized events table. Rows are immutable; the
 * annotation stages derive new rows through {@link #toBuilder()}.
 */
public class TraceRow {

    private final String funcName;
    private final String cat;
    private final double time;
    private final long timeStart;
    private final long timeEnd;
    private final long timeRange;
    private final String timeInterval;
    private final Long pid;
    private final Long tid;
    private final String procName;
    private final String fileName;
    private final String hostName;
    private final IOCategory ioCat;
    private final Long size;
    private final Long imageId;
    private final Long step;
    private final Integer accessPattern;
    private final Integer count;
    private final Map<String, Object> extraColumns;

    private TraceRow(Builder b) {
        this.funcName = b.funcName;
        this.cat = b.cat;
        this.time = b.time;
        this.timeStart = b.timeStart;
        this.timeEnd = b.timeEnd;
        this.timeRange = b.timeRange;
        this.timeInterval = b.timeInterval;
        this.pid = b.pid;
        this.tid = b.tid;
        this.procName = b.procName;
        this.fileName = b.fileName;
        this.hostName = b.hostName;
        this.ioCat = b.ioCat;
        this.size = b.size;
        this.imageId = b.imageId;
        this.step = b.step;
        this.accessPattern = b.accessPattern;
        this.count = b.count;
        this.extraColumns = b.extraColumns.isEmpty() ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(b.extraColumns));
    }

    /**
     * Value of a column by name; extra columns included. Null for a missing
     * value or an unknown column.
     */
    public Object get(String column) {
        switch (column) {
        case Columns.COL_FUNC_NAME:
            return funcName;
        case Columns.COL_CAT:
            return cat;
        case Columns.COL_TIME:
            return time;
        case Columns.COL_TIME_START:
            return timeStart;
        case Columns.COL_TIME_END:
            return timeEnd;
        case Columns.COL_TIME_RANGE:
            return timeRange;
        case Columns.COL_TIME_INTERVAL:
            return timeInterval;
        case Columns.COL_PID:
            return pid;
        case Columns.COL_TID:
            return tid;
        case Columns.COL_PROC_NAME:
            return procName;
        case Columns.COL_FILE_NAME:
            return fileName;
        case Columns.COL_HOST_NAME:
            return hostName;
        case Columns.COL_IO_CAT:
            return ioCat;
        case Columns.COL_SIZE:
            return size;
        case Columns.COL_IMAGE_ID:
            return imageId;
        case Columns.COL_STEP:
            return step;
        case Columns.COL_ACC_PAT:
            return accessPattern;
        case Columns.COL_COUNT:
            return count;
        default:
            return extraColumns.get(column);
        }
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.funcName = funcName;
        b.cat = cat;
        b.time = time;
        b.timeStart = timeStart;
        b.timeEnd = timeEnd;
        b.timeRange = timeRange;
        b.timeInterval = timeInterval;
        b.pid = pid;
        b.tid = tid;
        b.procName = procName;
        b.fileName = fileName;
        b.hostName = hostName;
        b.ioCat = ioCat;
        b.size = size;
        b.imageId = imageId;
        b.step = step;
        b.accessPattern = accessPattern;
        b.count = count;
        b.extraColumns.putAll(extraColumns);
        return b;
    }

    public String getFuncName() {
        return funcName;
    }

    public String getCat() {
        return cat;
    }

    public double getTime() {
        return time;
    }

    public long getTimeStart() {
        return timeStart;
    }

    public long getTimeEnd() {
        return timeEnd;
    }

    public long getTimeRange() {
        return timeRange;
    }

    public String getTimeInterval() {
        return timeInterval;
    }

    public Long getPid() {
        return pid;
    }

    public Long getTid() {
        return tid;
    }

    public String getProcName() {
        return procName;
    }

    public String getFileName() {
        return fileName;
    }

    public String getHostName() {
        return hostName;
    }

    public IOCategory getIoCat() {
        return ioCat;
    }

    public Long getSize() {
        return size;
    }

    public Long getImageId() {
        return imageId;
    }

    public Long getStep() {
        return step;
    }

    public Integer getAccessPattern() {
        return accessPattern;
    }

    public Integer getCount() {
        return count;
    }

    public Map<String, Object> getExtraColumns() {
        return extraColumns;
    }

    @Override
    public String toString() {
        return String.format("%s %s t=%d+%.6f file=%s host=%s io=%s size=%s", funcName, cat, timeStart, time,
                fileName, hostName, ioCat, size);
    }

    public static class Builder {
        private String funcName;
        private String cat;
        private double time;
        private long timeStart;
        private long timeEnd;
        private long timeRange;
        private String timeInterval;
        private Long pid;
        private Long tid;
        private String procName;
        private String fileName;
        private String hostName;
        private IOCategory ioCat;
        private Long size;
        private Long imageId;
        private Long step;
        private Integer accessPattern;
        private Integer count;
        private final Map<String, Object> extraColumns = new LinkedHashMap<>();

        public Builder funcName(String funcName) {
            this.funcName = funcName;
            return this;
        }

        public Builder cat(String cat) {
            this.cat = cat;
            return this;
        }

        public Builder time(double time) {
            this.time = time;
            return this;
        }

        public Builder timeStart(long timeStart) {
            this.timeStart = timeStart;
            return this;
        }

        public Builder timeEnd(long timeEnd) {
            this.timeEnd = timeEnd;
            return this;
        }

        public Builder timeRange(long timeRange) {
            this.timeRange = timeRange;
            return this;
        }

        public Builder timeInterval(String timeInterval) {
            this.timeInterval = timeInterval;
            return this;
        }

        public Builder pid(Long pid) {
            this.pid = pid;
            return this;
        }

        public Builder tid(Long tid) {
            this.tid = tid;
            return this;
        }

        public Builder procName(String procName) {
            this.procName = procName;
            return this;
        }

        public Builder fileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        public Builder hostName(String hostName) {
            this.hostName = hostName;
            return this;
        }

        public Builder ioCat(IOCategory ioCat) {
            this.ioCat = ioCat;
            return this;
        }

        public Builder size(Long size) {
            this.size = size;
            return this;
        }

        public Builder imageId(Long imageId) {
            this.imageId = imageId;
            return this;
        }

        public Builder step(Long step) {
            this.step = step;
            return this;
        }

        public Builder accessPattern(Integer accessPattern) {
            this.accessPattern = accessPattern;
            return this;
        }

        public Builder count(Integer count) {
            this.count = count;
            return this;
        }

        public Builder extraColumns(Map<String, Object> columns) {
            this.extraColumns.putAll(columns);
            return this;
        }

        public TraceRow build() {
            return new TraceRow(this);
        }
    }
}
