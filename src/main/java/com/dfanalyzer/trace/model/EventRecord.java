package com.dfanalyzer.trace.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A regular traced call. Instances are immutable; rebasing produces a new
 * instance.
 */
public class EventRecord extends ParsedRecord {

    private final String cat;
    private final long ts;
    private final long dur;
    private final long te;
    private final long trange;
    private final String timeInterval;
    private final IOCategory ioCategory;
    private final Long size;
    private final Long imageId;
    private final String fileHash;
    private final Long step;
    private final Map<String, Object> extraColumns;

    private EventRecord(Builder b) {
        super(b.name, b.pid, b.tid, b.hostHash);
        this.cat = b.cat;
        this.ts = b.ts;
        this.dur = b.dur;
        this.te = b.ts + b.dur;
        this.trange = b.trange;
        this.timeInterval = b.timeInterval;
        this.ioCategory = b.ioCategory == null ? IOCategory.OTHER : b.ioCategory;
        this.size = b.size;
        this.imageId = b.imageId;
        this.fileHash = b.fileHash;
        this.step = b.step;
        this.extraColumns = b.extraColumns.isEmpty() ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(b.extraColumns));
    }

    @Override
    public RecordKind getKind() {
        return RecordKind.EVENT;
    }

    /**
     * Shifts the event so that {@code minTs} becomes time zero and recomputes
     * the time bucket from the shifted start time.
     */
    public EventRecord rebase(long minTs, double granularity) {
        long shifted = ts - minTs;
        return toBuilder()
                .ts(shifted)
                .trange((long) Math.floor(shifted / granularity))
                .build();
    }

    public Builder toBuilder() {
        Builder b = new Builder()
                .name(getName())
                .cat(cat)
                .pid(getPid())
                .tid(getTid())
                .hostHash(getHostHash())
                .ts(ts)
                .dur(dur)
                .trange(trange)
                .timeInterval(timeInterval)
                .ioCategory(ioCategory)
                .size(size)
                .imageId(imageId)
                .fileHash(fileHash)
                .step(step);
        b.extraColumns.putAll(extraColumns);
        return b;
    }

    public String getCat() {
        return cat;
    }

    public long getTs() {
        return ts;
    }

    public long getDur() {
        return dur;
    }

    public long getTe() {
        return te;
    }

    public long getTrange() {
        return trange;
    }

    /**
     * Closed interval {@code [ts,te]}, only set when approximate time is off.
     */
    public String getTimeInterval() {
        return timeInterval;
    }

    public IOCategory getIoCategory() {
        return ioCategory;
    }

    public Long getSize() {
        return size;
    }

    public Long getImageId() {
        return imageId;
    }

    public String getFileHash() {
        return fileHash;
    }

    public Long getStep() {
        return step;
    }

    public Map<String, Object> getExtraColumns() {
        return extraColumns;
    }

    @Override
    public String toString() {
        return "Event[" + getName() + " cat=" + cat + " ts=" + ts + " dur=" + dur + " io=" + ioCategory + "]";
    }

    public static class Builder {
        private String name;
        private String cat;
        private Long pid;
        private Long tid;
        private String hostHash;
        private long ts;
        private long dur;
        private long trange;
        private String timeInterval;
        private IOCategory ioCategory;
        private Long size;
        private Long imageId;
        private String fileHash;
        private Long step;
        private final Map<String, Object> extraColumns = new LinkedHashMap<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder cat(String cat) {
            this.cat = cat;
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

        public Builder hostHash(String hostHash) {
            this.hostHash = hostHash;
            return this;
        }

        public Builder ts(long ts) {
            this.ts = ts;
            return this;
        }

        public Builder dur(long dur) {
            this.dur = dur;
            return this;
        }

        public Builder trange(long trange) {
            this.trange = trange;
            return this;
        }

        public Builder timeInterval(String timeInterval) {
            this.timeInterval = timeInterval;
            return this;
        }

        public Builder ioCategory(IOCategory ioCategory) {
            this.ioCategory = ioCategory;
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

        public Builder fileHash(String fileHash) {
            this.fileHash = fileHash;
            return this;
        }

        public Builder step(Long step) {
            this.step = step;
            return this;
        }

        public Builder extraColumns(Map<String, ?> columns) {
            if (columns != null) {
                this.extraColumns.putAll(columns);
            }
            return this;
        }

        public boolean hasExtraColumn(String column) {
            return extraColumns.containsKey(column);
        }

        public EventRecord build() {
            return new EventRecord(this);
        }
    }
}
