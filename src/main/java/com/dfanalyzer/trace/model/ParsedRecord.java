package com.dfanalyzer.trace.model;

/**
 * One record produced from one trace line. Subclasses carry the
 * kind-specific payload; {@link #getKind()} is the discriminant.
 */
public abstract class ParsedRecord {

    private final String name;
    private final Long pid;
    private final Long tid;
    private final String hostHash;

    protected ParsedRecord(String name, Long pid, Long tid, String hostHash) {
        this.name = name;
        this.pid = pid;
        this.tid = tid;
        this.hostHash = hostHash;
    }

    public abstract RecordKind getKind();

    public String getName() {
        return name;
    }

    public Long getPid() {
        return pid;
    }

    public Long getTid() {
        return tid;
    }

    /**
     * Host hash propagated from the {@code hhash} argument, or null.
     */
    public String getHostHash() {
        return hostHash;
    }
}
