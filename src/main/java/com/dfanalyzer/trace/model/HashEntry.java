package com.dfanalyzer.trace.model;

import java.util.Objects;

/**
 * Dictionary entry captured from an {@code FH}, {@code HH} or {@code SH}
 * marker: maps a hash to the human readable name it stands for.
 */
public class HashEntry extends ParsedRecord {

    private final RecordKind kind;
    private final String hash;

    public HashEntry(RecordKind kind, String name, String hash, Long pid, Long tid, String hostHash) {
        super(name, pid, tid, hostHash);
        if (!kind.isHashEntry()) {
            throw new IllegalArgumentException("Not a hash entry kind: " + kind);
        }
        this.kind = kind;
        this.hash = hash;
    }

    @Override
    public RecordKind getKind() {
        return kind;
    }

    /**
     * Hash value, null when the marker line carried no arguments.
     */
    public String getHash() {
        return hash;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HashEntry other = (HashEntry) o;
        return kind == other.kind &&
               Objects.equals(hash, other.hash) &&
               Objects.equals(getName(), other.getName()) &&
               Objects.equals(getPid(), other.getPid()) &&
               Objects.equals(getTid(), other.getTid()) &&
               Objects.equals(getHostHash(), other.getHostHash());
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, hash, getName(), getPid(), getTid(), getHostHash());
    }

    @Override
    public String toString() {
        return kind + "[" + hash + " -> " + getName() + "]";
    }
}
