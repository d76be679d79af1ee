package com.dfanalyzer.trace.table;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.dfanalyzer.trace.model.HashEntry;
import com.dfanalyzer.trace.model.RecordKind;

/**
 * Hash to name dictionary of one hash kind. The first entry seen for a hash
 * wins; entries are fed in ingestion order (batch ordinal, then line), which
 * makes the choice independent of which worker finished first.
 */
public class HashDictionary {

    private final RecordKind kind;
    private final Map<String, HashEntry> entries;

    private HashDictionary(RecordKind kind, Map<String, HashEntry> entries) {
        this.kind = kind;
        this.entries = Collections.unmodifiableMap(entries);
    }

    public RecordKind getKind() {
        return kind;
    }

    public HashEntry get(String hash) {
        return hash == null ? null : entries.get(hash);
    }

    /**
     * Name recorded for {@code hash}, or null when the hash is unknown.
     */
    public String resolve(String hash) {
        HashEntry entry = get(hash);
        return entry == null ? null : entry.getName();
    }

    public Collection<HashEntry> entries() {
        return entries.values();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * True when no entry carries its own host hash.
     */
    public boolean hostHashesEmpty() {
        return entries.values().stream().allMatch(e -> e.getHostHash() == null || e.getHostHash().isEmpty());
    }

    public static class Builder {
        private final RecordKind kind;
        private final Map<String, HashEntry> entries = new LinkedHashMap<>();

        public Builder(RecordKind kind) {
            if (!kind.isHashEntry()) {
                throw new IllegalArgumentException("Not a hash kind: " + kind);
            }
            this.kind = kind;
        }

        public Builder add(HashEntry entry) {
            if (entry.getKind() != kind) {
                throw new IllegalArgumentException("Expected " + kind + " entry but got " + entry.getKind());
            }
            if (entry.getHash() != null) {
                entries.putIfAbsent(entry.getHash(), entry);
            }
            return this;
        }

        public HashDictionary build() {
            return new HashDictionary(kind, new LinkedHashMap<>(entries));
        }
    }
}
