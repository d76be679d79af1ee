package com.dfanalyzer.trace.model;

/**
 * Name/value metadata captured from a marker line that is not a hash
 * dictionary entry. {@code PR} markers become {@link RecordKind#PROCESS_METADATA},
 * everything else {@link RecordKind#OTHER_METADATA}.
 */
public class MetadataEntry extends ParsedRecord {

    private final RecordKind kind;
    private final String value;

    public MetadataEntry(RecordKind kind, String name, String value, Long pid, Long tid, String hostHash) {
        super(name, pid, tid, hostHash);
        if (!kind.isMetadata()) {
            throw new IllegalArgumentException("Not a metadata kind: " + kind);
        }
        this.kind = kind;
        this.value = value;
    }

    @Override
    public RecordKind getKind() {
        return kind;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return kind + "[" + getName() + "=" + value + "]";
    }
}
