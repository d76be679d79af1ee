package com.dfanalyzer.trace.model;

/**
 * Discriminant of a parsed trace line. The codes are the ones used by the
 * trace capture layer and are stable.
 */
public enum RecordKind {
    EVENT(0),
    FILE_HASH(1),
    HOST_HASH(2),
    STRING_HASH(3),
    OTHER_METADATA(4),
    PROCESS_METADATA(5);

    RecordKind(final int pCode) {
        this.code = pCode;
    }

    public final int code;

    public boolean isHashEntry() {
        return this == FILE_HASH || this == HOST_HASH || this == STRING_HASH;
    }

    public boolean isMetadata() {
        return this == OTHER_METADATA || this == PROCESS_METADATA;
    }

    /**
     * Maps the name of a metadata marker line to its kind.
     */
    public static RecordKind findByMarker(final String marker) {
        if ("FH".equals(marker)) {
            return FILE_HASH;
        } else if ("HH".equals(marker)) {
            return HOST_HASH;
        } else if ("SH".equals(marker)) {
            return STRING_HASH;
        } else if ("PR".equals(marker)) {
            return PROCESS_METADATA;
        }
        return OTHER_METADATA;
    }
}
