package com.dfanalyzer.trace.model;

public enum IOCategory {
    READ(1, "read"),
    WRITE(2, "write"),
    METADATA(3, "metadata"),
    OTHER(6, "other");

    IOCategory(final int pCode, final String pLabel) {
        this.code = pCode;
        this.label = pLabel;
    }

    public final int code;
    private final String label;

    public String getLabel() {
        return label;
    }

    public boolean isDataTransfer() {
        return this == READ || this == WRITE;
    }
}
