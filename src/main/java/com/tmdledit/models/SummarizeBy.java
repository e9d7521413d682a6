package com.tmdledit.models;

public enum SummarizeBy {
    NONE("none"),
    SUM("sum"),
    COUNT("count"),
    MIN("min"),
    MAX("max"),
    AVERAGE("average");

    private final String tmdl;

    SummarizeBy(String tmdl) {
        this.tmdl = tmdl;
    }

    public String toTmdl() {
        return tmdl;
    }

    public static SummarizeBy fromTmdl(String value) {
        if (value == null) return null;
        String v = value.trim();
        for (SummarizeBy mode : values()) {
            if (mode.tmdl.equalsIgnoreCase(v)) {
                return mode;
            }
        }
        return null;
    }
}
