package com.tmdledit.models;

public enum PartitionMode {
    IMPORT("import"),
    DIRECT_QUERY("directQuery"),
    DUAL("dual"),
    DIRECT_LAKE("directLake");

    private final String tmdl;

    PartitionMode(String tmdl) {
        this.tmdl = tmdl;
    }

    public String toTmdl() {
        return tmdl;
    }

    public static PartitionMode fromTmdl(String value) {
        if (value == null) return null;
        String v = value.trim();
        for (PartitionMode mode : values()) {
            if (mode.tmdl.equalsIgnoreCase(v)) {
                return mode;
            }
        }
        return null;
    }
}
