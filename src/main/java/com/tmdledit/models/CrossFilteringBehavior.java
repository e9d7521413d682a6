package com.tmdledit.models;

public enum CrossFilteringBehavior {
    AUTOMATIC("automatic"),
    ONE_DIRECTION("oneDirection"),
    BOTH_DIRECTIONS("bothDirections");

    private final String tmdl;

    CrossFilteringBehavior(String tmdl) {
        this.tmdl = tmdl;
    }

    public String toTmdl() {
        return tmdl;
    }

    public static CrossFilteringBehavior fromTmdl(String value) {
        if (value == null) return null;
        String v = value.trim();
        for (CrossFilteringBehavior b : values()) {
            if (b.tmdl.equalsIgnoreCase(v)) {
                return b;
            }
        }
        return null;
    }
}
