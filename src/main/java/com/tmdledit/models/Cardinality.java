package com.tmdledit.models;

/**
 * Relationship cardinality, read either from an explicit {@code cardinality} property or from the
 * {@code fromCardinality}/{@code toCardinality} pair (defaults: many on the from side, one on the to side).
 */
public enum Cardinality {
    ONE_TO_MANY("oneToMany", "one-to-many"),
    MANY_TO_ONE("manyToOne", "many-to-one"),
    ONE_TO_ONE("oneToOne", "one-to-one"),
    MANY_TO_MANY("manyToMany", "many-to-many");

    private final String tmdl;
    private final String label;

    Cardinality(String tmdl, String label) {
        this.tmdl = tmdl;
        this.label = label;
    }

    public String toTmdl() {
        return tmdl;
    }

    public String getLabel() {
        return label;
    }

    public static Cardinality fromTmdl(String value) {
        if (value == null) return null;
        String v = value.trim();
        for (Cardinality c : values()) {
            if (c.tmdl.equalsIgnoreCase(v) || c.label.equalsIgnoreCase(v)) {
                return c;
            }
        }
        return null;
    }

    public static Cardinality fromEnds(String fromCardinality, String toCardinality) {
        boolean fromMany = fromCardinality == null || !"one".equalsIgnoreCase(fromCardinality.trim());
        boolean toMany = toCardinality != null && "many".equalsIgnoreCase(toCardinality.trim());
        if (fromMany && toMany) return MANY_TO_MANY;
        if (fromMany) return MANY_TO_ONE;
        if (toMany) return ONE_TO_MANY;
        return ONE_TO_ONE;
    }
}
