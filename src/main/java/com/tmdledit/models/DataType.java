package com.tmdledit.models;

public enum DataType {
    STRING("string"),
    INT64("int64"),
    DOUBLE("double"),
    DECIMAL("decimal"),
    BOOLEAN("boolean"),
    DATE_TIME("dateTime"),
    BINARY("binary"),
    VARIANT("variant");

    private final String tmdl;

    DataType(String tmdl) {
        this.tmdl = tmdl;
    }

    public String toTmdl() {
        return tmdl;
    }

    /**
     * @return the matching constant (case-insensitive), or null for values outside the enumeration
     */
    public static DataType fromTmdl(String value) {
        if (value == null) return null;
        String v = value.trim();
        for (DataType type : values()) {
            if (type.tmdl.equalsIgnoreCase(v)) {
                return type;
            }
        }
        return null;
    }
}
