package com.tmdledit.models;

import java.util.Locale;

/**
 * Structural entity types recognized by their leading TMDL keyword.
 */
public enum EntityKind {
    TABLE("table", true),
    COLUMN("column", true),
    MEASURE("measure", true),
    PARTITION("partition", true),
    HIERARCHY("hierarchy", true),
    LEVEL("level", true),
    RELATIONSHIP("relationship", true),
    ANNOTATION("annotation", true),
    CALCULATION_GROUP("calculationGroup", false),
    CALCULATION_ITEM("calculationItem", true),
    VARIATION("variation", true);

    private final String keyword;
    private final boolean named;

    EntityKind(String keyword, boolean named) {
        this.keyword = keyword;
        this.named = named;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * False only for {@code calculationGroup}, which is declared without a name.
     */
    public boolean isNamed() {
        return named;
    }

    public static EntityKind fromKeyword(String keyword) {
        if (keyword == null) {
            return null;
        }
        for (EntityKind kind : values()) {
            if (kind.keyword.equals(keyword)) {
                return kind;
            }
        }
        return null;
    }

    /**
     * Lenient lookup for user input: accepts the keyword in any case, the enum name,
     * and dashed/underscored spellings ("calculation-item").
     */
    public static EntityKind parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
        for (EntityKind kind : values()) {
            if (kind.keyword.toLowerCase(Locale.ROOT).equals(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
