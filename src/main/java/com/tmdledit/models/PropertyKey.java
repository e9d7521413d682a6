package com.tmdledit.models;

/**
 * Properties that can be supplied when adding or updating an entity.
 */
public enum PropertyKey {
    NAME("name", null),
    DATA_TYPE("data_type", "dataType"),
    EXPRESSION("expression", null),
    FORMAT_STRING("format_string", "formatString"),
    SUMMARIZE_BY("summarize_by", "summarizeBy"),
    IS_HIDDEN("is_hidden", "isHidden"),
    DESCRIPTION("description", null);

    private final String payloadKey;
    private final String tmdlKey;

    PropertyKey(String payloadKey, String tmdlKey) {
        this.payloadKey = payloadKey;
        this.tmdlKey = tmdlKey;
    }

    public String getPayloadKey() {
        return payloadKey;
    }

    /** Property line key, or null when the value lives in the declaration or description. */
    public String getTmdlKey() {
        return tmdlKey;
    }
}
