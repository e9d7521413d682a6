package com.tmdledit.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.tmdledit.models.DataType;
import com.tmdledit.models.PropertyKey;
import com.tmdledit.models.SummarizeBy;

/**
 * One accepted payload key: the property it sets and the shape its JSON value must have.
 */
public class PayloadArgSpec {

    /**
     * Value shapes. {@code LINE} values end up on a single TMDL line (a declaration name or a
     * {@code key: value} property), so line breaks are refused; {@code TEXT} may span lines.
     */
    public enum Type {
        LINE,
        TEXT,
        BOOLEAN,
        DATA_TYPE,
        SUMMARIZE_BY
    }

    private final PropertyKey key;
    private final Type type;
    private final boolean required;

    public PayloadArgSpec(PropertyKey key, Type type, boolean required) {
        this.key = key;
        this.type = type;
        this.required = required;
    }

    public String getName() {
        return key.getPayloadKey();
    }

    public PropertyKey getKey() {
        return key;
    }

    public Type getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    /**
     * Returns a detail code for the first problem with {@code node}, or null when it is acceptable.
     * A JSON null passes unless the argument is required.
     */
    public String validate(JsonNode node) {
        if (node == null || node.isNull()) {
            return required ? "missing-required:" + getName() : null;
        }
        if (type == Type.BOOLEAN) {
            return node.isBoolean() ? null : "invalid-type:" + getName();
        }
        if (!node.isTextual()) {
            return "invalid-type:" + getName();
        }
        String text = node.asText();
        switch (type) {
            case LINE:
                return text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0 ? "invalid-value:" + getName() : null;
            case DATA_TYPE:
                return DataType.fromTmdl(text) == null ? "invalid-enum:" + getName() : null;
            case SUMMARIZE_BY:
                return SummarizeBy.fromTmdl(text) == null ? "invalid-enum:" + getName() : null;
            default:
                return null;
        }
    }

    /**
     * Typed value of a node that passed {@link #validate(JsonNode)}; null for a JSON null.
     */
    public Object convert(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        switch (type) {
            case BOOLEAN:
                return node.asBoolean();
            case DATA_TYPE:
                return DataType.fromTmdl(node.asText());
            case SUMMARIZE_BY:
                return SummarizeBy.fromTmdl(node.asText());
            default:
                return node.asText();
        }
    }
}
