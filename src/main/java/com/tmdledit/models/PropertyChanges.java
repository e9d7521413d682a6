package com.tmdledit.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * An ordered set of property changes. A key mapped to null clears that property.
 */
public class PropertyChanges {

    private final Map<PropertyKey, Object> values = new LinkedHashMap<>();

    public PropertyChanges name(String name) {
        values.put(PropertyKey.NAME, name);
        return this;
    }

    public PropertyChanges dataType(DataType dataType) {
        values.put(PropertyKey.DATA_TYPE, dataType);
        return this;
    }

    public PropertyChanges expression(String expression) {
        values.put(PropertyKey.EXPRESSION, expression);
        return this;
    }

    public PropertyChanges formatString(String formatString) {
        values.put(PropertyKey.FORMAT_STRING, formatString);
        return this;
    }

    public PropertyChanges summarizeBy(SummarizeBy summarizeBy) {
        values.put(PropertyKey.SUMMARIZE_BY, summarizeBy);
        return this;
    }

    public PropertyChanges hidden(Boolean hidden) {
        values.put(PropertyKey.IS_HIDDEN, hidden);
        return this;
    }

    public PropertyChanges description(String description) {
        values.put(PropertyKey.DESCRIPTION, description);
        return this;
    }

    /**
     * Untyped setter; the value must match the key's type (String, Boolean, {@link DataType} or
     * {@link SummarizeBy}).
     */
    public PropertyChanges set(PropertyKey key, Object value) {
        values.put(key, value);
        return this;
    }

    public PropertyChanges clear(PropertyKey key) {
        values.put(key, null);
        return this;
    }

    public boolean contains(PropertyKey key) {
        return values.containsKey(key);
    }

    public Object get(PropertyKey key) {
        return values.get(key);
    }

    public String getString(PropertyKey key) {
        Object value = values.get(key);
        return value == null ? null : value.toString();
    }

    public Set<PropertyKey> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
