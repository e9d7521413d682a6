package com.tmdledit.models;

import java.util.List;
import java.util.Set;

/**
 * A property line of an entity: {@code key: value}, {@code key = expression} or a bare flag.
 * Keys outside {@link #RECOGNIZED_KEYS} are carried through untouched.
 */
public class TmdlProperty extends TmdlElement {

    public enum Style {
        COLON,
        EQUALS,
        FLAG
    }

    public static final Set<String> RECOGNIZED_KEYS = Set.of(
        "dataType", "lineageTag", "summarizeBy", "formatString", "sourceColumn", "isHidden",
        "mode", "dataCategory", "sortByColumn", "displayFolder", "isNameInferred", "fromColumn",
        "toColumn", "fromCardinality", "toCardinality", "cardinality", "crossFilteringBehavior",
        "isActive", "joinOnDateBehavior", "column", "ordinal", "precedence", "isDefault",
        "relationship", "defaultHierarchy", "source", "changedProperty", "isDefaultLabel",
        "isKey", "isPrivate", "showAsVariationsOnly", "isAvailableInMdx", "sourceLineageTag",
        "expression", "formatStringDefinition", "description"
    );

    private final String key;
    private final Style style;
    private String value;
    private final int depth;
    private final int lineNumber;
    private List<String> rawLines;

    public TmdlProperty(String key, Style style, String value, int depth, int lineNumber, List<String> rawLines) {
        this.key = key;
        this.style = style;
        this.value = value;
        this.depth = depth;
        this.lineNumber = lineNumber;
        this.rawLines = rawLines == null ? null : List.copyOf(rawLines);
    }

    public static TmdlProperty colon(String key, String value, int depth) {
        return new TmdlProperty(key, Style.COLON, value, depth, 0, null);
    }

    public static TmdlProperty flag(String key, int depth) {
        return new TmdlProperty(key, Style.FLAG, null, depth, 0, null);
    }

    public static TmdlProperty expression(String key, String expression, int depth) {
        return new TmdlProperty(key, Style.EQUALS, expression, depth, 0, null);
    }

    public String getKey() {
        return key;
    }

    public Style getStyle() {
        return style;
    }

    /** Unquoted value, expression text, or null for a flag. */
    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
        this.rawLines = null;
    }

    public boolean isRecognized() {
        return RECOGNIZED_KEYS.contains(key);
    }

    /**
     * Boolean reading: a bare flag is true, otherwise the value must be {@code true}.
     */
    public boolean isTrue() {
        return style == Style.FLAG || "true".equalsIgnoreCase(value);
    }

    public List<String> getRawLines() {
        return rawLines;
    }

    @Override
    public int getDepth() {
        return depth;
    }

    @Override
    public int getLineNumber() {
        return lineNumber;
    }

    @Override
    public boolean isModified() {
        return rawLines == null;
    }

    @Override
    public TmdlProperty copy() {
        return new TmdlProperty(key, style, value, depth, lineNumber, rawLines);
    }

    @Override
    public String toString() {
        return key + (style == Style.FLAG ? "" : (style == Style.COLON ? ": " : " = ") + value);
    }
}
