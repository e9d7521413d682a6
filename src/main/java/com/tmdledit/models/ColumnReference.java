package com.tmdledit.models;

import com.tmdledit.writer.IdentifierQuoting;

import java.util.Objects;

/**
 * By-name reference to a column, written {@code Table.Column} with either part quoted.
 */
public final class ColumnReference {

    private final String table;
    private final String column;

    public ColumnReference(String table, String column) {
        this.table = table;
        this.column = column;
    }

    /**
     * Splits on the first dot outside single quotes. Returns null for null input and a
     * table-less reference when no dot is present.
     */
    public static ColumnReference parse(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        boolean quoted = false;
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (c == '.' && !quoted) {
                return new ColumnReference(
                    IdentifierQuoting.unquote(trimmed.substring(0, i)),
                    IdentifierQuoting.unquote(trimmed.substring(i + 1)));
            }
        }
        return new ColumnReference(null, IdentifierQuoting.unquote(trimmed));
    }

    public String getTable() {
        return table;
    }

    public String getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnReference)) return false;
        ColumnReference other = (ColumnReference) o;
        return Objects.equals(table, other.table) && Objects.equals(column, other.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, column);
    }

    @Override
    public String toString() {
        String col = IdentifierQuoting.quote(column);
        return table == null ? col : IdentifierQuoting.quote(table) + "." + col;
    }
}
