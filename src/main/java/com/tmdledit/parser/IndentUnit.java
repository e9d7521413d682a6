package com.tmdledit.parser;

import java.util.List;
import java.util.Objects;

/**
 * The indentation step of a document: one tab (the format's default) or a fixed run of spaces.
 */
public final class IndentUnit {

    public static final IndentUnit TAB = new IndentUnit("\t");

    private final String unit;

    private IndentUnit(String unit) {
        this.unit = unit;
    }

    public static IndentUnit spaces(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("Space indent must be positive: " + count);
        }
        return new IndentUnit(" ".repeat(count));
    }

    /**
     * Detects the unit from the first indented, non-blank physical line; tabs win by default.
     */
    public static IndentUnit detect(List<String> physicalLines) {
        for (String raw : physicalLines) {
            String body = LineSegmenter.stripTerminator(raw);
            if (body.isBlank()) {
                continue;
            }
            char first = body.charAt(0);
            if (first == '\t') {
                return TAB;
            }
            if (first == ' ') {
                int count = 0;
                while (count < body.length() && body.charAt(count) == ' ') {
                    count++;
                }
                return spaces(count);
            }
        }
        return TAB;
    }

    public String getUnit() {
        return unit;
    }

    public boolean isTab() {
        return "\t".equals(unit);
    }

    public String repeat(int depth) {
        return depth <= 0 ? "" : unit.repeat(depth);
    }

    /**
     * Whole indent units at the start of the line. A tab always counts as one unit;
     * a partial run of spaces is rounded down.
     */
    public int depthOf(String body) {
        int width = unit.length();
        int depth = 0;
        int spaces = 0;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\t') {
                depth++;
                spaces = 0;
            } else if (c == ' ') {
                spaces++;
                if (!isTab() && spaces == width) {
                    depth++;
                    spaces = 0;
                }
            } else {
                break;
            }
        }
        return depth;
    }

    /**
     * Strips at most {@code depth} units of leading whitespace.
     */
    public String stripIndent(String body, int depth) {
        int remaining = depth;
        int i = 0;
        int width = unit.length();
        while (remaining > 0 && i < body.length()) {
            char c = body.charAt(i);
            if (c == '\t') {
                i++;
                remaining--;
            } else if (c == ' ') {
                int run = 0;
                while (run < width && i + run < body.length() && body.charAt(i + run) == ' ') {
                    run++;
                }
                i += run;
                remaining--;
                if (run < width) {
                    break;
                }
            } else {
                break;
            }
        }
        return body.substring(i);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IndentUnit)) return false;
        return unit.equals(((IndentUnit) o).unit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(unit);
    }

    @Override
    public String toString() {
        return isTab() ? "tab" : unit.length() + " spaces";
    }
}
