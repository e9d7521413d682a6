package com.tmdledit.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts the logical text of an {@code = ...} value from a statement and its continuation
 * lines. Continuation lines lose the base indent of two units below the statement; fenced
 * values lose their fences.
 */
final class ExpressionText {

    private static final String FENCE = "```";

    private ExpressionText() {
    }

    static String extract(LogicalLine line, IndentUnit unit, String inline) {
        List<String> continuation = line.getContinuationLines();
        int base = line.getDepth() + 2;
        List<String> parts = new ArrayList<>();

        if (LineSegmenter.isOpenFence(inline)) {
            String head = inline.substring(FENCE.length()).strip();
            if (!head.isEmpty()) {
                parts.add(head);
            }
            for (int i = 0; i < continuation.size() - 1; i++) {
                parts.add(stripLine(continuation.get(i), unit, base));
            }
            return String.join("\n", parts);
        }

        if (!inline.isEmpty()) {
            parts.add(inline);
        }
        for (String raw : continuation) {
            parts.add(stripLine(raw, unit, base));
        }
        while (!parts.isEmpty() && parts.get(parts.size() - 1).isEmpty()) {
            parts.remove(parts.size() - 1);
        }
        return String.join("\n", parts);
    }

    private static String stripLine(String raw, IndentUnit unit, int base) {
        String body = LineSegmenter.stripTerminator(raw);
        if (body.isBlank()) {
            return "";
        }
        return unit.stripIndent(body, base).stripTrailing();
    }
}
