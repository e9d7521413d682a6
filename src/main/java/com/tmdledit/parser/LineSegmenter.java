package com.tmdledit.parser;

import com.tmdledit.errors.MalformedIndentationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits TMDL text into logical lines.
 *
 * <p>A statement whose first separator is {@code =} carries an expression. The expression continues
 * onto following physical lines that are indented at least two units deeper than the statement,
 * onto lines deeper than the statement while its brackets are still open, and through a closing
 * {@code ```} fence when the expression opens one. Blank lines inside such a span belong to it.
 * Blank lines, {@code //} comments and {@code ///} descriptions outside spans are kept as trivia.
 */
public class LineSegmenter {

    private static final String FENCE = "```";
    private static final char BOM = '\uFEFF';

    public List<LogicalLine> segment(String text) throws MalformedIndentationException {
        List<String> physical = splitPhysicalLines(text);
        return segment(physical, IndentUnit.detect(physical));
    }

    public List<LogicalLine> segment(List<String> physical, IndentUnit unit) throws MalformedIndentationException {
        List<LogicalLine> result = new ArrayList<>();
        int lastDepth = -1;
        int i = 0;
        int n = physical.size();
        while (i < n) {
            String raw = physical.get(i);
            String body = stripTerminator(raw);
            int lineNumber = i + 1;
            if (body.isBlank()) {
                result.add(new LogicalLine(lineNumber, 0, LogicalLine.Kind.BLANK, "", List.of(raw)));
                i++;
                continue;
            }
            int depth = unit.depthOf(body);
            String content = stripBom(body).strip();
            if (content.startsWith("///")) {
                result.add(new LogicalLine(lineNumber, depth, LogicalLine.Kind.DESCRIPTION, content, List.of(raw)));
                i++;
                continue;
            }
            if (content.startsWith("//")) {
                result.add(new LogicalLine(lineNumber, depth, LogicalLine.Kind.COMMENT, content, List.of(raw)));
                i++;
                continue;
            }
            if (depth > lastDepth + 1) {
                throw new MalformedIndentationException(
                    "Indentation skips a level (depth " + depth + " after depth " + lastDepth + ")", lineNumber);
            }

            List<String> raws = new ArrayList<>();
            raws.add(raw);
            int next = i + 1;
            int separator = findSeparator(content);
            if (separator >= 0 && content.charAt(separator) == '=') {
                String inline = content.substring(separator + 1).strip();
                if (isOpenFence(inline)) {
                    next = consumeFence(physical, next, raws, lineNumber);
                } else {
                    next = consumeContinuation(physical, next, raws, unit, depth, bracketBalance(inline));
                }
            }
            result.add(new LogicalLine(lineNumber, depth, LogicalLine.Kind.STATEMENT, content, raws));
            lastDepth = depth;
            i = next;
        }
        return result;
    }

    private int consumeContinuation(List<String> physical, int start, List<String> raws,
                                    IndentUnit unit, int headerDepth, int balance) {
        int n = physical.size();
        int j = start;
        while (j < n) {
            String body = stripTerminator(physical.get(j));
            if (body.isBlank()) {
                int k = j;
                while (k < n && stripTerminator(physical.get(k)).isBlank()) {
                    k++;
                }
                if (k >= n || !continues(stripTerminator(physical.get(k)), unit, headerDepth, balance)) {
                    break;
                }
                for (int b = j; b < k; b++) {
                    raws.add(physical.get(b));
                }
                j = k;
                continue;
            }
            if (!continues(body, unit, headerDepth, balance)) {
                break;
            }
            raws.add(physical.get(j));
            balance += bracketBalance(body.strip());
            j++;
        }
        return j;
    }

    private boolean continues(String body, IndentUnit unit, int headerDepth, int balance) {
        int depth = unit.depthOf(body);
        return depth >= headerDepth + 2 || (balance > 0 && depth > headerDepth);
    }

    private int consumeFence(List<String> physical, int start, List<String> raws, int headerLine)
            throws MalformedIndentationException {
        for (int j = start; j < physical.size(); j++) {
            raws.add(physical.get(j));
            if (stripTerminator(physical.get(j)).strip().startsWith(FENCE)) {
                return j + 1;
            }
        }
        throw new MalformedIndentationException("Unterminated ``` expression", headerLine);
    }

    static boolean isOpenFence(String inline) {
        if (!inline.startsWith(FENCE)) {
            return false;
        }
        int count = 0;
        int idx = 0;
        while ((idx = inline.indexOf(FENCE, idx)) >= 0) {
            count++;
            idx += FENCE.length();
        }
        return count % 2 == 1;
    }

    /**
     * Index of the first {@code :} or {@code =} outside single- or double-quoted text, or -1.
     */
    public static int findSeparator(String content) {
        boolean inSingle = false;
        boolean inDouble = false;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (inSingle) {
                if (c == '\'') inSingle = false;
                continue;
            }
            if (inDouble) {
                if (c == '"') inDouble = false;
                continue;
            }
            if (c == '\'') {
                inSingle = true;
            } else if (c == '"') {
                inDouble = true;
            } else if (c == ':' || c == '=') {
                return i;
            }
        }
        return -1;
    }

    /**
     * Net count of opening minus closing brackets, ignoring quoted text, {@code [...]} names
     * and anything after a {@code //} comment.
     */
    static int bracketBalance(String text) {
        int balance = 0;
        boolean inSingle = false;
        boolean inDouble = false;
        boolean inSquare = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inSingle) {
                if (c == '\'') inSingle = false;
                continue;
            }
            if (inDouble) {
                if (c == '"') inDouble = false;
                continue;
            }
            if (inSquare) {
                if (c == ']') {
                    inSquare = false;
                    balance--;
                }
                continue;
            }
            if (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '/') {
                break;
            }
            switch (c) {
                case '\'':
                    inSingle = true;
                    break;
                case '"':
                    inDouble = true;
                    break;
                case '[':
                    inSquare = true;
                    balance++;
                    break;
                case '(':
                case '{':
                    balance++;
                    break;
                case ')':
                case '}':
                    balance--;
                    break;
                default:
                    break;
            }
        }
        return balance;
    }

    /**
     * Splits text into physical lines, each keeping its own terminator ({@code \n} or {@code \r\n}).
     * A final line without terminator is kept as-is; empty text yields no lines.
     */
    public static List<String> splitPhysicalLines(String text) {
        List<String> lines = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return lines;
        }
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lines.add(text.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
        }
        return lines;
    }

    public static String stripTerminator(String raw) {
        int end = raw.length();
        if (end > 0 && raw.charAt(end - 1) == '\n') {
            end--;
            if (end > 0 && raw.charAt(end - 1) == '\r') {
                end--;
            }
        }
        return raw.substring(0, end);
    }

    /**
     * The terminator used by the first terminated line; {@code \n} when none is found.
     */
    public static String detectNewline(List<String> physical) {
        for (String raw : physical) {
            if (raw.endsWith("\r\n")) return "\r\n";
            if (raw.endsWith("\n")) return "\n";
        }
        return "\n";
    }

    private static String stripBom(String body) {
        if (!body.isEmpty() && body.charAt(0) == BOM) {
            return body.substring(1);
        }
        return body;
    }
}
