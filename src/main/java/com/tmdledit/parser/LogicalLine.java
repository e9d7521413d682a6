package com.tmdledit.parser;

import java.util.Collections;
import java.util.List;

/**
 * One logical statement of TMDL text: a physical line plus any continuation lines
 * of a multi-line value. Raw lines keep their original terminators so that
 * concatenating them reproduces the source bytes.
 */
public final class LogicalLine {

    public enum Kind {
        BLANK,
        COMMENT,
        DESCRIPTION,
        STATEMENT
    }

    private final int lineNumber;
    private final int depth;
    private final Kind kind;
    private final String content;
    private final List<String> rawLines;

    public LogicalLine(int lineNumber, int depth, Kind kind, String content, List<String> rawLines) {
        this.lineNumber = lineNumber;
        this.depth = depth;
        this.kind = kind;
        this.content = content;
        this.rawLines = List.copyOf(rawLines);
    }

    /** 1-based number of the first physical line. */
    public int getLineNumber() {
        return lineNumber;
    }

    public int getDepth() {
        return depth;
    }

    public Kind getKind() {
        return kind;
    }

    /** First physical line without indentation or terminator. */
    public String getContent() {
        return content;
    }

    public List<String> getRawLines() {
        return rawLines;
    }

    public List<String> getContinuationLines() {
        if (rawLines.size() <= 1) {
            return Collections.emptyList();
        }
        return rawLines.subList(1, rawLines.size());
    }

    public boolean isTrivia() {
        return kind != Kind.STATEMENT;
    }

    public String getRawText() {
        StringBuilder sb = new StringBuilder();
        for (String raw : rawLines) {
            sb.append(raw);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return lineNumber + ":" + depth + ":" + kind + ":" + content;
    }
}
