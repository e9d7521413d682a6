package com.tmdledit.models;

import java.util.List;

/**
 * Verbatim lines of a block the editor does not model: model-level declarations such as
 * {@code model}, {@code ref} or {@code expression}, and property lines that own nested lines.
 */
public final class OpaqueBlock extends TmdlElement {

    private final String keyword;
    private final int depth;
    private final int lineNumber;
    private final List<String> rawLines;

    public OpaqueBlock(String keyword, int depth, int lineNumber, List<String> rawLines) {
        this.keyword = keyword;
        this.depth = depth;
        this.lineNumber = lineNumber;
        this.rawLines = List.copyOf(rawLines);
    }

    public String getKeyword() {
        return keyword;
    }

    public List<String> getRawLines() {
        return rawLines;
    }

    public String getRawText() {
        return String.join("", rawLines);
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
        return false;
    }

    @Override
    public OpaqueBlock copy() {
        return new OpaqueBlock(keyword, depth, lineNumber, rawLines);
    }
}
