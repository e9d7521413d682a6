package com.tmdledit.models;

import java.util.List;

/**
 * A blank line, {@code //} comment or {@code ///} description line kept verbatim.
 */
public final class Trivia extends TmdlElement {

    public enum Type {
        BLANK,
        COMMENT,
        DESCRIPTION
    }

    private final Type type;
    private final String text;
    private final int depth;
    private final int lineNumber;
    private final List<String> rawLines;

    public Trivia(Type type, String text, int depth, int lineNumber, List<String> rawLines) {
        this.type = type;
        this.text = text;
        this.depth = depth;
        this.lineNumber = lineNumber;
        this.rawLines = rawLines == null ? null : List.copyOf(rawLines);
    }

    public static Trivia blank() {
        return new Trivia(Type.BLANK, "", 0, 0, null);
    }

    public static Trivia description(String line, int depth) {
        String text = line == null || line.isEmpty() ? "///" : "/// " + line;
        return new Trivia(Type.DESCRIPTION, text, depth, 0, null);
    }

    public Type getType() {
        return type;
    }

    public boolean isBlank() {
        return type == Type.BLANK;
    }

    /** Line content without indentation, including the comment marker. */
    public String getText() {
        return text;
    }

    /**
     * Text of a description line after {@code ///} and one following space.
     */
    public String getDescriptionText() {
        String body = text.startsWith("///") ? text.substring(3) : text;
        return body.startsWith(" ") ? body.substring(1) : body;
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
    public Trivia copy() {
        return new Trivia(type, text, depth, lineNumber, rawLines);
    }
}
