package com.tmdledit.errors;

/**
 * The text cannot be arranged into an indentation tree (skipped level, dedent past the root,
 * unterminated fenced expression).
 */
public class MalformedIndentationException extends TmdlParseException {

    public static final String CODE = "malformed_indentation";

    public MalformedIndentationException(String message, int lineNumber) {
        super(CODE, message, lineNumber);
    }
}
