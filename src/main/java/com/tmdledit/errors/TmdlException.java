package com.tmdledit.errors;

/**
 * Base of every recoverable failure raised by the TMDL core.
 * Carries a stable error code plus, where known, the offending line number and entity path.
 */
public abstract class TmdlException extends Exception {

    private final String errorCode;
    private final int lineNumber;
    private final String path;

    protected TmdlException(String errorCode, String message, int lineNumber, String path) {
        super(message);
        this.errorCode = errorCode;
        this.lineNumber = lineNumber;
        this.path = path;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * 1-based line number in the parsed text, or 0 when the error is not tied to a line.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getPath() {
        return path;
    }
}
