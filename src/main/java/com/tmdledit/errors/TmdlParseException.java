package com.tmdledit.errors;

public abstract class TmdlParseException extends TmdlException {

    protected TmdlParseException(String errorCode, String message, int lineNumber) {
        super(errorCode, lineNumber > 0 ? "Line " + lineNumber + ": " + message : message, lineNumber, null);
    }
}
