package com.tmdledit.errors;

/**
 * A mutation was rejected. The document passed to the failing call is left unmodified.
 */
public abstract class TmdlMutationException extends TmdlException {

    protected TmdlMutationException(String errorCode, String message, String path) {
        super(errorCode, message, 0, path);
    }
}
