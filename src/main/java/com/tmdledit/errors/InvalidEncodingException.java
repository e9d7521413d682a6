package com.tmdledit.errors;

/**
 * The file is not valid UTF-8. Editing it would rewrite the undecodable bytes, so it is refused.
 */
public class InvalidEncodingException extends TmdlParseException {

    public static final String CODE = "invalid_encoding";

    public InvalidEncodingException(String message) {
        super(CODE, message, 0);
    }
}
