package com.tmdledit.errors;

public class DuplicateNameException extends TmdlMutationException {

    public static final String CODE = "duplicate_name";

    public DuplicateNameException(String message, String path) {
        super(CODE, message, path);
    }
}
