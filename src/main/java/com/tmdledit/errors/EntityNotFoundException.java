package com.tmdledit.errors;

public class EntityNotFoundException extends TmdlMutationException {

    public static final String CODE = "not_found";

    public EntityNotFoundException(String message, String path) {
        super(CODE, message, path);
    }
}
