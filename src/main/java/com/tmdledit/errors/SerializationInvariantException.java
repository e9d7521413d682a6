package com.tmdledit.errors;

/**
 * Re-parsing serializer output did not reproduce an equivalent tree. Always a defect in the
 * editor itself, so it is unchecked and must never be swallowed.
 */
public class SerializationInvariantException extends IllegalStateException {

    public static final String CODE = "serialization_invariant_violation";

    public SerializationInvariantException(String message) {
        super(message);
    }

    public SerializationInvariantException(String message, Throwable cause) {
        super(message, cause);
    }
}
