package com.tmdledit.errors;

/**
 * A payload key or value outside the recognized schema, or a property that does not apply to
 * the addressed entity kind. {@link #getDetail()} holds a short machine-readable reason such as
 * {@code unknown-arg:foo} or {@code invalid-enum:summarize_by}.
 */
public class UnsupportedPropertyException extends TmdlMutationException {

    public static final String CODE = "unsupported_property";

    private final String detail;

    public UnsupportedPropertyException(String detail, String message, String path) {
        super(CODE, message, path);
        this.detail = detail;
    }

    public UnsupportedPropertyException(String detail, String message) {
        this(detail, message, null);
    }

    public String getDetail() {
        return detail;
    }
}
