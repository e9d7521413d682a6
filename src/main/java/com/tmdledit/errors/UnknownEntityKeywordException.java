package com.tmdledit.errors;

public class UnknownEntityKeywordException extends TmdlParseException {

    public static final String CODE = "unknown_entity_keyword";

    private final String keyword;

    public UnknownEntityKeywordException(String keyword, int lineNumber) {
        super(CODE, "Unrecognized top-level keyword: " + keyword, lineNumber);
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
