package com.tmdledit.models;

/**
 * Member of a document or entity: an entity, a property, an opaque block or trivia.
 */
public abstract class TmdlElement {

    public abstract int getDepth();

    /** 1-based source line, or 0 for elements created by an edit. */
    public abstract int getLineNumber();

    /**
     * True once the element no longer matches its source text and must be rendered.
     */
    public abstract boolean isModified();

    public abstract TmdlElement copy();
}
