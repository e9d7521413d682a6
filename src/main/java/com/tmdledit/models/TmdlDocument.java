package com.tmdledit.models;

import com.tmdledit.parser.IndentUnit;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parsed TMDL file: ordered top-level elements plus the line terminator and indent unit
 * the text was written with.
 */
public class TmdlDocument {

    private final List<TmdlElement> elements;
    private final String newline;
    private final IndentUnit indentUnit;

    public TmdlDocument(List<TmdlElement> elements, String newline, IndentUnit indentUnit) {
        this.elements = new ArrayList<>(elements);
        this.newline = newline;
        this.indentUnit = indentUnit;
    }

    public List<TmdlElement> getElements() {
        return elements;
    }

    public String getNewline() {
        return newline;
    }

    public IndentUnit getIndentUnit() {
        return indentUnit;
    }

    public List<TmdlEntity> getTables() {
        return Elements.entities(elements, EntityKind.TABLE);
    }

    public TmdlEntity getTable(String name) {
        return Elements.findEntity(elements, EntityKind.TABLE, name);
    }

    public List<TmdlEntity> getRelationships() {
        return Elements.entities(elements, EntityKind.RELATIONSHIP);
    }

    public TmdlEntity findTopLevel(EntityKind kind, String name) {
        return Elements.findEntity(elements, kind, name);
    }

    /**
     * Every lineage tag in the document, in source order.
     */
    public Set<String> collectLineageTags() {
        Set<String> tags = new LinkedHashSet<>();
        collectTags(elements, tags);
        return tags;
    }

    private static void collectTags(List<TmdlElement> members, Set<String> tags) {
        for (TmdlElement element : members) {
            if (element instanceof TmdlEntity) {
                TmdlEntity entity = (TmdlEntity) element;
                String tag = entity.getLineageTag();
                if (tag != null) {
                    tags.add(tag);
                }
                collectTags(entity.getMembers(), tags);
            }
        }
    }

    public TmdlDocument copy() {
        return new TmdlDocument(Elements.copyAll(elements), newline, indentUnit);
    }
}
