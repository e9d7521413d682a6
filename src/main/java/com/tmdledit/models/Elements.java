package com.tmdledit.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Lookups over an ordered member list.
 */
public final class Elements {

    private Elements() {
    }

    public static List<TmdlEntity> entities(List<TmdlElement> members, EntityKind kind) {
        List<TmdlEntity> result = new ArrayList<>();
        for (TmdlElement element : members) {
            if (element instanceof TmdlEntity) {
                TmdlEntity entity = (TmdlEntity) element;
                if (kind == null || entity.getKind() == kind) {
                    result.add(entity);
                }
            }
        }
        return result;
    }

    /**
     * Entity of the given kind by name: an exact match wins, otherwise the first
     * case-insensitive match. A null name matches the first entity of an unnamed kind.
     */
    public static TmdlEntity findEntity(List<TmdlElement> members, EntityKind kind, String name) {
        List<TmdlEntity> candidates = entities(members, kind);
        if (name == null || !kind.isNamed()) {
            return candidates.isEmpty() ? null : candidates.get(0);
        }
        for (TmdlEntity entity : candidates) {
            if (name.equals(entity.getName())) {
                return entity;
            }
        }
        for (TmdlEntity entity : candidates) {
            if (name.equalsIgnoreCase(entity.getName())) {
                return entity;
            }
        }
        return null;
    }

    public static TmdlProperty findProperty(List<TmdlElement> members, String key) {
        for (TmdlElement element : members) {
            if (element instanceof TmdlProperty && ((TmdlProperty) element).getKey().equals(key)) {
                return (TmdlProperty) element;
            }
        }
        return null;
    }

    public static List<TmdlElement> copyAll(List<TmdlElement> members) {
        List<TmdlElement> copies = new ArrayList<>(members.size());
        for (TmdlElement element : members) {
            copies.add(element.copy());
        }
        return copies;
    }
}
