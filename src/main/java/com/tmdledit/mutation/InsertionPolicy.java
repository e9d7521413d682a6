package com.tmdledit.mutation;

import com.tmdledit.models.EntityKind;
import com.tmdledit.models.TmdlEntity;

/**
 * Decides where among a parent's members a new child entity goes.
 */
public interface InsertionPolicy {

    /**
     * Index into {@code parent.getMembers()} at which the new entity is inserted.
     */
    int insertionIndex(TmdlEntity parent, EntityKind kind);

    static InsertionPolicy fromName(String name) {
        if (name == null || name.isBlank() || "convention".equalsIgnoreCase(name.trim())) {
            return new AuthoredConventionPolicy();
        }
        if ("append".equalsIgnoreCase(name.trim())) {
            return new AppendInsertionPolicy();
        }
        throw new IllegalArgumentException("Unknown insertion policy: " + name + " (expected convention or append)");
    }
}
