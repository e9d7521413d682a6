package com.tmdledit.mutation;

import com.tmdledit.models.EntityKind;
import com.tmdledit.models.TmdlElement;
import com.tmdledit.models.TmdlEntity;
import com.tmdledit.models.TmdlProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Order in which property lines are written directly under a declaration.
 */
final class CanonicalPropertyOrder {

    private static final Map<EntityKind, List<String>> ORDER = Map.of(
        EntityKind.COLUMN, List.of("dataType", "isHidden", "formatString", "isDefaultLabel", "lineageTag",
            "dataCategory", "summarizeBy", "isNameInferred", "sourceColumn", "sortByColumn"),
        EntityKind.MEASURE, List.of("isHidden", "formatString", "displayFolder", "lineageTag"),
        EntityKind.TABLE, List.of("isHidden", "isPrivate", "showAsVariationsOnly", "lineageTag"),
        EntityKind.HIERARCHY, List.of("isHidden", "lineageTag")
    );

    private CanonicalPropertyOrder() {
    }

    static int rank(EntityKind kind, String key) {
        return ORDER.getOrDefault(kind, Collections.emptyList()).indexOf(key);
    }

    /**
     * Position for a new property line within the run of properties that opens the entity's
     * members: after the last ranked property that sorts before it, else at the start of the run.
     * Keys without a rank go to the end of the run.
     */
    static int insertionIndex(TmdlEntity entity, String key) {
        List<TmdlElement> members = entity.getMembers();
        int runEnd = 0;
        while (runEnd < members.size() && members.get(runEnd) instanceof TmdlProperty) {
            runEnd++;
        }
        int rank = rank(entity.getKind(), key);
        if (rank < 0) {
            return runEnd;
        }
        int index = 0;
        for (int i = 0; i < runEnd; i++) {
            int memberRank = rank(entity.getKind(), ((TmdlProperty) members.get(i)).getKey());
            if (memberRank >= 0 && memberRank < rank) {
                index = i + 1;
            }
        }
        return index;
    }
}
