package com.tmdledit.mutation;

import com.tmdledit.models.EntityKind;
import com.tmdledit.models.TmdlElement;
import com.tmdledit.models.TmdlEntity;

import java.util.List;

/**
 * Places a new entity the way authoring tools group a table's children: calculation group,
 * measures, columns, hierarchies, partitions, annotations.
 *
 * <p>The entity goes after the last sibling of its own kind; failing that, before the first
 * sibling of a later group; failing that, after the last sibling of an earlier group; otherwise
 * at the end.
 */
public class AuthoredConventionPolicy implements InsertionPolicy {

    static final List<EntityKind> GROUP_ORDER = List.of(
        EntityKind.CALCULATION_GROUP,
        EntityKind.MEASURE,
        EntityKind.COLUMN,
        EntityKind.HIERARCHY,
        EntityKind.PARTITION,
        EntityKind.ANNOTATION
    );

    @Override
    public int insertionIndex(TmdlEntity parent, EntityKind kind) {
        List<TmdlElement> members = parent.getMembers();
        int rank = GROUP_ORDER.indexOf(kind);

        int lastSame = -1;
        int firstLater = -1;
        int lastEarlier = -1;
        for (int i = 0; i < members.size(); i++) {
            if (!(members.get(i) instanceof TmdlEntity)) {
                continue;
            }
            EntityKind memberKind = ((TmdlEntity) members.get(i)).getKind();
            if (memberKind == kind) {
                lastSame = i;
                continue;
            }
            int memberRank = GROUP_ORDER.indexOf(memberKind);
            if (rank < 0 || memberRank < 0) {
                continue;
            }
            if (memberRank > rank && firstLater < 0) {
                firstLater = i;
            } else if (memberRank < rank) {
                lastEarlier = i;
            }
        }

        if (lastSame >= 0) {
            return lastSame + 1;
        }
        if (firstLater >= 0) {
            return firstLater;
        }
        if (lastEarlier >= 0) {
            return lastEarlier + 1;
        }
        return members.size();
    }
}
