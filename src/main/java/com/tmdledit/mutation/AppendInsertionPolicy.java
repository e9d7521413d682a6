package com.tmdledit.mutation;

import com.tmdledit.models.EntityKind;
import com.tmdledit.models.TmdlEntity;

public class AppendInsertionPolicy implements InsertionPolicy {

    @Override
    public int insertionIndex(TmdlEntity parent, EntityKind kind) {
        return parent.getMembers().size();
    }
}
