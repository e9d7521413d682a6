package com.tmdledit.mutation;

import java.util.Set;

/**
 * Source of lineage tags for newly added entities.
 */
public interface LineageTagGenerator {

    /**
     * Returns a tag not contained in {@code existing}.
     */
    String next(Set<String> existing);
}
