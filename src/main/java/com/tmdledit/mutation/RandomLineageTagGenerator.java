package com.tmdledit.mutation;

import java.util.Set;
import java.util.UUID;

public class RandomLineageTagGenerator implements LineageTagGenerator {

    @Override
    public String next(Set<String> existing) {
        String tag = UUID.randomUUID().toString();
        while (existing.contains(tag)) {
            tag = UUID.randomUUID().toString();
        }
        return tag;
    }
}
