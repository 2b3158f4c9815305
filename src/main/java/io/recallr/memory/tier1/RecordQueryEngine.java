package io.recallr.memory.tier1;

import io.recallr.memory.MemoryQuery;
import io.recallr.memory.MemoryRecord;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Filtered scan over Tier 1. Day files are visited newest first and records
 * within a file in write order. Once {@code limit} matches are collected no
 * further files are opened.
 */
public class RecordQueryEngine {

    private final Tier1Store store;

    public RecordQueryEngine(Tier1Store store) {
        this.store = store;
    }

    public List<MemoryRecord> query(MemoryQuery query) {
        List<MemoryRecord> results = new ArrayList<>();
        int limit = query.limit();
        for (Path file : store.dayFiles()) {
            if (limit > 0 && results.size() >= limit) break;
            for (LocatedRecord located : store.read(file)) {
                if (!query.matches(located.record())) continue;
                results.add(located.record());
                if (limit > 0 && results.size() >= limit) break;
            }
        }
        return results;
    }
}
