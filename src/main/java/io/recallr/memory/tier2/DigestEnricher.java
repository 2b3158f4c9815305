package io.recallr.memory.tier2;

import io.recallr.memory.MemoryRecord;

import java.util.List;

/**
 * Fills digest payload fields (themes, keywords, entities, insights,
 * decisions) from the records a digest was built from.
 */
@FunctionalInterface
public interface DigestEnricher {

    Digest enrich(Digest digest, List<MemoryRecord> sources);

    static DigestEnricher none() {
        return (digest, sources) -> digest;
    }
}
