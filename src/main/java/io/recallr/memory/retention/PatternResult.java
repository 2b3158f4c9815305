package io.recallr.memory.retention;

import io.recallr.memory.MemoryRecord;

import java.util.List;

/**
 * Output of pattern detection over a candidate set.
 *
 * @param toArchive candidates minus outliers, with pattern metadata applied, in candidate order
 * @param outliers  pattern representatives exempted from archival, with pattern metadata applied
 * @param patterns  clusters found in this run
 */
public record PatternResult(List<MemoryRecord> toArchive, List<MemoryRecord> outliers, List<DetectedPattern> patterns) {

    public PatternResult {
        toArchive = List.copyOf(toArchive);
        outliers = List.copyOf(outliers);
        patterns = List.copyOf(patterns);
    }
}
