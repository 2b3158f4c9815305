package io.recallr.memory.retention;

import io.recallr.memory.MemoryRecord;

import java.util.List;

/**
 * Supplies graph centrality for a batch of records before the retention
 * cascade runs. Centrality is computed outside this engine; implementations
 * return the records with {@code graphCentrality} set.
 */
@FunctionalInterface
public interface CentralityAnnotator {

    List<MemoryRecord> annotate(List<MemoryRecord> records);

    /** Leaves centrality as stored on disk. */
    static CentralityAnnotator none() {
        return records -> records;
    }
}
