package io.recallr.memory;

import java.util.Collection;
import java.util.List;

/**
 * Tiered memory for a long-lived identity: an append-only record log that is
 * periodically consolidated into digests.
 */
public interface Memory {

    /**
     * Appends a record to today's Tier 1 file.
     *
     * @throws MemoryException NULL_INPUT when the record, its identity or its content is missing,
     *                         INVALID_INPUT when importance is outside 0..1,
     *                         STORAGE_FULL, RESOURCE_LIMIT or IO_ERROR from the store
     */
    void store(MemoryRecord record);

    /**
     * Records matching the filter, newest day first and in write order within a day.
     * Corrupt lines and unreadable files are skipped.
     */
    List<MemoryRecord> query(MemoryQuery query);

    /**
     * Runs one archival pass for an identity: retention, pattern detection,
     * digest synthesis, indexing and write-back.
     *
     * @return number of records archived, 0 when nothing was eligible
     */
    int archive(String ciId, int maxAgeDays);

    /**
     * Persists {@code last_accessed = now} for the given records of an identity.
     *
     * @return number of records updated
     */
    int recordAccess(String ciId, Collection<String> recordIds);

    /**
     * Health check, verifies the stores are operational.
     */
    boolean healthCheck();
}
