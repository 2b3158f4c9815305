package io.recallr.memory.insight;

/**
 * Storage footprint of one identity.
 *
 * @param ciId            identity
 * @param tier1Records    records in the Tier 1 log, archived included
 * @param tier2Digests    indexed digests, archived included
 * @param totalMemories   tier1Records plus tier2Digests
 * @param bytesUsed       bytes of this identity's Tier 1 lines, newlines included
 * @param oldestTimestamp oldest record timestamp, 0 when there are none
 * @param newestTimestamp newest record timestamp, 0 when there are none
 */
public record MemoryStats(
        String ciId,
        long tier1Records,
        long tier2Digests,
        long totalMemories,
        long bytesUsed,
        long oldestTimestamp,
        long newestTimestamp
) {
}
