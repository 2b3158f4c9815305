package io.recallr.memory.insight;

/**
 * How much unconsolidated material an identity is carrying.
 *
 * @param totalMemories              Tier 1 records
 * @param activeMemories             records not yet archived
 * @param archivedMemories           records folded into digests
 * @param compressionRatio           archived / total, 0 when empty
 * @param consolidationRecommended   true once active records reach {@value MemoryInsights#CONSOLIDATION_THRESHOLD}
 * @param status                     healthy, degraded or critical
 */
public record ConsolidationHealth(
        long totalMemories,
        long activeMemories,
        long archivedMemories,
        double compressionRatio,
        boolean consolidationRecommended,
        Status status
) {

    public enum Status {
        HEALTHY,
        DEGRADED,
        CRITICAL;

        static Status forActive(long active) {
            if (active < 50) return HEALTHY;
            if (active < 200) return DEGRADED;
            return CRITICAL;
        }
    }
}
