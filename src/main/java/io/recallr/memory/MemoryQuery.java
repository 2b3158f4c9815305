package io.recallr.memory;

/**
 * Filter for Tier 1 queries. Every criterion is optional.
 *
 * @param ciId            exact identity match, null for all identities
 * @param startTime       inclusive lower bound on timestamp, null for none
 * @param endTime         inclusive upper bound on timestamp, null for none
 * @param type            record type, null for all
 * @param minImportance   records below this importance are skipped
 * @param limit           maximum results, 0 for unlimited
 * @param excludeArchived skip records already folded into a digest
 */
public record MemoryQuery(
        String ciId,
        Long startTime,
        Long endTime,
        MemoryType type,
        double minImportance,
        int limit,
        boolean excludeArchived
) {

    public static MemoryQuery all() {
        return new MemoryQuery(null, null, null, null, 0.0, 0, false);
    }

    public static MemoryQuery forIdentity(String ciId) {
        return new MemoryQuery(ciId, null, null, null, 0.0, 0, false);
    }

    public MemoryQuery withTimeRange(Long startTime, Long endTime) {
        return new MemoryQuery(ciId, startTime, endTime, type, minImportance, limit, excludeArchived);
    }

    public MemoryQuery withType(MemoryType type) {
        return new MemoryQuery(ciId, startTime, endTime, type, minImportance, limit, excludeArchived);
    }

    public MemoryQuery withMinImportance(double minImportance) {
        return new MemoryQuery(ciId, startTime, endTime, type, minImportance, limit, excludeArchived);
    }

    public MemoryQuery withLimit(int limit) {
        return new MemoryQuery(ciId, startTime, endTime, type, minImportance, limit, excludeArchived);
    }

    public MemoryQuery excludingArchived() {
        return new MemoryQuery(ciId, startTime, endTime, type, minImportance, limit, true);
    }

    public boolean matches(MemoryRecord record) {
        if (ciId != null && !ciId.equals(record.ciId())) return false;
        if (startTime != null && record.timestamp() < startTime) return false;
        if (endTime != null && record.timestamp() > endTime) return false;
        if (type != null && record.type() != type) return false;
        if (record.importance() < minImportance) return false;
        return !(excludeArchived && record.archived());
    }
}
