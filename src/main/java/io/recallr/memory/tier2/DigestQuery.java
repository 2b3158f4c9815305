package io.recallr.memory.tier2;

/**
 * Filter for indexed digest lookups. Null criteria match everything.
 *
 * @param ciId            identity
 * @param startTime       inclusive lower bound on digest timestamp
 * @param endTime         inclusive upper bound on digest timestamp
 * @param periodType      weekly or monthly
 * @param digestType      digest classification
 * @param theme           exact theme the digest must carry
 * @param keyword         exact keyword the digest must carry
 * @param includeArchived also return archived digests
 * @param limit           maximum results, 0 for unlimited
 */
public record DigestQuery(
        String ciId,
        Long startTime,
        Long endTime,
        PeriodType periodType,
        DigestType digestType,
        String theme,
        String keyword,
        boolean includeArchived,
        int limit
) {

    public static DigestQuery forIdentity(String ciId) {
        return new DigestQuery(ciId, null, null, null, null, null, null, false, 0);
    }

    public DigestQuery withTimeRange(Long startTime, Long endTime) {
        return new DigestQuery(ciId, startTime, endTime, periodType, digestType, theme, keyword, includeArchived, limit);
    }

    public DigestQuery withPeriodType(PeriodType periodType) {
        return new DigestQuery(ciId, startTime, endTime, periodType, digestType, theme, keyword, includeArchived, limit);
    }

    public DigestQuery withDigestType(DigestType digestType) {
        return new DigestQuery(ciId, startTime, endTime, periodType, digestType, theme, keyword, includeArchived, limit);
    }

    public DigestQuery withTheme(String theme) {
        return new DigestQuery(ciId, startTime, endTime, periodType, digestType, theme, keyword, includeArchived, limit);
    }

    public DigestQuery withKeyword(String keyword) {
        return new DigestQuery(ciId, startTime, endTime, periodType, digestType, theme, keyword, includeArchived, limit);
    }

    public DigestQuery withLimit(int limit) {
        return new DigestQuery(ciId, startTime, endTime, periodType, digestType, theme, keyword, includeArchived, limit);
    }

    public DigestQuery includingArchived() {
        return new DigestQuery(ciId, startTime, endTime, periodType, digestType, theme, keyword, true, limit);
    }
}
