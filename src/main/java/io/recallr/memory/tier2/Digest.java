package io.recallr.memory.tier2;

import java.util.List;

/**
 * A Tier 2 summary of a batch of archived Tier 1 records.
 *
 * <p>Digests carry no reference back to individual records; lineage is the
 * identity, the period and the time range. List fields are capped at
 * {@link #MAX_THEMES}, {@link #MAX_KEYWORDS} and {@link #MAX_INSIGHTS} entries.</p>
 */
public record Digest(
        String digestId,
        String ciId,
        long timestamp,
        PeriodType periodType,
        String periodId,
        DigestType digestType,
        int sourceTier,
        int sourceRecordCount,
        String summary,
        List<String> themes,
        List<String> keywords,
        DigestEntities entities,
        List<String> keyInsights,
        List<String> decisionsMade,
        int questionsAsked,
        boolean archived
) {

    public static final int MAX_THEMES = 20;
    public static final int MAX_KEYWORDS = 50;
    public static final int MAX_INSIGHTS = 10;

    public Digest {
        if (periodType == null) periodType = PeriodType.WEEKLY;
        if (digestType == null) digestType = DigestType.INTERACTION;
        themes = capped(themes, MAX_THEMES);
        keywords = capped(keywords, MAX_KEYWORDS);
        keyInsights = capped(keyInsights, MAX_INSIGHTS);
        decisionsMade = decisionsMade == null ? List.of() : List.copyOf(decisionsMade);
        if (entities == null) entities = DigestEntities.EMPTY;
    }

    public Digest withThemes(List<String> themes) {
        return new Digest(digestId, ciId, timestamp, periodType, periodId, digestType, sourceTier,
                sourceRecordCount, summary, themes, keywords, entities, keyInsights, decisionsMade,
                questionsAsked, archived);
    }

    public Digest withKeywords(List<String> keywords) {
        return new Digest(digestId, ciId, timestamp, periodType, periodId, digestType, sourceTier,
                sourceRecordCount, summary, themes, keywords, entities, keyInsights, decisionsMade,
                questionsAsked, archived);
    }

    public Digest withEntities(DigestEntities entities) {
        return new Digest(digestId, ciId, timestamp, periodType, periodId, digestType, sourceTier,
                sourceRecordCount, summary, themes, keywords, entities, keyInsights, decisionsMade,
                questionsAsked, archived);
    }

    public Digest withDecisionsMade(List<String> decisionsMade) {
        return new Digest(digestId, ciId, timestamp, periodType, periodId, digestType, sourceTier,
                sourceRecordCount, summary, themes, keywords, entities, keyInsights, decisionsMade,
                questionsAsked, archived);
    }

    private static List<String> capped(List<String> values, int max) {
        if (values == null) return List.of();
        return List.copyOf(values.size() > max ? values.subList(0, max) : values);
    }
}
