package io.recallr.memory.insight;

/**
 * A pattern recorded in Tier 1.
 *
 * @param patternId           pattern id
 * @param memberCount         members still present in Tier 1
 * @param similarityThreshold threshold members were grouped with
 * @param centroidPreview     preview of the seed member's content
 */
public record PatternSummary(String patternId, int memberCount, double similarityThreshold, String centroidPreview) {
}
