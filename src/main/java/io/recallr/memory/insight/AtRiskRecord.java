package io.recallr.memory.insight;

/**
 * A record the next archival run would fold into a digest.
 *
 * @param recordId record id
 * @param preview  first {@value MemoryInsights#PREVIEW_LENGTH} characters of the content
 * @param reason   why it is eligible
 * @param score    1.0 for explicit consent, lower for age-based eligibility
 */
public record AtRiskRecord(String recordId, String preview, String reason, double score) {
}
