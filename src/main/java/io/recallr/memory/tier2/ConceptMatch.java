package io.recallr.memory.tier2;

/**
 * A theme, keyword or concept name found by {@link DigestIndex#searchConcepts(String)}.
 */
public record ConceptMatch(String name, String digestId, String periodId, String summary) {
}
