package io.recallr.memory.tier2;

/**
 * A file entity found by {@link DigestIndex#searchCode(String)}.
 */
public record CodeMatch(String path, String digestId, String periodId, String summary) {
}
