package io.recallr.memory.retention;

/**
 * Outcome of the retention cascade for one record, with the rule that decided it.
 */
public enum RetentionDecision {
    ALREADY_ARCHIVED(false, "already archived"),
    MARKED_IMPORTANT(false, "marked important"),
    MARKED_FORGETTABLE(true, "marked forgettable (user consent)"),
    RECENTLY_ACCESSED(false, "accessed within the last 7 days"),
    HIGH_EMOTION(false, "high emotional intensity"),
    HIGH_CENTRALITY(false, "central in the memory graph"),
    TOO_RECENT(false, "younger than the retention window"),
    AGED_OUT(true, "old with no preservation factors");

    private final boolean candidate;
    private final String reason;

    RetentionDecision(boolean candidate, String reason) {
        this.candidate = candidate;
        this.reason = reason;
    }

    /** True if the record may be archived. */
    public boolean candidate() {
        return candidate;
    }

    public String reason() {
        return reason;
    }
}
