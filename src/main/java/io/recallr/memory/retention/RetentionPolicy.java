package io.recallr.memory.retention;

import io.recallr.memory.ErrorCode;
import io.recallr.memory.MemoryException;
import io.recallr.memory.MemoryRecord;

/**
 * Ordered keep/archive cascade. The first matching rule decides; the order is
 * part of the contract:
 *
 * <ol>
 *   <li>already archived: not a candidate</li>
 *   <li>marked important: keep</li>
 *   <li>marked forgettable: archive, regardless of everything below</li>
 *   <li>accessed within {@value #RECENT_ACCESS_DAYS} days: keep</li>
 *   <li>emotion intensity at least {@value #HIGH_EMOTION_THRESHOLD}: keep</li>
 *   <li>graph centrality at least {@value #HIGH_CENTRALITY_THRESHOLD}: keep</li>
 *   <li>younger than {@code maxAgeDays}: keep</li>
 *   <li>otherwise: archive</li>
 * </ol>
 */
public final class RetentionPolicy {

    public static final int RECENT_ACCESS_DAYS = 7;
    public static final double HIGH_EMOTION_THRESHOLD = 0.7;
    public static final double HIGH_CENTRALITY_THRESHOLD = 0.5;

    private static final long SECONDS_PER_DAY = 86_400L;

    private RetentionPolicy() {
    }

    /**
     * @param record     record to judge
     * @param maxAgeDays retention window in days, not negative
     * @param now        current time, epoch seconds
     */
    public static RetentionDecision evaluate(MemoryRecord record, int maxAgeDays, long now) {
        if (maxAgeDays < 0) {
            throw new MemoryException(ErrorCode.INVALID_INPUT, "maxAgeDays must not be negative: " + maxAgeDays);
        }
        if (record.archived()) return RetentionDecision.ALREADY_ARCHIVED;
        if (record.markedImportant()) return RetentionDecision.MARKED_IMPORTANT;
        if (record.markedForgettable()) return RetentionDecision.MARKED_FORGETTABLE;
        if (record.lastAccessed() > 0 && now - record.lastAccessed() < RECENT_ACCESS_DAYS * SECONDS_PER_DAY) {
            return RetentionDecision.RECENTLY_ACCESSED;
        }
        if (record.emotionIntensity() >= HIGH_EMOTION_THRESHOLD) return RetentionDecision.HIGH_EMOTION;
        if (record.graphCentrality() >= HIGH_CENTRALITY_THRESHOLD) return RetentionDecision.HIGH_CENTRALITY;
        if (now - record.timestamp() < maxAgeDays * SECONDS_PER_DAY) return RetentionDecision.TOO_RECENT;
        return RetentionDecision.AGED_OUT;
    }

    public static boolean isCandidate(MemoryRecord record, int maxAgeDays, long now) {
        return evaluate(record, maxAgeDays, now).candidate();
    }
}
