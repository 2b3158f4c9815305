package io.recallr.memory;

import java.time.Instant;
import java.util.UUID;

/**
 * A single Tier 1 experience record.
 *
 * <p>Records are append-only. After creation they only change through
 * {@link #withLastAccessed(long)}, {@link #withArchived()} and the pattern
 * metadata set during an archival run. {@code markedImportant} and
 * {@code archived} are never both true.</p>
 *
 * @param id                 unique record id
 * @param ciId               owning identity
 * @param sessionId          optional session the record was captured in
 * @param timestamp          creation time, epoch seconds
 * @param content            the experience text (required)
 * @param response           optional response text
 * @param context            optional free-form context
 * @param component          optional originating component
 * @param type               kind of record
 * @param importance         0.0 to 1.0
 * @param lastAccessed       epoch seconds of the last recall, 0 if never accessed
 * @param emotionIntensity   0.0 to 1.0
 * @param graphCentrality    externally computed, 0.0 to 1.0
 * @param patternId          id of the pattern this record belongs to, or null
 * @param patternFrequency   size of that pattern
 * @param semanticSimilarity similarity to the pattern seed
 * @param patternOutlier     true if preserved as a representative of its pattern
 * @param markedImportant    explicit keep, blocks archival forever
 * @param markedForgettable  explicit consent to archive
 * @param archived           set once the record has been folded into a digest
 * @param tier               storage tier
 */
public record MemoryRecord(
        String id,
        String ciId,
        String sessionId,
        long timestamp,
        String content,
        String response,
        String context,
        String component,
        MemoryType type,
        double importance,
        long lastAccessed,
        double emotionIntensity,
        double graphCentrality,
        String patternId,
        int patternFrequency,
        double semanticSimilarity,
        boolean patternOutlier,
        boolean markedImportant,
        boolean markedForgettable,
        boolean archived,
        MemoryTier tier
) {

    public static final double DEFAULT_IMPORTANCE = 0.5;

    public MemoryRecord {
        if (type == null) {
            type = MemoryType.EXPERIENCE;
        }
        if (tier == null) {
            tier = MemoryTier.TIER1;
        }
    }

    /**
     * Starts a new record for the given identity. Id and timestamp default to
     * "now" and can be overridden on the builder.
     */
    public static Builder builder(String ciId, String content) {
        return new Builder().ciId(ciId).content(content);
    }

    /** Generates a record id of the form {@code <ciId>_<epochSeconds>_<8 hex chars>}. */
    public static String newId(String ciId, long timestamp) {
        return "%s_%d_%s".formatted(ciId, timestamp, UUID.randomUUID().toString().substring(0, 8));
    }

    public Builder toBuilder() {
        var b = new Builder();
        b.id = id;
        b.ciId = ciId;
        b.sessionId = sessionId;
        b.timestamp = timestamp;
        b.content = content;
        b.response = response;
        b.context = context;
        b.component = component;
        b.type = type;
        b.importance = importance;
        b.lastAccessed = lastAccessed;
        b.emotionIntensity = emotionIntensity;
        b.graphCentrality = graphCentrality;
        b.patternId = patternId;
        b.patternFrequency = patternFrequency;
        b.semanticSimilarity = semanticSimilarity;
        b.patternOutlier = patternOutlier;
        b.markedImportant = markedImportant;
        b.markedForgettable = markedForgettable;
        b.archived = archived;
        b.tier = tier;
        return b;
    }

    public MemoryRecord withArchived() {
        return toBuilder().archived(true).build();
    }

    public MemoryRecord withLastAccessed(long epochSeconds) {
        return toBuilder().lastAccessed(epochSeconds).build();
    }

    public MemoryRecord withGraphCentrality(double centrality) {
        return toBuilder().graphCentrality(centrality).build();
    }

    public MemoryRecord withPattern(String patternId, int frequency, double similarity, boolean outlier) {
        return toBuilder()
                .patternId(patternId)
                .patternFrequency(frequency)
                .semanticSimilarity(similarity)
                .patternOutlier(outlier)
                .build();
    }

    public static final class Builder {
        private String id;
        private String ciId;
        private String sessionId;
        private Long timestamp;
        private String content;
        private String response;
        private String context;
        private String component;
        private MemoryType type = MemoryType.EXPERIENCE;
        private double importance = DEFAULT_IMPORTANCE;
        private long lastAccessed;
        private double emotionIntensity;
        private double graphCentrality;
        private String patternId;
        private int patternFrequency;
        private double semanticSimilarity;
        private boolean patternOutlier;
        private boolean markedImportant;
        private boolean markedForgettable;
        private boolean archived;
        private MemoryTier tier = MemoryTier.TIER1;

        private Builder() {
        }

        public Builder id(String id) { this.id = id; return this; }
        public Builder ciId(String ciId) { this.ciId = ciId; return this; }
        public Builder sessionId(String sessionId) { this.sessionId = sessionId; return this; }
        public Builder timestamp(long timestamp) { this.timestamp = timestamp; return this; }
        public Builder content(String content) { this.content = content; return this; }
        public Builder response(String response) { this.response = response; return this; }
        public Builder context(String context) { this.context = context; return this; }
        public Builder component(String component) { this.component = component; return this; }
        public Builder type(MemoryType type) { this.type = type; return this; }
        public Builder importance(double importance) { this.importance = importance; return this; }
        public Builder lastAccessed(long lastAccessed) { this.lastAccessed = lastAccessed; return this; }
        public Builder emotionIntensity(double emotionIntensity) { this.emotionIntensity = emotionIntensity; return this; }
        public Builder graphCentrality(double graphCentrality) { this.graphCentrality = graphCentrality; return this; }
        public Builder patternId(String patternId) { this.patternId = patternId; return this; }
        public Builder patternFrequency(int patternFrequency) { this.patternFrequency = patternFrequency; return this; }
        public Builder semanticSimilarity(double semanticSimilarity) { this.semanticSimilarity = semanticSimilarity; return this; }
        public Builder patternOutlier(boolean patternOutlier) { this.patternOutlier = patternOutlier; return this; }
        public Builder markedImportant(boolean markedImportant) { this.markedImportant = markedImportant; return this; }
        public Builder markedForgettable(boolean markedForgettable) { this.markedForgettable = markedForgettable; return this; }
        public Builder archived(boolean archived) { this.archived = archived; return this; }
        public Builder tier(MemoryTier tier) { this.tier = tier; return this; }

        public MemoryRecord build() {
            long ts = timestamp != null ? timestamp : Instant.now().getEpochSecond();
            String recordId = id != null ? id : newId(ciId, ts);
            return new MemoryRecord(recordId, ciId, sessionId, ts, content, response, context, component,
                    type, importance, lastAccessed, emotionIntensity, graphCentrality, patternId,
                    patternFrequency, semanticSimilarity, patternOutlier, markedImportant,
                    markedForgettable, archived, tier);
        }
    }
}
