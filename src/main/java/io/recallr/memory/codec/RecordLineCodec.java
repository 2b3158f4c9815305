package io.recallr.memory.codec;

import io.recallr.memory.ErrorCode;
import io.recallr.memory.MemoryException;
import io.recallr.memory.MemoryRecord;
import io.recallr.memory.MemoryTier;
import io.recallr.memory.MemoryType;

/**
 * Converts records to and from their Tier 1 line form.
 *
 * <p>Base fields, in order: {@code record_id, timestamp, type, importance,
 * content, response?, context?, ci_id, session_id?, component?, tier, archived}.
 * Consolidation metadata sits between {@code component} and {@code tier} and
 * each field is written only when it differs from its default, so a freshly
 * stored record produces exactly the base line. Emotion intensity and graph
 * centrality keep full precision since retention compares them to thresholds.</p>
 */
public final class RecordLineCodec {

    private RecordLineCodec() {
    }

    public static String encode(MemoryRecord record) {
        var line = new JsonLineWriter()
                .string("record_id", record.id())
                .number("timestamp", record.timestamp())
                .number("type", record.type().code())
                .decimal("importance", record.importance())
                .string("content", record.content())
                .string("response", record.response())
                .string("context", record.context())
                .string("ci_id", record.ciId())
                .string("session_id", record.sessionId())
                .string("component", record.component());

        if (record.lastAccessed() > 0) line.number("last_accessed", record.lastAccessed());
        if (record.emotionIntensity() != 0) line.real("emotion_intensity", record.emotionIntensity());
        if (record.graphCentrality() != 0) line.real("graph_centrality", record.graphCentrality());
        if (record.markedImportant()) line.bool("marked_important", true);
        if (record.markedForgettable()) line.bool("marked_forgettable", true);
        if (record.patternId() != null) {
            line.string("pattern_id", record.patternId())
                    .number("pattern_frequency", record.patternFrequency())
                    .decimal("semantic_similarity", record.semanticSimilarity());
        }
        if (record.patternOutlier()) line.bool("is_pattern_outlier", true);

        return line.number("tier", record.tier().level())
                .bool("archived", record.archived())
                .toLine();
    }

    /**
     * Parses one line.
     *
     * @throws MemoryException with {@link ErrorCode#PARSE_ERROR} when the line is
     *                         not an object or lacks {@code record_id} or {@code content}
     */
    public static MemoryRecord decode(String line) {
        JsonLine json = JsonLine.parse(line);
        String id = json.string("record_id");
        String content = json.string("content");
        if (id == null || content == null) {
            throw new MemoryException(ErrorCode.PARSE_ERROR, "record line lacks record_id or content");
        }
        return MemoryRecord.builder(json.string("ci_id"), content)
                .id(id)
                .timestamp(json.longValue("timestamp", 0))
                .type(MemoryType.fromCode(json.intValue("type", MemoryType.EXPERIENCE.code())))
                .importance(json.doubleValue("importance", MemoryRecord.DEFAULT_IMPORTANCE))
                .response(json.string("response"))
                .context(json.string("context"))
                .sessionId(json.string("session_id"))
                .component(json.string("component"))
                .lastAccessed(json.longValue("last_accessed", 0))
                .emotionIntensity(json.doubleValue("emotion_intensity", 0))
                .graphCentrality(json.doubleValue("graph_centrality", 0))
                .markedImportant(json.bool("marked_important", false))
                .markedForgettable(json.bool("marked_forgettable", false))
                .patternId(json.string("pattern_id"))
                .patternFrequency(json.intValue("pattern_frequency", 0))
                .semanticSimilarity(json.doubleValue("semantic_similarity", 0))
                .patternOutlier(json.bool("is_pattern_outlier", false))
                .tier(MemoryTier.fromLevel(json.intValue("tier", 1)))
                .archived(json.bool("archived", false))
                .build();
    }
}
