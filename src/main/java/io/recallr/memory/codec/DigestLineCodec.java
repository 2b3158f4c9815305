package io.recallr.memory.codec;

import io.recallr.memory.ErrorCode;
import io.recallr.memory.MemoryException;
import io.recallr.memory.tier2.Digest;
import io.recallr.memory.tier2.DigestEntities;
import io.recallr.memory.tier2.DigestType;
import io.recallr.memory.tier2.PeriodType;

/**
 * Converts digests to and from their Tier 2 line form. Strings use the same
 * escaping as record lines.
 */
public final class DigestLineCodec {

    private DigestLineCodec() {
    }

    public static String encode(Digest digest) {
        var entities = new JsonLineWriter()
                .array("files", digest.entities().files())
                .array("concepts", digest.entities().concepts())
                .array("people", digest.entities().people());

        return new JsonLineWriter()
                .string("digest_id", digest.digestId())
                .number("timestamp", digest.timestamp())
                .number("period_type", digest.periodType().code())
                .string("period_id", digest.periodId())
                .number("source_tier", digest.sourceTier())
                .number("source_record_count", digest.sourceRecordCount())
                .string("ci_id", digest.ciId())
                .number("digest_type", digest.digestType().code())
                .array("themes", digest.themes())
                .array("keywords", digest.keywords())
                .object("entities", entities)
                .string("summary", digest.summary())
                .array("key_insights", digest.keyInsights())
                .number("questions_asked", digest.questionsAsked())
                .array("decisions_made", digest.decisionsMade())
                .bool("archived", digest.archived())
                .toLine();
    }

    /**
     * @throws MemoryException with {@link ErrorCode#PARSE_ERROR} when the line is
     *                         malformed or lacks {@code digest_id}
     */
    public static Digest decode(String line) {
        JsonLine json = JsonLine.parse(line);
        String id = json.string("digest_id");
        if (id == null) {
            throw new MemoryException(ErrorCode.PARSE_ERROR, "digest line lacks digest_id");
        }
        JsonLine entities = json.object("entities");
        return new Digest(
                id,
                json.string("ci_id"),
                json.longValue("timestamp", 0),
                PeriodType.fromCode(json.intValue("period_type", 0)),
                json.string("period_id"),
                DigestType.fromCode(json.intValue("digest_type", 0)),
                json.intValue("source_tier", 1),
                json.intValue("source_record_count", 0),
                json.string("summary"),
                json.strings("themes"),
                json.strings("keywords"),
                new DigestEntities(entities.strings("files"), entities.strings("concepts"), entities.strings("people")),
                json.strings("key_insights"),
                json.strings("decisions_made"),
                json.intValue("questions_asked", 0),
                json.bool("archived", false));
    }
}
