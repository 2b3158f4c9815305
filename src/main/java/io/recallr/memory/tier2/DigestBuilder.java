package io.recallr.memory.tier2;

import io.recallr.memory.MemoryRecord;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Builds digests from archived records. Records are bucketed by the ISO week
 * of their own timestamp and each bucket becomes one weekly digest.
 */
public class DigestBuilder {

    private final ZoneId zone;

    public DigestBuilder(ZoneId zone) {
        this.zone = zone;
    }

    /** ISO week id such as {@code 2025-W05}, using the week-based year. */
    public static String weekId(long epochSeconds, ZoneId zone) {
        ZonedDateTime time = Instant.ofEpochSecond(epochSeconds).atZone(zone);
        return "%d-W%02d".formatted(time.get(IsoFields.WEEK_BASED_YEAR), time.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
    }

    /**
     * One weekly digest per week bucket, ordered by week. Each digest is paired
     * with the records it summarizes.
     */
    public List<Batch> weekly(String ciId, List<MemoryRecord> records, long now) {
        Map<String, List<MemoryRecord>> buckets = new TreeMap<>();
        for (MemoryRecord record : records) {
            buckets.computeIfAbsent(weekId(record.timestamp(), zone), k -> new ArrayList<>()).add(record);
        }
        List<Batch> batches = new ArrayList<>(buckets.size());
        buckets.forEach((week, members) ->
                batches.add(new Batch(build(ciId, PeriodType.WEEKLY, week, members, now), members)));
        return batches;
    }

    /** All records in one weekly digest keyed by the first record's week. */
    public Batch single(String ciId, List<MemoryRecord> records, long now) {
        String week = weekId(records.get(0).timestamp(), zone);
        return new Batch(build(ciId, PeriodType.WEEKLY, week, records, now), records);
    }

    public Digest build(String ciId, PeriodType periodType, String periodId, List<MemoryRecord> records, long now) {
        int questions = 0;
        for (MemoryRecord record : records) {
            if (record.content() != null && record.content().indexOf('?') >= 0) {
                questions++;
            }
        }

        String label = periodType == PeriodType.WEEKLY ? "Weekly" : "Monthly";
        String summary = "%s digest for %s: %d interactions archived from Tier 1"
                .formatted(label, periodId, records.size());
        String digestId = "%s-%s-digest-%s".formatted(periodId, periodType.directory(),
                UUID.randomUUID().toString().substring(0, 8));

        return new Digest(digestId, ciId, now, periodType, periodId, DigestType.INTERACTION, 1,
                records.size(), summary, List.of(), List.of(), DigestEntities.EMPTY, List.of(), List.of(),
                questions, false);
    }

    /** A digest and the records it was built from. */
    public record Batch(Digest digest, List<MemoryRecord> records) {
        public Batch {
            records = List.copyOf(records);
        }
    }
}
