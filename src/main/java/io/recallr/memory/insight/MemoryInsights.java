package io.recallr.memory.insight;

import io.recallr.memory.MemoryEngine;
import io.recallr.memory.MemoryQuery;
import io.recallr.memory.MemoryRecord;
import io.recallr.memory.codec.RecordLineCodec;
import io.recallr.memory.retention.CentralityAnnotator;
import io.recallr.memory.retention.PatternDetector;
import io.recallr.memory.retention.RetentionDecision;
import io.recallr.memory.retention.RetentionPolicy;
import io.recallr.memory.tier2.DigestQuery;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only reports over an identity's memory: footprint, what the next
 * archival run would take, which patterns exist and whether consolidation is due.
 */
@Service
public class MemoryInsights {

    public static final int PREVIEW_LENGTH = 100;
    public static final int CONSOLIDATION_THRESHOLD = 100;

    private final MemoryEngine engine;
    private final Clock clock;
    private final CentralityAnnotator centralityAnnotator;

    public MemoryInsights(MemoryEngine engine, Clock clock, CentralityAnnotator centralityAnnotator) {
        this.engine = engine;
        this.clock = clock;
        this.centralityAnnotator = centralityAnnotator;
    }

    public MemoryStats stats(String ciId) {
        List<MemoryRecord> records = engine.query(MemoryQuery.forIdentity(ciId));
        long oldest = 0;
        long newest = 0;
        for (MemoryRecord record : records) {
            if (oldest == 0 || record.timestamp() < oldest) oldest = record.timestamp();
            if (record.timestamp() > newest) newest = record.timestamp();
        }
        long digests = engine.digests(DigestQuery.forIdentity(ciId).includingArchived()).size();
        long bytes = 0;
        for (MemoryRecord record : records) {
            bytes += RecordLineCodec.encode(record).getBytes(StandardCharsets.UTF_8).length + 1;
        }
        return new MemoryStats(ciId, records.size(), digests, records.size() + digests, bytes, oldest, newest);
    }

    /**
     * Records the retention cascade would hand to the next archival run, in
     * query order. Centrality is annotated first, as in an archival run; pattern
     * outlier exemption is not applied here.
     */
    public List<AtRiskRecord> atRisk(String ciId, int maxAgeDays) {
        long now = clock.instant().getEpochSecond();
        List<AtRiskRecord> atRisk = new ArrayList<>();
        List<MemoryRecord> active = engine.query(MemoryQuery.forIdentity(ciId).excludingArchived());
        for (MemoryRecord record : centralityAnnotator.annotate(active)) {
            RetentionDecision decision = RetentionPolicy.evaluate(record, maxAgeDays, now);
            if (!decision.candidate()) continue;
            double score = decision == RetentionDecision.MARKED_FORGETTABLE ? 1.0 : 0.8;
            atRisk.add(new AtRiskRecord(record.id(), preview(record.content()), decision.reason(), score));
        }
        return atRisk;
    }

    /** Patterns present in Tier 1, in order of first appearance. */
    public List<PatternSummary> patterns(String ciId) {
        Map<String, List<MemoryRecord>> byPattern = new LinkedHashMap<>();
        for (MemoryRecord record : engine.query(MemoryQuery.forIdentity(ciId))) {
            if (record.patternId() != null) {
                byPattern.computeIfAbsent(record.patternId(), k -> new ArrayList<>()).add(record);
            }
        }
        List<PatternSummary> patterns = new ArrayList<>(byPattern.size());
        byPattern.forEach((patternId, members) -> {
            MemoryRecord centroid = members.stream()
                    .filter(m -> m.semanticSimilarity() >= 1.0)
                    .findFirst()
                    .orElse(members.get(0));
            patterns.add(new PatternSummary(patternId, members.size(),
                    PatternDetector.SIMILARITY_THRESHOLD, preview(centroid.content())));
        });
        return patterns;
    }

    public ConsolidationHealth health(String ciId) {
        long total = 0;
        long archived = 0;
        for (MemoryRecord record : engine.query(MemoryQuery.forIdentity(ciId))) {
            total++;
            if (record.archived()) archived++;
        }
        long active = total - archived;
        double ratio = total > 0 ? (double) archived / total : 0.0;
        return new ConsolidationHealth(total, active, archived, ratio,
                active >= CONSOLIDATION_THRESHOLD, ConsolidationHealth.Status.forActive(active));
    }

    static String preview(String content) {
        if (content == null) return "";
        if (content.length() <= PREVIEW_LENGTH) return content;
        return content.substring(0, PREVIEW_LENGTH) + "...";
    }
}
