package io.recallr.memory.tier2;

import io.recallr.memory.MemoryRecord;
import io.recallr.memory.MemoryType;
import io.recallr.memory.retention.KeywordExtractor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default enrichment: the most frequent keywords across the source records,
 * and the content of any DECISION records as {@code decisions_made}.
 */
public class KeywordDigestEnricher implements DigestEnricher {

    static final int MAX_DECISION_LENGTH = 200;

    @Override
    public Digest enrich(Digest digest, List<MemoryRecord> sources) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        List<String> decisions = new ArrayList<>();
        for (MemoryRecord record : sources) {
            for (String keyword : KeywordExtractor.extract(record.content())) {
                counts.merge(keyword, 1, Integer::sum);
            }
            if (record.type() == MemoryType.DECISION) {
                String content = record.content();
                decisions.add(content.length() > MAX_DECISION_LENGTH ? content.substring(0, MAX_DECISION_LENGTH) : content);
            }
        }

        // Stable sort keeps first-seen order among equal counts
        List<String> keywords = counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(Digest.MAX_KEYWORDS)
                .map(Map.Entry::getKey)
                .toList();

        return digest.withKeywords(keywords).withDecisionsMade(decisions);
    }
}
