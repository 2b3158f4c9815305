package io.recallr.memory.retention;

import io.recallr.memory.MemoryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups near-duplicate archival candidates by keyword overlap and exempts
 * three representatives of each group from archival.
 *
 * <p>Clustering is a single forward pass: each candidate not yet in a pattern
 * gathers every later unassigned candidate whose similarity to it is at least
 * {@value #SIMILARITY_THRESHOLD}. Groups of {@value #MIN_PATTERN_SIZE} or more
 * become a pattern. Its outliers are the first member, the last member and the
 * most important of the remaining members.</p>
 *
 * <p>Forgettable candidates never join a pattern, and records already preserved
 * as outliers by an earlier run neither seed nor join one; the latter stay exempt.</p>
 */
public class PatternDetector {

    private static final Logger log = LoggerFactory.getLogger(PatternDetector.class);

    public static final double SIMILARITY_THRESHOLD = 0.4;
    public static final int MIN_PATTERN_SIZE = 3;
    public static final int MAX_PATTERN_MEMBERS = 256;

    public PatternResult detect(List<MemoryRecord> candidates) {
        List<MemoryRecord> clusterable = new ArrayList<>();
        for (MemoryRecord record : candidates) {
            if (!record.markedForgettable() && !record.patternOutlier()) {
                clusterable.add(record);
            }
        }

        List<Set<String>> keywords = new ArrayList<>(clusterable.size());
        for (MemoryRecord record : clusterable) {
            keywords.add(KeywordExtractor.extract(record.content()));
        }

        boolean[] assigned = new boolean[clusterable.size()];
        Map<String, MemoryRecord> updated = new HashMap<>();
        Set<String> outlierIds = new LinkedHashSet<>();
        List<DetectedPattern> patterns = new ArrayList<>();

        for (int i = 0; i < clusterable.size(); i++) {
            if (assigned[i]) continue;

            List<Integer> members = new ArrayList<>();
            List<Double> similarities = new ArrayList<>();
            members.add(i);
            similarities.add(1.0);

            for (int j = i + 1; j < clusterable.size(); j++) {
                if (assigned[j]) continue;
                double similarity = KeywordExtractor.similarity(keywords.get(i), keywords.get(j));
                if (similarity < SIMILARITY_THRESHOLD) continue;
                if (members.size() >= MAX_PATTERN_MEMBERS) {
                    log.debug("Pattern seeded by {} hit {} members, leaving the rest unclustered",
                            clusterable.get(i).id(), MAX_PATTERN_MEMBERS);
                    break;
                }
                members.add(j);
                similarities.add(similarity);
            }

            if (members.size() < MIN_PATTERN_SIZE) continue;

            MemoryRecord seed = clusterable.get(i);
            String patternId = "pattern_%d_%s".formatted(seed.timestamp(), Integer.toHexString(seed.id().hashCode()));
            Set<Integer> outliers = pickOutliers(members, clusterable);

            List<String> memberIds = new ArrayList<>(members.size());
            List<String> patternOutliers = new ArrayList<>(3);
            for (int m = 0; m < members.size(); m++) {
                int index = members.get(m);
                assigned[index] = true;
                MemoryRecord member = clusterable.get(index);
                boolean outlier = outliers.contains(index);
                updated.put(member.id(), member.withPattern(patternId, members.size(), similarities.get(m), outlier));
                memberIds.add(member.id());
                if (outlier) {
                    outlierIds.add(member.id());
                    patternOutliers.add(member.id());
                }
            }
            patterns.add(new DetectedPattern(patternId, memberIds, patternOutliers));
            log.debug("Detected {} with {} members", patternId, members.size());
        }

        List<MemoryRecord> toArchive = new ArrayList<>();
        List<MemoryRecord> outlierRecords = new ArrayList<>();
        for (MemoryRecord record : candidates) {
            MemoryRecord current = updated.getOrDefault(record.id(), record);
            if (outlierIds.contains(record.id())) {
                outlierRecords.add(current);
            } else if (record.patternOutlier() && !record.markedForgettable()) {
                log.debug("Record {} stays preserved as an outlier of {}", record.id(), record.patternId());
            } else {
                toArchive.add(current);
            }
        }
        return new PatternResult(toArchive, outlierRecords, patterns);
    }

    /** First, last, and the most important member in between (first seen wins ties). */
    private static Set<Integer> pickOutliers(List<Integer> members, List<MemoryRecord> records) {
        int first = members.get(0);
        int last = members.get(members.size() - 1);
        int best = members.get(1);
        for (int m = 2; m < members.size() - 1; m++) {
            int index = members.get(m);
            if (records.get(index).importance() > records.get(best).importance()) {
                best = index;
            }
        }
        Set<Integer> outliers = new LinkedHashSet<>();
        outliers.add(first);
        outliers.add(best);
        outliers.add(last);
        return outliers;
    }
}
