package io.recallr.memory.tier1;

import io.recallr.memory.MemoryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the outcome of an archival run back into the Tier 1 day files.
 *
 * <p>Each affected file is rewritten once. Archived records get
 * {@code archived=true} plus their pattern metadata; pattern outliers get the
 * metadata only. Only those fields are copied onto the on-disk record, and a
 * record that is marked important on disk is never archived.</p>
 */
public class ArchivalWriter {

    private static final Logger log = LoggerFactory.getLogger(ArchivalWriter.class);

    private final Tier1Store store;

    public ArchivalWriter(Tier1Store store) {
        this.store = store;
    }

    /**
     * @param archived records to flip to archived, located in their day files
     * @param outliers pattern representatives whose metadata should be persisted
     * @return number of records newly marked archived
     */
    public int writeBack(List<LocatedRecord> archived, List<LocatedRecord> outliers) {
        Map<Path, Map<String, MemoryRecord>> byFile = new LinkedHashMap<>();
        for (LocatedRecord located : outliers) {
            byFile.computeIfAbsent(located.file(), f -> new HashMap<>()).put(located.record().id(), located.record());
        }
        for (LocatedRecord located : archived) {
            byFile.computeIfAbsent(located.file(), f -> new HashMap<>())
                    .put(located.record().id(), located.record().withArchived());
        }

        int[] flipped = {0};
        byFile.forEach((file, targets) -> store.rewrite(file, onDisk -> {
            MemoryRecord target = targets.get(onDisk.id());
            if (target == null) return onDisk;
            if (target.archived() && onDisk.markedImportant()) {
                log.warn("Refusing to archive {}: marked important", onDisk.id());
                return onDisk;
            }
            if (target.archived() && !onDisk.archived()) {
                flipped[0]++;
            }
            return onDisk.toBuilder()
                    .archived(onDisk.archived() || target.archived())
                    .patternId(target.patternId())
                    .patternFrequency(target.patternFrequency())
                    .semanticSimilarity(target.semanticSimilarity())
                    .patternOutlier(target.patternOutlier())
                    .build();
        }));

        log.debug("Archival write-back touched {} files, archived {} records", byFile.size(), flipped[0]);
        return flipped[0];
    }

    /**
     * Sets {@code last_accessed} on the given records.
     *
     * @return number of records updated
     */
    public int touch(List<LocatedRecord> records, long now) {
        Map<Path, Map<String, MemoryRecord>> byFile = new LinkedHashMap<>();
        for (LocatedRecord located : records) {
            byFile.computeIfAbsent(located.file(), f -> new HashMap<>()).put(located.record().id(), located.record());
        }
        int updated = 0;
        for (var entry : byFile.entrySet()) {
            Map<String, MemoryRecord> targets = entry.getValue();
            updated += store.rewrite(entry.getKey(),
                    onDisk -> targets.containsKey(onDisk.id()) ? onDisk.withLastAccessed(now) : onDisk);
        }
        return updated;
    }
}
