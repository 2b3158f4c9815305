package io.recallr.memory;

import io.recallr.config.MemoryProperties;
import io.recallr.memory.retention.CentralityAnnotator;
import io.recallr.memory.retention.PatternDetector;
import io.recallr.memory.retention.PatternResult;
import io.recallr.memory.retention.RetentionPolicy;
import io.recallr.memory.tier1.ArchivalWriter;
import io.recallr.memory.tier1.LocatedRecord;
import io.recallr.memory.tier1.RecordQueryEngine;
import io.recallr.memory.tier1.Tier1Stats;
import io.recallr.memory.tier1.Tier1Store;
import io.recallr.memory.tier2.CodeMatch;
import io.recallr.memory.tier2.ConceptMatch;
import io.recallr.memory.tier2.Digest;
import io.recallr.memory.tier2.DigestBuilder;
import io.recallr.memory.tier2.DigestEnricher;
import io.recallr.memory.tier2.DigestIndex;
import io.recallr.memory.tier2.DigestLocation;
import io.recallr.memory.tier2.DigestQuery;
import io.recallr.memory.tier2.IndexStats;
import io.recallr.memory.tier2.StoredDigest;
import io.recallr.memory.tier2.Tier2Store;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The memory engine. Owns the Tier 1 log, the Tier 2 digest files and the
 * digest index for one root directory.
 *
 * <p>Layout under {@code root}:</p>
 * <ul>
 *   <li>{@code memory/tier1/yyyy-MM-dd.jsonl}: raw records</li>
 *   <li>{@code memory/tier2/weekly/*.jsonl}, {@code memory/tier2/monthly/*.jsonl}: digests</li>
 *   <li>{@code memory/tier2/index/digests.db}: SQLite digest index</li>
 * </ul>
 *
 * <p>Operations are synchronous. Every identity shares the day files and the
 * index connection, so all writes and index access go through one engine-wide
 * lock. Tier 1 reads are not locked: rewrites replace a day file atomically.</p>
 */
@Component
public class MemoryEngine implements Memory {

    private static final Logger log = LoggerFactory.getLogger(MemoryEngine.class);

    private final MemoryProperties properties;
    private final Clock clock;
    private final CentralityAnnotator centralityAnnotator;
    private final DigestEnricher digestEnricher;

    private final Tier1Store tier1;
    private final RecordQueryEngine queryEngine;
    private final ArchivalWriter archivalWriter;
    private final Tier2Store tier2;
    private final DigestIndex index;
    private final DigestBuilder digestBuilder;
    private final PatternDetector patternDetector = new PatternDetector();
    private final ReentrantLock lock = new ReentrantLock();

    private volatile boolean open;

    @Autowired
    public MemoryEngine(MemoryProperties properties, Clock clock,
                        CentralityAnnotator centralityAnnotator, DigestEnricher digestEnricher) {
        this.properties = properties;
        this.clock = clock;
        this.centralityAnnotator = centralityAnnotator;
        this.digestEnricher = digestEnricher;

        Path memoryDir = properties.rootPath().resolve("memory");
        this.tier1 = new Tier1Store(memoryDir.resolve("tier1"), clock, properties.zoneId(),
                properties.tier1MaxFileBytes(), properties.maxLineBytes());
        this.queryEngine = new RecordQueryEngine(tier1);
        this.archivalWriter = new ArchivalWriter(tier1);
        Path tier2Dir = memoryDir.resolve("tier2");
        this.tier2 = new Tier2Store(tier2Dir);
        this.index = new DigestIndex(tier2Dir.resolve("index").resolve("digests.db"), tier2Dir);
        this.digestBuilder = new DigestBuilder(properties.zoneId());
    }

    /** Engine without centrality input or digest enrichment. */
    public MemoryEngine(MemoryProperties properties, Clock clock) {
        this(properties, clock, CentralityAnnotator.none(), DigestEnricher.none());
    }

    @PostConstruct
    public void init() {
        if (open) return;
        tier1.ensureDirectory();
        tier2.ensureDirectories();
        index.open();
        open = true;
        log.info("Memory engine initialized at: {}", properties.rootPath().toAbsolutePath());
    }

    @PreDestroy
    public void close() {
        if (!open) return;
        open = false;
        locked(() -> {
            index.close();
            return null;
        });
        log.info("Memory engine closed");
    }

    @Override
    public void store(MemoryRecord record) {
        requireOpen();
        if (record == null) {
            throw new MemoryException(ErrorCode.NULL_INPUT, "record is null");
        }
        if (record.ciId() == null || record.ciId().isBlank() || record.content() == null) {
            throw new MemoryException(ErrorCode.NULL_INPUT, "record needs ci_id and content");
        }
        if (record.importance() < 0.0 || record.importance() > 1.0) {
            throw new MemoryException(ErrorCode.INVALID_INPUT, "importance out of range: " + record.importance());
        }
        if (record.markedImportant() && record.archived()) {
            throw new MemoryException(ErrorCode.INVALID_INPUT, "record cannot be both important and archived");
        }
        lock.lock();
        try {
            tier1.append(record);
        } finally {
            lock.unlock();
        }
        log.debug("Stored record {} for {}", record.id(), record.ciId());
    }

    @Override
    public List<MemoryRecord> query(MemoryQuery query) {
        requireOpen();
        if (query == null) {
            throw new MemoryException(ErrorCode.NULL_INPUT, "query is null");
        }
        return queryEngine.query(query);
    }

    @Override
    public int archive(String ciId, int maxAgeDays) {
        requireOpen();
        if (ciId == null || ciId.isBlank()) {
            throw new MemoryException(ErrorCode.NULL_INPUT, "ci_id is required");
        }
        if (maxAgeDays < 0) {
            throw new MemoryException(ErrorCode.INVALID_INPUT, "maxAgeDays must not be negative: " + maxAgeDays);
        }
        return locked(() -> archiveLocked(ciId, maxAgeDays));
    }

    private int archiveLocked(String ciId, int maxAgeDays) {
        long now = now();

        Map<String, Path> fileById = new HashMap<>();
        List<MemoryRecord> active = new ArrayList<>();
        for (LocatedRecord located : tier1.scan()) {
            MemoryRecord record = located.record();
            if (!ciId.equals(record.ciId()) || record.archived()) continue;
            fileById.put(record.id(), located.file());
            active.add(record);
        }
        if (active.isEmpty()) {
            log.debug("No active records for {}", ciId);
            return 0;
        }

        List<MemoryRecord> candidates = new ArrayList<>();
        for (MemoryRecord record : centralityAnnotator.annotate(active)) {
            if (RetentionPolicy.isCandidate(record, maxAgeDays, now)) {
                candidates.add(record);
            }
        }
        if (candidates.isEmpty()) {
            log.debug("Nothing eligible for archival for {} ({} active records)", ciId, active.size());
            return 0;
        }

        PatternResult patterns = patternDetector.detect(candidates);
        List<MemoryRecord> toArchive = patterns.toArchive();
        if (toArchive.isEmpty()) {
            archivalWriter.writeBack(List.of(), locate(patterns.outliers(), fileById));
            log.debug("All {} candidates for {} are preserved pattern outliers", candidates.size(), ciId);
            return 0;
        }

        List<DigestBuilder.Batch> batches = properties.singleDigestPerRun()
                ? List.of(digestBuilder.single(ciId, toArchive, now))
                : digestBuilder.weekly(ciId, toArchive, now);

        List<StoredDigest> stored = new ArrayList<>(batches.size());
        for (DigestBuilder.Batch batch : batches) {
            Digest digest = digestEnricher.enrich(batch.digest(), batch.records());
            stored.add(new StoredDigest(digest, tier2.store(digest)));
        }
        index.addAll(stored);

        int archived = archivalWriter.writeBack(locate(toArchive, fileById), locate(patterns.outliers(), fileById));
        log.info("Archived {} records for {} into {} digests ({} patterns, {} outliers preserved)",
                archived, ciId, stored.size(), patterns.patterns().size(), patterns.outliers().size());
        return archived;
    }

    @Override
    public int recordAccess(String ciId, Collection<String> recordIds) {
        requireOpen();
        if (ciId == null || recordIds == null) {
            throw new MemoryException(ErrorCode.NULL_INPUT, "ci_id and record ids are required");
        }
        if (recordIds.isEmpty()) return 0;
        Set<String> wanted = new HashSet<>(recordIds);
        return locked(() -> {
            List<LocatedRecord> matches = new ArrayList<>();
            for (LocatedRecord located : tier1.scan()) {
                if (ciId.equals(located.record().ciId()) && wanted.contains(located.record().id())) {
                    matches.add(located);
                }
            }
            return archivalWriter.touch(matches, now());
        });
    }

    /**
     * Indexed digests matching the filter, newest first. Index entries whose
     * file location no longer resolves are skipped.
     */
    public List<Digest> digests(DigestQuery query) {
        requireOpen();
        List<Digest> digests = new ArrayList<>();
        for (DigestLocation location : locked(() -> index.query(query))) {
            try {
                digests.add(tier2.read(location));
            } catch (MemoryException e) {
                log.warn("Skipping stale index entry {}:{}: {}", location.file(), location.offset(), e.getMessage());
            }
        }
        return digests;
    }

    public List<ConceptMatch> searchConcepts(String query) {
        requireOpen();
        return locked(() -> index.searchConcepts(query));
    }

    public List<CodeMatch> searchCode(String query) {
        requireOpen();
        return locked(() -> index.searchCode(query));
    }

    /**
     * Recreates the digest index from the digest files.
     *
     * @return number of digests indexed
     */
    public int rebuildIndex(String ciId) {
        requireOpen();
        log.info("Rebuilding digest index (requested for {})", ciId);
        return locked(() -> index.rebuild(tier2.scan()));
    }

    public IndexStats indexStats() {
        requireOpen();
        return locked(index::stats);
    }

    public Tier1Stats tier1Stats() {
        requireOpen();
        return tier1.stats();
    }

    @Override
    public boolean healthCheck() {
        return open && locked(index::healthCheck);
    }

    public boolean isOpen() {
        return open;
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private void requireOpen() {
        if (!open) {
            throw new MemoryException(ErrorCode.INVALID_STATE, "memory engine is not initialized");
        }
    }

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static List<LocatedRecord> locate(List<MemoryRecord> records, Map<String, Path> fileById) {
        List<LocatedRecord> located = new ArrayList<>(records.size());
        for (MemoryRecord record : records) {
            Path file = fileById.get(record.id());
            if (file != null) {
                located.add(new LocatedRecord(record, file));
            }
        }
        return located;
    }
}
