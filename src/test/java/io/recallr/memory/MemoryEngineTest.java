package io.recallr.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.recallr.config.MemoryProperties;
import io.recallr.memory.retention.CentralityAnnotator;
import io.recallr.memory.tier2.ConceptMatch;
import io.recallr.memory.tier2.Digest;
import io.recallr.memory.tier2.DigestBuilder;
import io.recallr.memory.tier2.DigestEnricher;
import io.recallr.memory.tier2.DigestQuery;
import io.recallr.memory.tier2.KeywordDigestEnricher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class MemoryEngineTest {

    private static final Instant NOW = Instant.parse("2025-02-10T12:00:00Z");
    private static final long DAY = 86_400L;
    private static final String CI = "ci-main";

    private static final List<String> DISTINCT_CONTENT = List.of(
            "Reviewed quarterly budget numbers",
            "Walked around the lake",
            "Fixed kitchen sink leak",
            "Called grandmother yesterday evening",
            "Planted tomato seedlings outside");

    private static final String DEPLOY = "Deploy pipeline failed on staging server";

    @TempDir
    Path tempDir;

    private MemoryEngine engine;

    @BeforeEach
    void setUp() {
        engine = new MemoryEngine(MemoryProperties.rootedAt(tempDir), Clock.fixed(NOW, ZoneOffset.UTC));
        engine.init();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static MemoryRecord.Builder aged(String content, int daysAgo) {
        return MemoryRecord.builder(CI, content).timestamp(NOW.getEpochSecond() - daysAgo * DAY);
    }

    private List<MemoryRecord> all() {
        return engine.query(MemoryQuery.forIdentity(CI));
    }

    @Test
    void shouldArchiveAgedLowImportanceRecordsIntoOneWeeklyDigest() {
        for (String content : DISTINCT_CONTENT) {
            engine.store(aged(content, 20).importance(0.2).build());
        }

        int archived = engine.archive(CI, 14);

        assertEquals(5, archived);
        List<Digest> digests = engine.digests(DigestQuery.forIdentity(CI));
        assertEquals(1, digests.size());
        Digest digest = digests.get(0);
        assertEquals(DigestBuilder.weekId(NOW.getEpochSecond() - 20 * DAY, ZoneOffset.UTC), digest.periodId());
        assertEquals("2025-W04", digest.periodId());
        assertEquals(5, digest.sourceRecordCount());
        assertEquals(CI, digest.ciId());
        assertEquals(NOW.getEpochSecond(), digest.timestamp());
        assertTrue(all().stream().allMatch(MemoryRecord::archived));
    }

    @Test
    void shouldBeIdempotentWithoutNewWrites() {
        for (String content : DISTINCT_CONTENT) {
            engine.store(aged(content, 20).build());
        }
        assertEquals(5, engine.archive(CI, 14));

        assertEquals(0, engine.archive(CI, 14));
        assertEquals(1, engine.digests(DigestQuery.forIdentity(CI)).size());
    }

    @Test
    void shouldReturnZeroWhenNothingIsEligible() {
        engine.store(aged("fresh thought", 1).build());

        assertEquals(0, engine.archive(CI, 14));
        assertEquals(0, engine.archive("nobody", 14));
        assertTrue(engine.digests(DigestQuery.forIdentity(CI)).isEmpty());
    }

    @Test
    void shouldArchiveForgettableRecordEvenIfJustAccessed() {
        engine.store(aged("please forget this", 0)
                .markedForgettable(true)
                .lastAccessed(NOW.getEpochSecond() - 1)
                .emotionIntensity(1.0)
                .build());

        assertEquals(1, engine.archive(CI, 14));
        assertTrue(all().get(0).archived());
    }

    @Test
    void shouldNeverArchiveImportantRecords() {
        engine.store(aged("my first day", 400).markedImportant(true).importance(0.0).build());
        engine.store(aged("ordinary day", 400).build());

        assertEquals(1, engine.archive(CI, 0));
        assertEquals(0, engine.archive(CI, 0));

        MemoryRecord important = all().stream().filter(MemoryRecord::markedImportant).findFirst().orElseThrow();
        assertFalse(important.archived());
    }

    @Test
    void shouldPreserveThreeRepresentativesOfARepeatedPattern() {
        double[] importance = {0.2, 0.3, 0.9, 0.4, 0.1};
        for (int i = 0; i < importance.length; i++) {
            engine.store(aged(DEPLOY, 20).id("deploy-" + i).importance(importance[i]).build());
        }

        assertEquals(2, engine.archive(CI, 14));

        List<MemoryRecord> records = all();
        Set<String> survivors = records.stream().filter(r -> !r.archived()).map(MemoryRecord::id)
                .collect(Collectors.toSet());
        assertEquals(Set.of("deploy-0", "deploy-2", "deploy-4"), survivors);
        assertEquals(1, records.stream().map(MemoryRecord::patternId).distinct().count());
        assertTrue(records.stream().allMatch(r -> r.patternFrequency() == 5));
        assertTrue(records.stream().filter(r -> !r.archived()).allMatch(MemoryRecord::patternOutlier));

        assertEquals(0, engine.archive(CI, 14));
        assertEquals(2, engine.digests(DigestQuery.forIdentity(CI)).get(0).sourceRecordCount());
    }

    @Test
    void shouldBucketArchivalByWeek() {
        engine.store(aged(DISTINCT_CONTENT.get(0), 20).build());
        engine.store(aged(DISTINCT_CONTENT.get(1), 30).build());
        engine.store(aged(DISTINCT_CONTENT.get(2), 31).build());

        assertEquals(3, engine.archive(CI, 14));

        List<Digest> digests = engine.digests(DigestQuery.forIdentity(CI));
        assertEquals(2, digests.size());
        assertEquals(Set.of("2025-W04", "2025-W02"),
                digests.stream().map(Digest::periodId).collect(Collectors.toSet()));
        assertEquals(3, digests.stream().mapToInt(Digest::sourceRecordCount).sum());
    }

    @Test
    void shouldUseOneDigestPerRunWhenConfigured() {
        engine.close();
        var props = new MemoryProperties(tempDir.toString(), null, null, null, "UTC", true, null);
        engine = new MemoryEngine(props, Clock.fixed(NOW, ZoneOffset.UTC));
        engine.init();
        engine.store(aged(DISTINCT_CONTENT.get(0), 20).build());
        engine.store(aged(DISTINCT_CONTENT.get(1), 30).build());

        assertEquals(2, engine.archive(CI, 14));

        List<Digest> digests = engine.digests(DigestQuery.forIdentity(CI));
        assertEquals(1, digests.size());
        assertEquals("2025-W04", digests.get(0).periodId());
    }

    @Test
    void shouldLeaveOtherIdentitiesAlone() {
        engine.store(aged("mine to archive", 20).build());
        engine.store(MemoryRecord.builder("ci-other", "theirs to keep")
                .timestamp(NOW.getEpochSecond() - 20 * DAY).build());

        assertEquals(1, engine.archive(CI, 14));

        assertFalse(engine.query(MemoryQuery.forIdentity("ci-other")).get(0).archived());
    }

    @Test
    void shouldApplyInjectedCentrality() {
        engine.close();
        CentralityAnnotator hub = records -> records.stream()
                .map(r -> r.content().contains("hub") ? r.withGraphCentrality(0.9) : r)
                .toList();
        engine = new MemoryEngine(MemoryProperties.rootedAt(tempDir), Clock.fixed(NOW, ZoneOffset.UTC),
                hub, DigestEnricher.none());
        engine.init();
        engine.store(aged("central hub memory", 40).build());
        engine.store(aged("peripheral detail", 40).build());

        assertEquals(1, engine.archive(CI, 14));

        MemoryRecord hubRecord = all().stream().filter(r -> r.content().contains("hub")).findFirst().orElseThrow();
        assertFalse(hubRecord.archived());
    }

    @Test
    void shouldRoundTripStoredRecordsInWriteOrder() {
        for (int i = 0; i < 10; i++) {
            engine.store(aged("record number " + i, 0).id("r" + i).build());
        }

        List<MemoryRecord> records = engine.query(MemoryQuery.all());

        assertEquals(10, records.size());
        for (int i = 0; i < 10; i++) {
            assertEquals("r" + i, records.get(i).id());
        }
    }

    @Test
    void shouldPersistRecordAccess() {
        MemoryRecord old = aged("looked at again", 30).build();
        engine.store(old);

        assertEquals(1, engine.recordAccess(CI, List.of(old.id(), "unknown")));

        assertEquals(NOW.getEpochSecond(), all().get(0).lastAccessed());
        assertEquals(0, engine.archive(CI, 14));
    }

    @Test
    void shouldValidateStoredRecords() {
        assertEquals(ErrorCode.NULL_INPUT, assertThrows(MemoryException.class, () -> engine.store(null)).code());
        assertEquals(ErrorCode.NULL_INPUT, assertThrows(MemoryException.class,
                () -> engine.store(MemoryRecord.builder(CI, null).build())).code());
        assertEquals(ErrorCode.NULL_INPUT, assertThrows(MemoryException.class,
                () -> engine.store(MemoryRecord.builder(null, "x").build())).code());
        assertEquals(ErrorCode.INVALID_INPUT, assertThrows(MemoryException.class,
                () -> engine.store(MemoryRecord.builder(CI, "x").importance(1.5).build())).code());
        assertEquals(ErrorCode.INVALID_INPUT, assertThrows(MemoryException.class,
                () -> engine.store(MemoryRecord.builder(CI, "x").markedImportant(true).archived(true).build())).code());
        assertEquals(ErrorCode.INVALID_INPUT, assertThrows(MemoryException.class,
                () -> engine.archive(CI, -1)).code());
    }

    @Test
    void shouldRefuseOperationsBeforeInit() {
        var fresh = new MemoryEngine(MemoryProperties.rootedAt(tempDir.resolve("other")), Clock.systemUTC());

        var e = assertThrows(MemoryException.class, () -> fresh.store(MemoryRecord.builder(CI, "x").build()));
        assertEquals(ErrorCode.INVALID_STATE, e.code());
        assertEquals(ErrorCode.INVALID_STATE, assertThrows(MemoryException.class,
                () -> fresh.query(MemoryQuery.all())).code());
        assertFalse(fresh.healthCheck());
    }

    @Test
    void shouldReportStorageFull() {
        engine.close();
        var props = new MemoryProperties(tempDir.toString(), 1L, null, null, "UTC", false, null);
        engine = new MemoryEngine(props, Clock.fixed(NOW, ZoneOffset.UTC));
        engine.init();
        engine.store(aged("first", 0).build());

        var e = assertThrows(MemoryException.class, () -> engine.store(aged("second", 0).build()));

        assertEquals(ErrorCode.STORAGE_FULL, e.code());
    }

    @Test
    void shouldRebuildIndexWithSameSearchResults() {
        engine.close();
        engine = new MemoryEngine(MemoryProperties.rootedAt(tempDir), Clock.fixed(NOW, ZoneOffset.UTC),
                CentralityAnnotator.none(), new KeywordDigestEnricher());
        engine.init();
        for (String content : DISTINCT_CONTENT) {
            engine.store(aged(content, 20).build());
        }
        engine.archive(CI, 14);
        List<ConceptMatch> before = engine.searchConcepts("budget");
        assertFalse(before.isEmpty());

        assertEquals(1, engine.rebuildIndex(CI));

        assertEquals(before, engine.searchConcepts("budget"));
        assertEquals(1, engine.indexStats().digests());
    }

    @Test
    void shouldWriteFilesInDocumentedLayout() throws IOException {
        engine.store(aged(DISTINCT_CONTENT.get(0), 20).build());
        engine.archive(CI, 14);

        Path tier1 = tempDir.resolve("memory/tier1/2025-02-10.jsonl");
        Path weekly = tempDir.resolve("memory/tier2/weekly/2025-W04.jsonl");
        assertTrue(Files.exists(tier1));
        assertTrue(Files.exists(weekly));
        assertTrue(Files.exists(tempDir.resolve("memory/tier2/index/digests.db")));

        var mapper = new ObjectMapper();
        try (Stream<String> lines = Stream.concat(Files.readAllLines(tier1).stream(), Files.readAllLines(weekly).stream())) {
            lines.forEach(line -> assertDoesNotThrow(() -> mapper.readTree(line)));
        }
        assertTrue(mapper.readTree(Files.readAllLines(tier1).get(0)).get("archived").asBoolean());
    }

    @Test
    void shouldReportHealth() {
        assertTrue(engine.healthCheck());
        engine.close();
        assertFalse(engine.healthCheck());
    }

    @Test
    void shouldArchiveRecordsJustBelowRetentionThresholds() {
        engine.store(aged("slightly moving evening", 20).emotionIntensity(0.699).build());
        engine.store(aged("loosely linked note", 20).graphCentrality(0.496).build());
        engine.store(aged("deeply moving farewell", 20).emotionIntensity(0.7).build());
        engine.store(aged("well connected topic", 20).graphCentrality(0.5).build());

        assertEquals(2, engine.archive(CI, 14));

        Set<String> kept = all().stream().filter(r -> !r.archived()).map(MemoryRecord::content)
                .collect(Collectors.toSet());
        assertEquals(Set.of("deeply moving farewell", "well connected topic"), kept);
    }

    @Test
    void shouldKeepEveryArchivedFlagWhenIdentitiesArchiveConcurrently() throws Exception {
        int perIdentity = 300;
        for (int i = 0; i < perIdentity * 2; i++) {
            String ciId = i % 2 == 0 ? "ci-a" : "ci-b";
            engine.store(MemoryRecord.builder(ciId, "entry" + i).timestamp(NOW.getEpochSecond() - 20 * DAY).build());
        }

        ExecutorService executor = Executors.newFixedThreadPool(3);
        var start = new CountDownLatch(1);
        try {
            Future<Integer> a = executor.submit(() -> {
                start.await();
                return engine.archive("ci-a", 14);
            });
            Future<Integer> b = executor.submit(() -> {
                start.await();
                return engine.archive("ci-b", 14);
            });
            Future<Integer> writes = executor.submit(() -> {
                start.await();
                for (int i = 0; i < 50; i++) {
                    engine.store(MemoryRecord.builder("ci-c", "fresh" + i).timestamp(NOW.getEpochSecond()).build());
                }
                return 50;
            });
            start.countDown();

            assertEquals(perIdentity, a.get(60, TimeUnit.SECONDS));
            assertEquals(perIdentity, b.get(60, TimeUnit.SECONDS));
            assertEquals(50, writes.get(60, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertTrue(engine.query(MemoryQuery.forIdentity("ci-a")).stream().allMatch(MemoryRecord::archived));
        assertTrue(engine.query(MemoryQuery.forIdentity("ci-b")).stream().allMatch(MemoryRecord::archived));
        assertEquals(50, engine.query(MemoryQuery.forIdentity("ci-c")).size());
        assertEquals(0, engine.archive("ci-a", 14));
        assertEquals(0, engine.archive("ci-b", 14));
        assertEquals(1, engine.digests(DigestQuery.forIdentity("ci-a")).size());
        assertEquals(1, engine.digests(DigestQuery.forIdentity("ci-b")).size());
    }

    @Test
    void shouldLeaveTier1UntouchedWhenDigestStorageFails() throws IOException {
        for (String content : DISTINCT_CONTENT) {
            engine.store(aged(content, 20).build());
        }
        Path weekly = tempDir.resolve("memory/tier2/weekly");
        Files.delete(weekly);
        Files.writeString(weekly, "not a directory");

        var e = assertThrows(MemoryException.class, () -> engine.archive(CI, 14));

        assertEquals(ErrorCode.IO_ERROR, e.code());
        assertTrue(all().stream().noneMatch(MemoryRecord::archived));
        assertTrue(engine.digests(DigestQuery.forIdentity(CI)).isEmpty());

        Files.delete(weekly);
        Files.createDirectories(weekly);
        assertEquals(5, engine.archive(CI, 14));
        assertTrue(all().stream().allMatch(MemoryRecord::archived));
    }

    @Test
    void shouldArchiveSameRecordsAgainAfterFailedRun() {
        engine.close();
        var failures = new AtomicInteger(1);
        DigestEnricher flaky = (digest, sources) -> {
            if (failures.getAndDecrement() > 0) {
                throw new MemoryException(ErrorCode.IO_ERROR, "enrichment unavailable");
            }
            return digest;
        };
        engine = new MemoryEngine(MemoryProperties.rootedAt(tempDir), Clock.fixed(NOW, ZoneOffset.UTC),
                CentralityAnnotator.none(), flaky);
        engine.init();
        for (String content : DISTINCT_CONTENT) {
            engine.store(aged(content, 20).build());
        }

        assertThrows(MemoryException.class, () -> engine.archive(CI, 14));
        assertTrue(all().stream().noneMatch(MemoryRecord::archived));

        assertEquals(5, engine.archive(CI, 14));
        List<Digest> digests = engine.digests(DigestQuery.forIdentity(CI));
        assertEquals(1, digests.size());
        assertEquals(5, digests.get(0).sourceRecordCount());
    }
}
