package io.recallr.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.List;

/**
 * Configuration for the memory engine.
 *
 * <p>Binds to {@code recallr.memory} in application.yml:</p>
 * <pre>
 * recallr:
 *   memory:
 *     root: ./data
 *     tier1-max-file-bytes: 104857600
 *     max-line-bytes: 65536
 *     max-age-days: 14
 *     zone: UTC
 *     archival:
 *       enabled: true
 *       cron: "0 3 * * *"
 *       identities:
 *         - ci-main
 * </pre>
 *
 * @param root               directory holding {@code memory/tier1} and {@code memory/tier2}
 * @param tier1MaxFileBytes  a day file at or above this size refuses further appends
 * @param maxLineBytes       largest serialized record accepted
 * @param maxAgeDays         default retention window for scheduled archival
 * @param zone               zone used for day files and week buckets (system default when blank)
 * @param singleDigestPerRun put a whole archival run into one digest keyed by its first record's week
 * @param archival           recurring archival job settings
 */
@ConfigurationProperties(prefix = "recallr.memory")
public record MemoryProperties(
        String root,
        Long tier1MaxFileBytes,
        Integer maxLineBytes,
        Integer maxAgeDays,
        String zone,
        boolean singleDigestPerRun,
        Archival archival
) {

    public static final long DEFAULT_TIER1_MAX_FILE_BYTES = 100L * 1024 * 1024;
    public static final int DEFAULT_MAX_LINE_BYTES = 64 * 1024;
    public static final int DEFAULT_MAX_AGE_DAYS = 14;

    public MemoryProperties {
        if (root == null || root.isBlank()) {
            root = "./data";
        }
        if (tier1MaxFileBytes == null || tier1MaxFileBytes <= 0) {
            tier1MaxFileBytes = DEFAULT_TIER1_MAX_FILE_BYTES;
        }
        if (maxLineBytes == null || maxLineBytes <= 0) {
            maxLineBytes = DEFAULT_MAX_LINE_BYTES;
        }
        if (maxAgeDays == null || maxAgeDays < 0) {
            maxAgeDays = DEFAULT_MAX_AGE_DAYS;
        }
        if (archival == null) {
            archival = new Archival(true, null, null);
        }
    }

    /** Defaults rooted at the given directory, UTC zone. */
    public static MemoryProperties rootedAt(Path root) {
        return new MemoryProperties(root.toString(), null, null, null, "UTC", false, null);
    }

    public Path rootPath() {
        return Path.of(root);
    }

    public ZoneId zoneId() {
        return zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
    }

    /**
     * @param enabled    whether recurring archival jobs are registered at startup
     * @param cron       schedule for every identity's job
     * @param identities identities to archive
     */
    public record Archival(boolean enabled, String cron, List<String> identities) {

        public Archival {
            if (cron == null || cron.isBlank()) {
                cron = "0 3 * * *";
            }
            if (identities == null) {
                identities = List.of();
            }
        }
    }
}
