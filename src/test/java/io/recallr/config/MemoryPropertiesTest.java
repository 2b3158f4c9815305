package io.recallr.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MemoryPropertiesTest {

    @Test
    void shouldApplyDefaults() {
        var props = new MemoryProperties(null, null, null, null, null, false, null);

        assertEquals("./data", props.root());
        assertEquals(100L * 1024 * 1024, props.tier1MaxFileBytes());
        assertEquals(64 * 1024, props.maxLineBytes());
        assertEquals(14, props.maxAgeDays());
        assertEquals(ZoneId.systemDefault(), props.zoneId());
        assertTrue(props.archival().enabled());
        assertEquals("0 3 * * *", props.archival().cron());
        assertEquals(List.of(), props.archival().identities());
    }

    @Test
    void shouldReplaceNonPositiveLimits() {
        var props = new MemoryProperties(" ", 0L, -1, -5, "", false, null);

        assertEquals("./data", props.root());
        assertEquals(MemoryProperties.DEFAULT_TIER1_MAX_FILE_BYTES, props.tier1MaxFileBytes());
        assertEquals(MemoryProperties.DEFAULT_MAX_LINE_BYTES, props.maxLineBytes());
        assertEquals(MemoryProperties.DEFAULT_MAX_AGE_DAYS, props.maxAgeDays());
    }

    @Test
    void shouldKeepExplicitValues() {
        var archival = new MemoryProperties.Archival(false, "0 */6 * * *", List.of("ci-main"));
        var props = new MemoryProperties("/var/recallr", 2048L, 512, 0, "Europe/Amsterdam", true, archival);

        assertEquals(Path.of("/var/recallr"), props.rootPath());
        assertEquals(2048L, props.tier1MaxFileBytes());
        assertEquals(512, props.maxLineBytes());
        assertEquals(0, props.maxAgeDays());
        assertEquals(ZoneId.of("Europe/Amsterdam"), props.zoneId());
        assertTrue(props.singleDigestPerRun());
        assertFalse(props.archival().enabled());
        assertEquals(List.of("ci-main"), props.archival().identities());
    }

    @Test
    void shouldRootAtDirectoryInUtc(@TempDir Path dir) {
        var props = MemoryProperties.rootedAt(dir);

        assertEquals(dir, props.rootPath());
        assertEquals(ZoneOffset.UTC.normalized(), props.zoneId().normalized());
    }
}
