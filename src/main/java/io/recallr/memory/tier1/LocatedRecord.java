package io.recallr.memory.tier1;

import io.recallr.memory.MemoryRecord;

import java.nio.file.Path;

/**
 * A record together with the day file it was read from.
 */
public record LocatedRecord(MemoryRecord record, Path file) {
}
