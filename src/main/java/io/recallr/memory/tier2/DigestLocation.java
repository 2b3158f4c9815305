package io.recallr.memory.tier2;

import java.nio.file.Path;

/**
 * Where a digest line starts: the period file and the byte offset of the line.
 */
public record DigestLocation(Path file, long offset) {
}
