package io.recallr.memory.tier1;

/**
 * Size of the Tier 1 log.
 *
 * @param files   number of day files
 * @param records parsable record lines
 * @param bytes   total bytes on disk
 */
public record Tier1Stats(int files, long records, long bytes) {
}
