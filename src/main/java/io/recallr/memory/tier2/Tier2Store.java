package io.recallr.memory.tier2;

import io.recallr.memory.ErrorCode;
import io.recallr.memory.MemoryException;
import io.recallr.memory.codec.DigestLineCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Append-only digest log: {@code weekly/<period>.jsonl} and
 * {@code monthly/<period>.jsonl} under the tier2 directory.
 */
public class Tier2Store {

    private static final Logger log = LoggerFactory.getLogger(Tier2Store.class);
    private static final String SUFFIX = ".jsonl";

    private final Path directory;

    public Tier2Store(Path directory) {
        this.directory = directory;
    }

    public void ensureDirectories() {
        try {
            for (PeriodType type : PeriodType.values()) {
                Files.createDirectories(directory.resolve(type.directory()));
            }
        } catch (IOException e) {
            log.error("Failed to create tier2 directories under {}", directory, e);
            throw new MemoryException(ErrorCode.IO_ERROR, "cannot create " + directory, e);
        }
    }

    public Path directory() {
        return directory;
    }

    public Path periodFile(PeriodType type, String periodId) {
        return directory.resolve(type.directory()).resolve(periodId + SUFFIX);
    }

    /**
     * Appends a digest to its period file.
     *
     * @return the file and the byte offset where the new line starts
     */
    public DigestLocation store(Digest digest) {
        Path file = periodFile(digest.periodType(), digest.periodId());
        byte[] line = (DigestLineCodec.encode(digest) + "\n").getBytes(StandardCharsets.UTF_8);
        try {
            Files.createDirectories(file.getParent());
            long offset = Files.exists(file) ? Files.size(file) : 0L;
            Files.write(file, line, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            log.debug("Stored digest {} at {}:{}", digest.digestId(), file.getFileName(), offset);
            return new DigestLocation(file, offset);
        } catch (IOException e) {
            log.error("Failed to store digest {} in {}", digest.digestId(), file, e);
            throw new MemoryException(ErrorCode.IO_ERROR, "digest store failed: " + file.getFileName(), e);
        }
    }

    /**
     * Reads the digest line starting at a location.
     *
     * @throws MemoryException NOT_FOUND when the file or offset does not exist,
     *                         PARSE_ERROR when the line is malformed
     */
    public Digest read(DigestLocation location) {
        Path file = location.file();
        if (!Files.isRegularFile(file)) {
            throw new MemoryException(ErrorCode.NOT_FOUND, "no digest file " + file);
        }
        try (var in = new RandomAccessFile(file.toFile(), "r")) {
            if (location.offset() < 0 || location.offset() >= in.length()) {
                throw new MemoryException(ErrorCode.NOT_FOUND,
                        "offset %d outside %s".formatted(location.offset(), file.getFileName()));
            }
            in.seek(location.offset());
            var line = new ByteArrayOutputStream();
            int b;
            while ((b = in.read()) != -1 && b != '\n') {
                line.write(b);
            }
            return DigestLineCodec.decode(line.toString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.error("Failed to read digest at {}:{}", file, location.offset(), e);
            throw new MemoryException(ErrorCode.IO_ERROR, "digest read failed: " + file.getFileName(), e);
        }
    }

    /**
     * Every parsable digest in weekly then monthly files, with its location.
     * Malformed lines and unreadable files are skipped.
     */
    public List<StoredDigest> scan() {
        List<StoredDigest> digests = new ArrayList<>();
        for (PeriodType type : PeriodType.values()) {
            for (Path file : periodFiles(type)) {
                digests.addAll(read(file));
            }
        }
        return digests;
    }

    private List<Path> periodFiles(PeriodType type) {
        Path dir = directory.resolve(type.directory());
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(f -> f.getFileName().toString().endsWith(SUFFIX)).sorted().toList();
        } catch (IOException e) {
            log.warn("Skipping unreadable tier2 directory {}: {}", dir, e.getMessage());
            return List.of();
        }
    }

    private List<StoredDigest> read(Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            log.warn("Skipping unreadable digest file {}: {}", file.getFileName(), e.getMessage());
            return List.of();
        }

        List<StoredDigest> digests = new ArrayList<>();
        int start = 0;
        while (start < bytes.length) {
            int end = start;
            while (end < bytes.length && bytes[end] != '\n') end++;
            if (end > start) {
                String line = new String(bytes, start, end - start, StandardCharsets.UTF_8);
                try {
                    digests.add(new StoredDigest(DigestLineCodec.decode(line), new DigestLocation(file, start)));
                } catch (MemoryException e) {
                    log.debug("Skipping malformed digest at {}:{}: {}", file.getFileName(), start, e.getMessage());
                }
            }
            start = end + 1;
        }
        return digests;
    }
}
