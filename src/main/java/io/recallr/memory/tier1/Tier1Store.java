package io.recallr.memory.tier1;

import io.recallr.memory.ErrorCode;
import io.recallr.memory.MemoryException;
import io.recallr.memory.MemoryRecord;
import io.recallr.memory.codec.RecordLineCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Append-only Tier 1 record log, one {@code yyyy-MM-dd.jsonl} file per calendar day.
 *
 * <p>Appends always go to the file for the current day. Reads tolerate
 * corruption: unreadable files and unparsable lines are skipped and logged.
 * The only in-place change is {@link #rewrite(Path, UnaryOperator)}, used to
 * set {@code last_accessed}, {@code archived} and pattern metadata.</p>
 */
public class Tier1Store {

    private static final Logger log = LoggerFactory.getLogger(Tier1Store.class);
    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final String SUFFIX = ".jsonl";

    private final Path directory;
    private final Clock clock;
    private final ZoneId zone;
    private final long maxFileBytes;
    private final int maxLineBytes;

    public Tier1Store(Path directory, Clock clock, ZoneId zone, long maxFileBytes, int maxLineBytes) {
        this.directory = directory;
        this.clock = clock;
        this.zone = zone;
        this.maxFileBytes = maxFileBytes;
        this.maxLineBytes = maxLineBytes;
    }

    public void ensureDirectory() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            log.error("Failed to create tier1 directory: {}", directory, e);
            throw new MemoryException(ErrorCode.IO_ERROR, "cannot create " + directory, e);
        }
    }

    public Path directory() {
        return directory;
    }

    /**
     * Appends one record to today's file.
     *
     * @return the day file written to
     * @throws MemoryException STORAGE_FULL when today's file reached its ceiling,
     *                         RESOURCE_LIMIT when the line is too large, IO_ERROR on write failure
     */
    public Path append(MemoryRecord record) {
        Path file = dayFile(LocalDate.ofInstant(clock.instant(), zone));
        try {
            if (Files.exists(file) && Files.size(file) >= maxFileBytes) {
                log.warn("Tier1 day file {} reached {} bytes, refusing append", file.getFileName(), maxFileBytes);
                throw new MemoryException(ErrorCode.STORAGE_FULL, "day file full: " + file.getFileName());
            }

            byte[] line = RecordLineCodec.encode(record).getBytes(StandardCharsets.UTF_8);
            if (line.length > maxLineBytes) {
                throw new MemoryException(ErrorCode.RESOURCE_LIMIT,
                        "record %s is %d bytes, limit %d".formatted(record.id(), line.length, maxLineBytes));
            }

            byte[] withNewline = new byte[line.length + 1];
            System.arraycopy(line, 0, withNewline, 0, line.length);
            withNewline[line.length] = '\n';
            Files.write(file, withNewline, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            log.debug("Appended record {} to {}", record.id(), file.getFileName());
            return file;
        } catch (IOException e) {
            log.error("Failed to append record {} to {}", record.id(), file, e);
            throw new MemoryException(ErrorCode.IO_ERROR, "append failed: " + file.getFileName(), e);
        }
    }

    public Path dayFile(LocalDate day) {
        return directory.resolve(day.format(DAY_FORMAT) + SUFFIX);
    }

    /**
     * Day files, newest first. Names sort chronologically, so this is a
     * descending name sort.
     */
    public List<Path> dayFiles() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(f -> f.getFileName().toString().endsWith(SUFFIX))
                    .filter(Files::isRegularFile)
                    .sorted(Comparator.comparing((Path f) -> f.getFileName().toString()).reversed())
                    .toList();
        } catch (IOException e) {
            log.error("Failed to list tier1 directory: {}", directory, e);
            throw new MemoryException(ErrorCode.IO_ERROR, "cannot list " + directory, e);
        }
    }

    /**
     * Parses every readable line of one day file, in file order. Returns an
     * empty list if the file cannot be read.
     */
    public List<LocatedRecord> read(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Skipping unreadable tier1 file {}: {}", file.getFileName(), e.getMessage());
            return List.of();
        }

        List<LocatedRecord> records = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) continue;
            try {
                records.add(new LocatedRecord(RecordLineCodec.decode(line), file));
            } catch (MemoryException e) {
                log.debug("Skipping malformed line {} in {}: {}", i + 1, file.getFileName(), e.getMessage());
            }
        }
        return records;
    }

    /** Every readable record, newest day file first. */
    public List<LocatedRecord> scan() {
        List<LocatedRecord> all = new ArrayList<>();
        for (Path file : dayFiles()) {
            all.addAll(read(file));
        }
        return all;
    }

    /**
     * Rewrites one day file, passing every parsable record through {@code update}.
     * Lines that fail to parse, and records the operator returns unchanged, are
     * written back verbatim. The new content replaces the file through a rename.
     *
     * @return number of records changed
     */
    public int rewrite(Path file, UnaryOperator<MemoryRecord> update) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to read {} for rewrite", file, e);
            throw new MemoryException(ErrorCode.IO_ERROR, "rewrite read failed: " + file.getFileName(), e);
        }

        int changed = 0;
        var out = new StringBuilder();
        for (String line : lines) {
            String written = line;
            if (!line.isBlank()) {
                try {
                    MemoryRecord before = RecordLineCodec.decode(line);
                    MemoryRecord after = update.apply(before);
                    if (!after.equals(before)) {
                        written = RecordLineCodec.encode(after);
                        changed++;
                    }
                } catch (MemoryException e) {
                    if (e.code() != ErrorCode.PARSE_ERROR) throw e;
                    log.debug("Keeping malformed line in {} as-is", file.getFileName());
                }
            }
            out.append(written).append('\n');
        }

        if (changed == 0) {
            return 0;
        }

        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.writeString(temp, out, StandardCharsets.UTF_8);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("Failed to rewrite {}", file, e);
            throw new MemoryException(ErrorCode.IO_ERROR, "rewrite failed: " + file.getFileName(), e);
        }
        log.debug("Rewrote {} records in {}", changed, file.getFileName());
        return changed;
    }

    public Tier1Stats stats() {
        int files = 0;
        long records = 0;
        long bytes = 0;
        for (Path file : dayFiles()) {
            files++;
            records += read(file).size();
            try {
                bytes += Files.size(file);
            } catch (IOException e) {
                log.warn("Cannot size tier1 file {}: {}", file.getFileName(), e.getMessage());
            }
        }
        return new Tier1Stats(files, records, bytes);
    }
}
