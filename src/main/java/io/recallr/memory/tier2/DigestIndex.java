package io.recallr.memory.tier2;

import io.recallr.memory.ErrorCode;
import io.recallr.memory.MemoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.*;
import java.util.ArrayList;
import java.util.List;

/**
 * SQLite index over the Tier 2 digest files.
 *
 * <p>The index is derived data: every row points at a digest line by file and
 * byte offset, and {@link #rebuild(List)} recreates it from the files alone.</p>
 *
 * <p>Schema:</p>
 * <ul>
 *   <li>{@code digests}: metadata, summary and file location per digest</li>
 *   <li>{@code themes}, {@code keywords}: one row per digest and term</li>
 *   <li>{@code entities}: one row per digest, kind (file, concept, person) and name</li>
 * </ul>
 */
public class DigestIndex implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DigestIndex.class);

    static final int CONCEPT_SEARCH_LIMIT = 50;
    static final int CODE_SEARCH_LIMIT = 100;

    private final Path dbFile;
    private final Path baseDir;
    private Connection connection;

    /**
     * @param dbFile  SQLite database file
     * @param baseDir directory digest file paths are stored relative to
     */
    public DigestIndex(Path dbFile, Path baseDir) {
        this.dbFile = dbFile;
        this.baseDir = baseDir;
    }

    public void open() {
        try {
            Files.createDirectories(dbFile.getParent());
        } catch (IOException e) {
            log.error("Failed to create index directory: {}", dbFile.getParent(), e);
            throw new MemoryException(ErrorCode.IO_ERROR, "cannot create index directory", e);
        }
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbFile);
            try (var stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA busy_timeout=5000");
            }
            createSchema();
            log.info("Digest index opened at: {}", dbFile);
        } catch (SQLException e) {
            log.error("Failed to open digest index at {}", dbFile, e);
            throw new MemoryException(ErrorCode.IO_ERROR, "digest index initialization failed", e);
        }
    }

    private void createSchema() throws SQLException {
        try (var stmt = connection.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS digests (
                    digest_id TEXT PRIMARY KEY,
                    ci_id TEXT,
                    timestamp INTEGER NOT NULL,
                    period_type INTEGER NOT NULL,
                    period_id TEXT,
                    digest_type INTEGER NOT NULL,
                    source_record_count INTEGER NOT NULL,
                    questions_asked INTEGER NOT NULL,
                    archived INTEGER NOT NULL DEFAULT 0,
                    summary TEXT,
                    file_path TEXT NOT NULL,
                    file_offset INTEGER NOT NULL
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_ci_time ON digests(ci_id, timestamp)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_period ON digests(period_type, period_id)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_type ON digests(digest_type)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS themes (
                    digest_id TEXT NOT NULL,
                    theme TEXT NOT NULL
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_theme ON themes(theme)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS keywords (
                    digest_id TEXT NOT NULL,
                    keyword TEXT NOT NULL
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_keyword ON keywords(keyword)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS entities (
                    digest_id TEXT NOT NULL,
                    kind TEXT NOT NULL,
                    name TEXT NOT NULL
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_entity ON entities(kind, name)");
        }
    }

    public void add(StoredDigest digest) {
        addAll(List.of(digest));
    }

    /**
     * Indexes digests in one transaction. Re-adding a digest id replaces its rows.
     * Any failure rolls back every insert of the batch.
     */
    public void addAll(List<StoredDigest> digests) {
        inTransaction("index " + digests.size() + " digests", () -> {
            for (StoredDigest digest : digests) {
                insert(digest);
            }
        });
        log.debug("Indexed {} digests", digests.size());
    }

    /**
     * Clears every row and indexes the given digests, in one transaction.
     *
     * @return number of digests indexed
     */
    public int rebuild(List<StoredDigest> digests) {
        inTransaction("rebuild index", () -> {
            try (var stmt = connection.createStatement()) {
                stmt.executeUpdate("DELETE FROM themes");
                stmt.executeUpdate("DELETE FROM keywords");
                stmt.executeUpdate("DELETE FROM entities");
                stmt.executeUpdate("DELETE FROM digests");
            }
            for (StoredDigest digest : digests) {
                insert(digest);
            }
        });
        log.info("Digest index rebuilt with {} digests", digests.size());
        return digests.size();
    }

    private void insert(StoredDigest stored) throws SQLException {
        Digest d = stored.digest();
        deleteRows(d.digestId());

        String sql = """
            INSERT INTO digests (digest_id, ci_id, timestamp, period_type, period_id, digest_type,
                                 source_record_count, questions_asked, archived, summary, file_path, file_offset)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, d.digestId());
            stmt.setString(2, d.ciId());
            stmt.setLong(3, d.timestamp());
            stmt.setInt(4, d.periodType().code());
            stmt.setString(5, d.periodId());
            stmt.setInt(6, d.digestType().code());
            stmt.setInt(7, d.sourceRecordCount());
            stmt.setInt(8, d.questionsAsked());
            stmt.setInt(9, d.archived() ? 1 : 0);
            stmt.setString(10, d.summary());
            stmt.setString(11, relativize(stored.location().file()));
            stmt.setLong(12, stored.location().offset());
            stmt.executeUpdate();
        }

        insertTerms("INSERT INTO themes (digest_id, theme) VALUES (?, ?)", d.digestId(), d.themes());
        insertTerms("INSERT INTO keywords (digest_id, keyword) VALUES (?, ?)", d.digestId(), d.keywords());
        insertEntities(d.digestId(), "file", d.entities().files());
        insertEntities(d.digestId(), "concept", d.entities().concepts());
        insertEntities(d.digestId(), "person", d.entities().people());
    }

    private void deleteRows(String digestId) throws SQLException {
        for (String table : List.of("themes", "keywords", "entities", "digests")) {
            try (var stmt = connection.prepareStatement("DELETE FROM " + table + " WHERE digest_id = ?")) {
                stmt.setString(1, digestId);
                stmt.executeUpdate();
            }
        }
    }

    private void insertTerms(String sql, String digestId, List<String> terms) throws SQLException {
        if (terms.isEmpty()) return;
        try (var stmt = connection.prepareStatement(sql)) {
            for (String term : terms) {
                stmt.setString(1, digestId);
                stmt.setString(2, term);
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private void insertEntities(String digestId, String kind, List<String> names) throws SQLException {
        if (names.isEmpty()) return;
        try (var stmt = connection.prepareStatement("INSERT INTO entities (digest_id, kind, name) VALUES (?, ?, ?)")) {
            for (String name : names) {
                stmt.setString(1, digestId);
                stmt.setString(2, kind);
                stmt.setString(3, name);
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    /**
     * Locations of matching digests, newest first.
     */
    public List<DigestLocation> query(DigestQuery query) {
        var sql = new StringBuilder("SELECT file_path, file_offset FROM digests WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        if (query.ciId() != null) {
            sql.append(" AND ci_id = ?");
            params.add(query.ciId());
        }
        if (query.startTime() != null) {
            sql.append(" AND timestamp >= ?");
            params.add(query.startTime());
        }
        if (query.endTime() != null) {
            sql.append(" AND timestamp <= ?");
            params.add(query.endTime());
        }
        if (query.periodType() != null) {
            sql.append(" AND period_type = ?");
            params.add(query.periodType().code());
        }
        if (query.digestType() != null) {
            sql.append(" AND digest_type = ?");
            params.add(query.digestType().code());
        }
        if (query.theme() != null) {
            sql.append(" AND digest_id IN (SELECT digest_id FROM themes WHERE theme = ?)");
            params.add(query.theme());
        }
        if (query.keyword() != null) {
            sql.append(" AND digest_id IN (SELECT digest_id FROM keywords WHERE keyword = ?)");
            params.add(query.keyword());
        }
        if (!query.includeArchived()) {
            sql.append(" AND archived = 0");
        }
        sql.append(" ORDER BY timestamp DESC, digest_id");
        if (query.limit() > 0) {
            sql.append(" LIMIT ?");
            params.add(query.limit());
        }

        List<DigestLocation> locations = new ArrayList<>();
        try (var stmt = connection.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
                stmt.setObject(i + 1, params.get(i));
            }
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    locations.add(new DigestLocation(baseDir.resolve(rs.getString("file_path")), rs.getLong("file_offset")));
                }
            }
        } catch (SQLException e) {
            log.error("Digest query failed: {}", query, e);
            throw new MemoryException(ErrorCode.IO_ERROR, "digest query failed", e);
        }
        return locations;
    }

    /**
     * Themes, keywords and concept entities whose name or digest summary contains
     * the query, ordered by name.
     */
    public List<ConceptMatch> searchConcepts(String query) {
        if (query == null || query.isBlank()) return List.of();
        String sql = """
            SELECT name, digest_id, period_id, summary FROM (
                SELECT t.theme AS name, d.digest_id, d.period_id, d.summary
                FROM themes t JOIN digests d ON d.digest_id = t.digest_id
                WHERE d.archived = 0
                UNION
                SELECT k.keyword AS name, d.digest_id, d.period_id, d.summary
                FROM keywords k JOIN digests d ON d.digest_id = k.digest_id
                WHERE d.archived = 0
                UNION
                SELECT e.name AS name, d.digest_id, d.period_id, d.summary
                FROM entities e JOIN digests d ON d.digest_id = e.digest_id
                WHERE e.kind = 'concept' AND d.archived = 0
            )
            WHERE name LIKE ? OR summary LIKE ?
            ORDER BY name, digest_id
            LIMIT ?
            """;
        List<ConceptMatch> matches = new ArrayList<>();
        String pattern = likePattern(query);
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, pattern);
            stmt.setString(2, pattern);
            stmt.setInt(3, CONCEPT_SEARCH_LIMIT);
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    matches.add(new ConceptMatch(rs.getString("name"), rs.getString("digest_id"),
                            rs.getString("period_id"), rs.getString("summary")));
                }
            }
        } catch (SQLException e) {
            log.error("Concept search failed for '{}'", query, e);
            throw new MemoryException(ErrorCode.IO_ERROR, "concept search failed", e);
        }
        return matches;
    }

    /**
     * File entities whose path or digest summary contains the query, ordered by path.
     */
    public List<CodeMatch> searchCode(String query) {
        if (query == null || query.isBlank()) return List.of();
        String sql = """
            SELECT e.name, d.digest_id, d.period_id, d.summary
            FROM entities e JOIN digests d ON d.digest_id = e.digest_id
            WHERE e.kind = 'file' AND d.archived = 0
              AND (e.name LIKE ? OR d.summary LIKE ?)
            ORDER BY e.name, d.digest_id
            LIMIT ?
            """;
        List<CodeMatch> matches = new ArrayList<>();
        String pattern = likePattern(query);
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, pattern);
            stmt.setString(2, pattern);
            stmt.setInt(3, CODE_SEARCH_LIMIT);
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    matches.add(new CodeMatch(rs.getString("name"), rs.getString("digest_id"),
                            rs.getString("period_id"), rs.getString("summary")));
                }
            }
        } catch (SQLException e) {
            log.error("Code search failed for '{}'", query, e);
            throw new MemoryException(ErrorCode.IO_ERROR, "code search failed", e);
        }
        return matches;
    }

    public IndexStats stats() {
        try (var stmt = connection.createStatement()) {
            return new IndexStats(
                    count(stmt, "SELECT COUNT(*) FROM digests"),
                    count(stmt, "SELECT COUNT(DISTINCT theme) FROM themes"),
                    count(stmt, "SELECT COUNT(DISTINCT keyword) FROM keywords"));
        } catch (SQLException e) {
            log.error("Failed to read digest index stats", e);
            throw new MemoryException(ErrorCode.IO_ERROR, "index stats failed", e);
        }
    }

    private static int count(Statement stmt, String sql) throws SQLException {
        try (var rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    public boolean healthCheck() {
        if (connection == null) return false;
        try (var stmt = connection.createStatement();
             var rs = stmt.executeQuery("SELECT 1")) {
            return rs.next();
        } catch (SQLException e) {
            return false;
        }
    }

    @Override
    public void close() {
        if (connection == null) return;
        try {
            connection.close();
            log.info("Digest index closed");
        } catch (SQLException e) {
            log.error("Error closing digest index", e);
        } finally {
            connection = null;
        }
    }

    private String relativize(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        Path base = baseDir.toAbsolutePath().normalize();
        return absolute.startsWith(base) ? base.relativize(absolute).toString() : absolute.toString();
    }

    /** Substring LIKE pattern with the caller's wildcards stripped. */
    static String likePattern(String query) {
        return "%" + query.replace("%", "").replace("_", "") + "%";
    }

    private void inTransaction(String action, SqlWork work) {
        if (connection == null) {
            throw new MemoryException(ErrorCode.INVALID_STATE, "digest index is not open");
        }
        try {
            connection.setAutoCommit(false);
            try {
                work.run();
                connection.commit();
            } catch (SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            log.error("Digest index transaction failed: {}", action, e);
            throw new MemoryException(ErrorCode.IO_ERROR, action + " failed", e);
        }
    }

    @FunctionalInterface
    private interface SqlWork {
        void run() throws SQLException;
    }
}
