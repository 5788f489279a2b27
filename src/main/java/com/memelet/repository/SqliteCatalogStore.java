package com.memelet.repository;

import com.memelet.model.AlbumItem;
import com.memelet.model.CatalogStats;
import com.memelet.model.JobStatus;
import com.memelet.model.MediaAnalysis;
import com.memelet.model.MediaRecord;
import com.memelet.model.MediaStatus;
import com.memelet.model.MediaType;
import com.memelet.model.Tag;

import java.io.File;
import java.nio.file.Path;
import java.sql.*;
import java.time.LocalDateTime;
import java.util.*;

/**
 * SQLite implementation of the catalog (memelet.db).
 * Every call opens its own connection, so the store can be shared between the batch pass and
 * concurrently triggered single-item operations. Multi-row writes run in a transaction.
 */
public class SqliteCatalogStore implements CatalogStore {
    private static final int CURRENT_DB_VERSION = 2;

    private static final String SQL_CREATE_METADATA = """
            CREATE TABLE IF NOT EXISTS metadata (
             version integer PRIMARY KEY
            );""";

    private static final String SQL_CREATE_MEMES = """
            CREATE TABLE IF NOT EXISTS memes (
             id integer PRIMARY KEY AUTOINCREMENT,
             file_path text NOT NULL UNIQUE,
             media_type text NOT NULL DEFAULT 'image',
             status text NOT NULL DEFAULT 'new',
             content_hash text,
             size integer DEFAULT 0,
             title text,
             ref_content text,
             template text,
             caption text,
             description text,
             meaning text,
             suggested_tags text,
             error_message text,
             created_at text,
             updated_at text
            );""";

    private static final String SQL_CREATE_ALBUM_ITEMS = """
            CREATE TABLE IF NOT EXISTS album_items (
             id integer PRIMARY KEY AUTOINCREMENT,
             album_id integer NOT NULL,
             file_path text NOT NULL,
             display_order integer NOT NULL,
             content_hash text,
             size integer DEFAULT 0,
             UNIQUE (album_id, display_order),
             FOREIGN KEY (album_id) REFERENCES memes(id) ON DELETE CASCADE
            );""";

    private static final String SQL_CREATE_TAGS = """
            CREATE TABLE IF NOT EXISTS tags (
             id integer PRIMARY KEY AUTOINCREMENT,
             name text NOT NULL UNIQUE COLLATE NOCASE,
             description text,
             color text,
             parse_from_filename integer DEFAULT 0,
             ai_can_suggest integer DEFAULT 0
            );""";

    private static final String SQL_CREATE_MEME_TAGS = """
            CREATE TABLE IF NOT EXISTS meme_tags (
             meme_id integer NOT NULL,
             tag_id integer NOT NULL,
             created_at text,
             PRIMARY KEY (meme_id, tag_id),
             FOREIGN KEY (meme_id) REFERENCES memes(id) ON DELETE CASCADE,
             FOREIGN KEY (tag_id) REFERENCES tags(id) ON DELETE CASCADE
            );""";

    private static final String SQL_CREATE_WORKSPACES = """
            CREATE TABLE IF NOT EXISTS workspace_reservations (
             name text PRIMARY KEY,
             reserved_at text
            );""";

    private static final String SQL_CREATE_JOBS = """
            CREATE TABLE IF NOT EXISTS jobs (
             job_id text PRIMARY KEY,
             type text NOT NULL,
             target text,
             state text NOT NULL,
             applied integer DEFAULT 0,
             message text,
             created_at text,
             finished_at text
            );""";

    private static final String SQL_INDEX_STATUS = "CREATE INDEX IF NOT EXISTS idx_status ON memes(status);";
    private static final String SQL_INDEX_HASH = "CREATE INDEX IF NOT EXISTS idx_memes_hash ON memes(content_hash);";
    private static final String SQL_INDEX_ALBUM_ITEMS = "CREATE INDEX IF NOT EXISTS idx_album_items_album ON album_items(album_id);";
    private static final String SQL_INDEX_MEME_TAGS_TAG_ID = "CREATE INDEX IF NOT EXISTS idx_meme_tags_tag_id ON meme_tags(tag_id);";

    private static final String MEME_COLUMNS = """
            id, file_path, media_type, status, content_hash, size, title, ref_content, template, caption,
            description, meaning, suggested_tags, error_message, created_at, updated_at""";

    private final String connectionUrl;

    public SqliteCatalogStore(Path databaseFile) {
        File dbFolder = databaseFile.toAbsolutePath().getParent().toFile();
        if (!dbFolder.exists()) {
            if (!dbFolder.mkdirs()) {
                throw new DatabaseException("Could not create catalog database directory: " + dbFolder.getAbsolutePath());
            }
        }
        this.connectionUrl = "jdbc:sqlite:" + databaseFile.toAbsolutePath();
        initialize();
    }

    // Constructor for custom URLs (e.g. shared in-memory databases in tests)
    public SqliteCatalogStore(String connectionUrl) {
        this.connectionUrl = connectionUrl;
        initialize();
    }

    private Connection connect() throws SQLException {
        Connection conn = DriverManager.getConnection(connectionUrl);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA foreign_keys = ON;");
            stmt.execute("PRAGMA busy_timeout = 10000;");
        }
        return conn;
    }

    /**
     * Initializes the schema and upgrades databases created by older versions.
     */
    private void initialize() {
        try (Connection conn = connect()) {
            // WAL lets readers proceed while a batch pass writes
            if (!connectionUrl.contains(":memory:") && !connectionUrl.contains("mode=memory")) {
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute("PRAGMA journal_mode=WAL;");
                    stmt.execute("PRAGMA synchronous=NORMAL;");
                }
            }

            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                int version = 0;
                try (ResultSet rs = stmt.executeQuery("SELECT version FROM metadata ORDER BY version DESC LIMIT 1")) {
                    if (rs.next()) {
                        version = rs.getInt("version");
                    }
                } catch (SQLException e) {
                    // Metadata table doesn't exist yet
                }

                if (version < CURRENT_DB_VERSION) {
                    migrate(conn, stmt);
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new DatabaseException("Catalog database initialization failed", e);
        }
    }

    private void migrate(Connection conn, Statement stmt) throws SQLException {
        stmt.execute(SQL_CREATE_METADATA);
        stmt.execute(SQL_CREATE_MEMES);
        stmt.execute(SQL_CREATE_ALBUM_ITEMS);
        stmt.execute(SQL_CREATE_TAGS);
        stmt.execute(SQL_CREATE_MEME_TAGS);
        stmt.execute(SQL_CREATE_WORKSPACES);
        stmt.execute(SQL_CREATE_JOBS);

        // Databases created before albums and hashing existed only have the first memes columns
        Map<String, String> memeColumns = new LinkedHashMap<>();
        memeColumns.put("media_type", "text NOT NULL DEFAULT 'image'");
        memeColumns.put("content_hash", "text");
        memeColumns.put("size", "integer DEFAULT 0");
        memeColumns.put("title", "text");
        memeColumns.put("suggested_tags", "text");
        memeColumns.put("error_message", "text");
        memeColumns.put("created_at", "text");
        memeColumns.put("updated_at", "text");

        Set<String> existingColumns = getExistingColumns(conn, "memes");
        for (Map.Entry<String, String> column : memeColumns.entrySet()) {
            if (!existingColumns.contains(column.getKey())) {
                stmt.execute("ALTER TABLE memes ADD COLUMN " + column.getKey() + " " + column.getValue());
            }
        }

        stmt.execute(SQL_INDEX_STATUS);
        stmt.execute(SQL_INDEX_HASH);
        stmt.execute(SQL_INDEX_ALBUM_ITEMS);
        stmt.execute(SQL_INDEX_MEME_TAGS_TAG_ID);

        stmt.execute("INSERT OR REPLACE INTO metadata (version) VALUES (" + CURRENT_DB_VERSION + ");");
    }

    private Set<String> getExistingColumns(Connection conn, String tableName) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (ResultSet rs = conn.getMetaData().getColumns(null, null, tableName, null)) {
            while (rs.next()) {
                columns.add(rs.getString("COLUMN_NAME"));
            }
        }
        return columns;
    }

    // --- Media records ---

    @Override
    public MediaRecord insertMedia(MediaRecord record) {
        try (Connection conn = connect()) {
            insertMediaRow(conn, record);
            return record;
        } catch (SQLException e) {
            throw new DatabaseException("Failed to insert record: " + record.getPath(), e);
        }
    }

    @Override
    public MediaRecord insertAlbum(MediaRecord album, List<AlbumItem> items) {
        String itemSql = "INSERT INTO album_items(album_id, file_path, display_order, content_hash, size) VALUES(?,?,?,?,?)";
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try {
                insertMediaRow(conn, album);
                try (PreparedStatement pstmt = conn.prepareStatement(itemSql, Statement.RETURN_GENERATED_KEYS)) {
                    for (AlbumItem item : items) {
                        pstmt.setLong(1, album.getId());
                        pstmt.setString(2, item.getPath());
                        pstmt.setInt(3, item.getDisplayOrder());
                        pstmt.setString(4, item.getContentHash());
                        pstmt.setLong(5, item.getSize());
                        pstmt.executeUpdate();
                        try (ResultSet keys = pstmt.getGeneratedKeys()) {
                            if (keys.next()) {
                                item.setId(keys.getLong(1));
                            }
                        }
                        item.setAlbumId(album.getId());
                    }
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            album.setAlbumItems(new ArrayList<>(items));
            return album;
        } catch (SQLException e) {
            throw new DatabaseException("Failed to insert album: " + album.getPath(), e);
        }
    }

    private void insertMediaRow(Connection conn, MediaRecord record) throws SQLException {
        String sql = """
                INSERT INTO memes(file_path, media_type, status, content_hash, size, title, error_message, created_at, updated_at)
                VALUES(?,?,?,?,?,?,?,?,?)""";
        LocalDateTime now = LocalDateTime.now();
        try (PreparedStatement pstmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            pstmt.setString(1, record.getPath());
            pstmt.setString(2, record.getMediaType().getDbValue());
            pstmt.setString(3, record.getStatus().getDbValue());
            pstmt.setString(4, record.getContentHash());
            pstmt.setLong(5, record.getSize());
            pstmt.setString(6, record.getTitle());
            pstmt.setString(7, record.getErrorMessage());
            pstmt.setString(8, now.toString());
            pstmt.setString(9, now.toString());
            pstmt.executeUpdate();
            try (ResultSet keys = pstmt.getGeneratedKeys()) {
                if (keys.next()) {
                    record.setId(keys.getLong(1));
                }
            }
        }
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
    }

    @Override
    public Optional<MediaRecord> findById(long id) {
        return findOne("SELECT " + MEME_COLUMNS + " FROM memes WHERE id = ?", id);
    }

    @Override
    public Optional<MediaRecord> findByPath(String path) {
        return findOne("SELECT " + MEME_COLUMNS + " FROM memes WHERE file_path = ?", path);
    }

    @Override
    public Optional<MediaRecord> findFirstByHash(String contentHash) {
        if (contentHash == null) {
            return Optional.empty();
        }
        return findOne("SELECT " + MEME_COLUMNS + " FROM memes WHERE content_hash = ? ORDER BY id ASC LIMIT 1", contentHash);
    }

    private Optional<MediaRecord> findOne(String sql, Object parameter) {
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setObject(1, parameter);
            try (ResultSet rs = pstmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResultSetToRecord(conn, rs));
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to load record for " + parameter, e);
        }
        return Optional.empty();
    }

    @Override
    public List<MediaRecord> findAll() {
        String sql = "SELECT " + MEME_COLUMNS + " FROM memes ORDER BY id ASC";
        List<MediaRecord> records = new ArrayList<>();
        try (Connection conn = connect();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                records.add(mapResultSetToRecord(conn, rs));
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to load records", e);
        }
        return records;
    }

    @Override
    public List<MediaRecord> findByStatus(MediaStatus... statuses) {
        if (statuses.length == 0) {
            return new ArrayList<>();
        }
        String placeholders = String.join(",", Collections.nCopies(statuses.length, "?"));
        String sql = "SELECT " + MEME_COLUMNS + " FROM memes WHERE status IN (" + placeholders + ") ORDER BY created_at ASC, id ASC";
        List<MediaRecord> records = new ArrayList<>();
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < statuses.length; i++) {
                pstmt.setString(i + 1, statuses[i].getDbValue());
            }
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    records.add(mapResultSetToRecord(conn, rs));
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to load records by status", e);
        }
        return records;
    }

    @Override
    public Set<String> getAllKnownPaths() {
        Set<String> paths = new HashSet<>();
        String sql = "SELECT file_path FROM memes UNION SELECT file_path FROM album_items";
        try (Connection conn = connect();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                paths.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to load known paths", e);
        }
        return paths;
    }

    @Override
    public List<AlbumItem> getAlbumItems(long albumId) {
        try (Connection conn = connect()) {
            return getAlbumItems(conn, albumId);
        } catch (SQLException e) {
            throw new DatabaseException("Failed to load album items for album " + albumId, e);
        }
    }

    private List<AlbumItem> getAlbumItems(Connection conn, long albumId) throws SQLException {
        String sql = """
                SELECT id, album_id, file_path, display_order, content_hash, size
                FROM album_items
                WHERE album_id = ?
                ORDER BY display_order ASC""";
        List<AlbumItem> items = new ArrayList<>();
        try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setLong(1, albumId);
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    items.add(new AlbumItem(
                            rs.getLong("id"),
                            rs.getLong("album_id"),
                            rs.getString("file_path"),
                            rs.getInt("display_order"),
                            rs.getString("content_hash"),
                            rs.getLong("size")));
                }
            }
        }
        return items;
    }

    @Override
    public void updateContentHash(long id, String contentHash) {
        executeUpdate("UPDATE memes SET content_hash = ?, updated_at = ? WHERE id = ?",
                "Failed to update hash for record " + id, contentHash, now(), id);
    }

    @Override
    public void updatePath(long id, String newPath) {
        executeUpdate("UPDATE memes SET file_path = ?, updated_at = ? WHERE id = ?",
                "Failed to relocate record " + id, newPath, now(), id);
    }

    @Override
    public void updateAlbumItem(AlbumItem item) {
        executeUpdate("UPDATE album_items SET file_path = ?, content_hash = ?, size = ? WHERE id = ?",
                "Failed to update album item " + item.getId(), item.getPath(), item.getContentHash(), item.getSize(), item.getId());
    }

    @Override
    public void markError(long id, String errorMessage) {
        executeUpdate("UPDATE memes SET status = 'error', error_message = ?, updated_at = ? WHERE id = ?",
                "Failed to mark record " + id + " as error", errorMessage, now(), id);
    }

    @Override
    public boolean transitionStatus(long id, MediaStatus expected, MediaStatus target) {
        int updated = executeUpdate("UPDATE memes SET status = ?, updated_at = ? WHERE id = ? AND status = ?",
                "Failed to change status of record " + id, target.getDbValue(), now(), id, expected.getDbValue());
        return updated == 1;
    }

    @Override
    public boolean completeAnalysis(long id, MediaAnalysis analysis) {
        String sql = """
                UPDATE memes
                SET status = 'done',
                    ref_content = ?,
                    template = ?,
                    caption = ?,
                    description = ?,
                    meaning = ?,
                    suggested_tags = ?,
                    error_message = NULL,
                    updated_at = ?
                WHERE id = ? AND status = 'processing'""";
        int updated = executeUpdate(sql, "Failed to store analysis for record " + id,
                analysis.getReferences(), analysis.getTemplate(), analysis.getCaption(),
                analysis.getDescription(), analysis.getMeaning(), analysis.getTagsAsText(), now(), id);
        return updated == 1;
    }

    @Override
    public boolean failProcessing(long id, String errorMessage) {
        int updated = executeUpdate(
                "UPDATE memes SET status = 'error', error_message = ?, updated_at = ? WHERE id = ? AND status = 'processing'",
                "Failed to mark record " + id + " as failed", errorMessage, now(), id);
        return updated == 1;
    }

    @Override
    public CatalogStats countByStatus() {
        Map<MediaStatus, Integer> counts = new EnumMap<>(MediaStatus.class);
        String sql = "SELECT status, COUNT(*) AS count FROM memes GROUP BY status";
        try (Connection conn = connect();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                counts.put(MediaStatus.fromDbValue(rs.getString("status")), rs.getInt("count"));
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to count records by status", e);
        }
        return new CatalogStats(counts);
    }

    private MediaRecord mapResultSetToRecord(Connection conn, ResultSet rs) throws SQLException {
        MediaRecord record = new MediaRecord(
                rs.getString("file_path"),
                MediaType.fromDbValue(rs.getString("media_type")),
                MediaStatus.fromDbValue(rs.getString("status")),
                rs.getString("content_hash"),
                rs.getLong("size"));
        record.setId(rs.getLong("id"));
        record.setTitle(rs.getString("title"));
        record.setReferences(rs.getString("ref_content"));
        record.setTemplate(rs.getString("template"));
        record.setCaption(rs.getString("caption"));
        record.setDescription(rs.getString("description"));
        record.setMeaning(rs.getString("meaning"));
        record.setSuggestedTags(rs.getString("suggested_tags"));
        record.setErrorMessage(rs.getString("error_message"));
        record.setCreatedAt(parseTimestamp(rs.getString("created_at")));
        record.setUpdatedAt(parseTimestamp(rs.getString("updated_at")));

        if (record.isAlbum()) {
            record.setAlbumItems(getAlbumItems(conn, record.getId()));
        }
        return record;
    }

    // --- Tags ---

    @Override
    public Tag insertTag(Tag tag) {
        String sql = "INSERT INTO tags(name, description, color, parse_from_filename, ai_can_suggest) VALUES(?,?,?,?,?)";
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            pstmt.setString(1, tag.getName());
            pstmt.setString(2, tag.getDescription());
            pstmt.setString(3, tag.getColor());
            pstmt.setInt(4, tag.isParseFromFilename() ? 1 : 0);
            pstmt.setInt(5, tag.isAiCanSuggest() ? 1 : 0);
            pstmt.executeUpdate();
            try (ResultSet keys = pstmt.getGeneratedKeys()) {
                if (keys.next()) {
                    tag.setId(keys.getLong(1));
                }
            }
            return tag;
        } catch (SQLException e) {
            throw new DatabaseException("Error creating tag: " + tag.getName(), e);
        }
    }

    @Override
    public List<Tag> findAllTags() {
        return queryTags("SELECT * FROM tags ORDER BY name ASC");
    }

    @Override
    public List<Tag> findFilenameTags() {
        return queryTags("SELECT * FROM tags WHERE parse_from_filename = 1 ORDER BY name ASC");
    }

    @Override
    public List<Tag> findSuggestibleTags() {
        return queryTags("SELECT * FROM tags WHERE ai_can_suggest = 1 ORDER BY name ASC");
    }

    @Override
    public List<Tag> getTagsForMedia(long mediaId) {
        String sql = """
            SELECT t.*
            FROM tags t
            JOIN meme_tags mt ON t.id = mt.tag_id
            WHERE mt.meme_id = ?
            ORDER BY t.name ASC
        """;
        List<Tag> tags = new ArrayList<>();
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setLong(1, mediaId);
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    tags.add(mapResultSetToTag(rs));
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to load tags for record " + mediaId, e);
        }
        return tags;
    }

    private List<Tag> queryTags(String sql) {
        List<Tag> tags = new ArrayList<>();
        try (Connection conn = connect();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                tags.add(mapResultSetToTag(rs));
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to load tags", e);
        }
        return tags;
    }

    private Tag mapResultSetToTag(ResultSet rs) throws SQLException {
        return new Tag(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("description"),
                rs.getString("color"),
                rs.getInt("parse_from_filename") == 1,
                rs.getInt("ai_can_suggest") == 1);
    }

    @Override
    public boolean addMemeTagIfAbsent(long mediaId, long tagId) {
        int inserted = executeUpdate("INSERT OR IGNORE INTO meme_tags(meme_id, tag_id, created_at) VALUES(?, ?, ?)",
                "Error linking tag " + tagId + " to record " + mediaId, mediaId, tagId, now());
        return inserted == 1;
    }

    // --- Frame workspaces ---

    @Override
    public boolean reserveWorkspace(String name) {
        int inserted = executeUpdate("INSERT OR IGNORE INTO workspace_reservations(name, reserved_at) VALUES(?, ?)",
                "Failed to reserve workspace " + name, name, now());
        return inserted == 1;
    }

    @Override
    public void releaseWorkspace(String name) {
        executeUpdate("DELETE FROM workspace_reservations WHERE name = ?", "Failed to release workspace " + name, name);
    }

    @Override
    public int releaseAllWorkspaces() {
        return executeUpdate("DELETE FROM workspace_reservations", "Failed to release workspaces");
    }

    // --- Jobs ---

    @Override
    public void saveJob(JobStatus job) {
        String sql = """
                INSERT INTO jobs(job_id, type, target, state, applied, message, created_at, finished_at)
                VALUES(?,?,?,?,?,?,?,?)
                ON CONFLICT(job_id) DO UPDATE SET
                 state = excluded.state,
                 applied = excluded.applied,
                 message = excluded.message,
                 finished_at = excluded.finished_at""";
        executeUpdate(sql, "Failed to save job " + job.getJobId(),
                job.getJobId(),
                job.getType().name(),
                job.getTarget(),
                job.getState().name(),
                job.isApplied() ? 1 : 0,
                job.getMessage(),
                job.getCreatedAt() != null ? job.getCreatedAt().toString() : null,
                job.getFinishedAt() != null ? job.getFinishedAt().toString() : null);
    }

    @Override
    public Optional<JobStatus> findJob(String jobId) {
        String sql = "SELECT * FROM jobs WHERE job_id = ?";
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, jobId);
            try (ResultSet rs = pstmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new JobStatus(
                            rs.getString("job_id"),
                            JobStatus.JobType.valueOf(rs.getString("type")),
                            rs.getString("target"),
                            JobStatus.JobState.valueOf(rs.getString("state")),
                            rs.getInt("applied") == 1,
                            rs.getString("message"),
                            parseTimestamp(rs.getString("created_at")),
                            parseTimestamp(rs.getString("finished_at"))));
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to load job " + jobId, e);
        }
        return Optional.empty();
    }

    // --- Helpers ---

    private int executeUpdate(String sql, String errorMessage, Object... parameters) {
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < parameters.length; i++) {
                pstmt.setObject(i + 1, parameters[i]);
            }
            return pstmt.executeUpdate();
        } catch (SQLException e) {
            throw new DatabaseException(errorMessage, e);
        }
    }

    private static String now() {
        return LocalDateTime.now().toString();
    }

    // Rows written by the first version of the catalog use SQLite's CURRENT_TIMESTAMP format
    private static LocalDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return LocalDateTime.parse(value.trim().replace(' ', 'T'));
    }
}
