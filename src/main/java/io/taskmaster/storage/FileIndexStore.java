package io.taskmaster.storage;

import io.taskmaster.model.FileRecord;
import io.taskmaster.model.FileStatus;
import io.taskmaster.model.ManifestEntry;
import io.taskmaster.model.Page;
import io.taskmaster.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;

/**
 * File records ({@code files_index}) and their manifest fingerprints ({@code scan_manifest}).
 * A manifest row is only ever written in the same transaction as its file record.
 */
public final class FileIndexStore {
    private static final String FILE_COLUMNS = """
            id,path,display_name,ext,size_bytes,mtime_ms,mime_type,content_hash,status,last_error,
            metadata_completeness,metadata_json,first_seen_run_id,last_run_id,created_at_ms,updated_at_ms,last_checked_at_ms""";

    private final Database database;
    private final LongAdder fileRecordWrites = new LongAdder();
    private final LongAdder manifestWrites = new LongAdder();

    public FileIndexStore(Database database) {
        this.database = database;
    }

    public Optional<ManifestEntry> manifestEntry(String pathHash) {
        String sql = """
                SELECT path_hash,path,root,content_hash,size_bytes,mtime_ms,last_seen_run_id,last_status,last_error,updated_at_ms
                FROM scan_manifest WHERE path_hash=?
                """;
        return database.read("read manifest entry", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, pathHash);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) return Optional.empty();
                    return Optional.of(new ManifestEntry(
                            rs.getString("path_hash"),
                            rs.getString("path"),
                            rs.getString("root"),
                            rs.getString("content_hash"),
                            rs.getLong("size_bytes"),
                            rs.getLong("mtime_ms"),
                            rs.getString("last_seen_run_id"),
                            rs.getString("last_status"),
                            rs.getString("last_error"),
                            rs.getLong("updated_at_ms")
                    ));
                }
            }
        });
    }

    public long countManifestEntries(String root) {
        boolean scoped = root != null && !root.isBlank();
        String sql = scoped
                ? "SELECT COUNT(1) FROM scan_manifest WHERE root=?"
                : "SELECT COUNT(1) FROM scan_manifest";
        return database.read("count manifest entries", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                if (scoped) {
                    ps.setString(1, root);
                }
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getLong(1) : 0L;
                }
            }
        });
    }

    public Optional<FileRecord> findByPathHash(String pathHash) {
        String sql = "SELECT " + FILE_COLUMNS + " FROM files_index WHERE path_hash=?";
        return database.read("read file record", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, pathHash);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapFile(rs)) : Optional.empty();
                }
            }
        });
    }

    public Optional<FileRecord> getFile(long fileId) {
        return database.read("read file record", c -> getFile(c, fileId));
    }

    static Optional<FileRecord> getFile(Connection c, long fileId) throws SQLException {
        String sql = "SELECT " + FILE_COLUMNS + " FROM files_index WHERE id=?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, fileId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapFile(rs)) : Optional.empty();
            }
        }
    }

    public Page<FileRecord> listFiles(FileStatus status, int limit, int offset) {
        String where = status == null ? "" : " WHERE status=?";
        String countSql = "SELECT COUNT(1) FROM files_index" + where;
        String sql = "SELECT " + FILE_COLUMNS + " FROM files_index" + where + " ORDER BY id ASC LIMIT ? OFFSET ?";
        int safeLimit = Math.max(1, limit);
        int safeOffset = Math.max(0, offset);
        return database.read("list file records", c -> {
            long total;
            try (PreparedStatement ps = c.prepareStatement(countSql)) {
                if (status != null) {
                    ps.setString(1, status.name());
                }
                try (ResultSet rs = ps.executeQuery()) {
                    total = rs.next() ? rs.getLong(1) : 0L;
                }
            }
            List<FileRecord> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                int i = 1;
                if (status != null) {
                    ps.setString(i++, status.name());
                }
                ps.setInt(i++, safeLimit);
                ps.setInt(i, safeOffset);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(mapFile(rs));
                    }
                }
            }
            return new Page<>(out, total, safeOffset + out.size() < total);
        });
    }

    /**
     * Keyset iteration over records in a status, used by the refresh job.
     */
    public List<FileRecord> listByStatusAfter(FileStatus status, long afterId, int limit) {
        String sql = "SELECT " + FILE_COLUMNS + " FROM files_index WHERE status=? AND id>? ORDER BY id ASC LIMIT ?";
        return database.read("list file records by status", c -> {
            List<FileRecord> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, status.name());
                ps.setLong(2, afterId);
                ps.setInt(3, Math.max(1, limit));
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(mapFile(rs));
                    }
                }
            }
            return out;
        });
    }

    /**
     * Upserts the file record and its manifest entry atomically.
     */
    public UpsertResult upsertObservation(FileObservation obs) {
        String select = "SELECT id FROM files_index WHERE path_hash=?";
        String upsertFile = """
                INSERT INTO files_index(
                    path,path_hash,display_name,ext,size_bytes,mtime_ms,mime_type,content_hash,status,last_error,
                    metadata_completeness,metadata_json,first_seen_run_id,last_run_id,created_at_ms,updated_at_ms,last_checked_at_ms
                ) VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT(path_hash) DO UPDATE SET
                    path=excluded.path,
                    display_name=excluded.display_name,
                    ext=excluded.ext,
                    size_bytes=excluded.size_bytes,
                    mtime_ms=excluded.mtime_ms,
                    mime_type=excluded.mime_type,
                    content_hash=excluded.content_hash,
                    status=excluded.status,
                    last_error=excluded.last_error,
                    metadata_completeness=excluded.metadata_completeness,
                    metadata_json=excluded.metadata_json,
                    last_run_id=excluded.last_run_id,
                    updated_at_ms=excluded.updated_at_ms,
                    last_checked_at_ms=excluded.last_checked_at_ms
                """;
        String upsertManifest = """
                INSERT INTO scan_manifest(path_hash,path,root,content_hash,size_bytes,mtime_ms,last_seen_run_id,last_status,last_error,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT(path_hash) DO UPDATE SET
                    path=excluded.path,
                    root=excluded.root,
                    content_hash=excluded.content_hash,
                    size_bytes=excluded.size_bytes,
                    mtime_ms=excluded.mtime_ms,
                    last_seen_run_id=excluded.last_seen_run_id,
                    last_status=excluded.last_status,
                    last_error=excluded.last_error,
                    updated_at_ms=excluded.updated_at_ms
                """;
        UpsertResult result = database.write("upsert file observation", c -> {
            boolean existed;
            try (PreparedStatement ps = c.prepareStatement(select)) {
                ps.setString(1, obs.pathHash());
                try (ResultSet rs = ps.executeQuery()) {
                    existed = rs.next();
                }
            }
            try (PreparedStatement ps = c.prepareStatement(upsertFile)) {
                ps.setString(1, obs.path());
                ps.setString(2, obs.pathHash());
                ps.setString(3, obs.displayName());
                ps.setString(4, obs.ext());
                ps.setLong(5, obs.sizeBytes());
                ps.setLong(6, obs.mtimeMs());
                ps.setString(7, obs.mimeType());
                setNullableString(ps, 8, obs.contentHash());
                ps.setString(9, obs.status().name());
                setNullableString(ps, 10, obs.lastError());
                ps.setString(11, obs.metadataCompleteness());
                ps.setString(12, Jsons.toCompactJson(obs.metadata()));
                ps.setString(13, obs.runId());
                ps.setString(14, obs.runId());
                ps.setLong(15, obs.nowMs());
                ps.setLong(16, obs.nowMs());
                ps.setLong(17, obs.nowMs());
                ps.executeUpdate();
            }
            long fileId;
            try (PreparedStatement ps = c.prepareStatement(select)) {
                ps.setString(1, obs.pathHash());
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        throw new SQLException("file record vanished after upsert: " + obs.path());
                    }
                    fileId = rs.getLong(1);
                }
            }
            try (PreparedStatement ps = c.prepareStatement(upsertManifest)) {
                ps.setString(1, obs.pathHash());
                ps.setString(2, obs.path());
                ps.setString(3, obs.root());
                setNullableString(ps, 4, obs.contentHash());
                ps.setLong(5, obs.sizeBytes());
                ps.setLong(6, obs.mtimeMs());
                ps.setString(7, obs.runId());
                ps.setString(8, obs.status().name());
                setNullableString(ps, 9, obs.lastError());
                ps.setLong(10, obs.nowMs());
                ps.executeUpdate();
            }
            return new UpsertResult(fileId, !existed);
        });
        fileRecordWrites.increment();
        manifestWrites.increment();
        return result;
    }

    /**
     * Flags active records not checked since {@code cutoffMs} as stale.
     */
    public int markStaleCheckedBefore(long cutoffMs, long nowMs) {
        String sql = "UPDATE files_index SET status=?, updated_at_ms=? WHERE status=? AND last_checked_at_ms<?";
        int rows = database.write("flag stale file records", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, FileStatus.STALE.name());
                ps.setLong(2, nowMs);
                ps.setString(3, FileStatus.ACTIVE.name());
                ps.setLong(4, cutoffMs);
                return ps.executeUpdate();
            }
        });
        if (rows > 0) {
            fileRecordWrites.add(rows);
        }
        return rows;
    }

    public void markMissing(FileRecord record, String pathHash, String runId, long nowMs) {
        String file = "UPDATE files_index SET status=?, last_error=?, last_run_id=?, updated_at_ms=?, last_checked_at_ms=? WHERE id=?";
        String manifest = "UPDATE scan_manifest SET last_status=?, last_error=?, last_seen_run_id=?, updated_at_ms=? WHERE path_hash=?";
        database.write("mark file record missing", c -> {
            try (PreparedStatement ps = c.prepareStatement(file)) {
                ps.setString(1, FileStatus.MISSING.name());
                ps.setString(2, "file_not_found");
                ps.setString(3, runId);
                ps.setLong(4, nowMs);
                ps.setLong(5, nowMs);
                ps.setLong(6, record.id());
                ps.executeUpdate();
            }
            try (PreparedStatement ps = c.prepareStatement(manifest)) {
                ps.setString(1, FileStatus.MISSING.name());
                ps.setString(2, "file_not_found");
                ps.setString(3, runId);
                ps.setLong(4, nowMs);
                ps.setString(5, pathHash);
                ps.executeUpdate();
            }
            return null;
        });
        fileRecordWrites.increment();
        manifestWrites.increment();
    }

    public WriteCounters writeCounters() {
        return new WriteCounters(fileRecordWrites.sum(), manifestWrites.sum());
    }

    static FileRecord mapFile(ResultSet rs) throws SQLException {
        String metadataJson = rs.getString("metadata_json");
        Map<String, Object> metadata = Jsons.toMap(metadataJson);
        return new FileRecord(
                rs.getLong("id"),
                rs.getString("path"),
                rs.getString("display_name"),
                rs.getString("ext"),
                rs.getLong("size_bytes"),
                rs.getLong("mtime_ms"),
                rs.getString("mime_type"),
                rs.getString("content_hash"),
                FileStatus.fromDb(rs.getString("status")),
                rs.getString("last_error"),
                rs.getString("metadata_completeness"),
                metadata,
                rs.getString("first_seen_run_id"),
                rs.getString("last_run_id"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms"),
                rs.getLong("last_checked_at_ms")
        );
    }

    private static void setNullableString(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }

    public record FileObservation(
            String path,
            String pathHash,
            String root,
            String displayName,
            String ext,
            long sizeBytes,
            long mtimeMs,
            String mimeType,
            String contentHash,
            FileStatus status,
            String lastError,
            String metadataCompleteness,
            Map<String, Object> metadata,
            String runId,
            long nowMs
    ) {
    }

    public record UpsertResult(long fileId, boolean created) {
    }

    public record WriteCounters(long fileRecordWrites, long manifestWrites) {
    }
}
