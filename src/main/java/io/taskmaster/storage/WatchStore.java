package io.taskmaster.storage;

import io.taskmaster.model.WatchedDirectory;
import io.taskmaster.util.Jsons;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class WatchStore {
    private static final String COLUMNS = "watch_id,path,recursive,allowed_exts_json,active,created_at_ms,updated_at_ms";

    private final Database database;

    public WatchStore(Database database) {
        this.database = database;
    }

    /**
     * Registers a directory, or reactivates and updates it when the path is already known.
     */
    public WatchedDirectory add(String path, boolean recursive, List<String> allowedExts, long nowMs) {
        String sql = """
                INSERT INTO watched_directories(path,recursive,allowed_exts_json,active,created_at_ms,updated_at_ms)
                VALUES(?,?,?,1,?,?)
                ON CONFLICT(path) DO UPDATE SET
                    recursive=excluded.recursive,
                    allowed_exts_json=excluded.allowed_exts_json,
                    active=1,
                    updated_at_ms=excluded.updated_at_ms
                """;
        String extsJson = Jsons.toCompactJsonArray(allowedExts);
        database.write("add watched directory", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, path);
                ps.setInt(2, recursive ? 1 : 0);
                ps.setString(3, extsJson);
                ps.setLong(4, nowMs);
                ps.setLong(5, nowMs);
                ps.executeUpdate();
            }
            return null;
        });
        return findByPath(path).orElseThrow(() -> new IllegalStateException("watch vanished after insert: " + path));
    }

    public Optional<WatchedDirectory> findByPath(String path) {
        String sql = "SELECT " + COLUMNS + " FROM watched_directories WHERE path=?";
        return database.read("read watched directory", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, path);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.empty();
                }
            }
        });
    }

    public List<WatchedDirectory> list(boolean activeOnly) {
        String sql = "SELECT " + COLUMNS + " FROM watched_directories"
                + (activeOnly ? " WHERE active=1" : "") + " ORDER BY watch_id ASC";
        return database.read("list watched directories", c -> {
            List<WatchedDirectory> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql);
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        });
    }

    public boolean deactivate(long watchId, long nowMs) {
        return database.write("deactivate watched directory", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE watched_directories SET active=0, updated_at_ms=? WHERE watch_id=? AND active=1")) {
                ps.setLong(1, nowMs);
                ps.setLong(2, watchId);
                return ps.executeUpdate() == 1;
            }
        });
    }

    private static WatchedDirectory map(ResultSet rs) throws SQLException {
        return new WatchedDirectory(
                rs.getLong("watch_id"),
                rs.getString("path"),
                rs.getInt("recursive") == 1,
                parseExts(rs.getString("allowed_exts_json")),
                rs.getInt("active") == 1,
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    private static List<String> parseExts(String json) throws SQLException {
        try {
            return Jsons.toStringList(json);
        } catch (IllegalArgumentException e) {
            throw new SQLException("invalid allowed_exts_json: " + json, e);
        }
    }
}
