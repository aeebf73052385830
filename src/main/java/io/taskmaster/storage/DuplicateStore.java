package io.taskmaster.storage;

import io.taskmaster.model.DuplicateRelationship;
import io.taskmaster.model.FileRecord;
import io.taskmaster.model.FileStatus;
import io.taskmaster.model.RelationType;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class DuplicateStore {
    private static final String RELATION_SELECT = """
            SELECT r.canonical_file_id,r.duplicate_file_id,r.relation_type,r.confidence,r.match_basis,r.updated_at_ms,
                   fc.path AS canonical_path, fd.path AS duplicate_path
            FROM file_duplicate_relationships r
            JOIN files_index fc ON fc.id=r.canonical_file_id
            JOIN files_index fd ON fd.id=r.duplicate_file_id
            """;

    private final Database database;

    public DuplicateStore(Database database) {
        this.database = database;
    }

    /**
     * Replaces every exact relationship from one consistent snapshot of active records.
     * The lowest id in each hash group is canonical, so a canonical never has an outgoing link.
     */
    public RebuildResult rebuildExact(long nowMs) {
        String groups = """
                SELECT id, content_hash FROM files_index
                WHERE status=? AND content_hash IS NOT NULL AND content_hash<>''
                  AND content_hash IN (
                      SELECT content_hash FROM files_index
                      WHERE status=? AND content_hash IS NOT NULL AND content_hash<>''
                      GROUP BY content_hash HAVING COUNT(1)>1
                  )
                ORDER BY content_hash ASC, id ASC
                """;
        String insert = """
                INSERT INTO file_duplicate_relationships(
                    canonical_file_id,duplicate_file_id,relation_type,confidence,match_basis,updated_at_ms
                ) VALUES(?,?,?,1.0,'sha256',?)
                """;
        return database.write("rebuild exact duplicate groups", c -> {
            try (Statement st = c.createStatement()) {
                st.executeUpdate("DELETE FROM file_duplicate_relationships WHERE relation_type='exact'");
            }
            int groupCount = 0;
            int relationships = 0;
            try (PreparedStatement ps = c.prepareStatement(groups);
                 PreparedStatement ins = c.prepareStatement(insert)) {
                ps.setString(1, FileStatus.ACTIVE.name());
                ps.setString(2, FileStatus.ACTIVE.name());
                String currentHash = null;
                long canonicalId = -1L;
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        long id = rs.getLong("id");
                        String hash = rs.getString("content_hash");
                        if (!hash.equals(currentHash)) {
                            currentHash = hash;
                            canonicalId = id;
                            groupCount++;
                            continue;
                        }
                        ins.setLong(1, canonicalId);
                        ins.setLong(2, id);
                        ins.setString(3, RelationType.EXACT.dbValue());
                        ins.setLong(4, nowMs);
                        ins.addBatch();
                        relationships++;
                    }
                }
                if (relationships > 0) {
                    ins.executeBatch();
                }
            }
            return new RebuildResult(groupCount, relationships);
        });
    }

    public List<DuplicateRelationship> listRelationships(RelationType type) {
        String sql = RELATION_SELECT + " WHERE r.relation_type=? ORDER BY r.canonical_file_id ASC, r.duplicate_file_id ASC";
        return database.read("list duplicate relationships", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, type.dbValue());
                return mapRelations(ps);
            }
        });
    }

    /**
     * Everything known about one file's duplicate links, in both directions.
     */
    public Optional<DuplicateSummary> duplicatesOf(long fileId) {
        String duplicateOf = RELATION_SELECT
                + " WHERE r.duplicate_file_id=? AND r.relation_type='exact' ORDER BY r.canonical_file_id ASC LIMIT 1";
        String exact = RELATION_SELECT
                + " WHERE r.canonical_file_id=? AND r.relation_type='exact' ORDER BY r.duplicate_file_id ASC";
        String near = RELATION_SELECT
                + " WHERE r.canonical_file_id=? AND r.relation_type='near' ORDER BY r.confidence DESC, r.duplicate_file_id ASC";
        return database.read("read duplicate relationships", c -> {
            Optional<FileRecord> file = FileIndexStore.getFile(c, fileId);
            if (file.isEmpty()) {
                return Optional.empty();
            }
            List<DuplicateRelationship> parent = query(c, duplicateOf, fileId);
            return Optional.of(new DuplicateSummary(
                    file.get(),
                    parent.isEmpty() ? null : parent.get(0),
                    query(c, exact, fileId),
                    query(c, near, fileId)
            ));
        });
    }

    private List<DuplicateRelationship> query(Connection c, String sql, long fileId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, fileId);
            return mapRelations(ps);
        }
    }

    private List<DuplicateRelationship> mapRelations(PreparedStatement ps) throws SQLException {
        List<DuplicateRelationship> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new DuplicateRelationship(
                        rs.getLong("canonical_file_id"),
                        rs.getLong("duplicate_file_id"),
                        RelationType.fromDb(rs.getString("relation_type")),
                        rs.getDouble("confidence"),
                        rs.getString("match_basis"),
                        rs.getString("canonical_path"),
                        rs.getString("duplicate_path"),
                        rs.getLong("updated_at_ms")
                ));
            }
        }
        return out;
    }

    public record RebuildResult(int groups, int relationships) {
    }

    public record DuplicateSummary(
            FileRecord file,
            DuplicateRelationship duplicateOf,
            List<DuplicateRelationship> exactDuplicates,
            List<DuplicateRelationship> nearDuplicates
    ) {
    }
}
