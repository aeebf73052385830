package io.taskmaster.storage;

import io.taskmaster.model.EventLevel;
import io.taskmaster.model.EventType;
import io.taskmaster.model.EventView;
import io.taskmaster.model.Page;
import io.taskmaster.util.Jsons;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class EventStore {
    private final Database database;

    public EventStore(Database database) {
        this.database = database;
    }

    /**
     * Appends a batch in one transaction. Ids come from the AUTOINCREMENT key, so they only grow.
     */
    public int insertBatch(List<EventRow> rows) {
        if (rows.isEmpty()) {
            return 0;
        }
        String sql = """
                INSERT INTO events(run_id,task_id,level,event_type,code,category,message,payload_json,created_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?)
                """;
        return database.write("append events", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (EventRow row : rows) {
                    ps.setString(1, row.runId());
                    if (row.taskId() == null) {
                        ps.setNull(2, Types.VARCHAR);
                    } else {
                        ps.setString(2, row.taskId());
                    }
                    ps.setString(3, row.level().name());
                    ps.setString(4, row.type().name());
                    ps.setString(5, row.type().code());
                    ps.setString(6, row.type().category());
                    ps.setString(7, row.message());
                    ps.setString(8, Jsons.toCompactJson(row.payload()));
                    ps.setLong(9, row.createdAtMs());
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            return rows.size();
        });
    }

    public Page<EventView> listEvents(String runId, EventQuery query) {
        StringBuilder where = new StringBuilder(" WHERE run_id=?");
        List<Object> args = new ArrayList<>();
        args.add(runId);
        if (query.level() != null) {
            where.append(" AND level=?");
            args.add(query.level().name());
        }
        if (query.type() != null) {
            where.append(" AND event_type=?");
            args.add(query.type().name());
        }
        if (query.startedAfterMs() != null) {
            where.append(" AND created_at_ms>=?");
            args.add(query.startedAfterMs());
        }
        if (query.startedBeforeMs() != null) {
            where.append(" AND created_at_ms<=?");
            args.add(query.startedBeforeMs());
        }
        String countSql = "SELECT COUNT(1) FROM events" + where;
        String sql = """
                SELECT event_id,run_id,task_id,level,event_type,code,category,message,payload_json,created_at_ms
                FROM events""" + where + " ORDER BY event_id ASC LIMIT ? OFFSET ?";
        int limit = Math.max(1, query.limit());
        int offset = Math.max(0, query.offset());
        return database.read("list events", c -> {
            long total;
            try (PreparedStatement ps = c.prepareStatement(countSql)) {
                bind(ps, args);
                try (ResultSet rs = ps.executeQuery()) {
                    total = rs.next() ? rs.getLong(1) : 0L;
                }
            }
            List<EventView> items = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                int next = bind(ps, args);
                ps.setInt(next++, limit);
                ps.setInt(next, offset);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        items.add(new EventView(
                                rs.getLong("event_id"),
                                rs.getString("run_id"),
                                rs.getString("task_id"),
                                rs.getString("level"),
                                rs.getString("event_type"),
                                rs.getString("code"),
                                rs.getString("category"),
                                rs.getString("message"),
                                Jsons.toMap(rs.getString("payload_json")),
                                rs.getLong("created_at_ms")
                        ));
                    }
                }
            }
            return new Page<>(items, total, offset + items.size() < total);
        });
    }

    private static int bind(PreparedStatement ps, List<Object> args) throws SQLException {
        int i = 1;
        for (Object arg : args) {
            if (arg instanceof Long l) {
                ps.setLong(i++, l);
            } else {
                ps.setString(i++, String.valueOf(arg));
            }
        }
        return i;
    }

    public record EventRow(
            String runId,
            String taskId,
            EventLevel level,
            EventType type,
            String message,
            Map<String, Object> payload,
            long createdAtMs
    ) {
    }

    /**
     * Filters for {@link #listEvents}; null fields do not filter.
     */
    public record EventQuery(
            EventLevel level,
            EventType type,
            Long startedAfterMs,
            Long startedBeforeMs,
            int limit,
            int offset
    ) {
        public static EventQuery all() {
            return new EventQuery(null, null, null, null, 100, 0);
        }
    }
}
