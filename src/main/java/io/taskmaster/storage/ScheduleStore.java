package io.taskmaster.storage;

import io.taskmaster.model.ScheduleView;
import io.taskmaster.util.Jsons;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recurring schedules. A due window is consumed by a conditional update on the exact
 * {@code next_run_at_ms} that was read, and the run is inserted in the same transaction,
 * so concurrent tickers cannot both fire it.
 */
public final class ScheduleStore {
    private static final String COLUMNS = """
            schedule_id,name,job_type,spec,interval_minutes,params_json,active,last_run_at_ms,next_run_at_ms,last_run_id,created_at_ms,updated_at_ms""";

    private final Database database;

    public ScheduleStore(Database database) {
        this.database = database;
    }

    /**
     * Creates or replaces the schedule with this name. The next due time is reset only when
     * the schedule is new, was inactive, or its interval changed.
     */
    public ScheduleView upsert(ScheduleDraft draft, long nowMs) {
        String find = "SELECT interval_minutes,active,next_run_at_ms FROM schedules WHERE name=?";
        String insert = """
                INSERT INTO schedules(name,job_type,spec,interval_minutes,params_json,active,next_run_at_ms,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?)
                """;
        String update = """
                UPDATE schedules SET job_type=?, spec=?, interval_minutes=?, params_json=?, active=?, next_run_at_ms=?, updated_at_ms=?
                WHERE name=?
                """;
        long firstDue = nowMs + draft.intervalMinutes() * 60_000L;
        database.write("upsert schedule " + draft.name(), c -> {
            Long existingNext = null;
            int existingInterval = -1;
            boolean existingActive = false;
            try (PreparedStatement ps = c.prepareStatement(find)) {
                ps.setString(1, draft.name());
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        existingInterval = rs.getInt("interval_minutes");
                        existingActive = rs.getInt("active") == 1;
                        existingNext = rs.getLong("next_run_at_ms");
                    }
                }
            }
            if (existingNext == null) {
                try (PreparedStatement ps = c.prepareStatement(insert)) {
                    ps.setString(1, draft.name());
                    ps.setString(2, draft.jobType());
                    ps.setString(3, draft.spec());
                    ps.setInt(4, draft.intervalMinutes());
                    ps.setString(5, Jsons.toCompactJson(draft.params()));
                    ps.setInt(6, draft.active() ? 1 : 0);
                    ps.setLong(7, firstDue);
                    ps.setLong(8, nowMs);
                    ps.setLong(9, nowMs);
                    ps.executeUpdate();
                }
                return null;
            }
            boolean resetDue = !existingActive || existingInterval != draft.intervalMinutes();
            try (PreparedStatement ps = c.prepareStatement(update)) {
                ps.setString(1, draft.jobType());
                ps.setString(2, draft.spec());
                ps.setInt(3, draft.intervalMinutes());
                ps.setString(4, Jsons.toCompactJson(draft.params()));
                ps.setInt(5, draft.active() ? 1 : 0);
                ps.setLong(6, resetDue ? firstDue : existingNext);
                ps.setLong(7, nowMs);
                ps.setString(8, draft.name());
                ps.executeUpdate();
            }
            return null;
        });
        return findByName(draft.name())
                .orElseThrow(() -> new IllegalStateException("schedule vanished after upsert: " + draft.name()));
    }

    public Optional<ScheduleView> findByName(String name) {
        String sql = "SELECT " + COLUMNS + " FROM schedules WHERE name=?";
        return database.read("read schedule", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, name);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.empty();
                }
            }
        });
    }

    public List<ScheduleView> list(boolean activeOnly) {
        String sql = "SELECT " + COLUMNS + " FROM schedules"
                + (activeOnly ? " WHERE active=1" : "")
                + " ORDER BY next_run_at_ms ASC, schedule_id ASC";
        return database.read("list schedules", c -> {
            List<ScheduleView> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql);
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        });
    }

    public List<ScheduleView> listDue(long nowMs, int maxDue) {
        String sql = "SELECT " + COLUMNS + " FROM schedules WHERE active=1 AND next_run_at_ms<=? ORDER BY next_run_at_ms ASC, schedule_id ASC LIMIT ?";
        return database.read("list due schedules", c -> {
            List<ScheduleView> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setLong(1, nowMs);
                ps.setInt(2, Math.max(1, maxDue));
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(map(rs));
                    }
                }
            }
            return out;
        });
    }

    /**
     * Consumes the due window the caller observed and inserts its run. Returns false when
     * another ticker already consumed that window; nothing is written in that case.
     */
    public boolean claimAndCreateRun(ScheduleView due, RunStore.NewRun run, long nowMs) {
        String claim = """
                UPDATE schedules SET last_run_at_ms=?, next_run_at_ms=?, last_run_id=?, updated_at_ms=?
                WHERE schedule_id=? AND next_run_at_ms=? AND active=1
                """;
        long nextDue = nowMs + due.intervalMinutes() * 60_000L;
        return database.write("claim schedule " + due.name(), database.lifecyclePolicy(), c -> {
            try (PreparedStatement ps = c.prepareStatement(claim)) {
                ps.setLong(1, nowMs);
                ps.setLong(2, nextDue);
                ps.setString(3, run.runId());
                ps.setLong(4, nowMs);
                ps.setLong(5, due.scheduleId());
                ps.setLong(6, due.nextRunAtMs());
                if (ps.executeUpdate() != 1) {
                    return false;
                }
            }
            RunStore.insertRun(c, run);
            return true;
        });
    }

    private static ScheduleView map(ResultSet rs) throws SQLException {
        long lastRun = rs.getLong("last_run_at_ms");
        Long lastRunAt = rs.wasNull() ? null : lastRun;
        return new ScheduleView(
                rs.getLong("schedule_id"),
                rs.getString("name"),
                rs.getString("job_type"),
                rs.getString("spec"),
                rs.getInt("interval_minutes"),
                Jsons.toMap(rs.getString("params_json")),
                rs.getInt("active") == 1,
                lastRunAt,
                rs.getLong("next_run_at_ms"),
                rs.getString("last_run_id"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    public record ScheduleDraft(
            String name,
            String jobType,
            String spec,
            int intervalMinutes,
            Map<String, Object> params,
            boolean active
    ) {
    }
}
