package io.taskmaster.storage;

import io.taskmaster.model.Page;
import io.taskmaster.model.RunStatus;
import io.taskmaster.model.RunView;
import io.taskmaster.model.TaskStatus;
import io.taskmaster.model.TaskView;
import io.taskmaster.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Authoritative Run/Task state. Every transition is a conditional update on the expected
 * current status, so two workers can never move the same row.
 */
public final class RunStore {
    private static final String TASK_COLUMNS = """
            task_id,run_id,name,status,retry_count,max_retries,error,reason,params_json,metrics_json,
            next_attempt_at_ms,worker_id,created_at_ms,started_at_ms,finished_at_ms""";
    private static final String RUN_COLUMNS = """
            run_id,job_type,status,source,cancel_requested,error,params_json,summary_json,created_at_ms,started_at_ms,completed_at_ms""";

    private final Database database;

    public RunStore(Database database) {
        this.database = database;
    }

    public void createRun(NewRun run) {
        database.write("create run " + run.runId(), database.lifecyclePolicy(), c -> {
            insertRun(c, run);
            return null;
        });
    }

    /**
     * Inserts a run and its fixed task set on a caller-owned transaction.
     */
    static void insertRun(Connection c, NewRun run) throws SQLException {
        if (run.tasks().isEmpty()) {
            throw new IllegalArgumentException("a run needs at least one task");
        }
        try (PreparedStatement r = c.prepareStatement(
                "INSERT INTO runs(run_id,job_type,status,source,params_json,created_at_ms,updated_at_ms) VALUES(?,?,?,?,?,?,?)");
             PreparedStatement t = c.prepareStatement(
                     "INSERT INTO tasks(task_id,run_id,seq,name,status,params_json,max_retries,next_attempt_at_ms,created_at_ms,updated_at_ms) VALUES(?,?,?,?,?,?,?,?,?,?)")) {
            r.setString(1, run.runId());
            r.setString(2, run.jobType());
            r.setString(3, RunStatus.QUEUED.name());
            r.setString(4, run.source());
            r.setString(5, Jsons.toCompactJson(run.params()));
            r.setLong(6, run.nowMs());
            r.setLong(7, run.nowMs());
            r.executeUpdate();

            int seq = 0;
            for (NewTask task : run.tasks()) {
                t.setString(1, task.taskId());
                t.setString(2, run.runId());
                t.setInt(3, seq++);
                t.setString(4, task.name());
                t.setString(5, TaskStatus.PENDING.name());
                t.setString(6, Jsons.toCompactJson(task.params()));
                t.setInt(7, Math.max(0, task.maxRetries()));
                t.setLong(8, 0L);
                t.setLong(9, run.nowMs());
                t.setLong(10, run.nowMs());
                t.addBatch();
            }
            t.executeBatch();
        }
    }

    public int countQueuedRuns() {
        return database.read("count queued runs", c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT COUNT(1) FROM runs WHERE status=?")) {
                ps.setString(1, RunStatus.QUEUED.name());
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            }
        });
    }

    public Optional<RunView> getRun(String runId) {
        String runSql = "SELECT " + RUN_COLUMNS + " FROM runs WHERE run_id=?";
        String taskSql = "SELECT " + TASK_COLUMNS + " FROM tasks WHERE run_id=? ORDER BY seq ASC";
        return database.read("read run " + runId, c -> {
            RunView header;
            try (PreparedStatement ps = c.prepareStatement(runSql)) {
                ps.setString(1, runId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) return Optional.empty();
                    header = mapRun(rs, List.of());
                }
            }
            List<TaskView> tasks = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(taskSql)) {
                ps.setString(1, runId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        tasks.add(mapTask(rs));
                    }
                }
            }
            return Optional.of(new RunView(
                    header.runId(), header.jobType(), header.status(), header.source(), header.cancelRequested(),
                    header.error(), header.params(), header.summary(), header.createdAtMs(), header.startedAtMs(),
                    header.completedAtMs(), tasks
            ));
        });
    }

    public Optional<TaskView> getTask(String taskId) {
        String sql = "SELECT " + TASK_COLUMNS + " FROM tasks WHERE task_id=?";
        return database.read("read task " + taskId, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, taskId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapTask(rs)) : Optional.empty();
                }
            }
        });
    }

    public Page<RunView> listRuns(RunStatus status, int limit, int offset) {
        String where = status == null ? "" : " WHERE status=?";
        String countSql = "SELECT COUNT(1) FROM runs" + where;
        String sql = "SELECT " + RUN_COLUMNS + " FROM runs" + where + " ORDER BY created_at_ms DESC, run_id DESC LIMIT ? OFFSET ?";
        int safeLimit = Math.max(1, limit);
        int safeOffset = Math.max(0, offset);
        return database.read("list runs", c -> {
            long total;
            try (PreparedStatement ps = c.prepareStatement(countSql)) {
                if (status != null) {
                    ps.setString(1, status.name());
                }
                try (ResultSet rs = ps.executeQuery()) {
                    total = rs.next() ? rs.getLong(1) : 0L;
                }
            }
            List<RunView> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                int i = 1;
                if (status != null) {
                    ps.setString(i++, status.name());
                }
                ps.setInt(i++, safeLimit);
                ps.setInt(i, safeOffset);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(mapRun(rs, List.of()));
                    }
                }
            }
            return new Page<>(out, total, safeOffset + out.size() < total);
        });
    }

    /**
     * Claims the oldest due pending task of a live run and opens a new attempt row.
     */
    public Optional<TaskClaim> claimNextTask(String workerId, long nowMs) {
        String select = """
                SELECT t.task_id,t.run_id,t.name,t.params_json,t.retry_count,r.job_type,r.params_json AS run_params_json
                FROM tasks t JOIN runs r ON r.run_id=t.run_id
                WHERE t.status=? AND t.next_attempt_at_ms<=? AND r.status IN (?,?) AND r.cancel_requested=0
                ORDER BY r.created_at_ms ASC, t.seq ASC
                LIMIT 8
                """;
        String claim = "UPDATE tasks SET status=?, worker_id=?, started_at_ms=?, finished_at_ms=NULL, reason=NULL, updated_at_ms=? WHERE task_id=? AND status=?";
        String startRun = "UPDATE runs SET status=?, started_at_ms=?, updated_at_ms=? WHERE run_id=? AND status=?";
        String attempt = "INSERT OR REPLACE INTO task_attempts(task_id,attempt,worker_id,status,started_at_ms) VALUES(?,?,?,?,?)";
        return database.write("claim next task", database.lifecyclePolicy(), c -> {
            List<TaskClaim> candidates = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(select)) {
                ps.setString(1, TaskStatus.PENDING.name());
                ps.setLong(2, nowMs);
                ps.setString(3, RunStatus.QUEUED.name());
                ps.setString(4, RunStatus.RUNNING.name());
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(new TaskClaim(
                                rs.getString("task_id"),
                                rs.getString("run_id"),
                                rs.getString("job_type"),
                                rs.getString("name"),
                                Jsons.toMap(rs.getString("params_json")),
                                Jsons.toMap(rs.getString("run_params_json")),
                                rs.getInt("retry_count") + 1,
                                false
                        ));
                    }
                }
            }
            for (TaskClaim candidate : candidates) {
                int claimed;
                try (PreparedStatement up = c.prepareStatement(claim)) {
                    up.setString(1, TaskStatus.RUNNING.name());
                    up.setString(2, workerId);
                    up.setLong(3, nowMs);
                    up.setLong(4, nowMs);
                    up.setString(5, candidate.taskId());
                    up.setString(6, TaskStatus.PENDING.name());
                    claimed = up.executeUpdate();
                }
                if (claimed != 1) {
                    continue;
                }
                boolean runStarted;
                try (PreparedStatement up = c.prepareStatement(startRun)) {
                    up.setString(1, RunStatus.RUNNING.name());
                    up.setLong(2, nowMs);
                    up.setLong(3, nowMs);
                    up.setString(4, candidate.runId());
                    up.setString(5, RunStatus.QUEUED.name());
                    runStarted = up.executeUpdate() == 1;
                }
                try (PreparedStatement ins = c.prepareStatement(attempt)) {
                    ins.setString(1, candidate.taskId());
                    ins.setInt(2, candidate.attempt());
                    ins.setString(3, workerId);
                    ins.setString(4, TaskStatus.RUNNING.name());
                    ins.setLong(5, nowMs);
                    ins.executeUpdate();
                }
                return Optional.of(new TaskClaim(
                        candidate.taskId(), candidate.runId(), candidate.jobType(), candidate.name(),
                        candidate.params(), candidate.runParams(), candidate.attempt(), runStarted
                ));
            }
            return Optional.empty();
        });
    }

    /**
     * Moves a running task to a terminal status. Returns false when the task was not running.
     */
    public boolean finishTask(String taskId, int attempt, TaskStatus status, String error, String reason,
                              Map<String, Object> metrics, long nowMs) {
        if (!status.terminal()) {
            throw new IllegalArgumentException("finishTask needs a terminal status, got " + status);
        }
        String update = """
                UPDATE tasks SET status=?, error=?, reason=?, metrics_json=?, finished_at_ms=?, updated_at_ms=?
                WHERE task_id=? AND status=?
                """;
        String attemptSql = "UPDATE task_attempts SET status=?, error=?, finished_at_ms=? WHERE task_id=? AND attempt=?";
        return database.write("finish task " + taskId, database.lifecyclePolicy(), c -> {
            int rows;
            try (PreparedStatement ps = c.prepareStatement(update)) {
                ps.setString(1, status.name());
                setNullableString(ps, 2, error);
                setNullableString(ps, 3, reason);
                ps.setString(4, Jsons.toCompactJson(metrics));
                ps.setLong(5, nowMs);
                ps.setLong(6, nowMs);
                ps.setString(7, taskId);
                ps.setString(8, TaskStatus.RUNNING.name());
                rows = ps.executeUpdate();
            }
            if (rows == 1) {
                try (PreparedStatement ps = c.prepareStatement(attemptSql)) {
                    ps.setString(1, status.name());
                    setNullableString(ps, 2, error);
                    ps.setLong(3, nowMs);
                    ps.setString(4, taskId);
                    ps.setInt(5, attempt);
                    ps.executeUpdate();
                }
            }
            return rows == 1;
        });
    }

    /**
     * The orchestrator's own retry transition: failed back to pending with a delay,
     * only while retry budget remains and the run is still live.
     */
    public boolean scheduleRetry(String taskId, long nextAttemptAtMs, long nowMs) {
        String sql = """
                UPDATE tasks SET status=?, retry_count=retry_count+1, next_attempt_at_ms=?, worker_id=NULL, updated_at_ms=?
                WHERE task_id=? AND status=? AND retry_count<max_retries
                  AND run_id IN (SELECT run_id FROM runs WHERE status IN (?,?) AND cancel_requested=0)
                """;
        return database.write("schedule task retry " + taskId, database.lifecyclePolicy(), c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, TaskStatus.PENDING.name());
                ps.setLong(2, nextAttemptAtMs);
                ps.setLong(3, nowMs);
                ps.setString(4, taskId);
                ps.setString(5, TaskStatus.FAILED.name());
                ps.setString(6, RunStatus.QUEUED.name());
                ps.setString(7, RunStatus.RUNNING.name());
                return ps.executeUpdate() == 1;
            }
        });
    }

    public RetryResult retryTask(String runId, String taskId, long nowMs) {
        String read = """
                SELECT t.status,t.retry_count,t.max_retries,r.status AS run_status,r.cancel_requested
                FROM tasks t JOIN runs r ON r.run_id=t.run_id
                WHERE t.task_id=? AND t.run_id=?
                """;
        String update = """
                UPDATE tasks SET status=?, retry_count=retry_count+1, next_attempt_at_ms=?, worker_id=NULL, updated_at_ms=?
                WHERE task_id=? AND status=?
                """;
        return database.write("retry task " + taskId, database.lifecyclePolicy(), c -> {
            String status;
            int retryCount;
            int maxRetries;
            String runStatus;
            boolean cancelRequested;
            try (PreparedStatement ps = c.prepareStatement(read)) {
                ps.setString(1, taskId);
                ps.setString(2, runId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return new RetryResult(runId, taskId, false, "not_found", 0);
                    }
                    status = rs.getString("status");
                    retryCount = rs.getInt("retry_count");
                    maxRetries = rs.getInt("max_retries");
                    runStatus = rs.getString("run_status");
                    cancelRequested = rs.getInt("cancel_requested") == 1;
                }
            }
            if (RunStatus.fromDb(runStatus).terminal()) {
                return new RetryResult(runId, taskId, false, "run_terminal:" + runStatus, retryCount);
            }
            if (cancelRequested) {
                return new RetryResult(runId, taskId, false, "run_cancel_requested", retryCount);
            }
            if (!TaskStatus.FAILED.name().equals(status)) {
                return new RetryResult(runId, taskId, false, "not_failed:" + status, retryCount);
            }
            if (retryCount >= maxRetries) {
                return new RetryResult(runId, taskId, false, "retry_budget_exhausted", retryCount);
            }
            try (PreparedStatement ps = c.prepareStatement(update)) {
                ps.setString(1, TaskStatus.PENDING.name());
                ps.setLong(2, nowMs);
                ps.setLong(3, nowMs);
                ps.setString(4, taskId);
                ps.setString(5, TaskStatus.FAILED.name());
                if (ps.executeUpdate() != 1) {
                    return new RetryResult(runId, taskId, false, "concurrent_update", retryCount);
                }
            }
            return new RetryResult(runId, taskId, true, "retry_scheduled", retryCount + 1);
        });
    }

    /**
     * Flags the run for cooperative cancellation and cancels tasks that never started.
     */
    public CancelResult requestCancel(String runId, long nowMs) {
        String check = "SELECT status FROM runs WHERE run_id=?";
        String flag = "UPDATE runs SET cancel_requested=1, updated_at_ms=? WHERE run_id=?";
        String pending = "SELECT task_id FROM tasks WHERE run_id=? AND status=?";
        String cancelPending = """
                UPDATE tasks SET status=?, reason='cancel_requested', finished_at_ms=?, updated_at_ms=?
                WHERE task_id=? AND status=?
                """;
        String running = "SELECT COUNT(1) FROM tasks WHERE run_id=? AND status=?";
        return database.write("cancel run " + runId, database.lifecyclePolicy(), c -> {
            String status;
            try (PreparedStatement ps = c.prepareStatement(check)) {
                ps.setString(1, runId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return new CancelResult(runId, false, "not_found", List.of(), 0);
                    }
                    status = rs.getString("status");
                }
            }
            if (RunStatus.fromDb(status).terminal()) {
                return new CancelResult(runId, false, "terminal_state:" + status, List.of(), 0);
            }
            try (PreparedStatement ps = c.prepareStatement(flag)) {
                ps.setLong(1, nowMs);
                ps.setString(2, runId);
                ps.executeUpdate();
            }
            List<String> pendingIds = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(pending)) {
                ps.setString(1, runId);
                ps.setString(2, TaskStatus.PENDING.name());
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        pendingIds.add(rs.getString(1));
                    }
                }
            }
            List<String> cancelled = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(cancelPending)) {
                for (String taskId : pendingIds) {
                    ps.setString(1, TaskStatus.CANCELLED.name());
                    ps.setLong(2, nowMs);
                    ps.setLong(3, nowMs);
                    ps.setString(4, taskId);
                    ps.setString(5, TaskStatus.PENDING.name());
                    if (ps.executeUpdate() == 1) {
                        cancelled.add(taskId);
                    }
                }
            }
            int runningTasks;
            try (PreparedStatement ps = c.prepareStatement(running)) {
                ps.setString(1, runId);
                ps.setString(2, TaskStatus.RUNNING.name());
                try (ResultSet rs = ps.executeQuery()) {
                    runningTasks = rs.next() ? rs.getInt(1) : 0;
                }
            }
            return new CancelResult(runId, true, "cancel_requested", cancelled, runningTasks);
        });
    }

    public boolean isCancelRequested(String runId) {
        return database.read("read cancel flag", c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT cancel_requested FROM runs WHERE run_id=?")) {
                ps.setString(1, runId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() && rs.getInt(1) == 1;
                }
            }
        });
    }

    public RunSnapshot snapshot(String runId) {
        String runSql = "SELECT status,cancel_requested FROM runs WHERE run_id=?";
        String taskSql = "SELECT task_id,status,retry_count,max_retries,metrics_json FROM tasks WHERE run_id=? ORDER BY seq ASC";
        return database.read("read run snapshot", c -> {
            RunStatus status;
            boolean cancelRequested;
            try (PreparedStatement ps = c.prepareStatement(runSql)) {
                ps.setString(1, runId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        throw new IllegalArgumentException("Unknown run: " + runId);
                    }
                    status = RunStatus.fromDb(rs.getString("status"));
                    cancelRequested = rs.getInt("cancel_requested") == 1;
                }
            }
            List<TaskState> tasks = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(taskSql)) {
                ps.setString(1, runId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        tasks.add(new TaskState(
                                rs.getString("task_id"),
                                TaskStatus.fromDb(rs.getString("status")),
                                rs.getInt("retry_count"),
                                rs.getInt("max_retries"),
                                Jsons.toMap(rs.getString("metrics_json"))
                        ));
                    }
                }
            }
            return new RunSnapshot(runId, status, cancelRequested, tasks);
        });
    }

    /**
     * Run status derived from its tasks, or empty while the run must stay open: a task is
     * still pending or running, or a failed task can still be retried.
     */
    public static Optional<RunStatus> deriveRunStatus(List<TaskState> tasks, boolean cancelRequested) {
        boolean anyFailed = false;
        boolean anyCancelled = false;
        for (TaskState task : tasks) {
            switch (task.status()) {
                case PENDING, RUNNING -> {
                    return Optional.empty();
                }
                case FAILED -> {
                    if (!cancelRequested && task.retryCount() < task.maxRetries()) {
                        return Optional.empty();
                    }
                    anyFailed = true;
                }
                case CANCELLED -> anyCancelled = true;
                default -> {
                }
            }
        }
        if (anyFailed) {
            return Optional.of(RunStatus.FAILED);
        }
        if (anyCancelled) {
            return Optional.of(RunStatus.CANCELLED);
        }
        return Optional.of(RunStatus.COMPLETED);
    }

    /**
     * Terminal transition for a run; only the first caller wins.
     */
    public boolean completeRun(String runId, RunStatus status, Map<String, Object> summary, String error, long nowMs) {
        if (!status.terminal()) {
            throw new IllegalArgumentException("completeRun needs a terminal status, got " + status);
        }
        String sql = """
                UPDATE runs SET status=?, summary_json=?, error=?, completed_at_ms=?, updated_at_ms=?,
                    started_at_ms=COALESCE(started_at_ms, ?)
                WHERE run_id=? AND status IN (?,?)
                """;
        return database.write("complete run " + runId, database.lifecyclePolicy(), c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, status.name());
                ps.setString(2, Jsons.toCompactJson(summary));
                setNullableString(ps, 3, error);
                ps.setLong(4, nowMs);
                ps.setLong(5, nowMs);
                ps.setLong(6, nowMs);
                ps.setString(7, runId);
                ps.setString(8, RunStatus.QUEUED.name());
                ps.setString(9, RunStatus.RUNNING.name());
                return ps.executeUpdate() == 1;
            }
        });
    }

    /**
     * Fails tasks left running by a process that died. Only safe while no worker of this
     * data root is alive, so it is called from startup.
     */
    public List<OrphanedTask> failOrphanedRunning(long nowMs) {
        String select = "SELECT task_id,run_id FROM tasks WHERE status=?";
        String update = """
                UPDATE tasks SET status=?, error='orphaned_by_restart', reason='orphaned', finished_at_ms=?, updated_at_ms=?
                WHERE task_id=? AND status=?
                """;
        String attempts = "UPDATE task_attempts SET status=?, error='orphaned_by_restart', finished_at_ms=? WHERE task_id=? AND finished_at_ms IS NULL";
        return database.write("fail orphaned tasks", database.lifecyclePolicy(), c -> {
            List<OrphanedTask> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(select)) {
                ps.setString(1, TaskStatus.RUNNING.name());
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new OrphanedTask(rs.getString("task_id"), rs.getString("run_id")));
                    }
                }
            }
            try (PreparedStatement up = c.prepareStatement(update);
                 PreparedStatement at = c.prepareStatement(attempts)) {
                for (OrphanedTask row : out) {
                    up.setString(1, TaskStatus.FAILED.name());
                    up.setLong(2, nowMs);
                    up.setLong(3, nowMs);
                    up.setString(4, row.taskId());
                    up.setString(5, TaskStatus.RUNNING.name());
                    up.executeUpdate();
                    at.setString(1, TaskStatus.FAILED.name());
                    at.setLong(2, nowMs);
                    at.setString(3, row.taskId());
                    at.executeUpdate();
                }
            }
            return out;
        });
    }

    public List<AttemptRow> listAttempts(String taskId) {
        String sql = "SELECT task_id,attempt,worker_id,status,error,started_at_ms,finished_at_ms FROM task_attempts WHERE task_id=? ORDER BY attempt ASC";
        return database.read("list task attempts", c -> {
            List<AttemptRow> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, taskId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new AttemptRow(
                                rs.getString("task_id"),
                                rs.getInt("attempt"),
                                rs.getString("worker_id"),
                                rs.getString("status"),
                                rs.getString("error"),
                                rs.getLong("started_at_ms"),
                                nullableLong(rs, "finished_at_ms")
                        ));
                    }
                }
            }
            return out;
        });
    }

    public Map<String, Integer> runStatusCounts() {
        return database.read("count runs by status", c -> {
            Map<String, Integer> out = new LinkedHashMap<>();
            try (PreparedStatement ps = c.prepareStatement("SELECT status, COUNT(1) FROM runs GROUP BY status ORDER BY status");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(rs.getString(1), rs.getInt(2));
                }
            }
            return out;
        });
    }

    private static RunView mapRun(ResultSet rs, List<TaskView> tasks) throws SQLException {
        return new RunView(
                rs.getString("run_id"),
                rs.getString("job_type"),
                rs.getString("status"),
                rs.getString("source"),
                rs.getInt("cancel_requested") == 1,
                rs.getString("error"),
                Jsons.toMap(rs.getString("params_json")),
                Jsons.toMap(rs.getString("summary_json")),
                rs.getLong("created_at_ms"),
                nullableLong(rs, "started_at_ms"),
                nullableLong(rs, "completed_at_ms"),
                tasks
        );
    }

    private static TaskView mapTask(ResultSet rs) throws SQLException {
        return new TaskView(
                rs.getString("task_id"),
                rs.getString("run_id"),
                rs.getString("name"),
                rs.getString("status"),
                rs.getInt("retry_count"),
                rs.getInt("max_retries"),
                rs.getString("error"),
                rs.getString("reason"),
                Jsons.toMap(rs.getString("params_json")),
                Jsons.toMap(rs.getString("metrics_json")),
                rs.getLong("next_attempt_at_ms"),
                rs.getString("worker_id"),
                rs.getLong("created_at_ms"),
                nullableLong(rs, "started_at_ms"),
                nullableLong(rs, "finished_at_ms")
        );
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static void setNullableString(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }

    public record NewRun(String runId, String jobType, String source, Map<String, Object> params,
                         List<NewTask> tasks, long nowMs) {
    }

    public record NewTask(String taskId, String name, Map<String, Object> params, int maxRetries) {
    }

    public record TaskClaim(String taskId, String runId, String jobType, String name, Map<String, Object> params,
                            Map<String, Object> runParams, int attempt, boolean runStarted) {
    }

    public record TaskState(String taskId, TaskStatus status, int retryCount, int maxRetries,
                            Map<String, Object> metrics) {
    }

    public record RunSnapshot(String runId, RunStatus status, boolean cancelRequested, List<TaskState> tasks) {
    }

    public record RetryResult(String runId, String taskId, boolean accepted, String message, int retryCount) {
    }

    public record CancelResult(String runId, boolean accepted, String message, List<String> cancelledTaskIds,
                               int runningTasks) {
    }

    public record OrphanedTask(String taskId, String runId) {
    }

    public record AttemptRow(String taskId, int attempt, String workerId, String status, String error,
                             long startedAtMs, Long finishedAtMs) {
    }
}
