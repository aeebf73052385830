package io.taskmaster.runtime;

import io.taskmaster.config.TaskMasterConfig;
import io.taskmaster.config.TaskMasterSettings;
import io.taskmaster.events.EventBus;
import io.taskmaster.events.EventDraft;
import io.taskmaster.identity.DedupEngine;
import io.taskmaster.identity.IdentityEngine;
import io.taskmaster.identity.RefreshEngine;
import io.taskmaster.model.EventType;
import io.taskmaster.model.EventView;
import io.taskmaster.model.FileRecord;
import io.taskmaster.model.FileStatus;
import io.taskmaster.model.JobType;
import io.taskmaster.model.Page;
import io.taskmaster.model.RunStatus;
import io.taskmaster.model.RunView;
import io.taskmaster.model.ScheduleView;
import io.taskmaster.model.TaskStatus;
import io.taskmaster.model.TaskView;
import io.taskmaster.model.WatchedDirectory;
import io.taskmaster.parser.ParserRegistry;
import io.taskmaster.scan.DiscoveryStage;
import io.taskmaster.storage.Database;
import io.taskmaster.storage.DuplicateStore;
import io.taskmaster.storage.EventStore;
import io.taskmaster.storage.FileIndexStore;
import io.taskmaster.storage.PersistenceException;
import io.taskmaster.storage.RunStore;
import io.taskmaster.storage.ScheduleStore;
import io.taskmaster.storage.WatchStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * The orchestrator. One instance owns every collaborator for a data root; nothing here is
 * process-global. Callers get synchronous acknowledgements and observe outcomes through
 * {@link #getRun} and {@link #listEvents}.
 */
public final class TaskMasterRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TaskMasterRuntime.class);
    private static final long WORKER_IDLE_SLEEP_MS = 200L;
    private static final long WORKER_ERROR_SLEEP_MS = 1_000L;

    private final TaskMasterConfig config;
    private final Database database;
    private final FileIndexStore fileIndexStore;
    private final DuplicateStore duplicateStore;
    private final RunStore runStore;
    private final EventStore eventStore;
    private final ScheduleStore scheduleStore;
    private final WatchStore watchStore;
    private final EventBus eventBus;
    private final ParserRegistry parsers;
    private final DedupEngine dedup;
    private final RunPlanner planner;
    private final TaskExecutor executor;
    private final LongSupplier clock;
    private final ConcurrentMap<String, AtomicBoolean> cancelFlags = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private volatile TaskMasterSettings settings;
    private volatile long settingsFileMtimeMs = Long.MIN_VALUE;
    private volatile long lastSettingsCheckMs;
    private ExecutorService workers;
    private ScheduledExecutorService scheduler;

    public TaskMasterRuntime(TaskMasterConfig config) {
        this(config, TaskMasterSettings.load(config.settingsFile()), ParserRegistry.withDefaults(), System::currentTimeMillis);
    }

    public TaskMasterRuntime(TaskMasterConfig config, TaskMasterSettings settings, ParserRegistry parsers,
                             LongSupplier clock) {
        this.config = config;
        this.settings = settings;
        this.parsers = parsers;
        this.clock = clock;
        this.database = new Database(config, settings);
        this.fileIndexStore = new FileIndexStore(database);
        this.duplicateStore = new DuplicateStore(database);
        this.runStore = new RunStore(database);
        this.eventStore = new EventStore(database);
        this.scheduleStore = new ScheduleStore(database);
        this.watchStore = new WatchStore(database);
        this.eventBus = new EventBus(eventStore, settings.eventQueueCapacity(), clock);
        IdentityEngine identity = new IdentityEngine(fileIndexStore, parsers, clock);
        this.dedup = new DedupEngine(duplicateStore, clock);
        this.planner = new RunPlanner(watchStore);
        this.executor = new TaskExecutor(
                new DiscoveryStage(clock),
                identity,
                new RefreshEngine(fileIndexStore, identity, clock),
                eventBus,
                clock
        );
        this.settingsFileMtimeMs = resolveFileMtimeMs(config.settingsFile());
    }

    public void init() {
        database.init();
    }

    /**
     * Fails tasks left running by a process that died, then re-evaluates their runs. Only the
     * process that owns the workers of a namespace may call this; {@link #start()} does.
     */
    public int recoverOrphanedTasks() {
        List<RunStore.OrphanedTask> orphans = runStore.failOrphanedRunning(clock.getAsLong());
        for (RunStore.OrphanedTask orphan : orphans) {
            log.warn("Failed orphaned task {} of run {}", orphan.taskId(), orphan.runId());
            eventBus.emit(EventDraft.warning(orphan.runId(), orphan.taskId(), EventType.TASK_FAILED,
                    "task orphaned by restart", Map.of("reason", "orphaned")));
            afterTaskFailed(orphan.runId(), orphan.taskId());
        }
        return orphans.size();
    }

    /**
     * Starts the event writer, recovers orphaned tasks, then starts the worker pool and the
     * scheduler loop.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        stopping.set(false);
        eventBus.start();
        recoverOrphanedTasks();
        TaskMasterSettings current = settings;
        int threads = Math.max(1, current.workerThreads());
        workers = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r);
            t.setName("taskmaster-worker-" + t.getId());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < threads; i++) {
            String workerId = config.namespace() + "-worker-" + (i + 1);
            workers.submit(() -> workerLoop(workerId));
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "taskmaster-scheduler");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::schedulerTick, current.schedulerIntervalMs(),
                current.schedulerIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("TaskMaster started: namespace={} workers={} schedulerIntervalMs={}",
                config.namespace(), threads, current.schedulerIntervalMs());
    }

    @Override
    public void close() {
        stopping.set(true);
        if (started.compareAndSet(true, false)) {
            scheduler.shutdownNow();
            workers.shutdown();
            try {
                if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                    log.warn("Workers did not stop within 30s, interrupting");
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workers.shutdownNow();
            }
        }
        eventBus.close();
    }

    public SubmitOutcome submitRun(String jobTypeRaw, Map<String, Object> params) {
        return submitRun(jobTypeRaw, params, "api");
    }

    /**
     * Creates a queued run with its task set and returns immediately.
     *
     * @throws IllegalArgumentException for an unknown job type or invalid parameters
     * @throws IllegalStateException    when the queue is full
     */
    public SubmitOutcome submitRun(String jobTypeRaw, Map<String, Object> params, String source) {
        JobType jobType = JobType.parse(jobTypeRaw);
        enforceBackpressure();
        long now = clock.getAsLong();
        RunStore.NewRun run = planner.plan(jobType, params, source, settings.taskMaxRetries(), now);
        runStore.createRun(run);
        emitRunQueued(run);
        List<String> taskIds = new ArrayList<>();
        for (RunStore.NewTask task : run.tasks()) {
            taskIds.add(task.taskId());
        }
        return new SubmitOutcome(run.runId(), run.jobType(), RunStatus.QUEUED.name(), taskIds);
    }

    public Optional<RunView> getRun(String runId) {
        return runStore.getRun(runId);
    }

    public Page<RunView> listRuns(RunStatus status, int limit, int offset) {
        return runStore.listRuns(status, limit, offset);
    }

    /**
     * Flushes pending events first, so everything emitted before the call is visible.
     */
    public Page<EventView> listEvents(String runId, EventStore.EventQuery query) {
        return eventBus.listEvents(runId, query == null ? EventStore.EventQuery.all() : query);
    }

    public CancelOutcome cancelRun(String runId) {
        RunStore.CancelResult result = runStore.requestCancel(runId, clock.getAsLong());
        if (!result.accepted()) {
            return new CancelOutcome(runId, false, result.message(), 0, 0);
        }
        AtomicBoolean localFlag = cancelFlags.get(runId);
        if (localFlag != null) {
            localFlag.set(true);
        }
        for (String taskId : result.cancelledTaskIds()) {
            eventBus.emit(EventDraft.info(runId, taskId, EventType.TASK_CANCELLED, "task cancelled before start",
                    Map.of("reason", "cancel_requested")));
        }
        finalizeRunIfDone(runId);
        return new CancelOutcome(runId, true, result.message(), result.cancelledTaskIds().size(), result.runningTasks());
    }

    public RetryOutcome retryTask(String runId, String taskId) {
        RunStore.RetryResult result = runStore.retryTask(runId, taskId, clock.getAsLong());
        if (result.accepted()) {
            eventBus.emit(EventDraft.info(runId, taskId, EventType.TASK_RETRY, "manual retry",
                    Map.of("retry_count", result.retryCount(), "trigger", "manual")));
        }
        return new RetryOutcome(runId, taskId, result.accepted(), result.message(), result.retryCount());
    }

    public List<ScheduleView> listSchedules() {
        return scheduleStore.list(false);
    }

    public ScheduleView upsertSchedule(String name, String jobTypeRaw, String specRaw, Map<String, Object> params,
                                       boolean active) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("schedule name must not be blank");
        }
        JobType jobType = JobType.parse(jobTypeRaw);
        ScheduleSpec spec = ScheduleSpec.parse(specRaw);
        Map<String, Object> safeParams = params == null ? Map.of() : params;
        RunPlanner.validate(jobType, safeParams);
        return scheduleStore.upsert(new ScheduleStore.ScheduleDraft(
                name.trim(), jobType.wireName(), spec.spec(), spec.intervalMinutes(), safeParams, active
        ), clock.getAsLong());
    }

    /**
     * Fires due schedules. Each due window is claimed by a conditional update in the same
     * transaction that creates its run; a window lost to a concurrent tick is counted, not raised.
     */
    public ScheduleTickOutcome runDueSchedules(int maxDue) {
        long now = clock.getAsLong();
        List<ScheduleView> due = scheduleStore.listDue(now, Math.max(1, maxDue));
        List<TriggeredSchedule> triggered = new ArrayList<>();
        List<SkippedSchedule> skipped = new ArrayList<>();
        int conflicts = 0;
        for (ScheduleView schedule : due) {
            if (runStore.countQueuedRuns() >= settings.maxQueuedRuns()) {
                skipped.add(new SkippedSchedule(schedule.name(), "backpressure_queue_full"));
                continue;
            }
            RunStore.NewRun run;
            try {
                run = planner.plan(JobType.parse(schedule.jobType()), schedule.params(),
                        "schedule:" + schedule.name(), settings.taskMaxRetries(), now);
            } catch (IllegalArgumentException e) {
                log.warn("Schedule {} cannot be planned: {}", schedule.name(), e.getMessage());
                skipped.add(new SkippedSchedule(schedule.name(), e.getMessage()));
                continue;
            }
            if (!scheduleStore.claimAndCreateRun(schedule, run, now)) {
                conflicts++;
                continue;
            }
            emitRunQueued(run);
            eventBus.emit(EventDraft.info(run.runId(), null, EventType.SCHEDULE_TRIGGERED, "schedule triggered",
                    Map.of("schedule", schedule.name(), "due_at_ms", schedule.nextRunAtMs())));
            triggered.add(new TriggeredSchedule(schedule.scheduleId(), schedule.name(), run.runId(), schedule.nextRunAtMs()));
        }
        return new ScheduleTickOutcome(due.size(), triggered, conflicts, skipped);
    }

    public WatchedDirectory addWatch(String path, boolean recursive, List<String> allowedExts) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("watch path must not be blank");
        }
        String normalized = Path.of(path).toAbsolutePath().normalize().toString();
        return watchStore.add(normalized, recursive, allowedExts == null ? List.of() : allowedExts, clock.getAsLong());
    }

    public List<WatchedDirectory> listWatches(boolean activeOnly) {
        return watchStore.list(activeOnly);
    }

    public boolean removeWatch(long watchId) {
        return watchStore.deactivate(watchId, clock.getAsLong());
    }

    public Page<FileRecord> listFiles(FileStatus status, int limit, int offset) {
        return fileIndexStore.listFiles(status, limit, offset);
    }

    public Optional<DuplicateStore.DuplicateSummary> duplicatesOf(long fileId) {
        return duplicateStore.duplicatesOf(fileId);
    }

    public List<Database.SchemaMigrationRow> schemaMigrations(int limit) {
        return database.listSchemaMigrations(limit);
    }

    public TaskMasterSettings currentSettings() {
        return settings;
    }

    public ParserRegistry parsers() {
        return parsers;
    }

    /**
     * Re-reads the settings file. Worker count, scheduler cadence and database retry settings
     * apply on the next start; everything else applies to the next task.
     */
    public SettingsReloadOutcome reloadSettings() {
        Path file = config.settingsFile();
        TaskMasterSettings previous = settings;
        TaskMasterSettings loaded = TaskMasterSettings.load(file);
        settings = loaded;
        settingsFileMtimeMs = resolveFileMtimeMs(file);
        boolean changed = !loaded.equals(previous);
        if (changed) {
            log.info("Settings reloaded from {}", file);
        }
        return new SettingsReloadOutcome(changed, Files.exists(file), file.toString(), loaded,
                changed ? "reloaded" : "unchanged_content");
    }

    public SettingsReloadOutcome maybeReloadSettings(long minIntervalMs) {
        long now = clock.getAsLong();
        Path file = config.settingsFile();
        if (now - lastSettingsCheckMs < Math.max(1_000L, minIntervalMs)) {
            return new SettingsReloadOutcome(false, settingsFileMtimeMs >= 0L, file.toString(), settings, "skip_interval");
        }
        lastSettingsCheckMs = now;
        if (resolveFileMtimeMs(file) == settingsFileMtimeMs) {
            return new SettingsReloadOutcome(false, settingsFileMtimeMs >= 0L, file.toString(), settings, "unchanged");
        }
        return reloadSettings();
    }

    public StatsOutcome stats() {
        Database.WriteStats writes = database.writeStats();
        FileIndexStore.WriteCounters fileWrites = fileIndexStore.writeCounters();
        return new StatsOutcome(
                runStore.runStatusCounts(),
                writes.committedWrites(),
                writes.lockRetries(),
                writes.lockTimeouts(),
                fileWrites.fileRecordWrites(),
                fileWrites.manifestWrites(),
                eventBus.queued()
        );
    }

    /**
     * One claim/execute cycle on the calling thread.
     */
    public WorkerOutcome runWorkerOnce(String workerId) {
        long now = clock.getAsLong();
        Optional<RunStore.TaskClaim> maybe = runStore.claimNextTask(workerId, now);
        if (maybe.isEmpty()) {
            return new WorkerOutcome(false, null, null, null, "no_due_tasks");
        }
        RunStore.TaskClaim claim = maybe.get();
        String runId = claim.runId();
        String taskId = claim.taskId();
        if (claim.runStarted()) {
            eventBus.emit(EventDraft.info(runId, null, EventType.RUN_STARTED, "run started",
                    Map.of("job_type", claim.jobType())));
        }
        eventBus.emit(EventDraft.info(runId, taskId, EventType.TASK_STARTED, "task started",
                Map.of("name", claim.name(), "attempt", claim.attempt(), "worker_id", workerId)));

        TaskMasterSettings current = settings;
        AtomicBoolean flag = cancelFlags.computeIfAbsent(runId, k -> new AtomicBoolean());
        CancellationToken token = new CancellationToken(runId, flag, runStore, current.cancelCheckIntervalMs(),
                clock, TaskExecutor.deadlineFor(claim.params(), now));

        TaskExecutor.TaskResult result;
        try {
            result = executor.execute(claim, token, current);
        } catch (PersistenceException e) {
            log.warn("Task {} failed on persistence ({}): {}", taskId, e.kind(), e.getMessage());
            if (e.kind() == PersistenceException.Kind.LOCK_TIMEOUT) {
                eventBus.emit(EventDraft.error(runId, taskId, EventType.PERSISTENCE_LOCK_TIMEOUT, "database lock timeout",
                        Map.of("operation", e.operation(), "attempts", e.attempts())));
            }
            result = new TaskExecutor.TaskResult(TaskStatus.FAILED, e.getMessage(), e.kind().name().toLowerCase(Locale.ROOT), Map.of());
        } catch (RuntimeException e) {
            log.error("Task {} failed", taskId, e);
            result = new TaskExecutor.TaskResult(TaskStatus.FAILED, e.getClass().getSimpleName() + ": " + e.getMessage(),
                    "exception", Map.of());
        }

        boolean finished = runStore.finishTask(taskId, claim.attempt(), result.status(), result.error(), result.reason(),
                result.metrics(), clock.getAsLong());
        if (!finished) {
            log.warn("Task {} was no longer running when its attempt finished", taskId);
        }
        if (result.status() == TaskStatus.CANCELLED) {
            cancelFlags.remove(runId, flag);
        }
        emitTaskOutcome(runId, taskId, result);
        if (result.status() == TaskStatus.FAILED) {
            afterTaskFailed(runId, taskId);
        } else {
            finalizeRunIfDone(runId);
        }
        return new WorkerOutcome(true, runId, taskId, result.status().name(), result.reason());
    }

    /**
     * Drives workers on the calling thread until the run is terminal or nothing is runnable.
     */
    public RunView runToCompletion(String runId, String workerId, long timeoutMs) {
        long deadline = clock.getAsLong() + Math.max(0L, timeoutMs);
        while (true) {
            RunView run = runStore.getRun(runId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown run: " + runId));
            if (RunStatus.fromDb(run.status()).terminal() || clock.getAsLong() >= deadline) {
                eventBus.flush();
                return run;
            }
            WorkerOutcome outcome = runWorkerOnce(workerId);
            if (!outcome.claimed()) {
                if (!hasWaitingRetry(run)) {
                    eventBus.flush();
                    return runStore.getRun(runId).orElse(run);
                }
                sleepQuietly(WORKER_IDLE_SLEEP_MS);
            }
        }
    }

    private boolean hasWaitingRetry(RunView run) {
        return run.tasks().stream().anyMatch(t -> TaskStatus.PENDING.name().equals(t.status()));
    }

    private void afterTaskFailed(String runId, String taskId) {
        TaskMasterSettings current = settings;
        if (current.autoRetryFailedTasks()) {
            Optional<TaskView> task = runStore.getTask(taskId);
            if (task.isPresent() && task.get().retryCount() < task.get().maxRetries()) {
                long delay = retryDelayMs(current.taskRetryDelayMs(), task.get().retryCount());
                long now = clock.getAsLong();
                if (runStore.scheduleRetry(taskId, now + delay, now)) {
                    eventBus.emit(EventDraft.info(runId, taskId, EventType.TASK_RETRY, "automatic retry scheduled",
                            Map.of("retry_count", task.get().retryCount() + 1, "delay_ms", delay, "trigger", "auto")));
                    return;
                }
            }
        }
        finalizeRunIfDone(runId);
    }

    int trackedCancelFlags() {
        return cancelFlags.size();
    }

    static long retryDelayMs(long baseDelayMs, int retryCount) {
        int shift = Math.min(Math.max(0, retryCount), 20);
        long delay = Math.max(0L, baseDelayMs) << shift;
        return delay < 0L ? Long.MAX_VALUE : delay;
    }

    /**
     * Derives and commits the terminal run status once every task is settled. Duplicate
     * groups are rebuilt before the terminal state commits.
     */
    void finalizeRunIfDone(String runId) {
        RunStore.RunSnapshot snapshot = runStore.snapshot(runId);
        if (snapshot.status().terminal()) {
            return;
        }
        Optional<RunStatus> derived = RunStore.deriveRunStatus(snapshot.tasks(), snapshot.cancelRequested());
        if (derived.isEmpty()) {
            return;
        }
        RunStatus status = derived.get();
        Map<String, Object> summary = summarize(snapshot.tasks());
        String error = null;
        try {
            DuplicateStore.RebuildResult rebuilt = dedup.rebuildDuplicateGroups();
            summary.put("duplicate_groups", rebuilt.groups());
            summary.put("duplicate_relationships", rebuilt.relationships());
            eventBus.emit(EventDraft.info(runId, null, EventType.DEDUP_REBUILT, "duplicate groups rebuilt",
                    Map.of("groups", rebuilt.groups(), "relationships", rebuilt.relationships())));
        } catch (PersistenceException e) {
            log.warn("Duplicate rebuild failed for run {}: {}", runId, e.getMessage());
            if (e.kind() == PersistenceException.Kind.LOCK_TIMEOUT) {
                eventBus.emit(EventDraft.error(runId, null, EventType.PERSISTENCE_LOCK_TIMEOUT, "database lock timeout",
                        Map.of("operation", e.operation(), "attempts", e.attempts())));
            }
            status = RunStatus.FAILED;
            error = "dedup_rebuild_failed: " + e.getMessage();
        }
        if (status == RunStatus.FAILED && error == null) {
            error = firstTaskError(runId);
        }
        if (!runStore.completeRun(runId, status, summary, error, clock.getAsLong())) {
            return;
        }
        cancelFlags.remove(runId);
        EventType type = switch (status) {
            case COMPLETED -> EventType.RUN_COMPLETED;
            case CANCELLED -> EventType.RUN_CANCELLED;
            default -> EventType.RUN_FAILED;
        };
        EventDraft draft = status == RunStatus.FAILED
                ? EventDraft.error(runId, null, type, "run failed", summary)
                : EventDraft.info(runId, null, type, "run " + status.name().toLowerCase(Locale.ROOT), summary);
        eventBus.emit(draft);
        log.info("Run {} finished with status {}", runId, status);
    }

    private String firstTaskError(String runId) {
        return runStore.getRun(runId)
                .flatMap(run -> run.tasks().stream()
                        .filter(t -> TaskStatus.FAILED.name().equals(t.status()))
                        .map(t -> t.error() == null ? t.reason() : t.error())
                        .findFirst())
                .orElse(null);
    }

    private static Map<String, Object> summarize(List<RunStore.TaskState> tasks) {
        Map<String, Object> summary = new LinkedHashMap<>();
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        Map<String, Long> totals = new LinkedHashMap<>();
        for (RunStore.TaskState task : tasks) {
            byStatus.merge(task.status().name(), 1, Integer::sum);
            for (Map.Entry<String, Object> e : task.metrics().entrySet()) {
                if (e.getValue() instanceof Number n && !(e.getValue() instanceof Double)) {
                    totals.merge(e.getKey(), n.longValue(), Long::sum);
                }
            }
        }
        summary.put("tasks", byStatus);
        summary.putAll(totals);
        return summary;
    }

    private void emitTaskOutcome(String runId, String taskId, TaskExecutor.TaskResult result) {
        Map<String, Object> payload = new LinkedHashMap<>(result.metrics());
        if (result.reason() != null) {
            payload.put("reason", result.reason());
        }
        switch (result.status()) {
            case SUCCEEDED -> eventBus.emit(EventDraft.info(runId, taskId, EventType.TASK_SUCCEEDED, "task succeeded", payload));
            case CANCELLED -> eventBus.emit(EventDraft.info(runId, taskId, EventType.TASK_CANCELLED, "task cancelled", payload));
            default -> {
                payload.put("error", String.valueOf(result.error()));
                eventBus.emit(EventDraft.error(runId, taskId, EventType.TASK_FAILED, "task failed", payload));
            }
        }
    }

    private void emitRunQueued(RunStore.NewRun run) {
        eventBus.emit(EventDraft.info(run.runId(), null, EventType.RUN_QUEUED, "run queued",
                Map.of("job_type", run.jobType(), "source", run.source(), "tasks", run.tasks().size())));
    }

    private void enforceBackpressure() {
        int queued = runStore.countQueuedRuns();
        int limit = settings.maxQueuedRuns();
        if (queued >= limit) {
            throw new IllegalStateException("backpressure_queue_full queued=" + queued + " limit=" + limit);
        }
    }

    private void workerLoop(String workerId) {
        log.info("Worker {} started", workerId);
        while (!stopping.get() && !Thread.currentThread().isInterrupted()) {
            try {
                WorkerOutcome outcome = runWorkerOnce(workerId);
                if (!outcome.claimed()) {
                    sleepQuietly(WORKER_IDLE_SLEEP_MS);
                }
            } catch (RuntimeException e) {
                log.error("Worker {} cycle failed", workerId, e);
                sleepQuietly(WORKER_ERROR_SLEEP_MS);
            }
        }
        log.info("Worker {} stopped", workerId);
    }

    private void schedulerTick() {
        try {
            maybeReloadSettings(settings.schedulerIntervalMs());
            ScheduleTickOutcome outcome = runDueSchedules(settings.maxDueSchedulesPerTick());
            if (!outcome.triggered().isEmpty() || !outcome.skipped().isEmpty()) {
                log.info("Scheduler tick: triggered={} conflicts={} skipped={}",
                        outcome.triggered().size(), outcome.conflicts(), outcome.skipped().size());
            }
        } catch (RuntimeException e) {
            log.error("Scheduler tick failed", e);
        }
    }

    private static void sleepQuietly(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static long resolveFileMtimeMs(Path path) {
        if (!Files.exists(path)) {
            return -1L;
        }
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings mtime: " + path, e);
        }
    }

    public record SubmitOutcome(String runId, String jobType, String status, List<String> taskIds) {
    }

    public record CancelOutcome(String runId, boolean accepted, String message, int cancelledPendingTasks,
                                int runningTasks) {
    }

    public record RetryOutcome(String runId, String taskId, boolean accepted, String message, int retryCount) {
    }

    public record WorkerOutcome(boolean claimed, String runId, String taskId, String taskStatus, String message) {
    }

    public record TriggeredSchedule(long scheduleId, String name, String runId, long dueAtMs) {
    }

    public record SkippedSchedule(String name, String reason) {
    }

    public record ScheduleTickOutcome(int due, List<TriggeredSchedule> triggered, int conflicts,
                                      List<SkippedSchedule> skipped) {
    }

    public record SettingsReloadOutcome(boolean changed, boolean fileExists, String path, TaskMasterSettings settings,
                                        String reason) {
    }

    public record StatsOutcome(
            Map<String, Integer> runsByStatus,
            long committedWrites,
            long lockRetries,
            long lockTimeouts,
            long fileRecordWrites,
            long manifestWrites,
            int queuedEvents
    ) {
    }
}
