package io.taskmaster.runtime;

import io.taskmaster.config.TaskMasterSettings;
import io.taskmaster.events.EventBus;
import io.taskmaster.events.EventDraft;
import io.taskmaster.identity.IdentityEngine;
import io.taskmaster.identity.ObserveOutcome;
import io.taskmaster.identity.RefreshEngine;
import io.taskmaster.model.EventType;
import io.taskmaster.model.FileStatus;
import io.taskmaster.model.JobType;
import io.taskmaster.model.TaskStatus;
import io.taskmaster.scan.DiscoveredPath;
import io.taskmaster.scan.DiscoveryError;
import io.taskmaster.scan.DiscoveryStage;
import io.taskmaster.scan.DiscoveryWalk;
import io.taskmaster.scan.ScanBudget;
import io.taskmaster.scan.ScanFilters;
import io.taskmaster.scan.ScanParams;
import io.taskmaster.storage.RunStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.AccessDeniedException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Runs one claimed task attempt: discovery, identity and parsers for index tasks, or the
 * stale-record refresh. Persistence failures propagate to the caller, which fails the task.
 */
final class TaskExecutor {
    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);
    static final String PARAM_TASK_TIMEOUT_SECONDS = "task_timeout_seconds";

    private final DiscoveryStage discovery;
    private final IdentityEngine identity;
    private final RefreshEngine refresh;
    private final EventBus events;
    private final LongSupplier clock;

    TaskExecutor(DiscoveryStage discovery, IdentityEngine identity, RefreshEngine refresh, EventBus events,
                 LongSupplier clock) {
        this.discovery = discovery;
        this.identity = identity;
        this.refresh = refresh;
        this.events = events;
        this.clock = clock;
    }

    static long deadlineFor(Map<String, Object> taskParams, long startedAtMs) {
        long seconds = ScanParams.longParam(taskParams, PARAM_TASK_TIMEOUT_SECONDS, 0L);
        return seconds > 0L ? startedAtMs + seconds * 1000L : 0L;
    }

    TaskResult execute(RunStore.TaskClaim claim, CancellationToken token, TaskMasterSettings settings) {
        JobType jobType = JobType.parse(claim.jobType());
        if (jobType == JobType.REFRESH) {
            return executeRefresh(claim, token);
        }
        return executeIndex(claim, token, settings);
    }

    private TaskResult executeIndex(RunStore.TaskClaim claim, CancellationToken token, TaskMasterSettings settings) {
        Map<String, Object> params = claim.params();
        Object rawRoot = params.get(RunPlanner.PARAM_ROOT);
        if (rawRoot == null || String.valueOf(rawRoot).isBlank()) {
            throw new IllegalArgumentException("index task has no root");
        }
        Path root = Path.of(String.valueOf(rawRoot));
        ScanFilters filters = ScanFilters.fromParams(params);
        ScanBudget budget = ScanBudget.fromParams(params, settings.defaultMaxFiles());
        TaskMetrics metrics = new TaskMetrics();
        String runId = claim.runId();
        String taskId = claim.taskId();

        DiscoveryWalk walk = discovery.discover(root, filters, budget,
                error -> onDiscoveryError(runId, taskId, error), token::shouldStop);
        if (walk.rootMissing()) {
            metrics.absorb(walk.stats(), 0L);
            events.emit(EventDraft.warning(runId, taskId, EventType.ROOT_MISSING,
                    "root_not_found_or_not_directory", Map.of("root", root.toString())));
            return new TaskResult(TaskStatus.SUCCEEDED, null, "root_missing", metrics.toMap());
        }

        Progress progress = new Progress(settings.progressEveryFiles(), settings.progressEveryMs(), clock.getAsLong());
        long hashPermissionErrors = 0L;
        boolean stoppedInLoop = false;
        while (walk.hasNext()) {
            DiscoveredPath path = walk.next();
            try {
                ObserveOutcome outcome = identity.observe(path, runId);
                count(metrics, outcome);
                if (outcome.action() == ObserveOutcome.Action.SKIPPED) {
                    walk.refundLast();
                }
                if (outcome.wrote() && outcome.status() == FileStatus.DAMAGED) {
                    events.emit(EventDraft.warning(runId, taskId, EventType.FILE_DAMAGED, "file marked damaged",
                            Map.of("path", path.path().toString(), "reason", String.valueOf(outcome.reason()))));
                }
                if (outcome.parserError() != null) {
                    events.emit(EventDraft.warning(runId, taskId, EventType.PARSER_FAILED, "parser failed",
                            Map.of("path", path.path().toString(),
                                    "parser", String.valueOf(outcome.parserId()),
                                    "error", outcome.parserError())));
                }
            } catch (AccessDeniedException e) {
                hashPermissionErrors++;
                events.emit(EventDraft.warning(runId, taskId, EventType.FILE_PERMISSION_DENIED, "file not readable",
                        Map.of("path", path.path().toString())));
            }
            metrics.processed++;
            if (progress.due(metrics.processed, clock.getAsLong())) {
                metrics.absorb(walk.stats(), hashPermissionErrors);
                events.emit(EventDraft.info(runId, taskId, EventType.TASK_PROGRESS, "progress", metrics.toMap()));
            }
            if (token.shouldStop()) {
                stoppedInLoop = true;
                break;
            }
        }
        metrics.absorb(walk.stats(), hashPermissionErrors);

        if (stoppedInLoop || walk.stopped()) {
            return new TaskResult(TaskStatus.CANCELLED, null, token.stopReason(), metrics.toMap());
        }
        if (walk.budgetExhausted()) {
            events.emit(EventDraft.warning(runId, taskId, EventType.TASK_BUDGET_EXHAUSTED,
                    "scan budget exhausted", metrics.toMap()));
            return new TaskResult(TaskStatus.SUCCEEDED, null, "budget_exhausted", metrics.toMap());
        }
        return new TaskResult(TaskStatus.SUCCEEDED, null, null, metrics.toMap());
    }

    private TaskResult executeRefresh(RunStore.TaskClaim claim, CancellationToken token) {
        long staleAfterHours = ScanParams.longParam(claim.params(), RunPlanner.PARAM_STALE_AFTER_HOURS,
                RunPlanner.DEFAULT_STALE_AFTER_HOURS);
        RefreshEngine.RefreshResult result = refresh.refresh(claim.runId(), staleAfterHours * 3_600_000L, token::shouldStop);
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("stale", result.stale());
        metrics.put("missing", result.missing());
        metrics.put("revalidated", result.revalidated());
        metrics.put("errors", result.errors());
        if (result.cancelled()) {
            return new TaskResult(TaskStatus.CANCELLED, null, token.stopReason(), metrics);
        }
        return new TaskResult(TaskStatus.SUCCEEDED, null, null, metrics);
    }

    private void onDiscoveryError(String runId, String taskId, DiscoveryError error) {
        switch (error.kind()) {
            case PERMISSION_DENIED -> events.emit(EventDraft.warning(runId, taskId, EventType.FILE_PERMISSION_DENIED,
                    "permission denied", Map.of("path", error.path().toString())));
            case SYMLINK_LOOP -> events.emit(EventDraft.warning(runId, taskId, EventType.FILE_SYMLINK_LOOP,
                    "symlink loop skipped", Map.of("path", error.path().toString(), "detail", error.message())));
            case IO_ERROR -> log.warn("Discovery I/O error run={} path={}: {}", runId, error.path(), error.message());
        }
    }

    private static void count(TaskMetrics metrics, ObserveOutcome outcome) {
        switch (outcome.action()) {
            case CREATED -> metrics.created++;
            case UPDATED -> metrics.updated++;
            case SKIPPED -> metrics.skipped++;
            case VANISHED -> metrics.vanished++;
        }
        if (outcome.wrote() && outcome.status() == FileStatus.DAMAGED) {
            metrics.damaged++;
        }
        if (outcome.parserError() != null) {
            metrics.parserFailures++;
        }
    }

    record TaskResult(TaskStatus status, String error, String reason, Map<String, Object> metrics) {
    }

    /**
     * Progress cadence: every K processed files or every T milliseconds, whichever comes first.
     */
    private static final class Progress {
        private final long everyFiles;
        private final long everyMs;
        private long lastFiles;
        private long lastAtMs;

        private Progress(long everyFiles, long everyMs, long nowMs) {
            this.everyFiles = Math.max(1L, everyFiles);
            this.everyMs = Math.max(1L, everyMs);
            this.lastAtMs = nowMs;
        }

        private boolean due(long processed, long nowMs) {
            if (processed - lastFiles >= everyFiles || nowMs - lastAtMs >= everyMs) {
                lastFiles = processed;
                lastAtMs = nowMs;
                return true;
            }
            return false;
        }
    }
}
