package io.taskmaster.runtime;

import io.taskmaster.model.JobType;
import io.taskmaster.model.WatchedDirectory;
import io.taskmaster.scan.ScanParams;
import io.taskmaster.storage.RunStore;
import io.taskmaster.storage.WatchStore;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Expands a job request into its fixed task set.
 */
final class RunPlanner {
    static final String PARAM_ROOT = "root";
    static final String PARAM_ROOTS = "roots";
    static final String PARAM_MAX_RETRIES = "max_retries";
    static final String PARAM_STALE_AFTER_HOURS = "stale_after_hours";
    static final long DEFAULT_STALE_AFTER_HOURS = 24L;

    private final WatchStore watchStore;

    RunPlanner(WatchStore watchStore) {
        this.watchStore = watchStore;
    }

    RunStore.NewRun plan(JobType jobType, Map<String, Object> params, String source, int defaultMaxRetries, long nowMs) {
        Map<String, Object> runParams = params == null ? new LinkedHashMap<>() : new LinkedHashMap<>(params);
        int maxRetries = (int) Math.max(0L, ScanParams.longParam(runParams, PARAM_MAX_RETRIES, defaultMaxRetries));
        List<RunStore.NewTask> tasks = switch (jobType) {
            case INDEX -> indexTasks(runParams, maxRetries);
            case REFRESH -> List.of(refreshTask(runParams, maxRetries));
            case WATCH_REFRESH -> watchTasks(runParams, maxRetries);
        };
        return new RunStore.NewRun(
                "run_" + UUID.randomUUID(),
                jobType.wireName(),
                source == null || source.isBlank() ? "api" : source,
                runParams,
                tasks,
                nowMs
        );
    }

    /**
     * Checks parameters that can be validated without touching the database.
     */
    static void validate(JobType jobType, Map<String, Object> params) {
        if (jobType == JobType.INDEX && roots(params).isEmpty()) {
            throw new IllegalArgumentException("index job needs at least one root");
        }
    }

    private List<RunStore.NewTask> indexTasks(Map<String, Object> runParams, int maxRetries) {
        List<String> roots = roots(runParams);
        if (roots.isEmpty()) {
            throw new IllegalArgumentException("index job needs at least one root");
        }
        List<RunStore.NewTask> out = new ArrayList<>();
        for (String root : roots) {
            Map<String, Object> taskParams = new LinkedHashMap<>(runParams);
            taskParams.remove(PARAM_ROOTS);
            taskParams.put(PARAM_ROOT, root);
            out.add(new RunStore.NewTask("task_" + UUID.randomUUID(), "index:" + root, taskParams, maxRetries));
        }
        return out;
    }

    private static RunStore.NewTask refreshTask(Map<String, Object> runParams, int maxRetries) {
        Map<String, Object> taskParams = new LinkedHashMap<>();
        taskParams.put(PARAM_STALE_AFTER_HOURS,
                ScanParams.longParam(runParams, PARAM_STALE_AFTER_HOURS, DEFAULT_STALE_AFTER_HOURS));
        Object timeout = runParams.get(TaskExecutor.PARAM_TASK_TIMEOUT_SECONDS);
        if (timeout != null) {
            taskParams.put(TaskExecutor.PARAM_TASK_TIMEOUT_SECONDS, timeout);
        }
        return new RunStore.NewTask("task_" + UUID.randomUUID(), "refresh", taskParams, maxRetries);
    }

    private List<RunStore.NewTask> watchTasks(Map<String, Object> runParams, int maxRetries) {
        List<WatchedDirectory> watches = watchStore.list(true);
        if (watches.isEmpty()) {
            throw new IllegalArgumentException("no active watched directories");
        }
        List<RunStore.NewTask> out = new ArrayList<>();
        for (WatchedDirectory watch : watches) {
            Map<String, Object> taskParams = new LinkedHashMap<>(runParams);
            taskParams.remove(PARAM_ROOTS);
            taskParams.put(PARAM_ROOT, watch.path());
            taskParams.put("recursive", watch.recursive());
            if (!watch.allowedExts().isEmpty()) {
                taskParams.put("allowed_exts", watch.allowedExts());
            }
            taskParams.put("watch_id", watch.watchId());
            out.add(new RunStore.NewTask("task_" + UUID.randomUUID(), "watch:" + watch.path(), taskParams, maxRetries));
        }
        return out;
    }

    private static List<String> roots(Map<String, Object> params) {
        Set<String> out = new LinkedHashSet<>();
        for (String raw : ScanParams.stringList(params, PARAM_ROOTS)) {
            out.add(normalize(raw));
        }
        Object single = params == null ? null : params.get(PARAM_ROOT);
        if (single != null && !String.valueOf(single).isBlank()) {
            out.add(normalize(String.valueOf(single).trim()));
        }
        return new ArrayList<>(out);
    }

    private static String normalize(String raw) {
        return Path.of(raw).toAbsolutePath().normalize().toString();
    }
}
