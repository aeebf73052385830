package io.taskmaster.cli;

import io.taskmaster.config.TaskMasterConfig;
import io.taskmaster.model.EventLevel;
import io.taskmaster.model.EventType;
import io.taskmaster.model.FileStatus;
import io.taskmaster.model.RunStatus;
import io.taskmaster.model.RunView;
import io.taskmaster.runtime.TaskMasterRuntime;
import io.taskmaster.storage.EventStore;
import io.taskmaster.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "taskmaster",
        mixinStandardHelpOptions = true,
        description = "TaskMaster job orchestration and file indexing CLI",
        subcommands = {
                TaskMasterCommand.InitCommand.class,
                TaskMasterCommand.SubmitCommand.class,
                TaskMasterCommand.RunCommand.class,
                TaskMasterCommand.RunsCommand.class,
                TaskMasterCommand.ShowRunCommand.class,
                TaskMasterCommand.EventsCommand.class,
                TaskMasterCommand.CancelCommand.class,
                TaskMasterCommand.RetryCommand.class,
                TaskMasterCommand.WorkerCommand.class,
                TaskMasterCommand.SchedulesCommand.class,
                TaskMasterCommand.ScheduleUpsertCommand.class,
                TaskMasterCommand.RunDueSchedulesCommand.class,
                TaskMasterCommand.WatchAddCommand.class,
                TaskMasterCommand.WatchesCommand.class,
                TaskMasterCommand.WatchRemoveCommand.class,
                TaskMasterCommand.FilesCommand.class,
                TaskMasterCommand.DuplicatesCommand.class,
                TaskMasterCommand.StatsCommand.class,
                TaskMasterCommand.SchemaMigrationsCommand.class,
                TaskMasterCommand.ReloadSettingsCommand.class
        }
)
public final class TaskMasterCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Runtime namespace (tenant scope)", defaultValue = "default")
    String namespace;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | submit | run | runs | run-show | events | cancel | retry | worker | schedules | schedule-upsert | run-due-schedules | watch-add | watches | watch-remove | files | duplicates | stats | schema-migrations | reload-settings");
    }

    TaskMasterConfig config() {
        return TaskMasterConfig.fromRoot(root, namespace);
    }

    TaskMasterRuntime runtime() {
        TaskMasterRuntime runtime = new TaskMasterRuntime(config());
        runtime.init();
        return runtime;
    }

    /**
     * Merges {@code --params-json} with repeated {@code --param key=value} pairs; pairs win.
     */
    static Map<String, Object> params(String paramsJson, Map<String, String> pairs) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (paramsJson != null && !paramsJson.isBlank()) {
            out.putAll(Jsons.toMap(paramsJson));
        }
        if (pairs != null) {
            out.putAll(pairs);
        }
        return out;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        TaskMasterCommand parent;

        @Override
        public Integer call() {
            try (TaskMasterRuntime runtime = parent.runtime()) {
                System.out.println("Initialized TaskMaster at: " + parent.config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "submit", description = "Queue a run and return its id immediately")
    static final class SubmitCommand implements Callable<Integer> {
        @ParentCommand
        TaskMasterCommand parent;

        @Option(names = {"--job"}, required = true, description = "Job type: index|refresh|watch_refresh")
        String job;

        @Option(names = {"--path"}, description = "Root directory to index (repeatable)")
        List<String> paths;

        @Option(names = {"--param"}, description = "Job parameter key=value (repeatable)")
        Map<String, String> pairs;

        @Option(names = {"--params-json"}, description = "Job parameters as a JSON object")
        String paramsJson;

        @Override
        public Integer call() {
            Map<String, Object> params = params(paramsJson, pairs);
            if (paths != null && !paths.isEmpty()) {
                params.put("roots", paths);
            }
            try (TaskMasterRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.submitRun(job, params, "cli")));
                return 0;
            } catch (IllegalArgumentException | IllegalStateException e) {
                System.out.println(Jsons.toJson(Map.of("error", e.getMessage())));
                return 1;
            }
        }
    }

    @Command(name = "run", description = "Queue a run and execute it in this process until it finishes")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        TaskMasterCommand parent;

        @Option(names = {"--job"}, required = true, description = "Job type: index|refresh|watch_refresh")
        String job;

        @Option(names = {"--path"}, description = "Root directory to index (repeatable)")
        List<String> paths;

        @Option(names = {"--param"}, description = "Job parameter key=value (repeatable)")
        Map<String, String> pairs;

        @Option(names = {"--params-json"}, description = "Job parameters as a JSON object")
        String paramsJson;

        @Option(names = {"--worker-id"}, defaultValue = "cli-run", description = "Worker identity")
        String workerId;

        @Option(names = {"--timeout-ms"}, defaultValue = "3600000", description = "Stop waiting after this long")
        long timeoutMs;

        @Override
        public Integer call() {
            Map<String, Object> params = params(paramsJson, pairs);
            if (paths != null && !paths.isEmpty()) {
                params.put("roots", paths);
            }
            try (TaskMasterRuntime runtime = parent.runtime()) {
                TaskMasterRuntime.SubmitOutcome submitted = runtime.submitRun(job, params, "cli");
                RunView run = runtime.runToCompletion(submitted.runId(), workerId, timeoutMs);
                System.out.println(Jsons.toJson(run));
                return RunStatus.COMPLETED.name().equals(run.status()) ? 0 : 1;
            } catch (IllegalArgumentException | IllegalStateException e) {
                System.out.println(Jsons.toJson(Map.of("error", e.getMessage())));
                return 1;
            }
        }
    }

    @Command(name = "runs", description = "List runs with optional status filter")
    static final class RunsCommand implements Callable<Integer> {
        @ParentCommand
        TaskMasterCommand parent;

        @Option(names = {"--status"}, description = "Filter by run status")
        String status;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Option(names = {"--offset"}, defaultValue = "0", description = "Pagination offset")
        int offset;

        @Override
        public Integer call() {
            try (TaskMasterRuntime runtime = parent.runtime()) {
                RunStatus filter = status == null || status.isBlank() ? null : RunStatus.fromDb(status);
                System.out.println(Jsons.toJson(runtime.listRuns(filter, limit, offset)));
            }
            return 0;
        }
    }

    @Command(name = "run-show", description = "Show one run with its tasks")
    static final class ShowRunCommand implements Callable<Integer> {
        @ParentCommand
        TaskMasterCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Override
        public Integer call() {
            try (TaskMasterRuntime runtime = parent.runtime()) {
                Optional<RunView> run = runtime.getRun(runId);
                if (run.isEmpty()) {
                    System.out.println("{\"error\":\"run not found\"}");
                    return 1;
                }
                System.out.println(Jsons.toJson(run.get()));
                return 0;
            }
        }
    }

    @Command(name = "events", description = "List events of a run")
    static final class EventsCommand implements Callable<Integer> {
        @ParentCommand
        TaskMasterCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Option(names = {"--level"}, description = "Filter by level: DEBUG|INFO|WARNING|ERROR")
        String level;

        @Option(names = {"--type"}, description = "Filter by event type name or TM_ code")
        String type;

        @Option(names = {"--after-ms"}, description = "Only events created at or after this epoch ms")
        Long afterMs;

        @Option(names = {"--before-ms"}, description = "Only events created at or before this epoch ms")
        Long beforeMs;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max number of rows")
        int limit;

        @Option(names = {"--offset"}, defaultValue = "0", description = "Pagination offset")
        int offset;

        @Override
        public Integer call() {
            EventStore.EventQuery query = new EventStore.EventQuery(
                    level == null ? null : EventLevel.parse(level),
                    type == null ? null : EventType.parse(type),
                    afterMs,
                    beforeMs,
                    limit,
                    offset
            );
            try (TaskMasterRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.listEvents(runId, query)));
            }
            return 0;
        }
    }

    @Command(name = "cancel", description = "Request cancellation of a run")
    static final class CancelCommand implements Callable<Integer> {
        @ParentCommand
        TaskMasterCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Override
        public Integer call() {
            try (TaskMasterRuntime runtime = parent.runtime()) {
                TaskMasterRuntime.CancelOutcome out = runtime.cancelRun(runId);
                System.out.println(Jsons.toJson(out));
                return out.accepted() ? 0 : 1;
            }
        }
    }

    @Command(name = "retry", description = "Retry a failed task of a live run")
    static final class RetryCommand implements Callable<Integer> {
        @ParentCommand
        TaskMasterCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Parameters(index = "1", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            try (TaskMasterRuntime runtime = parent.runtime()) {
                TaskMasterRuntime.RetryOutcome out = runtime.retryTask(runId, taskId);
                System.out.println(Jsons.toJson(out));
                return out.accepted() ? 0 : 1;
            }
        }
    }

    @Command(name = "worker", description = "Run the worker pool and scheduler, or a single poll")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        TaskMasterCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Run only one claim/execute cycle")
        boolean once;

        @Option(names = {"--worker-id"}, defaultValue = "worker-local", description = "Worker identity for --once")
        String workerId;

        @Override
        public Integer call() throws Exception {
            if (once) {
                try (TaskMasterRuntime runtime = parent.runtime()) {
                    TaskMasterRuntime.SettingsReloadOutcome reload = runtime.maybeReloadSettings(0L);
                    if (reload.changed()) {
                        System.out.println(Jsons.toJson(reload));
                    }
                    System.out.println(Jsons.toJson(runtime.runWorkerOnce(workerId)));
                }
                return 0;
            }
            TaskMasterRuntime runtime = parent.runtime();
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                runtime.close();
                stopped.countDown();
            }, "taskmaster-shutdown-hook"));
            runtime.start();
            stopped.await();
            return 0;
        }
    }

    @Command(name = "schedules", description = "List schedules")
    static final class SchedulesCommand implements Callable<Integer> {
        @ParentCommand
        TaskMasterCommand parent;

        @Override
        public Integer call() {
            try (TaskMasterRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.listSchedules()));
            }
            return 0;
        }
    }

    @Command(name = "schedule-upsert", description = "Create or update a named schedule")
    static final class ScheduleUpsertCommand implements Callable<Integer> {
        @ParentCommand
        TaskMasterCommand parent;

        @Option(names = {"--name"}, required = true, description = "Unique schedule name")
        String name;

        @Option(names = {"--job"}, required = true, description = "Job type: index|refresh|watch_refresh")
        String job;

        @Option(names = {"--spec"}, required = true, description = "@hourly | @daily | @every <n>m|h|d | <minutes>")
        String spec;

        @Option(names = {"--path"}, description = "Root directory to index (repeatable)")
        List<String> paths;

        @Option(names = {"--param"}, description = "Job parameter key=value (repeatable)")
        Map<String, String> pairs;

        @Option(names = {"--params-json"}, description = "Job parameters as a JSON object")
        String paramsJson;

        @Option(names = {"--active"}, defaultValue = "true", arity = "1", description = "Whether the schedule fires")
        boolean active;

        @Override
        public Integer call() {
            Map<String, Object> params = params(paramsJson, pairs);
            if (paths != null && !paths.isEmpty()) {
                params.put("roots", paths);
            }
            try (TaskMasterRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.upsertSchedule(name, job, spec, params, active)));
                return 0;
            } catch (IllegalArgumentException e) {
                System.out.println(Jsons.toJson(Map.of("error", e.getMessage())));
                return 1;
            }
        }
    }

    @Command(name = "run-due-schedules", description = "Fire schedules whose next run time has passed")
    static final class RunDueSchedulesCommand implements Callable<Integer> {
        @ParentCommand
        TaskMasterCommand parent;

        @Option(names = {"--max-due"}, defaultValue = "2", description = "Max schedules to fire in this tick")
        int maxDue;

        @Override
        public Integer call() {
            try (TaskMasterRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.runDueSchedules(maxDue)));
            }
            return 0;
        }
    }

    @Command(name = "watch-add", description = "Register a watched directory")
    static final class WatchAddCommand implements Callable<Integer> {
        @ParentCommand
        TaskMasterCommand parent;

        @Parameters(index = "0", description = "Directory path")
        String path;

        @Option(names = {"--recursive"}, defaultValue = "true", arity = "1", description = "Descend into subdirectories")
        boolean recursive;

        @Option(names = {"--ext"}, description = "Allowed extension, e.g. .pdf (repeatable)")
        List<String> exts;

        @Override
        public Integer call() {
            try (TaskMasterRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.addWatch(path, recursive, exts)));
            }
            return 0;
        }
    }

    @Command(name = "watches", description = "List watched directories")
    static final class WatchesCommand implements Callable<Integer> {
        @ParentCommand
        TaskMasterCommand parent;

        @Option(names = {"--active-only"}, defaultValue = "false", description = "Hide deactivated watches")
        boolean activeOnly;

        @Override
        public Integer call() {
            try (TaskMasterRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.listWatches(activeOnly)));
            }
            return 0;
        }
    }

    @Command(name = "watch-remove", description = "Deactivate a watched directory")
    static final class WatchRemoveCommand implements Callable<Integer> {
        @ParentCommand
        TaskMasterCommand parent;

        @Parameters(index = "0", description = "Watch id")
        long watchId;

        @Override
        public Integer call() {
            try (TaskMasterRuntime runtime = parent.runtime()) {
                boolean removed = runtime.removeWatch(watchId);
                System.out.println(Jsons.toJson(Map.of("watchId", watchId, "removed", removed)));
                return removed ? 0 : 1;
            }
        }
    }

    @Command(name = "files", description = "List indexed file records")
    static final class FilesCommand implements Callable<Integer> {
        @ParentCommand
        TaskMasterCommand parent;

        @Option(names = {"--status"}, description = "Filter by status: ACTIVE|MISSING|DAMAGED|STALE")
        String status;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Option(names = {"--offset"}, defaultValue = "0", description = "Pagination offset")
        int offset;

        @Override
        public Integer call() {
            try (TaskMasterRuntime runtime = parent.runtime()) {
                FileStatus filter = status == null || status.isBlank() ? null : FileStatus.fromDb(status);
                System.out.println(Jsons.toJson(runtime.listFiles(filter, limit, offset)));
            }
            return 0;
        }
    }

    @Command(name = "duplicates", description = "Show the exact-duplicate group of a file")
    static final class DuplicatesCommand implements Callable<Integer> {
        @ParentCommand
        TaskMasterCommand parent;

        @Parameters(index = "0", description = "File id")
        long fileId;

        @Override
        public Integer call() {
            try (TaskMasterRuntime runtime = parent.runtime()) {
                var summary = runtime.duplicatesOf(fileId);
                if (summary.isEmpty()) {
                    System.out.println("{\"error\":\"file not found\"}");
                    return 1;
                }
                System.out.println(Jsons.toJson(summary.get()));
                return 0;
            }
        }
    }

    @Command(name = "stats", description = "Show run counts and write counters")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        TaskMasterCommand parent;

        @Override
        public Integer call() {
            try (TaskMasterRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.stats()));
            }
            return 0;
        }
    }

    @Command(name = "schema-migrations", description = "Show applied schema migration versions")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        TaskMasterCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            try (TaskMasterRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.schemaMigrations(limit)));
            }
            return 0;
        }
    }

    @Command(name = "reload-settings", description = "Force reload taskmaster-settings.json and print effective values")
    static final class ReloadSettingsCommand implements Callable<Integer> {
        @ParentCommand
        TaskMasterCommand parent;

        @Override
        public Integer call() {
            try (TaskMasterRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.reloadSettings()));
            }
            return 0;
        }
    }
}
