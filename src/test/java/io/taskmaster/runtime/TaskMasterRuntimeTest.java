package io.taskmaster.runtime;

import io.taskmaster.config.TaskMasterConfig;
import io.taskmaster.config.TaskMasterSettings;
import io.taskmaster.model.EventView;
import io.taskmaster.model.FileStatus;
import io.taskmaster.model.RunView;
import io.taskmaster.model.TaskView;
import io.taskmaster.parser.Parser;
import io.taskmaster.parser.ParserRegistry;
import io.taskmaster.parser.PlainTextParser;
import io.taskmaster.parser.ValidationResult;
import io.taskmaster.storage.Database;
import io.taskmaster.storage.EventStore;
import io.taskmaster.storage.RunStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import java.util.stream.Stream;

final class TaskMasterRuntimeTest {

    @Test
    void indexRunCompletesAndARescanWritesNothing() throws Exception {
        Path dataDir = Files.createTempDirectory("taskmaster-test-runtime-index-");
        Path docs = Files.createTempDirectory("taskmaster-test-runtime-index-docs-");
        try {
            write(docs.resolve("a.txt"), "same");
            write(docs.resolve("b.txt"), "same");
            write(docs.resolve("sub/c.md"), "# other");
            try (TaskMasterRuntime runtime = runtime(dataDir, settings(true, 0L, 200), ParserRegistry.withDefaults(),
                    System::currentTimeMillis)) {
                TaskMasterRuntime.SubmitOutcome submitted = runtime.submitRun("index", Map.of("roots", List.of(docs.toString())));
                Assertions.assertEquals("QUEUED", submitted.status());
                Assertions.assertEquals(1, submitted.taskIds().size());

                RunView run = runtime.runToCompletion(submitted.runId(), "test-worker", 60_000L);
                Assertions.assertEquals("COMPLETED", run.status());
                Assertions.assertEquals(3L, number(run.summary(), "created"));
                Assertions.assertEquals(1L, number(run.summary(), "duplicate_relationships"));
                Assertions.assertNotNull(run.completedAtMs());

                List<String> types = eventTypes(runtime, submitted.runId());
                Assertions.assertEquals("RUN_QUEUED", types.get(0));
                Assertions.assertEquals("RUN_COMPLETED", types.get(types.size() - 1));
                Assertions.assertTrue(types.indexOf("RUN_STARTED") < types.indexOf("TASK_STARTED"));
                Assertions.assertTrue(types.indexOf("TASK_SUCCEEDED") < types.indexOf("DEDUP_REBUILT"));

                long writesBefore = runtime.stats().fileRecordWrites();
                String second = runtime.submitRun("index", Map.of("root", docs.toString())).runId();
                RunView rescan = runtime.runToCompletion(second, "test-worker", 60_000L);
                Assertions.assertEquals("COMPLETED", rescan.status());
                Assertions.assertEquals(3L, number(rescan.summary(), "skipped_unchanged"));
                Assertions.assertEquals(0L, number(rescan.summary(), "created"));
                Assertions.assertEquals(writesBefore, runtime.stats().fileRecordWrites());
                Assertions.assertEquals(2, runtime.stats().runsByStatus().get("COMPLETED"));
                Assertions.assertEquals(3L, runtime.listFiles(FileStatus.ACTIVE, 10, 0).count());
            }
        } finally {
            deleteRecursively(dataDir);
            deleteRecursively(docs);
        }
    }

    @Test
    void cancelMidScanKeepsCommittedWorkAndTheNextRunResumes() throws Exception {
        Path dataDir = Files.createTempDirectory("taskmaster-test-runtime-cancel-");
        Path docs = Files.createTempDirectory("taskmaster-test-runtime-cancel-docs-");
        try {
            for (int i = 0; i < 1000; i++) {
                write(docs.resolve(String.format("f%04d.txt", i)), "file number " + i);
            }
            AtomicReference<TaskMasterRuntime> holder = new AtomicReference<>();
            AtomicReference<String> target = new AtomicReference<>();
            AtomicInteger extracts = new AtomicInteger();
            ParserRegistry parsers = ParserRegistry.withDefaults();
            parsers.registerFirst(new HookedTextParser(path -> {
                if (extracts.incrementAndGet() == 400) {
                    holder.get().cancelRun(target.get());
                }
            }));
            try (TaskMasterRuntime runtime = runtime(dataDir, settings(true, 0L, 200), parsers, System::currentTimeMillis)) {
                holder.set(runtime);
                String runId = runtime.submitRun("index", Map.of("roots", List.of(docs.toString()))).runId();
                target.set(runId);

                RunView cancelled = runtime.runToCompletion(runId, "test-worker", 120_000L);
                Assertions.assertEquals("CANCELLED", cancelled.status());
                Assertions.assertTrue(cancelled.cancelRequested());
                TaskView task = cancelled.tasks().get(0);
                Assertions.assertEquals("CANCELLED", task.status());
                Assertions.assertEquals("cancel_requested", task.reason());
                Assertions.assertEquals(400L, runtime.listFiles(null, 1, 0).count());
                Assertions.assertEquals(400L, runtime.stats().manifestWrites());
                Assertions.assertFalse(runtime.cancelRun(runId).accepted());
                Assertions.assertEquals(0, runtime.trackedCancelFlags());

                String resumed = runtime.submitRun("index", Map.of("roots", List.of(docs.toString()))).runId();
                RunView done = runtime.runToCompletion(resumed, "test-worker", 120_000L);
                Assertions.assertEquals("COMPLETED", done.status());
                Assertions.assertEquals(400L, number(done.summary(), "skipped_unchanged"));
                Assertions.assertEquals(600L, number(done.summary(), "created"));
                Assertions.assertEquals(1000L, runtime.listFiles(FileStatus.ACTIVE, 1, 0).count());
            }
        } finally {
            deleteRecursively(dataDir);
            deleteRecursively(docs);
        }
    }

    @Test
    void unreadableDirectoryIsCountedWithoutFailingTheRun() throws Exception {
        Path dataDir = Files.createTempDirectory("taskmaster-test-runtime-perm-");
        Path docs = Files.createTempDirectory("taskmaster-test-runtime-perm-docs-");
        Path locked = docs.resolve("locked");
        try {
            for (int i = 0; i < 10; i++) {
                write(docs.resolve("f" + i + ".txt"), "readable " + i);
            }
            write(locked.resolve("hidden.txt"), "hidden");
            try {
                Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));
            } catch (UnsupportedOperationException e) {
                Assumptions.assumeTrue(false, "POSIX permissions not supported here");
            }
            Assumptions.assumeFalse(Files.isReadable(locked), "running with privileges that bypass permissions");

            try (TaskMasterRuntime runtime = runtime(dataDir, settings(true, 0L, 200), ParserRegistry.withDefaults(),
                    System::currentTimeMillis)) {
                String runId = runtime.submitRun("index", Map.of("roots", List.of(docs.toString()))).runId();
                RunView run = runtime.runToCompletion(runId, "test-worker", 60_000L);

                Assertions.assertEquals("COMPLETED", run.status());
                Map<String, Object> metrics = run.tasks().get(0).metrics();
                Assertions.assertEquals(1L, number(metrics, "permission_errors"));
                Assertions.assertEquals(10L, number(metrics, "created"));
                Assertions.assertTrue(eventTypes(runtime, runId).contains("FILE_PERMISSION_DENIED"));
            }
        } finally {
            if (Files.exists(locked)) {
                Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
            }
            deleteRecursively(dataDir);
            deleteRecursively(docs);
        }
    }

    @Test
    void missingRootSucceedsWithAWarning() throws Exception {
        Path dataDir = Files.createTempDirectory("taskmaster-test-runtime-missing-");
        try (TaskMasterRuntime runtime = runtime(dataDir, settings(true, 0L, 200), ParserRegistry.withDefaults(),
                System::currentTimeMillis)) {
            String runId = runtime.submitRun("index", Map.of("root", dataDir.resolve("nowhere").toString())).runId();
            RunView run = runtime.runToCompletion(runId, "test-worker", 60_000L);
            Assertions.assertEquals("COMPLETED", run.status());
            Assertions.assertEquals("root_missing", run.tasks().get(0).reason());
            Assertions.assertTrue(eventTypes(runtime, runId).contains("ROOT_MISSING"));
        } finally {
            deleteRecursively(dataDir);
        }
    }

    @Test
    void taskTimeoutStopsTheScanAsCancelled() throws Exception {
        Path dataDir = Files.createTempDirectory("taskmaster-test-runtime-timeout-");
        Path docs = Files.createTempDirectory("taskmaster-test-runtime-timeout-docs-");
        AtomicLong clock = new AtomicLong(5_000L);
        ParserRegistry parsers = ParserRegistry.withDefaults();
        parsers.registerFirst(new HookedTextParser(path -> clock.addAndGet(2_000L)));
        try (TaskMasterRuntime runtime = runtime(dataDir, settings(true, 0L, 200), parsers, clock::get)) {
            for (int i = 0; i < 5; i++) {
                write(docs.resolve("f" + i + ".txt"), "file " + i);
            }
            String runId = runtime.submitRun("index",
                    Map.of("root", docs.toString(), "task_timeout_seconds", 1)).runId();
            RunView run = runtime.runToCompletion(runId, "test-worker", 60_000L);

            Assertions.assertEquals("CANCELLED", run.status());
            Assertions.assertEquals("timeout", run.tasks().get(0).reason());
            Assertions.assertEquals(1L, runtime.listFiles(null, 10, 0).count());
        } finally {
            deleteRecursively(dataDir);
            deleteRecursively(docs);
        }
    }

    @Test
    void parserFailureIsRecordedWithoutFailingTheTask() throws Exception {
        Path dataDir = Files.createTempDirectory("taskmaster-test-runtime-parser-");
        Path docs = Files.createTempDirectory("taskmaster-test-runtime-parser-docs-");
        try {
            write(docs.resolve("a.txt"), "alpha");
            write(docs.resolve("b.txt"), "beta");
            write(docs.resolve("c.txt"), "gamma");
            ParserRegistry parsers = ParserRegistry.withDefaults();
            parsers.registerFirst(new LookupFailingParser("b.txt"));
            try (TaskMasterRuntime runtime = runtime(dataDir, settings(true, 0L, 200), parsers, System::currentTimeMillis)) {
                String runId = runtime.submitRun("index", Map.of("root", docs.toString())).runId();
                RunView run = runtime.runToCompletion(runId, "test-worker", 60_000L);

                Assertions.assertEquals("COMPLETED", run.status());
                TaskView task = run.tasks().get(0);
                Assertions.assertEquals("SUCCEEDED", task.status());
                Assertions.assertEquals(3L, number(task.metrics(), "created"));
                Assertions.assertEquals(1L, number(task.metrics(), "parser_failures"));
                Assertions.assertEquals(3L, runtime.listFiles(null, 10, 0).count());

                List<EventView> failures = runtime.listEvents(runId, null).items().stream()
                        .filter(e -> "PARSER_FAILED".equals(e.type()))
                        .toList();
                Assertions.assertEquals(1, failures.size());
                Assertions.assertTrue(String.valueOf(failures.get(0).payload().get("path")).endsWith("b.txt"));
                Assertions.assertEquals("lookup-failing", failures.get(0).payload().get("parser"));
            }
        } finally {
            deleteRecursively(dataDir);
            deleteRecursively(docs);
        }
    }

    @Test
    void progressIsReportedEveryConfiguredNumberOfFiles() throws Exception {
        Path dataDir = Files.createTempDirectory("taskmaster-test-runtime-progress-");
        Path docs = Files.createTempDirectory("taskmaster-test-runtime-progress-docs-");
        try {
            for (int i = 0; i < 35; i++) {
                write(docs.resolve(String.format("f%02d.txt", i)), "file " + i);
            }
            TaskMasterSettings d = TaskMasterSettings.defaults();
            TaskMasterSettings everyTen = new TaskMasterSettings(d.dbBusyTimeoutMs(), d.dbWriteMaxAttempts(),
                    d.dbWriteBaseBackoffMs(), d.dbWriteMaxBackoffMs(), d.lifecycleWriteMaxAttempts(), d.taskMaxRetries(),
                    true, 0L, d.workerThreads(), d.schedulerIntervalMs(), d.maxDueSchedulesPerTick(), 200,
                    10, d.progressEveryMs(), d.cancelCheckIntervalMs(), d.eventQueueCapacity(), d.defaultMaxFiles());
            AtomicLong clock = new AtomicLong(1_000L);
            try (TaskMasterRuntime runtime = runtime(dataDir, everyTen, ParserRegistry.withDefaults(), clock::get)) {
                String runId = runtime.submitRun("index", Map.of("root", docs.toString())).runId();
                Assertions.assertEquals("COMPLETED", runtime.runToCompletion(runId, "test-worker", 60_000L).status());

                List<Long> processed = runtime.listEvents(runId, null).items().stream()
                        .filter(e -> "TASK_PROGRESS".equals(e.type()))
                        .map(e -> number(e.payload(), "processed"))
                        .toList();
                Assertions.assertEquals(List.of(10L, 20L, 30L), processed);
            }
        } finally {
            deleteRecursively(dataDir);
            deleteRecursively(docs);
        }
    }

    @Test
    void failedTaskHoldsTheRunOpenUntilAManualRetry() throws Exception {
        Path dataDir = Files.createTempDirectory("taskmaster-test-runtime-retry-");
        Path docs = Files.createTempDirectory("taskmaster-test-runtime-retry-docs-");
        try {
            write(docs.resolve("a.txt"), "alpha");
            try (TaskMasterRuntime runtime = runtime(dataDir, settings(false, 0L, 200), ParserRegistry.withDefaults(),
                    System::currentTimeMillis)) {
                rejectFileInserts(dataDir, true);
                TaskMasterRuntime.SubmitOutcome submitted = runtime.submitRun("index",
                        Map.of("roots", List.of(docs.toString()), "max_retries", 1));
                String runId = submitted.runId();
                String taskId = submitted.taskIds().get(0);

                RunView afterFailure = runtime.runToCompletion(runId, "test-worker", 60_000L);
                Assertions.assertEquals("RUNNING", afterFailure.status());
                Assertions.assertEquals("FAILED", afterFailure.tasks().get(0).status());
                Assertions.assertEquals("fatal", afterFailure.tasks().get(0).reason());
                Assertions.assertEquals(0L, runtime.listFiles(null, 10, 0).count());

                rejectFileInserts(dataDir, false);
                TaskMasterRuntime.RetryOutcome retried = runtime.retryTask(runId, taskId);
                Assertions.assertTrue(retried.accepted());
                Assertions.assertEquals(1, retried.retryCount());

                RunView done = runtime.runToCompletion(runId, "test-worker", 60_000L);
                Assertions.assertEquals("COMPLETED", done.status());
                Assertions.assertEquals(1, done.tasks().get(0).retryCount());
                Assertions.assertFalse(runtime.retryTask(runId, taskId).accepted());
                Assertions.assertFalse(runtime.retryTask(runId, "task_unknown").accepted());

                Map<String, Object> retryPayload = runtime.listEvents(runId, null).items().stream()
                        .filter(e -> "TASK_RETRY".equals(e.type()))
                        .findFirst()
                        .orElseThrow()
                        .payload();
                Assertions.assertEquals("manual", retryPayload.get("trigger"));
            }
        } finally {
            deleteRecursively(dataDir);
            deleteRecursively(docs);
        }
    }

    @Test
    void automaticRetriesStopWhenTheBudgetIsSpent() throws Exception {
        Path dataDir = Files.createTempDirectory("taskmaster-test-runtime-autoretry-");
        Path docs = Files.createTempDirectory("taskmaster-test-runtime-autoretry-docs-");
        try {
            write(docs.resolve("a.txt"), "alpha");
            try (TaskMasterRuntime runtime = runtime(dataDir, settings(true, 0L, 200), ParserRegistry.withDefaults(),
                    System::currentTimeMillis)) {
                rejectFileInserts(dataDir, true);
                String runId = runtime.submitRun("index", Map.of("roots", List.of(docs.toString()), "max_retries", 2)).runId();
                RunView run = runtime.runToCompletion(runId, "test-worker", 60_000L);

                Assertions.assertEquals("FAILED", run.status());
                Assertions.assertEquals(2, run.tasks().get(0).retryCount());
                Assertions.assertNotNull(run.error());
                List<String> types = eventTypes(runtime, runId);
                Assertions.assertEquals(2L, types.stream().filter("TASK_RETRY"::equals).count());
                Assertions.assertEquals(3L, types.stream().filter("TASK_FAILED"::equals).count());
                Assertions.assertEquals("RUN_FAILED", types.get(types.size() - 1));
            }
        } finally {
            deleteRecursively(dataDir);
            deleteRecursively(docs);
        }
    }

    @Test
    void retryDelayDoublesPerAttempt() {
        Assertions.assertEquals(100L, TaskMasterRuntime.retryDelayMs(100L, 0));
        Assertions.assertEquals(800L, TaskMasterRuntime.retryDelayMs(100L, 3));
        Assertions.assertEquals(0L, TaskMasterRuntime.retryDelayMs(0L, 5));
        Assertions.assertEquals(100L << 20, TaskMasterRuntime.retryDelayMs(100L, 40));
    }

    @Test
    void cancellingARunExecutingElsewhereLeavesNoLocalState() throws Exception {
        Path dataDir = Files.createTempDirectory("taskmaster-test-runtime-remote-cancel-");
        try (TaskMasterRuntime runtime = runtime(dataDir, settings(false, 0L, 200), ParserRegistry.withDefaults(),
                System::currentTimeMillis)) {
            String runId = runtime.submitRun("index", Map.of("root", dataDir.toString())).runId();
            RunStore otherProcess = new RunStore(new Database(TaskMasterConfig.fromRoot(dataDir.toString())));
            Assertions.assertTrue(otherProcess.claimNextTask("remote-worker", System.currentTimeMillis()).isPresent());

            TaskMasterRuntime.CancelOutcome outcome = runtime.cancelRun(runId);
            Assertions.assertTrue(outcome.accepted());
            Assertions.assertEquals(1, outcome.runningTasks());
            Assertions.assertEquals("RUNNING", runtime.getRun(runId).orElseThrow().status());
            Assertions.assertTrue(otherProcess.isCancelRequested(runId));
            Assertions.assertEquals(0, runtime.trackedCancelFlags());
        } finally {
            deleteRecursively(dataDir);
        }
    }

    @Test
    void orphanedRunningTasksAreFailedOnRecovery() throws Exception {
        Path dataDir = Files.createTempDirectory("taskmaster-test-runtime-orphan-");
        try (TaskMasterRuntime runtime = runtime(dataDir, settings(false, 0L, 200), ParserRegistry.withDefaults(),
                System::currentTimeMillis)) {
            String runId = runtime.submitRun("index", Map.of("root", dataDir.toString())).runId();
            RunStore deadProcess = new RunStore(new Database(TaskMasterConfig.fromRoot(dataDir.toString())));
            Assertions.assertTrue(deadProcess.claimNextTask("dead-worker", System.currentTimeMillis()).isPresent());

            Assertions.assertEquals(1, runtime.recoverOrphanedTasks());
            TaskView task = runtime.getRun(runId).orElseThrow().tasks().get(0);
            Assertions.assertEquals("FAILED", task.status());
            Assertions.assertEquals("orphaned", task.reason());
            Assertions.assertEquals(0, runtime.recoverOrphanedTasks());
        } finally {
            deleteRecursively(dataDir);
        }
    }

    @Test
    void backpressureRejectsSubmissionsOverTheQueueLimit() throws Exception {
        Path dataDir = Files.createTempDirectory("taskmaster-test-runtime-backpressure-");
        try (TaskMasterRuntime runtime = runtime(dataDir, settings(true, 0L, 2), ParserRegistry.withDefaults(),
                System::currentTimeMillis)) {
            runtime.submitRun("index", Map.of("root", dataDir.toString()));
            runtime.submitRun("refresh", Map.of());
            IllegalStateException e = Assertions.assertThrows(IllegalStateException.class,
                    () -> runtime.submitRun("index", Map.of("root", dataDir.toString())));
            Assertions.assertTrue(e.getMessage().startsWith("backpressure_queue_full"));
            Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.submitRun("compress", Map.of()));
            Assertions.assertEquals(2L, runtime.listRuns(null, 10, 0).count());
        } finally {
            deleteRecursively(dataDir);
        }
    }

    @Test
    void concurrentSchedulerTicksTriggerEachWindowOnce() throws Exception {
        Path dataDir = Files.createTempDirectory("taskmaster-test-runtime-schedule-");
        Path docs = Files.createTempDirectory("taskmaster-test-runtime-schedule-docs-");
        ExecutorService pool = Executors.newFixedThreadPool(2);
        AtomicLong clock = new AtomicLong(0L);
        try (TaskMasterRuntime first = runtime(dataDir, settings(true, 0L, 200), ParserRegistry.withDefaults(), clock::get);
             TaskMasterRuntime second = runtime(dataDir, settings(true, 0L, 200), ParserRegistry.withDefaults(), clock::get)) {
            write(docs.resolve("a.txt"), "alpha");
            first.upsertSchedule("every-minute", "index", "@every 1m", Map.of("roots", List.of(docs.toString())), true);
            Assertions.assertEquals(0, first.runDueSchedules(5).triggered().size());

            clock.set(60_000L);
            CountDownLatch go = new CountDownLatch(1);
            List<Future<TaskMasterRuntime.ScheduleTickOutcome>> ticks = new ArrayList<>();
            for (TaskMasterRuntime runtime : List.of(first, second)) {
                ticks.add(pool.submit(() -> {
                    go.await();
                    return runtime.runDueSchedules(5);
                }));
            }
            go.countDown();
            int triggered = 0;
            for (Future<TaskMasterRuntime.ScheduleTickOutcome> tick : ticks) {
                triggered += tick.get(60, TimeUnit.SECONDS).triggered().size();
            }
            Assertions.assertEquals(1, triggered);
            Assertions.assertEquals(1L, first.listRuns(null, 10, 0).count());

            RunView run = first.listRuns(null, 10, 0).items().get(0);
            Assertions.assertEquals("schedule:every-minute", run.source());
            Assertions.assertEquals(run.runId(), first.listSchedules().get(0).lastRunId());
            Assertions.assertEquals(120_000L, first.listSchedules().get(0).nextRunAtMs());
            Assertions.assertTrue(eventTypes(first, run.runId()).contains("SCHEDULE_TRIGGERED"));
            Assertions.assertEquals("COMPLETED", first.runToCompletion(run.runId(), "test-worker", 60_000L).status());

            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> first.upsertSchedule("bad", "index", "@every 1m", Map.of(), true));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> first.upsertSchedule("bad", "index", "sometimes", Map.of("root", docs.toString()), true));
        } finally {
            pool.shutdownNow();
            deleteRecursively(dataDir);
            deleteRecursively(docs);
        }
    }

    @Test
    void refreshJobMarksVanishedFilesMissing() throws Exception {
        Path dataDir = Files.createTempDirectory("taskmaster-test-runtime-refresh-");
        Path docs = Files.createTempDirectory("taskmaster-test-runtime-refresh-docs-");
        AtomicLong clock = new AtomicLong(1_000_000L);
        try (TaskMasterRuntime runtime = runtime(dataDir, settings(true, 0L, 200), ParserRegistry.withDefaults(), clock::get)) {
            write(docs.resolve("keep.txt"), "keep");
            Path drop = write(docs.resolve("drop.txt"), "drop");
            String index = runtime.submitRun("index", Map.of("root", docs.toString())).runId();
            Assertions.assertEquals("COMPLETED", runtime.runToCompletion(index, "test-worker", 60_000L).status());

            Files.delete(drop);
            clock.addAndGet(2 * 3_600_000L);
            String refresh = runtime.submitRun("refresh", Map.of("stale_after_hours", 1)).runId();
            RunView run = runtime.runToCompletion(refresh, "test-worker", 60_000L);

            Assertions.assertEquals("COMPLETED", run.status());
            Assertions.assertEquals(2L, number(run.summary(), "stale"));
            Assertions.assertEquals(1L, number(run.summary(), "missing"));
            Assertions.assertEquals(1L, number(run.summary(), "revalidated"));
            Assertions.assertEquals(1L, runtime.listFiles(FileStatus.MISSING, 10, 0).count());
        } finally {
            deleteRecursively(dataDir);
            deleteRecursively(docs);
        }
    }

    @Test
    void watchRefreshScansEveryActiveWatch() throws Exception {
        Path dataDir = Files.createTempDirectory("taskmaster-test-runtime-watch-");
        Path docs = Files.createTempDirectory("taskmaster-test-runtime-watch-docs-");
        try (TaskMasterRuntime runtime = runtime(dataDir, settings(true, 0L, 200), ParserRegistry.withDefaults(),
                System::currentTimeMillis)) {
            write(docs.resolve("a.txt"), "alpha");
            write(docs.resolve("b.md"), "# beta");
            Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.submitRun("watch_refresh", Map.of()));

            long watchId = runtime.addWatch(docs.toString(), true, List.of("txt")).watchId();
            Assertions.assertEquals(1, runtime.listWatches(true).size());
            String runId = runtime.submitRun("watch-refresh", Map.of()).runId();
            RunView run = runtime.runToCompletion(runId, "test-worker", 60_000L);
            Assertions.assertEquals("COMPLETED", run.status());
            Assertions.assertEquals(1L, runtime.listFiles(null, 10, 0).count());
            Assertions.assertEquals(watchId, number(run.tasks().get(0).params(), "watch_id"));

            Assertions.assertTrue(runtime.removeWatch(watchId));
            Assertions.assertTrue(runtime.listWatches(true).isEmpty());
            Assertions.assertEquals(1, runtime.listWatches(false).size());
        } finally {
            deleteRecursively(dataDir);
            deleteRecursively(docs);
        }
    }

    @Test
    void lockTimeoutFailsTheTaskAndIsReportedAsAnEvent() throws Exception {
        Path dataDir = Files.createTempDirectory("taskmaster-test-runtime-lock-");
        Path docs = Files.createTempDirectory("taskmaster-test-runtime-lock-docs-");
        TaskMasterConfig config = TaskMasterConfig.fromRoot(dataDir.toString());
        AtomicReference<Thread> releaser = new AtomicReference<>();
        ParserRegistry parsers = ParserRegistry.withDefaults();
        parsers.registerFirst(new HookedTextParser(path -> {
            if (releaser.get() != null) {
                return;
            }
            try {
                Connection holder = DriverManager.getConnection("jdbc:sqlite:" + config.dbFile());
                Statement st = holder.createStatement();
                st.execute("BEGIN IMMEDIATE");
                Thread t = new Thread(() -> {
                    try {
                        Thread.sleep(1_000L);
                        st.execute("ROLLBACK");
                        st.close();
                        holder.close();
                    } catch (InterruptedException | SQLException e) {
                        throw new IllegalStateException(e);
                    }
                });
                releaser.set(t);
                t.start();
            } catch (SQLException e) {
                throw new IllegalStateException(e);
            }
        }));
        TaskMasterSettings d = TaskMasterSettings.defaults();
        TaskMasterSettings contended = new TaskMasterSettings(50L, 2, 5L, 10L, 60, d.taskMaxRetries(), false, 0L, 1,
                d.schedulerIntervalMs(), d.maxDueSchedulesPerTick(), d.maxQueuedRuns(), d.progressEveryFiles(),
                d.progressEveryMs(), d.cancelCheckIntervalMs(), d.eventQueueCapacity(), d.defaultMaxFiles());
        try {
            write(docs.resolve("a.txt"), "alpha");
            try (TaskMasterRuntime runtime = runtime(dataDir, contended, parsers, System::currentTimeMillis)) {
                String runId = runtime.submitRun("index", Map.of("root", docs.toString())).runId();
                runtime.start();

                TaskView task = awaitTask(runtime, runId, "FAILED", 30_000L);
                Assertions.assertEquals("lock_timeout", task.reason());
                Assertions.assertEquals("RUNNING", runtime.getRun(runId).orElseThrow().status());

                EventView timeout = runtime.listEvents(runId, null).items().stream()
                        .filter(e -> "PERSISTENCE_LOCK_TIMEOUT".equals(e.type()))
                        .findFirst()
                        .orElseThrow();
                Assertions.assertEquals("TM_PERSISTENCE_LOCK_TIMEOUT", timeout.code());
                Assertions.assertEquals(2L, number(timeout.payload(), "attempts"));
                Assertions.assertTrue(runtime.stats().lockTimeouts() >= 1L);
            }
        } finally {
            Thread t = releaser.get();
            if (t != null) {
                t.join(10_000L);
            }
            deleteRecursively(dataDir);
            deleteRecursively(docs);
        }
    }

    @Test
    void settingsReloadPicksUpFileChanges() throws Exception {
        Path dataDir = Files.createTempDirectory("taskmaster-test-runtime-settings-");
        TaskMasterConfig config = TaskMasterConfig.fromRoot(dataDir.toString());
        try (TaskMasterRuntime runtime = runtime(dataDir, TaskMasterSettings.defaults(), ParserRegistry.withDefaults(),
                System::currentTimeMillis)) {
            TaskMasterRuntime.SettingsReloadOutcome unchanged = runtime.reloadSettings();
            Assertions.assertFalse(unchanged.fileExists());

            Files.writeString(config.settingsFile(), "{\"taskMaxRetries\":7,\"maxQueuedRuns\":9}", StandardCharsets.UTF_8);
            TaskMasterRuntime.SettingsReloadOutcome reloaded = runtime.reloadSettings();
            Assertions.assertTrue(reloaded.changed());
            Assertions.assertTrue(reloaded.fileExists());
            Assertions.assertEquals(7, runtime.currentSettings().taskMaxRetries());
            Assertions.assertEquals(9, runtime.currentSettings().maxQueuedRuns());

            String runId = runtime.submitRun("refresh", Map.of()).runId();
            Assertions.assertEquals(7, runtime.getRun(runId).orElseThrow().tasks().get(0).maxRetries());
            Assertions.assertEquals("unchanged", runtime.maybeReloadSettings(60_000L).reason());
            Assertions.assertEquals("skip_interval", runtime.maybeReloadSettings(60_000L).reason());
        } finally {
            deleteRecursively(dataDir);
        }
    }

    private static TaskView awaitTask(TaskMasterRuntime runtime, String runId, String status, long timeoutMs)
            throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline) {
            TaskView task = runtime.getRun(runId).orElseThrow().tasks().get(0);
            if (status.equals(task.status())) {
                return task;
            }
            Thread.sleep(50L);
        }
        throw new AssertionError("task of " + runId + " never reached " + status);
    }

    private static TaskMasterRuntime runtime(Path dataDir, TaskMasterSettings settings, ParserRegistry parsers,
                                             LongSupplier clock) {
        TaskMasterRuntime runtime = new TaskMasterRuntime(TaskMasterConfig.fromRoot(dataDir.toString()), settings, parsers, clock);
        runtime.init();
        return runtime;
    }

    private static TaskMasterSettings settings(boolean autoRetry, long retryDelayMs, int maxQueuedRuns) {
        TaskMasterSettings d = TaskMasterSettings.defaults();
        return new TaskMasterSettings(d.dbBusyTimeoutMs(), d.dbWriteMaxAttempts(), d.dbWriteBaseBackoffMs(),
                d.dbWriteMaxBackoffMs(), d.lifecycleWriteMaxAttempts(), d.taskMaxRetries(), autoRetry, retryDelayMs,
                d.workerThreads(), d.schedulerIntervalMs(), d.maxDueSchedulesPerTick(), maxQueuedRuns,
                d.progressEveryFiles(), d.progressEveryMs(), d.cancelCheckIntervalMs(), d.eventQueueCapacity(),
                d.defaultMaxFiles());
    }

    private static List<String> eventTypes(TaskMasterRuntime runtime, String runId) {
        return runtime.listEvents(runId, new EventStore.EventQuery(null, null, null, null, 1_000, 0)).items().stream()
                .map(EventView::type)
                .toList();
    }

    private static void rejectFileInserts(Path dataDir, boolean reject) throws SQLException {
        try (Connection c = DriverManager.getConnection("jdbc:sqlite:" + TaskMasterConfig.fromRoot(dataDir.toString()).dbFile());
             Statement st = c.createStatement()) {
            st.execute("DROP TRIGGER IF EXISTS reject_file_inserts");
            if (reject) {
                st.execute("""
                        CREATE TRIGGER reject_file_inserts BEFORE INSERT ON files_index
                        BEGIN SELECT RAISE(ABORT, 'files_index is read-only'); END""");
            }
        }
    }

    private static long number(Map<String, Object> map, String key) {
        Object value = map.get(key);
        Assertions.assertNotNull(value, "missing " + key + " in " + map);
        return ((Number) value).longValue();
    }

    private static Path write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    /**
     * Text parser that runs a hook before each extraction.
     */
    private static final class HookedTextParser implements Parser {
        private final PlainTextParser delegate = new PlainTextParser();
        private final Consumer<Path> hook;

        private HookedTextParser(Consumer<Path> hook) {
            this.hook = hook;
        }

        @Override
        public String id() {
            return "hooked-text";
        }

        @Override
        public boolean supports(Path path) {
            return path.getFileName().toString().endsWith(".txt");
        }

        @Override
        public ValidationResult quickValidate(Path path) throws IOException {
            return delegate.quickValidate(path);
        }

        @Override
        public Map<String, Object> extractIndexMetadata(Path path) throws IOException {
            hook.accept(path);
            return delegate.extractIndexMetadata(path);
        }
    }

    private static final class LookupFailingParser implements Parser {
        private final String failOn;

        private LookupFailingParser(String failOn) {
            this.failOn = failOn;
        }

        @Override
        public String id() {
            return "lookup-failing";
        }

        @Override
        public boolean supports(Path path) {
            if (path.getFileName().toString().equals(failOn)) {
                throw new IllegalStateException("parser lookup failed for " + path);
            }
            return false;
        }

        @Override
        public ValidationResult quickValidate(Path path) {
            return ValidationResult.ok();
        }

        @Override
        public Map<String, Object> extractIndexMetadata(Path path) {
            return Map.of();
        }
    }
}
