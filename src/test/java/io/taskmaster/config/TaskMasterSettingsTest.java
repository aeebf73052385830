package io.taskmaster.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Stream;

final class TaskMasterSettingsTest {

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("taskmaster-test-settings-defaults-");
        try {
            TaskMasterSettings settings = TaskMasterSettings.load(root.resolve("absent.json"), Map.of(), new Properties());
            Assertions.assertEquals(TaskMasterSettings.defaults(), settings);
            Assertions.assertEquals(5000L, settings.dbBusyTimeoutMs());
            Assertions.assertEquals(2, settings.taskMaxRetries());
            Assertions.assertTrue(settings.autoRetryFailedTasks());
            Assertions.assertEquals(5000, settings.defaultMaxFiles());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileValuesAreClampedToTheirMinimums() throws Exception {
        Path root = Files.createTempDirectory("taskmaster-test-settings-clamp-");
        try {
            Path file = root.resolve("taskmaster-settings.json");
            Files.writeString(file, """
                    {"dbWriteMaxAttempts":0,"lifecycleWriteMaxAttempts":1,"dbWriteBaseBackoffMs":100,
                     "dbWriteMaxBackoffMs":10,"schedulerIntervalMs":5,"eventQueueCapacity":2,
                     "taskMaxRetries":-3,"workerThreads":0,"autoRetryFailedTasks":false}
                    """, StandardCharsets.UTF_8);
            TaskMasterSettings settings = TaskMasterSettings.load(file, Map.of(), new Properties());

            Assertions.assertEquals(1, settings.dbWriteMaxAttempts());
            Assertions.assertEquals(1, settings.lifecycleWriteMaxAttempts());
            Assertions.assertEquals(100L, settings.dbWriteBaseBackoffMs());
            Assertions.assertEquals(100L, settings.dbWriteMaxBackoffMs());
            Assertions.assertEquals(100L, settings.schedulerIntervalMs());
            Assertions.assertEquals(16, settings.eventQueueCapacity());
            Assertions.assertEquals(0, settings.taskMaxRetries());
            Assertions.assertEquals(1, settings.workerThreads());
            Assertions.assertFalse(settings.autoRetryFailedTasks());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void lifecycleAttemptsNeverDropBelowOrdinaryWriteAttempts() {
        TaskMasterSettings settings = TaskMasterSettings.fromFile(new TaskMasterSettings.SettingsFile(
                null, 9, null, null, 3, null, null, null, null, null, null, null, null, null, null, null, null
        ), TaskMasterSettings.defaults());
        Assertions.assertEquals(9, settings.dbWriteMaxAttempts());
        Assertions.assertEquals(9, settings.lifecycleWriteMaxAttempts());
    }

    @Test
    void systemPropertiesOverrideEnvironmentWhichOverridesTheFile() throws Exception {
        Path root = Files.createTempDirectory("taskmaster-test-settings-override-");
        try {
            Path file = root.resolve("taskmaster-settings.json");
            Files.writeString(file, "{\"workerThreads\":3,\"maxQueuedRuns\":7,\"taskMaxRetries\":4}", StandardCharsets.UTF_8);
            Properties props = new Properties();
            props.setProperty("taskmaster.worker.threads", "6");
            Map<String, String> env = Map.of(
                    "TASKMASTER_WORKER_THREADS", "5",
                    "TASKMASTER_MAX_QUEUED_RUNS", "11"
            );
            TaskMasterSettings settings = TaskMasterSettings.load(file, env, props);

            Assertions.assertEquals(6, settings.workerThreads());
            Assertions.assertEquals(11, settings.maxQueuedRuns());
            Assertions.assertEquals(4, settings.taskMaxRetries());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedValuesAreRejected() throws Exception {
        Path root = Files.createTempDirectory("taskmaster-test-settings-bad-");
        try {
            Assertions.assertThrows(IllegalArgumentException.class, () -> TaskMasterSettings.load(
                    root.resolve("absent.json"), Map.of("TASKMASTER_WORKER_THREADS", "many"), new Properties()));
            Path file = root.resolve("broken.json");
            Files.writeString(file, "{not json", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalStateException.class, () -> TaskMasterSettings.load(file, Map.of(), new Properties()));
        } finally {
            deleteRecursively(root);
        }
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
}
