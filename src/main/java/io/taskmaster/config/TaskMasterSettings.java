package io.taskmaster.config;

import io.taskmaster.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Operational settings resolved from {@code taskmaster-settings.json}, then environment
 * variables, then JVM system properties. Every value is clamped to a sane minimum.
 */
public record TaskMasterSettings(
        long dbBusyTimeoutMs,
        int dbWriteMaxAttempts,
        long dbWriteBaseBackoffMs,
        long dbWriteMaxBackoffMs,
        int lifecycleWriteMaxAttempts,
        int taskMaxRetries,
        boolean autoRetryFailedTasks,
        long taskRetryDelayMs,
        int workerThreads,
        long schedulerIntervalMs,
        int maxDueSchedulesPerTick,
        int maxQueuedRuns,
        int progressEveryFiles,
        long progressEveryMs,
        long cancelCheckIntervalMs,
        int eventQueueCapacity,
        int defaultMaxFiles
) {
    public static TaskMasterSettings defaults() {
        return new TaskMasterSettings(
                TaskMasterConfig.DEFAULT_DB_BUSY_TIMEOUT_MS,
                TaskMasterConfig.DEFAULT_DB_WRITE_MAX_ATTEMPTS,
                TaskMasterConfig.DEFAULT_DB_WRITE_BASE_BACKOFF_MS,
                TaskMasterConfig.DEFAULT_DB_WRITE_MAX_BACKOFF_MS,
                TaskMasterConfig.DEFAULT_LIFECYCLE_WRITE_MAX_ATTEMPTS,
                TaskMasterConfig.DEFAULT_TASK_MAX_RETRIES,
                true,
                TaskMasterConfig.DEFAULT_TASK_RETRY_DELAY_MS,
                TaskMasterConfig.DEFAULT_WORKER_THREADS,
                TaskMasterConfig.DEFAULT_SCHEDULER_INTERVAL_MS,
                TaskMasterConfig.DEFAULT_MAX_DUE_SCHEDULES_PER_TICK,
                TaskMasterConfig.DEFAULT_MAX_QUEUED_RUNS,
                TaskMasterConfig.DEFAULT_PROGRESS_EVERY_FILES,
                TaskMasterConfig.DEFAULT_PROGRESS_EVERY_MS,
                TaskMasterConfig.DEFAULT_CANCEL_CHECK_INTERVAL_MS,
                TaskMasterConfig.DEFAULT_EVENT_QUEUE_CAPACITY,
                TaskMasterConfig.DEFAULT_MAX_FILES
        );
    }

    /**
     * Loads the settings file (if present) and applies process-level overrides.
     */
    public static TaskMasterSettings load(Path settingsFile) {
        return load(settingsFile, System.getenv(), System.getProperties());
    }

    public static TaskMasterSettings load(Path settingsFile, Map<String, String> env, Properties props) {
        TaskMasterSettings fromFile = defaults();
        if (settingsFile != null && Files.exists(settingsFile)) {
            try {
                SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
                fromFile = fromFile(file, defaults());
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load settings: " + settingsFile, e);
            }
        }
        return fromFile(overrides(env, props), fromFile);
    }

    static TaskMasterSettings fromFile(SettingsFile file, TaskMasterSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long baseBackoff = sanitizeLong(file.dbWriteBaseBackoffMs(), defaults.dbWriteBaseBackoffMs(), 1L);
        long maxBackoff = sanitizeLong(file.dbWriteMaxBackoffMs(), defaults.dbWriteMaxBackoffMs(), baseBackoff);
        if (maxBackoff < baseBackoff) {
            maxBackoff = baseBackoff;
        }
        int writeAttempts = sanitizeInt(file.dbWriteMaxAttempts(), defaults.dbWriteMaxAttempts(), 1);
        int lifecycleAttempts = sanitizeInt(file.lifecycleWriteMaxAttempts(), defaults.lifecycleWriteMaxAttempts(), 1);
        return new TaskMasterSettings(
                sanitizeLong(file.dbBusyTimeoutMs(), defaults.dbBusyTimeoutMs(), 0L),
                writeAttempts,
                baseBackoff,
                maxBackoff,
                Math.max(writeAttempts, lifecycleAttempts),
                sanitizeInt(file.taskMaxRetries(), defaults.taskMaxRetries(), 0),
                sanitizeBoolean(file.autoRetryFailedTasks(), defaults.autoRetryFailedTasks()),
                sanitizeLong(file.taskRetryDelayMs(), defaults.taskRetryDelayMs(), 0L),
                sanitizeInt(file.workerThreads(), defaults.workerThreads(), 1),
                sanitizeLong(file.schedulerIntervalMs(), defaults.schedulerIntervalMs(), 100L),
                sanitizeInt(file.maxDueSchedulesPerTick(), defaults.maxDueSchedulesPerTick(), 1),
                sanitizeInt(file.maxQueuedRuns(), defaults.maxQueuedRuns(), 1),
                sanitizeInt(file.progressEveryFiles(), defaults.progressEveryFiles(), 1),
                sanitizeLong(file.progressEveryMs(), defaults.progressEveryMs(), 10L),
                sanitizeLong(file.cancelCheckIntervalMs(), defaults.cancelCheckIntervalMs(), 0L),
                sanitizeInt(file.eventQueueCapacity(), defaults.eventQueueCapacity(), 16),
                sanitizeInt(file.defaultMaxFiles(), defaults.defaultMaxFiles(), 1)
        );
    }

    private static SettingsFile overrides(Map<String, String> env, Properties props) {
        return new SettingsFile(
                lookupLong("TASKMASTER_DB_BUSY_TIMEOUT_MS", env, props),
                lookupInt("TASKMASTER_DB_WRITE_MAX_ATTEMPTS", env, props),
                lookupLong("TASKMASTER_DB_WRITE_BASE_BACKOFF_MS", env, props),
                lookupLong("TASKMASTER_DB_WRITE_MAX_BACKOFF_MS", env, props),
                lookupInt("TASKMASTER_LIFECYCLE_WRITE_MAX_ATTEMPTS", env, props),
                lookupInt("TASKMASTER_TASK_MAX_RETRIES", env, props),
                lookupBoolean("TASKMASTER_AUTO_RETRY_FAILED_TASKS", env, props),
                lookupLong("TASKMASTER_TASK_RETRY_DELAY_MS", env, props),
                lookupInt("TASKMASTER_WORKER_THREADS", env, props),
                lookupLong("TASKMASTER_SCHEDULER_INTERVAL_MS", env, props),
                null,
                lookupInt("TASKMASTER_MAX_QUEUED_RUNS", env, props),
                null,
                null,
                null,
                null,
                null
        );
    }

    private static String lookup(String envName, Map<String, String> env, Properties props) {
        String propName = envName.toLowerCase(Locale.ROOT).replace('_', '.');
        String value = props == null ? null : props.getProperty(propName);
        if (value == null || value.isBlank()) {
            value = env == null ? null : env.get(envName);
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Integer lookupInt(String name, Map<String, String> env, Properties props) {
        String raw = lookup(name, env, props);
        if (raw == null) {
            return null;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + name + ": " + raw, e);
        }
    }

    private static Long lookupLong(String name, Map<String, String> env, Properties props) {
        String raw = lookup(name, env, props);
        if (raw == null) {
            return null;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + name + ": " + raw, e);
        }
    }

    private static Boolean lookupBoolean(String name, Map<String, String> env, Properties props) {
        String raw = lookup(name, env, props);
        return raw == null ? null : Boolean.parseBoolean(raw);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw;
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    record SettingsFile(
            Long dbBusyTimeoutMs,
            Integer dbWriteMaxAttempts,
            Long dbWriteBaseBackoffMs,
            Long dbWriteMaxBackoffMs,
            Integer lifecycleWriteMaxAttempts,
            Integer taskMaxRetries,
            Boolean autoRetryFailedTasks,
            Long taskRetryDelayMs,
            Integer workerThreads,
            Long schedulerIntervalMs,
            Integer maxDueSchedulesPerTick,
            Integer maxQueuedRuns,
            Integer progressEveryFiles,
            Long progressEveryMs,
            Long cancelCheckIntervalMs,
            Integer eventQueueCapacity,
            Integer defaultMaxFiles
    ) {
    }
}
