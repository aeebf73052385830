package io.taskmaster.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

public final class TaskMasterConfig {
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String DEFAULT_NAMESPACES_DIR = "namespaces";
    public static final String SETTINGS_FILE_NAME = "taskmaster-settings.json";

    public static final long DEFAULT_DB_BUSY_TIMEOUT_MS = 5_000L;
    public static final int DEFAULT_DB_WRITE_MAX_ATTEMPTS = 5;
    public static final long DEFAULT_DB_WRITE_BASE_BACKOFF_MS = 50L;
    public static final long DEFAULT_DB_WRITE_MAX_BACKOFF_MS = 2_000L;
    public static final int DEFAULT_LIFECYCLE_WRITE_MAX_ATTEMPTS = 40;
    public static final int DEFAULT_TASK_MAX_RETRIES = 2;
    public static final long DEFAULT_TASK_RETRY_DELAY_MS = 10_000L;
    public static final int DEFAULT_WORKER_THREADS = 2;
    public static final long DEFAULT_SCHEDULER_INTERVAL_MS = 30_000L;
    public static final int DEFAULT_MAX_DUE_SCHEDULES_PER_TICK = 2;
    public static final int DEFAULT_MAX_QUEUED_RUNS = 200;
    public static final int DEFAULT_PROGRESS_EVERY_FILES = 100;
    public static final long DEFAULT_PROGRESS_EVERY_MS = 2_000L;
    public static final long DEFAULT_CANCEL_CHECK_INTERVAL_MS = 500L;
    public static final int DEFAULT_EVENT_QUEUE_CAPACITY = 1_024;
    public static final int DEFAULT_MAX_FILES = 5_000;

    private final Path rootDir;
    private final String namespace;

    public TaskMasterConfig(Path rootDir, String namespace) {
        this.rootDir = rootDir;
        this.namespace = namespace;
    }

    public static TaskMasterConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_NAMESPACE);
    }

    public static TaskMasterConfig fromRoot(String root, String namespace) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        String safeNamespace = sanitizeNamespace(namespace);
        Path scoped = DEFAULT_NAMESPACE.equals(safeNamespace)
                ? base
                : base.resolve(DEFAULT_NAMESPACES_DIR).resolve(safeNamespace);
        return new TaskMasterConfig(scoped, safeNamespace);
    }

    static String sanitizeNamespace(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_NAMESPACE : raw.trim().toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        if (value.isBlank() || "-".equals(value)) {
            return DEFAULT_NAMESPACE;
        }
        if (value.startsWith(".")) {
            value = "ns" + value;
        }
        return value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public String namespace() {
        return namespace;
    }

    public Path dbFile() {
        return rootDir.resolve("taskmaster.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }
}
