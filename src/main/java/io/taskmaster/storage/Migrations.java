package io.taskmaster.storage;

import java.util.List;

/**
 * Ordered schema history. Steps are append-only: an applied step must never be edited,
 * since its checksum is verified on every start.
 */
final class Migrations {
    private Migrations() {
    }

    static List<MigrationStep> all() {
        return List.of(
                new MigrationStep(
                        "0001_file_index",
                        "File records, scan manifest and duplicate relationships",
                        List.of(
                                """
                                CREATE TABLE IF NOT EXISTS files_index (
                                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                                    path TEXT NOT NULL,
                                    path_hash TEXT NOT NULL UNIQUE,
                                    display_name TEXT NOT NULL,
                                    ext TEXT,
                                    size_bytes INTEGER NOT NULL,
                                    mtime_ms INTEGER NOT NULL,
                                    mime_type TEXT,
                                    content_hash TEXT,
                                    status TEXT NOT NULL,
                                    last_error TEXT,
                                    metadata_completeness TEXT NOT NULL DEFAULT 'basic',
                                    metadata_json TEXT NOT NULL DEFAULT '{}',
                                    first_seen_run_id TEXT,
                                    last_run_id TEXT,
                                    created_at_ms INTEGER NOT NULL,
                                    updated_at_ms INTEGER NOT NULL,
                                    last_checked_at_ms INTEGER NOT NULL
                                )
                                """,
                                "CREATE INDEX IF NOT EXISTS idx_files_content_hash ON files_index(content_hash, status)",
                                "CREATE INDEX IF NOT EXISTS idx_files_status_checked ON files_index(status, last_checked_at_ms)",
                                """
                                CREATE TABLE IF NOT EXISTS scan_manifest (
                                    path_hash TEXT PRIMARY KEY,
                                    path TEXT NOT NULL,
                                    root TEXT NOT NULL,
                                    content_hash TEXT,
                                    size_bytes INTEGER NOT NULL,
                                    mtime_ms INTEGER NOT NULL,
                                    last_seen_run_id TEXT,
                                    last_status TEXT,
                                    last_error TEXT,
                                    updated_at_ms INTEGER NOT NULL
                                )
                                """,
                                "CREATE INDEX IF NOT EXISTS idx_manifest_root ON scan_manifest(root, path)",
                                """
                                CREATE TABLE IF NOT EXISTS file_duplicate_relationships (
                                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                                    canonical_file_id INTEGER NOT NULL,
                                    duplicate_file_id INTEGER NOT NULL,
                                    relation_type TEXT NOT NULL CHECK (relation_type IN ('exact', 'near')),
                                    confidence REAL NOT NULL DEFAULT 1.0,
                                    match_basis TEXT NOT NULL,
                                    updated_at_ms INTEGER NOT NULL,
                                    UNIQUE(canonical_file_id, duplicate_file_id, relation_type),
                                    FOREIGN KEY(canonical_file_id) REFERENCES files_index(id),
                                    FOREIGN KEY(duplicate_file_id) REFERENCES files_index(id)
                                )
                                """,
                                "CREATE INDEX IF NOT EXISTS idx_dup_duplicate ON file_duplicate_relationships(duplicate_file_id, relation_type)"
                        )
                ),
                new MigrationStep(
                        "0002_orchestration",
                        "Runs, tasks, task attempts and events",
                        List.of(
                                """
                                CREATE TABLE IF NOT EXISTS runs (
                                    run_id TEXT PRIMARY KEY,
                                    job_type TEXT NOT NULL,
                                    status TEXT NOT NULL,
                                    source TEXT NOT NULL DEFAULT 'api',
                                    params_json TEXT NOT NULL DEFAULT '{}',
                                    summary_json TEXT NOT NULL DEFAULT '{}',
                                    cancel_requested INTEGER NOT NULL DEFAULT 0,
                                    error TEXT,
                                    created_at_ms INTEGER NOT NULL,
                                    started_at_ms INTEGER,
                                    completed_at_ms INTEGER,
                                    updated_at_ms INTEGER NOT NULL
                                )
                                """,
                                "CREATE INDEX IF NOT EXISTS idx_runs_status_created ON runs(status, created_at_ms)",
                                """
                                CREATE TABLE IF NOT EXISTS tasks (
                                    task_id TEXT PRIMARY KEY,
                                    run_id TEXT NOT NULL,
                                    seq INTEGER NOT NULL,
                                    name TEXT NOT NULL,
                                    status TEXT NOT NULL,
                                    params_json TEXT NOT NULL DEFAULT '{}',
                                    metrics_json TEXT NOT NULL DEFAULT '{}',
                                    retry_count INTEGER NOT NULL DEFAULT 0,
                                    max_retries INTEGER NOT NULL,
                                    error TEXT,
                                    reason TEXT,
                                    next_attempt_at_ms INTEGER NOT NULL DEFAULT 0,
                                    worker_id TEXT,
                                    created_at_ms INTEGER NOT NULL,
                                    started_at_ms INTEGER,
                                    finished_at_ms INTEGER,
                                    updated_at_ms INTEGER NOT NULL,
                                    FOREIGN KEY(run_id) REFERENCES runs(run_id)
                                )
                                """,
                                "CREATE INDEX IF NOT EXISTS idx_tasks_status_next ON tasks(status, next_attempt_at_ms)",
                                "CREATE INDEX IF NOT EXISTS idx_tasks_run ON tasks(run_id, seq)",
                                """
                                CREATE TABLE IF NOT EXISTS task_attempts (
                                    task_id TEXT NOT NULL,
                                    attempt INTEGER NOT NULL,
                                    worker_id TEXT,
                                    status TEXT NOT NULL,
                                    error TEXT,
                                    started_at_ms INTEGER NOT NULL,
                                    finished_at_ms INTEGER,
                                    PRIMARY KEY(task_id, attempt),
                                    FOREIGN KEY(task_id) REFERENCES tasks(task_id)
                                )
                                """,
                                """
                                CREATE TABLE IF NOT EXISTS events (
                                    event_id INTEGER PRIMARY KEY AUTOINCREMENT,
                                    run_id TEXT NOT NULL,
                                    task_id TEXT,
                                    level TEXT NOT NULL,
                                    event_type TEXT NOT NULL,
                                    code TEXT NOT NULL,
                                    category TEXT NOT NULL,
                                    message TEXT NOT NULL,
                                    payload_json TEXT NOT NULL DEFAULT '{}',
                                    created_at_ms INTEGER NOT NULL
                                )
                                """,
                                "CREATE INDEX IF NOT EXISTS idx_events_run_id ON events(run_id, event_id)",
                                "CREATE INDEX IF NOT EXISTS idx_events_run_created ON events(run_id, created_at_ms)"
                        )
                ),
                new MigrationStep(
                        "0003_schedules_and_watches",
                        "Recurring schedules and watched directories",
                        List.of(
                                """
                                CREATE TABLE IF NOT EXISTS schedules (
                                    schedule_id INTEGER PRIMARY KEY AUTOINCREMENT,
                                    name TEXT NOT NULL UNIQUE,
                                    job_type TEXT NOT NULL,
                                    spec TEXT NOT NULL,
                                    interval_minutes INTEGER NOT NULL,
                                    params_json TEXT NOT NULL DEFAULT '{}',
                                    active INTEGER NOT NULL DEFAULT 1,
                                    last_run_at_ms INTEGER,
                                    next_run_at_ms INTEGER NOT NULL,
                                    last_run_id TEXT,
                                    created_at_ms INTEGER NOT NULL,
                                    updated_at_ms INTEGER NOT NULL
                                )
                                """,
                                "CREATE INDEX IF NOT EXISTS idx_schedules_due ON schedules(active, next_run_at_ms)",
                                """
                                CREATE TABLE IF NOT EXISTS watched_directories (
                                    watch_id INTEGER PRIMARY KEY AUTOINCREMENT,
                                    path TEXT NOT NULL UNIQUE,
                                    recursive INTEGER NOT NULL DEFAULT 1,
                                    allowed_exts_json TEXT NOT NULL DEFAULT '[]',
                                    active INTEGER NOT NULL DEFAULT 1,
                                    created_at_ms INTEGER NOT NULL,
                                    updated_at_ms INTEGER NOT NULL
                                )
                                """
                        )
                )
        );
    }

    record MigrationStep(String version, String description, List<String> sql) {
    }
}
