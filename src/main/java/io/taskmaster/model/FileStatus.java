package io.taskmaster.model;

import java.util.Locale;

/**
 * Lifecycle of a {@link FileRecord}. Records are never deleted, only re-flagged.
 */
public enum FileStatus {
    ACTIVE,
    MISSING,
    DAMAGED,
    STALE;

    public static FileStatus fromDb(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
