package io.taskmaster.model;

import java.util.Locale;

public enum RunStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean terminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public static RunStatus fromDb(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
