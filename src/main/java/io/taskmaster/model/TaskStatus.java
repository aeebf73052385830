package io.taskmaster.model;

import java.util.Locale;

public enum TaskStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean terminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    public static TaskStatus fromDb(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
