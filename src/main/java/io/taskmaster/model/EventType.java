package io.taskmaster.model;

import java.util.Locale;

/**
 * Fixed event taxonomy. Consumers filter on {@link #code()} or {@link #category()}
 * without parsing messages.
 */
public enum EventType {
    RUN_QUEUED("TM_RUN_QUEUED", "lifecycle"),
    RUN_STARTED("TM_RUN_START", "lifecycle"),
    RUN_COMPLETED("TM_RUN_COMPLETED", "lifecycle"),
    RUN_FAILED("TM_RUN_FAILED", "lifecycle"),
    RUN_CANCELLED("TM_RUN_CANCELLED", "lifecycle"),
    TASK_STARTED("TM_TASK_START", "task"),
    TASK_SUCCEEDED("TM_TASK_SUCCEEDED", "task"),
    TASK_FAILED("TM_TASK_FAILED", "task"),
    TASK_CANCELLED("TM_TASK_CANCELLED", "task"),
    TASK_RETRY("TM_TASK_RETRY", "task"),
    TASK_BUDGET_EXHAUSTED("TM_TASK_BUDGET_EXHAUSTED", "task"),
    TASK_PROGRESS("TM_PROGRESS", "progress"),
    ROOT_MISSING("TM_ROOT_MISSING", "discovery"),
    FILE_PERMISSION_DENIED("TM_FILE_PERMISSION_DENIED", "discovery"),
    FILE_SYMLINK_LOOP("TM_FILE_SYMLINK_LOOP", "discovery"),
    FILE_DAMAGED("TM_FILE_DAMAGED", "identity"),
    PARSER_FAILED("TM_PARSER_FAILED", "identity"),
    DEDUP_REBUILT("TM_DEDUP_REBUILT", "identity"),
    PERSISTENCE_LOCK_TIMEOUT("TM_PERSISTENCE_LOCK_TIMEOUT", "persistence"),
    SCHEDULE_TRIGGERED("TM_SCHEDULE_TRIGGERED", "schedule");

    private final String code;
    private final String category;

    EventType(String code, String category) {
        this.code = code;
        this.category = category;
    }

    public String code() {
        return code;
    }

    public String category() {
        return category;
    }

    /**
     * Accepts the enum name or the TM_ code.
     */
    public static EventType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("event type must not be blank");
        }
        String v = raw.trim().toUpperCase(Locale.ROOT);
        for (EventType type : values()) {
            if (type.name().equals(v) || type.code.equals(v)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + raw);
    }
}
