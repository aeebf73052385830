package io.taskmaster.model;

import java.util.Locale;

public enum EventLevel {
    DEBUG,
    INFO,
    WARNING,
    ERROR;

    public static EventLevel parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("event level must not be blank");
        }
        String v = raw.trim().toUpperCase(Locale.ROOT);
        if ("WARN".equals(v)) {
            return WARNING;
        }
        return valueOf(v);
    }
}
