package io.taskmaster.model;

import java.util.Locale;

public enum JobType {
    INDEX("index"),
    REFRESH("refresh"),
    WATCH_REFRESH("watch_refresh");

    private final String wireName;

    JobType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static JobType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("job type must not be blank");
        }
        String v = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (JobType type : values()) {
            if (type.wireName.equals(v)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported job type: " + raw);
    }
}
