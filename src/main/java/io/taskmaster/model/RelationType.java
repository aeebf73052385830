package io.taskmaster.model;

import java.util.Locale;

public enum RelationType {
    EXACT,
    /** Reserved for a similarity stage; nothing in this codebase writes it. */
    NEAR;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RelationType fromDb(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
