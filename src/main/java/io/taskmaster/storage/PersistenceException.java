package io.taskmaster.storage;

/**
 * Raised by {@link Database} for every store failure. {@link Kind#LOCK_TIMEOUT} means the
 * bounded retry-on-lock budget ran out; anything else is {@link Kind#FATAL}.
 */
public final class PersistenceException extends RuntimeException {
    public enum Kind { LOCK_TIMEOUT, FATAL }

    private final Kind kind;
    private final String operation;
    private final int attempts;

    public PersistenceException(Kind kind, String operation, int attempts, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.operation = operation;
        this.attempts = attempts;
    }

    public static PersistenceException lockTimeout(String operation, int attempts, Throwable cause) {
        return new PersistenceException(Kind.LOCK_TIMEOUT, operation, attempts,
                "Lock timeout after " + attempts + " attempts: " + operation, cause);
    }

    public static PersistenceException fatal(String operation, Throwable cause) {
        return new PersistenceException(Kind.FATAL, operation, 1, "Failed to " + operation, cause);
    }

    public Kind kind() {
        return kind;
    }

    public String operation() {
        return operation;
    }

    public int attempts() {
        return attempts;
    }
}
