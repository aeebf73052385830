package io.taskmaster.storage;

import java.util.concurrent.ThreadLocalRandom;

public record RetryPolicy(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        baseBackoffMs = Math.max(0L, baseBackoffMs);
        maxBackoffMs = Math.max(baseBackoffMs, maxBackoffMs);
    }

    /**
     * Exponential backoff for the given 1-based attempt, capped, plus up to a quarter of the
     * step as jitter.
     */
    public long backoffMs(int attempt) {
        long backoff = baseBackoffMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxBackoffMs);
        long jitterBound = Math.max(1L, backoff / 4L);
        long jitter = ThreadLocalRandom.current().nextLong(0L, jitterBound + 1L);
        return Math.min(maxBackoffMs, backoff + jitter);
    }
}
