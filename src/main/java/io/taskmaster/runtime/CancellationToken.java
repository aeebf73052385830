package io.taskmaster.runtime;

import io.taskmaster.storage.RunStore;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Cooperative stop signal for one task attempt. The in-process flag is checked on every call;
 * the persisted {@code cancel_requested} flag (set by another process) at most once per interval.
 */
final class CancellationToken {
    private final String runId;
    private final AtomicBoolean localFlag;
    private final RunStore runStore;
    private final long checkIntervalMs;
    private final LongSupplier clock;
    private final long deadlineMs;
    private long lastCheckMs;

    CancellationToken(String runId, AtomicBoolean localFlag, RunStore runStore, long checkIntervalMs,
                      LongSupplier clock, long deadlineMs) {
        this.runId = runId;
        this.localFlag = localFlag;
        this.runStore = runStore;
        this.checkIntervalMs = checkIntervalMs;
        this.clock = clock;
        this.deadlineMs = deadlineMs;
        this.lastCheckMs = clock.getAsLong();
    }

    boolean cancelled() {
        if (localFlag.get()) {
            return true;
        }
        long now = clock.getAsLong();
        if (now - lastCheckMs >= checkIntervalMs) {
            lastCheckMs = now;
            if (runStore.isCancelRequested(runId)) {
                localFlag.set(true);
            }
        }
        return localFlag.get();
    }

    boolean timedOut() {
        return deadlineMs > 0L && clock.getAsLong() >= deadlineMs;
    }

    boolean shouldStop() {
        return cancelled() || timedOut();
    }

    /**
     * Reason recorded on a task that stopped early.
     */
    String stopReason() {
        return localFlag.get() ? "cancel_requested" : "timeout";
    }
}
