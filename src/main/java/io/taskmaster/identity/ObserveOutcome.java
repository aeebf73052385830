package io.taskmaster.identity;

import io.taskmaster.model.FileStatus;

/**
 * Result of observing one path.
 *
 * @param fileId      record id, null when nothing was written for a vanished path
 * @param parserError set when the matching parser failed during extraction
 */
public record ObserveOutcome(
        Long fileId,
        Action action,
        FileStatus status,
        String reason,
        String parserId,
        String parserError
) {
    public enum Action {
        CREATED,
        UPDATED,
        SKIPPED,
        VANISHED
    }

    public boolean wrote() {
        return action == Action.CREATED || action == Action.UPDATED;
    }
}
