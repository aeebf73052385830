package io.taskmaster.model;

import java.util.Map;

public record TaskView(
        String taskId,
        String runId,
        String name,
        String status,
        int retryCount,
        int maxRetries,
        String error,
        String reason,
        Map<String, Object> params,
        Map<String, Object> metrics,
        long nextAttemptAtMs,
        String workerId,
        long createdAtMs,
        Long startedAtMs,
        Long finishedAtMs
) {
}
