package io.taskmaster.model;

import java.util.Map;

public record EventView(
        long eventId,
        String runId,
        String taskId,
        String level,
        String type,
        String code,
        String category,
        String message,
        Map<String, Object> payload,
        long createdAtMs
) {
}
