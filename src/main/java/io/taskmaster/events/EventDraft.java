package io.taskmaster.events;

import io.taskmaster.model.EventLevel;
import io.taskmaster.model.EventType;

import java.util.Map;

public record EventDraft(
        String runId,
        String taskId,
        EventLevel level,
        EventType type,
        String message,
        Map<String, Object> payload
) {
    public EventDraft {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("event needs a run id");
        }
        if (level == null || type == null) {
            throw new IllegalArgumentException("event needs a level and a type");
        }
        message = message == null ? "" : message;
        payload = payload == null ? Map.of() : payload;
    }

    public static EventDraft info(String runId, String taskId, EventType type, String message, Map<String, Object> payload) {
        return new EventDraft(runId, taskId, EventLevel.INFO, type, message, payload);
    }

    public static EventDraft warning(String runId, String taskId, EventType type, String message, Map<String, Object> payload) {
        return new EventDraft(runId, taskId, EventLevel.WARNING, type, message, payload);
    }

    public static EventDraft error(String runId, String taskId, EventType type, String message, Map<String, Object> payload) {
        return new EventDraft(runId, taskId, EventLevel.ERROR, type, message, payload);
    }
}
