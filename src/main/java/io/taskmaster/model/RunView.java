package io.taskmaster.model;

import java.util.List;
import java.util.Map;

public record RunView(
        String runId,
        String jobType,
        String status,
        String source,
        boolean cancelRequested,
        String error,
        Map<String, Object> params,
        Map<String, Object> summary,
        long createdAtMs,
        Long startedAtMs,
        Long completedAtMs,
        List<TaskView> tasks
) {
}
