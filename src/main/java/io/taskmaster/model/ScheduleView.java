package io.taskmaster.model;

import java.util.Map;

public record ScheduleView(
        long scheduleId,
        String name,
        String jobType,
        String spec,
        int intervalMinutes,
        Map<String, Object> params,
        boolean active,
        Long lastRunAtMs,
        long nextRunAtMs,
        String lastRunId,
        long createdAtMs,
        long updatedAtMs
) {
}
