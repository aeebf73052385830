package io.taskmaster.model;

import java.util.Map;

public record FileRecord(
        long id,
        String path,
        String displayName,
        String ext,
        long sizeBytes,
        long mtimeMs,
        String mimeType,
        String contentHash,
        FileStatus status,
        String lastError,
        String metadataCompleteness,
        Map<String, Object> metadata,
        String firstSeenRunId,
        String lastRunId,
        long createdAtMs,
        long updatedAtMs,
        long lastCheckedAtMs
) {
}
