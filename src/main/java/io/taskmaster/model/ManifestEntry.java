package io.taskmaster.model;

public record ManifestEntry(
        String pathHash,
        String path,
        String root,
        String contentHash,
        long sizeBytes,
        long mtimeMs,
        String lastSeenRunId,
        String lastStatus,
        String lastError,
        long updatedAtMs
) {
}
