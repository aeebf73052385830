package io.taskmaster.model;

import java.util.List;

public record WatchedDirectory(
        long watchId,
        String path,
        boolean recursive,
        List<String> allowedExts,
        boolean active,
        long createdAtMs,
        long updatedAtMs
) {
}
