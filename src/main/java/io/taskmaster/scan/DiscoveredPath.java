package io.taskmaster.scan;

import java.nio.file.Path;

/**
 * A regular file that passed every discovery filter.
 *
 * @param relativePath root-relative path with forward slashes
 * @param ext          lower-case extension including the dot, or empty
 */
public record DiscoveredPath(
        Path path,
        Path root,
        String relativePath,
        long sizeBytes,
        long mtimeMs,
        String ext,
        String mimeType
) {
}
