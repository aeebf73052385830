package io.taskmaster.scan;

import java.nio.file.Path;

/**
 * Non-fatal per-path failure. The walk records it and continues with siblings.
 */
public record DiscoveryError(Kind kind, Path path, String message) {
    public enum Kind { PERMISSION_DENIED, SYMLINK_LOOP, IO_ERROR }
}
