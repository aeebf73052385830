package io.taskmaster.scan;

import java.util.Map;

/**
 * Upper bounds for one walk. Zero means unbounded.
 */
public record ScanBudget(long maxFiles, long maxRuntimeMs) {
    public ScanBudget {
        if (maxFiles < 0 || maxRuntimeMs < 0) {
            throw new IllegalArgumentException("budget values must be >= 0");
        }
    }

    public static ScanBudget unbounded() {
        return new ScanBudget(0L, 0L);
    }

    public static ScanBudget fromParams(Map<String, Object> params, long defaultMaxFiles) {
        long maxFiles = ScanParams.longParam(params, "max_files", defaultMaxFiles);
        long maxRuntimeSeconds = ScanParams.longParam(params, "max_runtime_seconds", 0L);
        return new ScanBudget(Math.max(0L, maxFiles), Math.max(0L, maxRuntimeSeconds) * 1000L);
    }
}
