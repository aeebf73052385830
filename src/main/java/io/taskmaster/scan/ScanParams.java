package io.taskmaster.scan;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Typed reads over the loosely typed JSON parameter maps stored on runs and tasks.
 */
public final class ScanParams {
    private ScanParams() {
    }

    public static long longParam(Map<String, Object> params, String key, long fallback) {
        Object raw = params == null ? null : params.get(key);
        if (raw == null) {
            return fallback;
        }
        if (raw instanceof Number n) {
            return n.longValue();
        }
        String text = String.valueOf(raw).trim();
        if (text.isEmpty()) {
            return fallback;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter " + key + " must be an integer, got: " + raw, e);
        }
    }

    public static Long optionalLong(Map<String, Object> params, String key) {
        Object raw = params == null ? null : params.get(key);
        if (raw == null || String.valueOf(raw).isBlank()) {
            return null;
        }
        return longParam(params, key, 0L);
    }

    public static boolean boolParam(Map<String, Object> params, String key, boolean fallback) {
        Object raw = params == null ? null : params.get(key);
        if (raw == null) {
            return fallback;
        }
        if (raw instanceof Boolean b) {
            return b;
        }
        String text = String.valueOf(raw).trim().toLowerCase();
        return switch (text) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> throw new IllegalArgumentException("Parameter " + key + " must be a boolean, got: " + raw);
        };
    }

    /**
     * Accepts a JSON array or a comma separated string.
     */
    public static List<String> stringList(Map<String, Object> params, String key) {
        Object raw = params == null ? null : params.get(key);
        List<String> out = new ArrayList<>();
        if (raw == null) {
            return out;
        }
        if (raw instanceof Collection<?> values) {
            for (Object v : values) {
                if (v != null && !String.valueOf(v).isBlank()) {
                    out.add(String.valueOf(v).trim());
                }
            }
            return out;
        }
        for (String part : String.valueOf(raw).split(",")) {
            if (!part.isBlank()) {
                out.add(part.trim());
            }
        }
        return out;
    }
}
