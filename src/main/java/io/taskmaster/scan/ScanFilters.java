package io.taskmaster.scan;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Discovery filters. {@link #accepts} applies them in a fixed order: include globs, exclude
 * globs, extension/MIME allowlist, size range, modified-after window.
 */
public final class ScanFilters {
    public static final Set<String> DEFAULT_EXTS = Set.of(
            ".pdf", ".docx", ".txt", ".md", ".csv", ".xlsx", ".json", ".pptx",
            ".jpg", ".jpeg", ".tif", ".tiff", ".webp", ".png",
            ".mp3", ".m4a", ".wav", ".flac", ".mp4", ".mov", ".mkv", ".avi"
    );

    private final List<String> includeGlobs;
    private final List<String> excludeGlobs;
    private final List<PathMatcher> includes;
    private final List<PathMatcher> excludes;
    private final Set<String> allowedExts;
    private final List<String> allowedMime;
    private final Long minSizeBytes;
    private final Long maxSizeBytes;
    private final Long modifiedAfterMs;
    private final boolean recursive;
    private final int maxDepth;
    private final boolean followSymlinks;

    private ScanFilters(Builder b) {
        this.includeGlobs = List.copyOf(b.includeGlobs);
        this.excludeGlobs = List.copyOf(b.excludeGlobs);
        this.includes = compile(b.includeGlobs);
        this.excludes = compile(b.excludeGlobs);
        Set<String> exts = new LinkedHashSet<>();
        for (String ext : b.allowedExts) {
            exts.add(normalizeExt(ext));
        }
        this.allowedExts = exts.isEmpty() ? DEFAULT_EXTS : Set.copyOf(exts);
        List<String> mimes = new ArrayList<>();
        for (String mime : b.allowedMime) {
            mimes.add(mime.trim().toLowerCase(Locale.ROOT));
        }
        this.allowedMime = List.copyOf(mimes);
        this.minSizeBytes = b.minSizeBytes;
        this.maxSizeBytes = b.maxSizeBytes;
        this.modifiedAfterMs = b.modifiedAfterMs;
        this.recursive = b.recursive;
        this.maxDepth = b.maxDepth;
        this.followSymlinks = b.followSymlinks;
        if (minSizeBytes != null && maxSizeBytes != null && minSizeBytes > maxSizeBytes) {
            throw new IllegalArgumentException("min_size_bytes must be <= max_size_bytes");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ScanFilters defaults() {
        return builder().build();
    }

    public static ScanFilters fromParams(Map<String, Object> params) {
        return builder()
                .includeGlobs(ScanParams.stringList(params, "include_globs"))
                .excludeGlobs(ScanParams.stringList(params, "exclude_globs"))
                .allowedExts(ScanParams.stringList(params, "allowed_exts"))
                .allowedMime(ScanParams.stringList(params, "allowed_mime"))
                .minSizeBytes(ScanParams.optionalLong(params, "min_size_bytes"))
                .maxSizeBytes(ScanParams.optionalLong(params, "max_size_bytes"))
                .modifiedAfterMs(ScanParams.optionalLong(params, "modified_after_ms"))
                .recursive(ScanParams.boolParam(params, "recursive", true))
                .maxDepth((int) ScanParams.longParam(params, "max_depth", 0L))
                .followSymlinks(ScanParams.boolParam(params, "follow_symlinks", false))
                .build();
    }

    public Decision accepts(Path absolute, String relative, long sizeBytes, long mtimeMs) {
        if (!includes.isEmpty() && !matchesAny(includes, absolute, relative)) {
            return Decision.NOT_INCLUDED;
        }
        if (matchesAny(excludes, absolute, relative)) {
            return Decision.EXCLUDED;
        }
        String ext = MimeTypes.extensionOf(absolute.getFileName().toString());
        if (!allowedExts.contains(ext)) {
            return Decision.TYPE_NOT_ALLOWED;
        }
        if (!allowedMime.isEmpty() && !mimeAllowed(MimeTypes.guess(absolute.getFileName().toString()))) {
            return Decision.TYPE_NOT_ALLOWED;
        }
        if (minSizeBytes != null && sizeBytes < minSizeBytes) {
            return Decision.SIZE_OUT_OF_RANGE;
        }
        if (maxSizeBytes != null && sizeBytes > maxSizeBytes) {
            return Decision.SIZE_OUT_OF_RANGE;
        }
        if (modifiedAfterMs != null && mtimeMs <= modifiedAfterMs) {
            return Decision.TOO_OLD;
        }
        return Decision.ACCEPTED;
    }

    /**
     * Exclude globs that match a directory prune its whole subtree.
     */
    public boolean prunesDirectory(Path absolute, String relative) {
        return matchesAny(excludes, absolute, relative);
    }

    /**
     * Whether the subdirectories of a directory at {@code depth} (root = 0) are walked.
     * With {@code max_depth = 1} the root and its direct subdirectories are listed.
     */
    public boolean descendsInto(int depth) {
        if (!recursive) {
            return false;
        }
        return maxDepth <= 0 || depth < maxDepth;
    }

    private boolean mimeAllowed(String mime) {
        if (mime == null) {
            return false;
        }
        String m = mime.toLowerCase(Locale.ROOT);
        for (String allowed : allowedMime) {
            if (allowed.endsWith("/*")) {
                if (m.startsWith(allowed.substring(0, allowed.length() - 1))) {
                    return true;
                }
            } else if (allowed.equals(m)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesAny(List<PathMatcher> matchers, Path absolute, String relative) {
        if (matchers.isEmpty()) {
            return false;
        }
        Path rel = Path.of(relative);
        for (PathMatcher m : matchers) {
            if (m.matches(rel) || m.matches(absolute)) {
                return true;
            }
        }
        return false;
    }

    private static List<PathMatcher> compile(List<String> globs) {
        List<PathMatcher> out = new ArrayList<>();
        for (String glob : globs) {
            out.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
        }
        return List.copyOf(out);
    }

    static String normalizeExt(String raw) {
        String ext = raw.trim().toLowerCase(Locale.ROOT);
        return ext.startsWith(".") ? ext : "." + ext;
    }

    public List<String> includeGlobs() {
        return includeGlobs;
    }

    public List<String> excludeGlobs() {
        return excludeGlobs;
    }

    public Set<String> allowedExts() {
        return allowedExts;
    }

    public boolean recursive() {
        return recursive;
    }

    public boolean followSymlinks() {
        return followSymlinks;
    }

    public enum Decision {
        ACCEPTED,
        NOT_INCLUDED,
        EXCLUDED,
        TYPE_NOT_ALLOWED,
        SIZE_OUT_OF_RANGE,
        TOO_OLD
    }

    public static final class Builder {
        private List<String> includeGlobs = List.of();
        private List<String> excludeGlobs = List.of();
        private List<String> allowedExts = List.of();
        private List<String> allowedMime = List.of();
        private Long minSizeBytes;
        private Long maxSizeBytes;
        private Long modifiedAfterMs;
        private boolean recursive = true;
        private int maxDepth;
        private boolean followSymlinks;

        private Builder() {
        }

        public Builder includeGlobs(List<String> globs) {
            this.includeGlobs = globs == null ? List.of() : globs;
            return this;
        }

        public Builder excludeGlobs(List<String> globs) {
            this.excludeGlobs = globs == null ? List.of() : globs;
            return this;
        }

        public Builder allowedExts(List<String> exts) {
            this.allowedExts = exts == null ? List.of() : exts;
            return this;
        }

        public Builder allowedMime(List<String> mimes) {
            this.allowedMime = mimes == null ? List.of() : mimes;
            return this;
        }

        public Builder minSizeBytes(Long value) {
            this.minSizeBytes = value;
            return this;
        }

        public Builder maxSizeBytes(Long value) {
            this.maxSizeBytes = value;
            return this;
        }

        public Builder modifiedAfterMs(Long value) {
            this.modifiedAfterMs = value;
            return this;
        }

        public Builder recursive(boolean value) {
            this.recursive = value;
            return this;
        }

        public Builder maxDepth(int value) {
            this.maxDepth = Math.max(0, value);
            return this;
        }

        public Builder followSymlinks(boolean value) {
            this.followSymlinks = value;
            return this;
        }

        public ScanFilters build() {
            return new ScanFilters(this);
        }
    }
}
