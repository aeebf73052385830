package io.taskmaster.scan;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Lazy depth-first walk over one root. Directory entries are read one directory at a time and
 * visited in name order, so two walks over an unchanged tree yield the same sequence.
 * <p>
 * Directories are identified by {@link BasicFileAttributes#fileKey()} (device and inode on
 * POSIX), falling back to the real path, so a directory reached twice through different
 * spellings or links is reported as a symlink loop and not descended again.
 * <p>
 * Not thread-safe.
 */
public final class DiscoveryWalk implements Iterator<DiscoveredPath> {
    private final Path root;
    private final ScanFilters filters;
    private final ScanBudget budget;
    private final Consumer<DiscoveryError> errorSink;
    private final BooleanSupplier stopSignal;
    private final LongSupplier clock;
    private final long startedAtMs;

    private final Deque<Frame> stack = new ArrayDeque<>();
    private final Set<Object> visited = new HashSet<>();

    private DiscoveredPath next;
    private boolean finished;
    private long charged;

    private long directoriesVisited;
    private long entriesSeen;
    private long filesMatched;
    private long filtered;
    private long skippedSymlinks;
    private long permissionErrors;
    private long symlinkLoops;
    private long ioErrors;
    private boolean rootMissing;
    private boolean budgetExhausted;
    private boolean stopped;

    DiscoveryWalk(Path root, ScanFilters filters, ScanBudget budget, Consumer<DiscoveryError> errorSink,
                  BooleanSupplier stopSignal, LongSupplier clock) {
        this.root = root.toAbsolutePath().normalize();
        this.filters = filters;
        this.budget = budget;
        this.errorSink = errorSink;
        this.stopSignal = stopSignal;
        this.clock = clock;
        this.startedAtMs = clock.getAsLong();
        start();
    }

    private void start() {
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(root, BasicFileAttributes.class);
        } catch (IOException e) {
            rootMissing = true;
            finished = true;
            return;
        }
        if (!attrs.isDirectory()) {
            rootMissing = true;
            finished = true;
            return;
        }
        try {
            visited.add(identity(root, attrs));
        } catch (IOException e) {
            ioError(root, e);
            rootMissing = true;
            finished = true;
            return;
        }
        stack.push(new Frame(root, "", 0));
    }

    public Path root() {
        return root;
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        DiscoveredPath candidate = advance();
        if (candidate == null) {
            finished = true;
            return false;
        }
        if (budget.maxFiles() > 0 && charged >= budget.maxFiles()) {
            budgetExhausted = true;
            finished = true;
            stack.clear();
            return false;
        }
        next = candidate;
        return true;
    }

    @Override
    public DiscoveredPath next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        DiscoveredPath out = next;
        next = null;
        charged++;
        return out;
    }

    /**
     * Gives back the file-budget slot of the last yielded path. Callers use it for files the
     * manifest proves unchanged, so a follow-up run spends its budget on new work.
     */
    public void refundLast() {
        if (charged > 0) {
            charged--;
        }
    }

    public DiscoveryStats stats() {
        return new DiscoveryStats(
                directoriesVisited, entriesSeen, filesMatched, filtered, skippedSymlinks,
                permissionErrors, symlinkLoops, ioErrors, rootMissing, budgetExhausted, stopped
        );
    }

    public boolean rootMissing() {
        return rootMissing;
    }

    public boolean budgetExhausted() {
        return budgetExhausted;
    }

    public boolean stopped() {
        return stopped;
    }

    private DiscoveredPath advance() {
        while (!stack.isEmpty()) {
            if (stopSignal.getAsBoolean()) {
                stopped = true;
                stack.clear();
                return null;
            }
            if (budget.maxRuntimeMs() > 0 && clock.getAsLong() - startedAtMs >= budget.maxRuntimeMs()) {
                budgetExhausted = true;
                stack.clear();
                return null;
            }
            Frame frame = stack.peek();
            if (frame.entries == null) {
                frame.entries = list(frame.dir);
                directoriesVisited++;
            }
            if (!frame.entries.hasNext()) {
                stack.pop();
                continue;
            }
            DiscoveredPath found = visit(frame, frame.entries.next());
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private DiscoveredPath visit(Frame parent, Path entry) {
        entriesSeen++;
        String name = entry.getFileName().toString();
        String relative = parent.relative.isEmpty() ? name : parent.relative + "/" + name;
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            if (attrs.isSymbolicLink()) {
                if (!filters.followSymlinks()) {
                    skippedSymlinks++;
                    return null;
                }
                attrs = Files.readAttributes(entry, BasicFileAttributes.class);
            }
        } catch (AccessDeniedException e) {
            permissionDenied(entry, e);
            return null;
        } catch (IOException e) {
            ioError(entry, e);
            return null;
        }

        if (attrs.isDirectory()) {
            int depth = parent.depth + 1;
            if (!filters.descendsInto(parent.depth)) {
                return null;
            }
            if (filters.prunesDirectory(entry, relative)) {
                filtered++;
                return null;
            }
            Object key;
            try {
                key = identity(entry, attrs);
            } catch (IOException e) {
                ioError(entry, e);
                return null;
            }
            if (!visited.add(key)) {
                symlinkLoops++;
                errorSink.accept(new DiscoveryError(DiscoveryError.Kind.SYMLINK_LOOP, entry,
                        "directory already visited: " + key));
                return null;
            }
            stack.push(new Frame(entry, relative, depth));
            return null;
        }
        if (!attrs.isRegularFile()) {
            return null;
        }
        long size = attrs.size();
        long mtime = attrs.lastModifiedTime().toMillis();
        if (filters.accepts(entry, relative, size, mtime) != ScanFilters.Decision.ACCEPTED) {
            filtered++;
            return null;
        }
        filesMatched++;
        return new DiscoveredPath(
                entry,
                root,
                relative,
                size,
                mtime,
                MimeTypes.extensionOf(name),
                MimeTypes.guess(name)
        );
    }

    private Iterator<Path> list(Path dir) {
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path p : stream) {
                entries.add(p);
            }
        } catch (AccessDeniedException e) {
            permissionDenied(dir, e);
            return List.<Path>of().iterator();
        } catch (IOException e) {
            ioError(dir, e);
            return List.<Path>of().iterator();
        }
        entries.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
        return entries.iterator();
    }

    private void permissionDenied(Path path, IOException e) {
        permissionErrors++;
        errorSink.accept(new DiscoveryError(DiscoveryError.Kind.PERMISSION_DENIED, path, String.valueOf(e.getMessage())));
    }

    private void ioError(Path path, IOException e) {
        ioErrors++;
        errorSink.accept(new DiscoveryError(DiscoveryError.Kind.IO_ERROR, path,
                e.getClass().getSimpleName() + ": " + e.getMessage()));
    }

    private static Object identity(Path dir, BasicFileAttributes attrs) throws IOException {
        Object key = attrs.fileKey();
        return key != null ? key : dir.toRealPath();
    }

    private static final class Frame {
        private final Path dir;
        private final String relative;
        private final int depth;
        private Iterator<Path> entries;

        private Frame(Path dir, String relative, int depth) {
            this.dir = dir;
            this.relative = relative;
            this.depth = depth;
        }
    }
}
