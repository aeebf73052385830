package io.taskmaster.identity;

import io.taskmaster.model.FileRecord;
import io.taskmaster.model.FileStatus;
import io.taskmaster.model.ManifestEntry;
import io.taskmaster.scan.DiscoveredPath;
import io.taskmaster.scan.MimeTypes;
import io.taskmaster.storage.FileIndexStore;
import io.taskmaster.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.LongSupplier;

/**
 * Flags records that have not been checked recently as stale, then revalidates them:
 * a vanished file becomes missing, anything else is rehashed through {@link IdentityEngine}.
 */
public final class RefreshEngine {
    private static final Logger log = LoggerFactory.getLogger(RefreshEngine.class);
    private static final int PAGE_SIZE = 200;

    private final FileIndexStore store;
    private final IdentityEngine identity;
    private final LongSupplier clock;

    public RefreshEngine(FileIndexStore store, IdentityEngine identity, LongSupplier clock) {
        this.store = store;
        this.identity = identity;
        this.clock = clock;
    }

    public RefreshResult refresh(String runId, long staleAfterMs, BooleanSupplier cancelled) {
        long now = clock.getAsLong();
        int flagged = store.markStaleCheckedBefore(now - Math.max(0L, staleAfterMs), now);
        int missing = 0;
        int revalidated = 0;
        int errors = 0;
        long afterId = 0L;
        while (true) {
            List<FileRecord> page = store.listByStatusAfter(FileStatus.STALE, afterId, PAGE_SIZE);
            if (page.isEmpty()) {
                break;
            }
            for (FileRecord record : page) {
                afterId = record.id();
                if (cancelled.getAsBoolean()) {
                    return new RefreshResult(flagged, missing, revalidated, errors, true);
                }
                Path path = Path.of(record.path());
                String pathHash = Hashing.sha256Hex(path.toString());
                BasicFileAttributes attrs;
                try {
                    attrs = Files.readAttributes(path, BasicFileAttributes.class);
                } catch (NoSuchFileException e) {
                    store.markMissing(record, pathHash, runId, clock.getAsLong());
                    missing++;
                    continue;
                } catch (IOException e) {
                    log.warn("Cannot stat stale record {}: {}", record.path(), e.toString());
                    errors++;
                    continue;
                }
                Path root = store.manifestEntry(pathHash)
                        .map(ManifestEntry::root)
                        .map(Path::of)
                        .orElse(path.getParent());
                String name = path.getFileName().toString();
                DiscoveredPath discovered = new DiscoveredPath(
                        path,
                        root,
                        root.relativize(path).toString().replace('\\', '/'),
                        attrs.size(),
                        attrs.lastModifiedTime().toMillis(),
                        MimeTypes.extensionOf(name),
                        MimeTypes.guess(name)
                );
                try {
                    ObserveOutcome outcome = identity.observe(discovered, runId);
                    if (outcome.action() == ObserveOutcome.Action.VANISHED) {
                        missing++;
                    } else {
                        revalidated++;
                    }
                } catch (AccessDeniedException e) {
                    log.warn("Permission denied revalidating {}", record.path());
                    errors++;
                }
            }
        }
        return new RefreshResult(flagged, missing, revalidated, errors, false);
    }

    public record RefreshResult(int stale, int missing, int revalidated, int errors, boolean cancelled) {
    }
}
