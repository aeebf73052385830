package io.taskmaster.identity;

import io.taskmaster.model.FileRecord;
import io.taskmaster.model.FileStatus;
import io.taskmaster.model.ManifestEntry;
import io.taskmaster.parser.Parser;
import io.taskmaster.parser.ParserRegistry;
import io.taskmaster.parser.ValidationResult;
import io.taskmaster.scan.DiscoveredPath;
import io.taskmaster.storage.FileIndexStore;
import io.taskmaster.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Turns a discovered path into a persisted file record. Unchanged files (same mtime and size
 * as the manifest, record active or damaged) are skipped without hashing and without any write.
 * Stale and missing records are always rehashed.
 */
public final class IdentityEngine {
    private static final Logger log = LoggerFactory.getLogger(IdentityEngine.class);

    public static final String COMPLETENESS_FULL = "full";
    public static final String COMPLETENESS_PARTIAL = "partial";
    public static final String COMPLETENESS_BASIC = "basic";

    private final FileIndexStore store;
    private final ParserRegistry parsers;
    private final LongSupplier clock;

    public IdentityEngine(FileIndexStore store, ParserRegistry parsers) {
        this(store, parsers, System::currentTimeMillis);
    }

    public IdentityEngine(FileIndexStore store, ParserRegistry parsers, LongSupplier clock) {
        this.store = store;
        this.parsers = parsers;
        this.clock = clock;
    }

    public static String pathHash(DiscoveredPath path) {
        return Hashing.sha256Hex(path.path().toString());
    }

    /**
     * @throws AccessDeniedException when the file bytes cannot be read for lack of permission;
     *                               the caller counts it as a permission error and no record is written
     */
    public ObserveOutcome observe(DiscoveredPath discovered, String runId) throws AccessDeniedException {
        String pathHash = pathHash(discovered);
        Optional<ManifestEntry> manifest = store.manifestEntry(pathHash);
        if (manifest.isPresent()
                && manifest.get().mtimeMs() == discovered.mtimeMs()
                && manifest.get().sizeBytes() == discovered.sizeBytes()) {
            Optional<FileRecord> existing = store.findByPathHash(pathHash);
            if (existing.isPresent() && settled(existing.get().status())) {
                return new ObserveOutcome(existing.get().id(), ObserveOutcome.Action.SKIPPED,
                        existing.get().status(), existing.get().lastError(), null, null);
            }
        }

        String contentHash;
        FileStatus status = FileStatus.ACTIVE;
        String reason = null;
        try {
            contentHash = Hashing.sha256Hex(discovered.path());
        } catch (AccessDeniedException e) {
            throw e;
        } catch (NoSuchFileException e) {
            return vanished(pathHash, runId);
        } catch (IOException e) {
            contentHash = manifest.map(ManifestEntry::contentHash).orElse(null);
            status = FileStatus.DAMAGED;
            reason = "unreadable:" + e.getClass().getSimpleName() + ": " + e.getMessage();
        }

        String completeness = COMPLETENESS_BASIC;
        Map<String, Object> metadata = new LinkedHashMap<>();
        String parserId = null;
        String parserError = null;
        ParserRegistry.Resolution resolution = parsers.resolve(discovered.path());
        Optional<Parser> parser = Optional.ofNullable(resolution.parser());
        if (status == FileStatus.ACTIVE && parser.isPresent()) {
            parserId = parser.get().id();
            metadata.put("parser", parserId);
            ValidationResult validation;
            try {
                validation = parser.get().quickValidate(discovered.path());
            } catch (AccessDeniedException e) {
                throw e;
            } catch (Exception e) {
                validation = ValidationResult.invalid("unreadable:" + e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            if (!validation.valid()) {
                status = FileStatus.DAMAGED;
                reason = validation.reason();
            } else {
                try {
                    metadata.putAll(parser.get().extractIndexMetadata(discovered.path()));
                    completeness = COMPLETENESS_FULL;
                } catch (Exception e) {
                    parserError = e.getClass().getSimpleName() + ": " + e.getMessage();
                    completeness = COMPLETENESS_PARTIAL;
                    metadata.put("parser_error", parserError);
                    log.debug("Parser {} failed on {}", parserId, discovered.path(), e);
                }
            }
        }
        if (status == FileStatus.ACTIVE && resolution.failed() && parserError == null) {
            parserId = resolution.failedParserId();
            parserError = resolution.failure();
            completeness = COMPLETENESS_PARTIAL;
            metadata.put("parser_error", parserError);
        }

        long now = clock.getAsLong();
        FileIndexStore.UpsertResult result = store.upsertObservation(new FileIndexStore.FileObservation(
                discovered.path().toString(),
                pathHash,
                discovered.root().toString(),
                discovered.path().getFileName().toString(),
                discovered.ext(),
                discovered.sizeBytes(),
                discovered.mtimeMs(),
                discovered.mimeType(),
                contentHash,
                status,
                reason,
                completeness,
                metadata,
                runId,
                now
        ));
        return new ObserveOutcome(
                result.fileId(),
                result.created() ? ObserveOutcome.Action.CREATED : ObserveOutcome.Action.UPDATED,
                status,
                reason,
                parserId,
                parserError
        );
    }

    private static boolean settled(FileStatus status) {
        return status == FileStatus.ACTIVE || status == FileStatus.DAMAGED;
    }

    private ObserveOutcome vanished(String pathHash, String runId) {
        Optional<FileRecord> existing = store.findByPathHash(pathHash);
        if (existing.isPresent()) {
            store.markMissing(existing.get(), pathHash, runId, clock.getAsLong());
            return new ObserveOutcome(existing.get().id(), ObserveOutcome.Action.VANISHED,
                    FileStatus.MISSING, "file_not_found", null, null);
        }
        return new ObserveOutcome(null, ObserveOutcome.Action.VANISHED, FileStatus.MISSING, "file_not_found", null, null);
    }
}
