package io.taskmaster.parser;

import java.nio.file.Path;
import java.util.Map;

/**
 * Pluggable per-format extractor. Implementations must be stateless and thread-safe; the
 * same instance serves every worker.
 */
public interface Parser {
    String id();

    boolean supports(Path path);

    /**
     * Cheap structural check. An invalid result marks the file damaged; an exception is
     * treated as unreadable bytes.
     */
    ValidationResult quickValidate(Path path) throws Exception;

    Map<String, Object> extractIndexMetadata(Path path) throws Exception;
}
