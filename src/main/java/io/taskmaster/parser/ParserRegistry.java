package io.taskmaster.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered parser list; the first parser whose {@link Parser#supports} accepts a path wins.
 */
public final class ParserRegistry {
    private static final Logger log = LoggerFactory.getLogger(ParserRegistry.class);

    private final List<Parser> parsers = new CopyOnWriteArrayList<>();

    public static ParserRegistry withDefaults() {
        ParserRegistry registry = new ParserRegistry();
        registry.register(new PdfSignatureParser());
        registry.register(new DocxPackageParser());
        registry.register(new PlainTextParser());
        return registry;
    }

    public void register(Parser parser) {
        for (Parser existing : parsers) {
            if (existing.id().equals(parser.id())) {
                throw new IllegalArgumentException("Parser already registered: " + parser.id());
            }
        }
        parsers.add(parser);
    }

    /**
     * Places {@code parser} ahead of every registered parser.
     */
    public void registerFirst(Parser parser) {
        for (Parser existing : parsers) {
            if (existing.id().equals(parser.id())) {
                throw new IllegalArgumentException("Parser already registered: " + parser.id());
            }
        }
        parsers.add(0, parser);
    }

    public Optional<Parser> find(Path path) {
        return Optional.ofNullable(resolve(path).parser());
    }

    /**
     * Like {@link #find}, but a parser whose {@code supports} throws is skipped rather than
     * ending the lookup. The first such failure is reported on the result.
     */
    public Resolution resolve(Path path) {
        String failedParserId = null;
        String failure = null;
        for (Parser parser : parsers) {
            boolean supported;
            try {
                supported = parser.supports(path);
            } catch (RuntimeException e) {
                log.warn("Parser {} failed to inspect {}: {}", parser.id(), path, e.toString());
                if (failedParserId == null) {
                    failedParserId = parser.id();
                    failure = e.getClass().getSimpleName() + ": " + e.getMessage();
                }
                continue;
            }
            if (supported) {
                return new Resolution(parser, failedParserId, failure);
            }
        }
        return new Resolution(null, failedParserId, failure);
    }

    public List<String> listParserIds() {
        List<String> ids = new ArrayList<>();
        for (Parser parser : parsers) {
            ids.add(parser.id());
        }
        return ids;
    }

    public record Resolution(Parser parser, String failedParserId, String failure) {
        public boolean failed() {
            return failure != null;
        }
    }
}
