package io.codelab.parser;

import io.codelab.exception.ParserConfigurationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Maps language ids to parsers. Create one per caller (or per test); registries share nothing.
 *
 * <p>Ids are case-insensitive. Iteration order, which decides {@link #getParserByFilename} when several parsers
 * claim the same extension, is registration order; re-registering an id replaces its parser but keeps its position.
 *
 * <p>Not thread-safe: hosts that mutate a registry while other threads look parsers up must serialize access
 * themselves. {@link #clear()} tears the registry down.
 */
public class ParserRegistry {
    private static final Logger logger = LogManager.getLogger(ParserRegistry.class);

    private final Map<String, SourceParser> parsers = new LinkedHashMap<>();

    private static String key(String languageId) {
        return languageId.toLowerCase(Locale.ROOT);
    }

    /** Registers {@code parser} under {@code languageId}, replacing any parser already registered for it. */
    public void register(String languageId, SourceParser parser) {
        var previous = parsers.put(key(languageId), parser);
        if (previous != null && previous != parser) {
            logger.debug(
                    "Replaced parser for {}: {} -> {}",
                    languageId,
                    previous.getClass().getSimpleName(),
                    parser.getClass().getSimpleName());
        }
    }

    /** Registers {@code parser} under its own {@link SourceParser#languageId()}. */
    public void register(SourceParser parser) {
        register(parser.languageId(), parser);
    }

    /** @return true if a parser was registered for {@code languageId} */
    public boolean unregister(String languageId) {
        return parsers.remove(key(languageId)) != null;
    }

    public Optional<SourceParser> getParser(String languageId) {
        return Optional.ofNullable(parsers.get(key(languageId)));
    }

    /** The first parser, in registration order, that accepts {@code filename}. */
    public Optional<SourceParser> getParserByFilename(String filename) {
        for (var parser : parsers.values()) {
            if (parser.canParse(filename)) {
                return Optional.of(parser);
            }
        }
        return Optional.empty();
    }

    public List<String> registeredLanguages() {
        return List.copyOf(parsers.keySet());
    }

    public boolean isEmpty() {
        return parsers.isEmpty();
    }

    /**
     * Parses {@code code} with the parser registered for {@code languageId}.
     *
     * @throws ParserConfigurationException if no parser is registered for {@code languageId}
     */
    public ParseResult parse(String code, String languageId, @Nullable String filename) {
        var parser = getParser(languageId).orElseThrow(() -> ParserConfigurationException.forLanguage(languageId));
        return parser.parse(code, filename);
    }

    public ParseResult parse(String code, String languageId) {
        return parse(code, languageId, null);
    }

    /**
     * Reads {@code path} as UTF-8 and parses it with the first parser accepting its file name. The parser's own
     * errors and warnings are returned as-is.
     *
     * @throws ParserConfigurationException if no registered parser accepts the file name; the file is not read
     * @throws IOException if reading fails
     */
    public ParseResult parseFile(Path path) throws IOException {
        var filename = path.toString();
        var parser = getParserByFilename(filename).orElseThrow(() -> ParserConfigurationException.forFile(filename));
        var code = Files.readString(path, StandardCharsets.UTF_8);
        logger.trace("Parsing {} as {}", path, parser.languageId());
        return parser.parse(code, filename);
    }

    public void clear() {
        parsers.clear();
    }
}
