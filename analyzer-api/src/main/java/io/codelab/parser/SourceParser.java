package io.codelab.parser;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Turns source text of one language into a {@link ParseResult}.
 *
 * <p>Implementations keep no state about what they parsed: every call builds a fresh tree owned by the caller.
 */
public interface SourceParser {

    /**
     * Parses {@code source}. Syntax errors never escape as exceptions; they are returned in
     * {@link ParseResult#errors()} together with whatever tree could be recovered.
     */
    ParseResult parse(String source, @Nullable String filename);

    default ParseResult parse(String source) {
        return parse(source, null);
    }

    /** Lowercase file extensions, without the dot. */
    Set<String> supportedExtensions();

    String languageId();

    default boolean canParse(String filename) {
        return extensionOf(filename)
                .map(ext -> supportedExtensions().contains(ext))
                .orElse(false);
    }

    /**
     * The lowercased text after the last dot of the file name component of {@code filename}, or empty when the name
     * has no dot.
     */
    static Optional<String> extensionOf(String filename) {
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        var name = filename.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        return Optional.of(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
