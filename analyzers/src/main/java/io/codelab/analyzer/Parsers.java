package io.codelab.analyzer;

import io.codelab.analyzer.java.JavaSourceParser;
import io.codelab.analyzer.python.PythonSourceParser;
import io.codelab.parser.ParserRegistry;
import io.codelab.parser.SourceParser;
import io.codelab.util.CodeLabSettings;
import java.util.Locale;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Factory for the bundled Tree-sitter parsers. */
public final class Parsers {
    private static final Logger logger = LogManager.getLogger(Parsers.class);

    private Parsers() {}

    /** A new registry holding the parsers named by {@code registry.defaultLanguages}, in that order. */
    public static ParserRegistry defaultRegistry() {
        return defaultRegistry(CodeLabSettings.get());
    }

    public static ParserRegistry defaultRegistry(CodeLabSettings settings) {
        var registry = new ParserRegistry();
        for (var languageId : settings.defaultLanguages()) {
            create(languageId, settings)
                    .ifPresentOrElse(
                            registry::register,
                            () -> logger.warn("Ignoring unknown language '{}' in default registry", languageId));
        }
        return registry;
    }

    /** A bundled parser for {@code languageId}, if there is one. */
    public static Optional<SourceParser> create(String languageId, CodeLabSettings settings) {
        return switch (languageId.toLowerCase(Locale.ROOT)) {
            case PythonSourceParser.LANGUAGE_ID -> Optional.of(new PythonSourceParser(settings));
            case JavaSourceParser.LANGUAGE_ID -> Optional.of(new JavaSourceParser(settings));
            default -> Optional.empty();
        };
    }
}
