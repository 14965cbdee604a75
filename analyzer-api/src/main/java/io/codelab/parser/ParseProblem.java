package io.codelab.parser;

import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * An error or warning found while parsing.
 *
 * @param kind category, e.g. {@code SyntaxError}
 * @param message human readable description
 * @param line 1-based line, 0 when unknown
 * @param column 0-based column, 0 when unknown
 * @param text the offending source line, if known
 */
public record ParseProblem(String kind, String message, int line, int column, @Nullable String text) {

    public static final String SYNTAX_ERROR = "SyntaxError";
    public static final String ENCODING = "Encoding";

    public ParseProblem {
        Objects.requireNonNull(kind);
        Objects.requireNonNull(message);
    }

    public static ParseProblem syntaxError(String message, int line, int column, @Nullable String text) {
        return new ParseProblem(SYNTAX_ERROR, message, line, column, text);
    }

    @Override
    public String toString() {
        return kind + " at " + line + ":" + column + ": " + message;
    }
}
