package io.codelab.parser;

import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Facts about one parse call.
 *
 * @param language id of the parser that produced the tree
 * @param parseTimeMs wall time of the call in milliseconds
 * @param nodeCount nodes in the produced generic tree
 * @param lineCount lines in the source; a trailing newline does not add a line
 * @param filename the name passed to the parser, if any
 */
public record ParseMetadata(
        String language, double parseTimeMs, int nodeCount, int lineCount, @Nullable String filename) {

    public ParseMetadata {
        Objects.requireNonNull(language);
    }
}
