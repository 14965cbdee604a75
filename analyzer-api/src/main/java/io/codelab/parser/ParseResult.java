package io.codelab.parser;

import io.codelab.ast.Program;
import java.util.List;
import java.util.Objects;

/**
 * Everything a parse call produces. Recoverable syntax errors are reported in {@link #errors()}; {@link #ast()} is
 * then the part of the tree that could be recovered, possibly empty.
 */
public record ParseResult(
        Program ast, List<ParseProblem> errors, List<ParseProblem> warnings, ParseMetadata metadata) {

    public ParseResult {
        Objects.requireNonNull(ast);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        Objects.requireNonNull(metadata);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
