package io.codelab.ast;

import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * A counting or iterating loop. Iteration-style loops ({@code for x in xs}) put the loop target in {@code init} and
 * the iterable in {@code test}.
 */
public record ForLoop(
        @Nullable ASTNode init,
        @Nullable ASTNode test,
        @Nullable ASTNode update,
        @Nullable ASTNode body,
        @Nullable SourceRange range,
        Map<String, Object> metadata)
        implements ASTNode {

    public ForLoop {
        metadata = Children.metadata(metadata);
    }

    public ForLoop(
            @Nullable ASTNode init,
            @Nullable ASTNode test,
            @Nullable ASTNode update,
            @Nullable ASTNode body,
            @Nullable SourceRange range) {
        this(init, test, update, body, range, Map.of());
    }

    @Override
    public NodeType type() {
        return NodeType.FOR_LOOP;
    }

    @Override
    public List<ASTNode> children() {
        return Children.ofOptional(init, test, update, body);
    }
}
