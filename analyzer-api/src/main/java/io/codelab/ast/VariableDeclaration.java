package io.codelab.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** A named binding, optionally initialised. */
public record VariableDeclaration(
        String name,
        VariableKind kind,
        @Nullable ASTNode init,
        @Nullable String typeAnnotation,
        @Nullable SourceRange range,
        Map<String, Object> metadata)
        implements ASTNode {

    public VariableDeclaration {
        Objects.requireNonNull(name);
        Objects.requireNonNull(kind);
        metadata = Children.metadata(metadata);
    }

    public VariableDeclaration(String name, @Nullable ASTNode init, @Nullable SourceRange range) {
        this(name, VariableKind.VAR, init, null, range, Map.of());
    }

    @Override
    public NodeType type() {
        return NodeType.VARIABLE_DECLARATION;
    }

    @Override
    public Optional<String> symbolName() {
        return Optional.of(name);
    }

    @Override
    public List<ASTNode> children() {
        return Children.ofOptional(init);
    }
}
