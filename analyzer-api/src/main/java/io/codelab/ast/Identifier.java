package io.codelab.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** A reference to a name. */
public record Identifier(String name, @Nullable SourceRange range, Map<String, Object> metadata) implements ASTNode {

    /** Metadata key holding the full dotted access path when the identifier is the base of a member access. */
    public static final String PATH = "path";

    public Identifier {
        Objects.requireNonNull(name);
        metadata = Children.metadata(metadata);
    }

    public Identifier(String name, @Nullable SourceRange range) {
        this(name, range, Map.of());
    }

    @Override
    public NodeType type() {
        return NodeType.IDENTIFIER;
    }

    @Override
    public Optional<String> symbolName() {
        return Optional.of(name);
    }

    @Override
    public List<ASTNode> children() {
        return List.of();
    }
}
