package io.codelab.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * A constant.
 *
 * @param value the decoded value ({@link Long}, {@link Double}, {@link Boolean}, {@link String}) or null for null-like
 *     constants and values the front-end does not decode
 * @param raw the source text
 */
public record Literal(@Nullable Object value, String raw, @Nullable SourceRange range, Map<String, Object> metadata)
        implements ASTNode {

    public Literal {
        Objects.requireNonNull(raw);
        metadata = Children.metadata(metadata);
    }

    public Literal(@Nullable Object value, String raw, @Nullable SourceRange range) {
        this(value, raw, range, Map.of());
    }

    @Override
    public NodeType type() {
        return NodeType.LITERAL;
    }

    @Override
    public List<ASTNode> children() {
        return List.of();
    }
}
