package io.codelab.ast;

import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

public record ExpressionStatement(
        @Nullable ASTNode expression, @Nullable SourceRange range, Map<String, Object> metadata)
        implements ASTNode {

    public ExpressionStatement {
        metadata = Children.metadata(metadata);
    }

    public ExpressionStatement(@Nullable ASTNode expression, @Nullable SourceRange range) {
        this(expression, range, Map.of());
    }

    @Override
    public NodeType type() {
        return NodeType.EXPRESSION_STATEMENT;
    }

    @Override
    public List<ASTNode> children() {
        return Children.ofOptional(expression);
    }
}
