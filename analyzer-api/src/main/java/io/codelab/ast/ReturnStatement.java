package io.codelab.ast;

import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

public record ReturnStatement(@Nullable ASTNode argument, @Nullable SourceRange range, Map<String, Object> metadata)
        implements ASTNode {

    public ReturnStatement {
        metadata = Children.metadata(metadata);
    }

    public ReturnStatement(@Nullable ASTNode argument, @Nullable SourceRange range) {
        this(argument, range, Map.of());
    }

    @Override
    public NodeType type() {
        return NodeType.RETURN_STATEMENT;
    }

    @Override
    public List<ASTNode> children() {
        return Children.ofOptional(argument);
    }
}
