package io.codelab.ast;

import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

public record WhileLoop(
        @Nullable ASTNode test, @Nullable ASTNode body, @Nullable SourceRange range, Map<String, Object> metadata)
        implements ASTNode {

    public WhileLoop {
        metadata = Children.metadata(metadata);
    }

    public WhileLoop(@Nullable ASTNode test, @Nullable ASTNode body, @Nullable SourceRange range) {
        this(test, body, range, Map.of());
    }

    @Override
    public NodeType type() {
        return NodeType.WHILE_LOOP;
    }

    @Override
    public List<ASTNode> children() {
        return Children.ofOptional(test, body);
    }
}
