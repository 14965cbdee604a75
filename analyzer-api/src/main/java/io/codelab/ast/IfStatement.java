package io.codelab.ast;

import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/** A conditional; {@code else if} chains nest further {@code IfStatement}s in {@code alternate}. */
public record IfStatement(
        @Nullable ASTNode test,
        @Nullable ASTNode consequent,
        @Nullable ASTNode alternate,
        @Nullable SourceRange range,
        Map<String, Object> metadata)
        implements ASTNode {

    public IfStatement {
        metadata = Children.metadata(metadata);
    }

    public IfStatement(
            @Nullable ASTNode test,
            @Nullable ASTNode consequent,
            @Nullable ASTNode alternate,
            @Nullable SourceRange range) {
        this(test, consequent, alternate, range, Map.of());
    }

    @Override
    public NodeType type() {
        return NodeType.IF_STATEMENT;
    }

    @Override
    public List<ASTNode> children() {
        return Children.ofOptional(test, consequent, alternate);
    }
}
