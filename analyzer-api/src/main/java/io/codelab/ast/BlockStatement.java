package io.codelab.ast;

import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/** An ordered statement sequence. Front-ends may tag compound statements they flatten into a block in metadata. */
public record BlockStatement(List<ASTNode> body, @Nullable SourceRange range, Map<String, Object> metadata)
        implements ASTNode {

    public BlockStatement {
        body = List.copyOf(body);
        metadata = Children.metadata(metadata);
    }

    public BlockStatement(List<ASTNode> body, @Nullable SourceRange range) {
        this(body, range, Map.of());
    }

    @Override
    public NodeType type() {
        return NodeType.BLOCK_STATEMENT;
    }

    @Override
    public List<ASTNode> children() {
        return body;
    }
}
