package io.codelab.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/** Root of every tree: the top-level statements of one source file. */
public record Program(
        List<ASTNode> body, String sourceType, @Nullable SourceRange range, Map<String, Object> metadata)
        implements ASTNode {

    public static final String MODULE = "module";

    public Program {
        body = List.copyOf(body);
        Objects.requireNonNull(sourceType);
        metadata = Children.metadata(metadata);
    }

    public Program(List<ASTNode> body, @Nullable SourceRange range) {
        this(body, MODULE, range, Map.of());
    }

    public static Program empty() {
        return new Program(List.of(), null);
    }

    @Override
    public NodeType type() {
        return NodeType.PROGRAM;
    }

    @Override
    public List<ASTNode> children() {
        return body;
    }
}
