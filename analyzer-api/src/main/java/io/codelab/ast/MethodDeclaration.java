package io.codelab.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** A function declared as a member of a class. */
public record MethodDeclaration(
        String name,
        List<Parameter> params,
        @Nullable BlockStatement body,
        boolean isStatic,
        boolean isAsync,
        @Nullable String visibility,
        @Nullable SourceRange range,
        Map<String, Object> metadata)
        implements ASTNode {

    public MethodDeclaration {
        Objects.requireNonNull(name);
        params = List.copyOf(params);
        metadata = Children.metadata(metadata);
    }

    @Override
    public NodeType type() {
        return NodeType.METHOD_DECLARATION;
    }

    @Override
    public Optional<String> symbolName() {
        return Optional.of(name);
    }

    @Override
    public List<ASTNode> children() {
        return Children.ofOptional(body);
    }

    public List<String> paramNames() {
        return params.stream().map(Parameter::name).toList();
    }
}
