package io.codelab.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** A free-standing (non-member) function. */
public record FunctionDeclaration(
        String name,
        List<Parameter> params,
        @Nullable BlockStatement body,
        boolean isAsync,
        boolean isGenerator,
        @Nullable String returnType,
        @Nullable SourceRange range,
        Map<String, Object> metadata)
        implements ASTNode {

    public FunctionDeclaration {
        Objects.requireNonNull(name);
        params = List.copyOf(params);
        metadata = Children.metadata(metadata);
    }

    public FunctionDeclaration(
            String name, List<Parameter> params, @Nullable BlockStatement body, @Nullable SourceRange range) {
        this(name, params, body, false, false, null, range, Map.of());
    }

    @Override
    public NodeType type() {
        return NodeType.FUNCTION_DECLARATION;
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
