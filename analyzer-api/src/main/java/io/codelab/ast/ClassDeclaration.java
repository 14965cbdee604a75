package io.codelab.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * A class, interface or similar type declaration.
 *
 * @param superClass the first declared base, if any
 * @param interfaces further declared bases or implemented interfaces
 * @param body members and other statements of the class body, in order
 */
public record ClassDeclaration(
        String name,
        @Nullable String superClass,
        List<String> interfaces,
        List<ASTNode> body,
        @Nullable SourceRange range,
        Map<String, Object> metadata)
        implements ASTNode {

    public ClassDeclaration {
        Objects.requireNonNull(name);
        interfaces = List.copyOf(interfaces);
        body = List.copyOf(body);
        metadata = Children.metadata(metadata);
    }

    public ClassDeclaration(String name, List<ASTNode> body, @Nullable SourceRange range) {
        this(name, null, List.of(), body, range, Map.of());
    }

    @Override
    public NodeType type() {
        return NodeType.CLASS_DECLARATION;
    }

    @Override
    public Optional<String> symbolName() {
        return Optional.of(name);
    }

    @Override
    public List<ASTNode> children() {
        return body;
    }

    public List<MethodDeclaration> methods() {
        return body.stream()
                .filter(MethodDeclaration.class::isInstance)
                .map(MethodDeclaration.class::cast)
                .toList();
    }
}
