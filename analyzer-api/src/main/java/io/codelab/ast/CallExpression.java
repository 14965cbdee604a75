package io.codelab.ast;

import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * A call. Operator and container expressions that have no node kind of their own are also modelled as calls, with
 * no callee and the operator recorded under {@link #OPERATOR}.
 */
public record CallExpression(
        @Nullable ASTNode callee,
        List<ASTNode> arguments,
        @Nullable SourceRange range,
        Map<String, Object> metadata)
        implements ASTNode {

    public static final String OPERATOR = "operator";

    public CallExpression {
        arguments = List.copyOf(arguments);
        metadata = Children.metadata(metadata);
    }

    public CallExpression(@Nullable ASTNode callee, List<ASTNode> arguments, @Nullable SourceRange range) {
        this(callee, arguments, range, Map.of());
    }

    public static CallExpression operator(String operator, List<ASTNode> operands, @Nullable SourceRange range) {
        return new CallExpression(null, operands, range, Map.of(OPERATOR, operator));
    }

    @Override
    public NodeType type() {
        return NodeType.CALL_EXPRESSION;
    }

    @Override
    public List<ASTNode> children() {
        return Children.concat(callee, arguments);
    }

    public boolean isOperator() {
        return callee == null && metadata.containsKey(OPERATOR);
    }
}
