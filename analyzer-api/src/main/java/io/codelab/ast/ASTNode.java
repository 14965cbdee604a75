package io.codelab.ast;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * A node of the language-agnostic syntax tree.
 *
 * <p>The variant is fixed by {@link #type()}. Generic algorithms only ever look at {@link #children()}, never at a
 * variant's own fields, so a new variant only has to say what its structural children are.
 *
 * <p>Nodes are immutable and hold no reference to their parent; traversals track the parent themselves.
 */
public sealed interface ASTNode
        permits Program,
                FunctionDeclaration,
                ClassDeclaration,
                MethodDeclaration,
                VariableDeclaration,
                IfStatement,
                WhileLoop,
                ForLoop,
                ReturnStatement,
                ExpressionStatement,
                BlockStatement,
                CallExpression,
                Identifier,
                Literal {

    NodeType type();

    @Nullable
    SourceRange range();

    /** Auxiliary, front-end specific attributes. Never null, possibly empty. */
    Map<String, Object> metadata();

    /** Structural children in their natural order. Empty for leaves. */
    List<ASTNode> children();

    /** The declared or referenced name, for variants that carry one. */
    default Optional<String> symbolName() {
        return Optional.empty();
    }

    default Optional<SourceLocation> start() {
        var range = range();
        return range == null ? Optional.empty() : Optional.of(range.start());
    }
}
