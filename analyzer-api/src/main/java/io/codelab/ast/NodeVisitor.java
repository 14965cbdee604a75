package io.codelab.ast;

import org.jetbrains.annotations.Nullable;

/** Callback for {@link AstTraversal#walk}. */
@FunctionalInterface
public interface NodeVisitor {
    void visit(ASTNode node, @Nullable ASTNode parent);
}
