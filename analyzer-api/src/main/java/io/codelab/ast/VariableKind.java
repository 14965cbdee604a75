package io.codelab.ast;

/** Binding flavour of a {@link VariableDeclaration}. */
public enum VariableKind {
    VAR,
    CONST
}
