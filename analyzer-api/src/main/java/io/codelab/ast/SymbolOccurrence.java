package io.codelab.ast;

import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * One sighting of a name in a tree.
 *
 * @param kind the kind of node carrying the name
 * @param location where that node starts, if known
 * @param enclosingKind the kind of the node's parent, absent for the root
 */
public record SymbolOccurrence(NodeType kind, @Nullable SourceLocation location, @Nullable NodeType enclosingKind) {

    public SymbolOccurrence {
        Objects.requireNonNull(kind);
    }

    public boolean isDeclaration() {
        return kind == NodeType.VARIABLE_DECLARATION
                || kind == NodeType.FUNCTION_DECLARATION
                || kind == NodeType.METHOD_DECLARATION
                || kind == NodeType.CLASS_DECLARATION;
    }
}
