package io.codelab.analyzer;

import io.codelab.ast.ASTNode;
import io.codelab.ast.BlockStatement;
import io.codelab.ast.CallExpression;
import io.codelab.ast.Identifier;
import io.codelab.ast.Program;
import io.codelab.ast.SourceRange;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Converts one native Tree-sitter tree into the generic AST. An instance holds the text of a single parse and is
 * discarded afterwards.
 *
 * <p>Nodes without a dedicated mapping become operator {@link CallExpression}s over their converted named children,
 * so every named node of the source survives conversion in some form.
 */
public abstract class TreeSitterAstBuilder {
    /** Metadata key naming the native statement a generic node was built from. */
    public static final String STATEMENT = "statement";

    protected final String source;
    protected final byte[] srcBytes;

    protected TreeSitterAstBuilder(String source, byte[] srcBytes) {
        this.source = source;
        this.srcBytes = srcBytes;
    }

    public abstract Program build(TSNode root);

    protected abstract boolean isStatement(String nodeType);

    /** Converts a statement; statements without a generic counterpart yield an empty list. */
    protected abstract List<ASTNode> convertStatement(TSNode node);

    protected abstract ASTNode convertExpression(TSNode node);

    protected String text(@Nullable TSNode node) {
        return TreeSitterNodes.text(node, srcBytes);
    }

    protected @Nullable String textOrNull(@Nullable TSNode node) {
        return TreeSitterNodes.isPresent(node) ? text(node) : null;
    }

    protected SourceRange range(TSNode node) {
        return TreeSitterNodes.range(node);
    }

    protected List<ASTNode> convertStatements(TSNode container) {
        var result = new ArrayList<ASTNode>();
        for (var child : TreeSitterNodes.namedChildren(container)) {
            result.addAll(convertStatement(child));
        }
        return result;
    }

    protected BlockStatement block(TSNode blockNode) {
        return new BlockStatement(convertStatements(blockNode), range(blockNode));
    }

    protected @Nullable BlockStatement blockOrNull(@Nullable TSNode blockNode) {
        return TreeSitterNodes.isPresent(blockNode) ? block(blockNode) : null;
    }

    protected @Nullable ASTNode convertOrNull(@Nullable TSNode node) {
        return TreeSitterNodes.isPresent(node) ? convertAny(node) : null;
    }

    /** Converts a node found in either statement or expression position. */
    protected ASTNode convertAny(TSNode node) {
        if (!isStatement(node.getType())) {
            return convertExpression(node);
        }
        var converted = convertStatement(node);
        if (converted.size() == 1) {
            return converted.get(0);
        }
        return new BlockStatement(converted, range(node), Map.of(STATEMENT, node.getType()));
    }

    /** Operator call over the named children of {@code node}, named after its operator token or its node type. */
    protected CallExpression operatorCall(TSNode node) {
        var operatorNode = TreeSitterNodes.field(node, "operator");
        var operator = operatorNode == null ? node.getType() : text(operatorNode);
        var operands = new ArrayList<ASTNode>();
        for (var child : TreeSitterNodes.namedChildren(node)) {
            operands.add(convertAny(child));
        }
        return CallExpression.operator(operator, operands, range(node));
    }

    /** Identifier for the base of a dotted access such as {@code a.b.c}, keeping the whole path in metadata. */
    protected Identifier pathIdentifier(String baseName, TSNode wholeAccess) {
        var path = text(wholeAccess).replaceAll("\\s+", "");
        return new Identifier(baseName, range(wholeAccess), Map.of(Identifier.PATH, path));
    }
}
