package io.codelab.analyzer;

import io.codelab.ast.SourceLocation;
import io.codelab.ast.SourceRange;
import io.codelab.parser.ParseProblem;
import io.codelab.util.TextCanonicalizer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Helpers for reading Tree-sitter nodes: null-safe field access, text extraction from UTF-8 byte offsets, and
 * recursive searches.
 */
public final class TreeSitterNodes {
    private static final Logger log = LogManager.getLogger(TreeSitterNodes.class);

    public static final String COMMENT = "comment";
    public static final String ERROR = "ERROR";

    private TreeSitterNodes() {}

    public static boolean isPresent(@Nullable TSNode node) {
        return node != null && !node.isNull();
    }

    /** The child stored under {@code fieldName}, or null when the field is absent. */
    public static @Nullable TSNode field(TSNode node, String fieldName) {
        var child = node.getChildByFieldName(fieldName);
        return isPresent(child) ? child : null;
    }

    /** Named children without comments, error nodes and zero-width recovery tokens. */
    public static List<TSNode> namedChildren(TSNode node) {
        var result = new ArrayList<TSNode>(node.getNamedChildCount());
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            var child = node.getNamedChild(i);
            if (!isPresent(child) || child.isMissing()) {
                continue;
            }
            var type = child.getType();
            if (COMMENT.equals(type) || ERROR.equals(type)) {
                continue;
            }
            result.add(child);
        }
        return result;
    }

    public static List<TSNode> namedChildrenOfType(TSNode node, String type) {
        return namedChildren(node).stream().filter(c -> type.equals(c.getType())).toList();
    }

    /** All children stored under {@code fieldName}, for fields that may repeat such as a for loop's updates. */
    public static List<TSNode> childrenByField(TSNode node, String fieldName) {
        var result = new ArrayList<TSNode>();
        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (isPresent(child) && fieldName.equals(node.getFieldNameForChild(i))) {
                result.add(child);
            }
        }
        return result;
    }

    public static @Nullable TSNode firstNamedChild(TSNode node) {
        var children = namedChildren(node);
        return children.isEmpty() ? null : children.get(0);
    }

    /** True if {@code child} is the node stored under {@code fieldName} of {@code parent}. */
    public static boolean isField(TSNode parent, TSNode child, String fieldName) {
        var fieldNode = field(parent, fieldName);
        return fieldNode != null
                && fieldNode.getStartByte() == child.getStartByte()
                && fieldNode.getEndByte() == child.getEndByte()
                && fieldNode.getType().equals(child.getType());
    }

    /** True if an unnamed child token of {@code node} has the given type, e.g. {@code "async"}. */
    public static boolean hasToken(TSNode node, String tokenType) {
        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (isPresent(child) && !child.isNamed() && tokenType.equals(child.getType())) {
                return true;
            }
        }
        return false;
    }

    /** Recursively finds all nodes matching the given predicate, in pre-order. */
    public static List<TSNode> findAllNodesRecursive(TSNode rootNode, Predicate<TSNode> predicate) {
        var results = new ArrayList<TSNode>();
        findAllNodesRecursiveInternal(rootNode, predicate, node -> true, results);
        return results;
    }

    /**
     * Like {@link #findAllNodesRecursive} but does not look inside nodes rejected by {@code descend}. The root is
     * always searched.
     */
    public static List<TSNode> findAllNodesRecursive(
            TSNode rootNode, Predicate<TSNode> predicate, Predicate<TSNode> descend) {
        var results = new ArrayList<TSNode>();
        findAllNodesRecursiveInternal(rootNode, predicate, node -> node == rootNode || descend.test(node), results);
        return results;
    }

    private static void findAllNodesRecursiveInternal(
            @Nullable TSNode node, Predicate<TSNode> predicate, Predicate<TSNode> descend, List<TSNode> results) {
        if (!isPresent(node)) {
            return;
        }

        if (predicate.test(node)) {
            results.add(node);
        }
        if (!descend.test(node)) {
            return;
        }

        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (isPresent(child)) {
                findAllNodesRecursiveInternal(child, predicate, descend, results);
            }
        }
    }

    /** Extracts the UTF-8 text spanned by {@code node}. */
    public static String text(@Nullable TSNode node, byte[] srcBytes) {
        if (!isPresent(node)) {
            return "";
        }
        return textSlice(node.getStartByte(), node.getEndByte(), srcBytes);
    }

    public static String textSlice(int startByte, int endByte, byte[] bytes) {
        if (startByte < 0 || endByte > bytes.length || startByte > endByte) {
            log.warn("Invalid byte range [{}, {}] for byte array of length {}", startByte, endByte, bytes.length);
            return "";
        }

        // Handle zero-width nodes (same start and end position) - valid case
        if (startByte == endByte) {
            return "";
        }

        return new String(bytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }

    /** 1-based first line of {@code node}. */
    public static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /**
     * 1-based last line holding text of {@code node}. A node that ends right after a line break is reported as
     * ending on the line of that break.
     */
    public static int endLine(TSNode node) {
        var end = node.getEndPoint();
        var start = node.getStartPoint();
        if (end.getColumn() == 0 && end.getRow() > start.getRow()) {
            return end.getRow();
        }
        return end.getRow() + 1;
    }

    public static SourceRange range(TSNode node) {
        var start = node.getStartPoint();
        var end = node.getEndPoint();
        return new SourceRange(
                new SourceLocation(start.getRow() + 1, start.getColumn()),
                new SourceLocation(end.getRow() + 1, end.getColumn()));
    }

    /** Range from the start of {@code from} to the end of {@code to}. */
    public static SourceRange range(TSNode from, TSNode to) {
        var start = range(from).start();
        var end = range(to).end();
        return start.isAfter(end) ? range(from) : new SourceRange(start, end);
    }

    /** Records every error node and zero-width recovery token below {@code node}, in source order. */
    public static void collectSyntaxErrors(TSNode node, String source, List<ParseProblem> errors) {
        if (node.isMissing()) {
            var start = node.getStartPoint();
            errors.add(ParseProblem.syntaxError(
                    "missing " + node.getType(),
                    start.getRow() + 1,
                    start.getColumn(),
                    TextCanonicalizer.lineAt(source, start.getRow() + 1)));
            return;
        }
        if (ERROR.equals(node.getType())) {
            var start = node.getStartPoint();
            errors.add(ParseProblem.syntaxError(
                    "invalid syntax",
                    start.getRow() + 1,
                    start.getColumn(),
                    TextCanonicalizer.lineAt(source, start.getRow() + 1)));
            return;
        }
        if (!node.hasError()) {
            return;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (isPresent(child)) {
                collectSyntaxErrors(child, source, errors);
            }
        }
    }
}
