package io.codelab.ast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiPredicate;
import org.jetbrains.annotations.Nullable;

/**
 * Queries over the generic syntax tree. Every operation descends through {@link ASTNode#children()} only, so it works
 * for any front-end and for partial trees produced after syntax errors.
 *
 * <p>All methods are stateless; counters are carried as return values of the recursive helpers.
 */
public final class AstTraversal {

    private AstTraversal() {}

    /** Pre-order depth-first walk. The root is visited with a null parent. */
    public static void walk(ASTNode node, NodeVisitor visitor) {
        walk(node, null, visitor);
    }

    private static void walk(ASTNode node, @Nullable ASTNode parent, NodeVisitor visitor) {
        visitor.visit(node, parent);
        for (var child : node.children()) {
            walk(child, node, visitor);
        }
    }

    /**
     * Pre-order walk that skips the subtree of every node for which {@code enter} returns false. The node itself has
     * already been seen at that point.
     */
    public static void walkWhile(ASTNode node, BiPredicate<ASTNode, ASTNode> enter) {
        walkWhile(node, null, enter);
    }

    private static void walkWhile(
            ASTNode node, @Nullable ASTNode parent, BiPredicate<ASTNode, ASTNode> enter) {
        if (!enter.test(node, parent)) {
            return;
        }
        for (var child : node.children()) {
            walkWhile(child, node, enter);
        }
    }

    /** All nodes of the given kind, in pre-order. */
    public static List<ASTNode> findNodesByType(ASTNode ast, NodeType type) {
        var results = new ArrayList<ASTNode>();
        walk(ast, (node, parent) -> {
            if (node.type() == type) {
                results.add(node);
            }
        });
        return results;
    }

    /** Typed variant of {@link #findNodesByType}. */
    public static <T extends ASTNode> List<T> findNodes(ASTNode ast, Class<T> variant) {
        var results = new ArrayList<T>();
        walk(ast, (node, parent) -> {
            if (variant.isInstance(node)) {
                results.add(variant.cast(node));
            }
        });
        return results;
    }

    /**
     * The last node, in pre-order, whose range covers {@code line}. Every match replaces the previous one, so for
     * trees whose siblings do not overlap this is the innermost node on that line.
     */
    public static Optional<ASTNode> findNodeAtLine(ASTNode ast, int line) {
        return Optional.ofNullable(lastAtLine(ast, line, null));
    }

    private static @Nullable ASTNode lastAtLine(ASTNode node, int line, @Nullable ASTNode found) {
        var range = node.range();
        var current = range != null && range.containsLine(line) ? node : found;
        for (var child : node.children()) {
            current = lastAtLine(child, line, current);
        }
        return current;
    }

    /** All nodes whose range lies fully inside {@code [lo, hi]}, in pre-order. Nodes without a range never match. */
    public static List<ASTNode> findNodesAtRange(ASTNode ast, SourceLocation lo, SourceLocation hi) {
        var results = new ArrayList<ASTNode>();
        walk(ast, (node, parent) -> {
            var range = node.range();
            if (range != null && range.isWithin(lo, hi)) {
                results.add(node);
            }
        });
        return results;
    }

    public static int countNodes(ASTNode ast) {
        int count = 1;
        for (var child : ast.children()) {
            count += countNodes(child);
        }
        return count;
    }

    /** Deepest nesting of structural children; a lone root has depth 0. */
    public static int getMaxDepth(ASTNode ast) {
        int deepest = 0;
        for (var child : ast.children()) {
            deepest = Math.max(deepest, 1 + getMaxDepth(child));
        }
        return deepest;
    }

    /**
     * Structural cyclomatic complexity: 1 plus one for every if, while and for node in the subtree. Language analyzers
     * refine this on their native trees.
     */
    public static int calculateComplexity(ASTNode node) {
        return 1 + countBranches(node);
    }

    private static int countBranches(ASTNode node) {
        int branches = node.type().isBranching() ? 1 : 0;
        for (var child : node.children()) {
            branches += countBranches(child);
        }
        return branches;
    }

    /**
     * Maps every non-empty name in the tree to its occurrences in pre-order. Names are not scoped: a name used in two
     * unrelated functions shares one entry.
     */
    public static Map<String, List<SymbolOccurrence>> buildSymbolTable(ASTNode ast) {
        var table = new LinkedHashMap<String, List<SymbolOccurrence>>();
        walk(ast, (node, parent) -> node.symbolName()
                .filter(name -> !name.isEmpty())
                .ifPresent(name -> table.computeIfAbsent(name, k -> new ArrayList<>())
                        .add(new SymbolOccurrence(
                                node.type(), node.start().orElse(null), parent == null ? null : parent.type()))));
        return table;
    }

    /**
     * Names of declared variables that are never mentioned again anywhere in the tree, in declaration order.
     *
     * <p>This is a coarse heuristic: a name counts as used if it appears anywhere else, regardless of scope,
     * shadowing or aliasing.
     */
    public static List<String> findUnusedVariables(ASTNode ast) {
        var table = buildSymbolTable(ast);
        var unused = new LinkedHashSet<String>();
        for (var declaration : findNodes(ast, VariableDeclaration.class)) {
            var occurrences = table.get(declaration.name());
            if (occurrences != null && occurrences.size() == 1) {
                unused.add(declaration.name());
            }
        }
        return List.copyOf(unused);
    }

    public static List<FunctionDeclaration> getFunctions(ASTNode ast) {
        return findNodes(ast, FunctionDeclaration.class);
    }

    public static List<ClassDeclaration> getClasses(ASTNode ast) {
        return findNodes(ast, ClassDeclaration.class);
    }

    public static List<VariableDeclaration> getVariables(ASTNode ast) {
        return findNodes(ast, VariableDeclaration.class);
    }

    public static CodeMetrics extractMetrics(ASTNode ast) {
        var counts = tally(ast, new int[NodeType.values().length]);
        return new CodeMetrics(
                counts[NodeType.FUNCTION_DECLARATION.ordinal()],
                counts[NodeType.CLASS_DECLARATION.ordinal()],
                counts[NodeType.VARIABLE_DECLARATION.ordinal()],
                counts[NodeType.IF_STATEMENT.ordinal()],
                counts[NodeType.WHILE_LOOP.ordinal()] + counts[NodeType.FOR_LOOP.ordinal()],
                calculateComplexity(ast),
                getMaxDepth(ast),
                countNodes(ast));
    }

    private static int[] tally(ASTNode node, int[] counts) {
        counts[node.type().ordinal()]++;
        for (var child : node.children()) {
            tally(child, counts);
        }
        return counts;
    }
}
