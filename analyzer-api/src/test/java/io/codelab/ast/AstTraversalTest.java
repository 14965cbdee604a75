package io.codelab.ast;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class AstTraversalTest {

    private static SourceRange lines(int from, int to) {
        return SourceRange.of(from, 0, to, 10);
    }

    /**
     * <pre>
     * x = 1
     * def f(a):
     *     if a:
     *         return x
     *     return 0
     * class C:
     *     def m(self): ...
     * </pre>
     */
    private static Program sample() {
        var declX = new VariableDeclaration("x", new Literal(1L, "1", SourceRange.of(1, 4, 1, 5)), lines(1, 1));
        var ifStatement = new IfStatement(
                new Identifier("a", SourceRange.of(3, 7, 3, 8)),
                new BlockStatement(
                        List.of(new ReturnStatement(new Identifier("x", SourceRange.of(4, 15, 4, 16)), lines(4, 4))),
                        lines(4, 4)),
                null,
                lines(3, 4));
        var returnZero = new ReturnStatement(new Literal(0L, "0", SourceRange.of(5, 11, 5, 12)), lines(5, 5));
        var function = new FunctionDeclaration(
                "f", List.of(Parameter.named("a")), new BlockStatement(List.of(ifStatement, returnZero), lines(3, 5)),
                lines(2, 5));
        var method = new MethodDeclaration(
                "m", List.of(Parameter.named("self")), null, false, false, "public", lines(7, 7), Map.of());
        var cls = new ClassDeclaration("C", List.of(method), lines(6, 7));
        return new Program(List.of(declX, function, cls), lines(1, 7));
    }

    @Test
    void testCountNodesMatchesWalkVisits() {
        var ast = sample();
        var visits = new int[1];
        AstTraversal.walk(ast, (node, parent) -> visits[0]++);
        assertEquals(visits[0], AstTraversal.countNodes(ast));
        assertEquals(14, visits[0]);
    }

    @Test
    void testWalkPassesParents() {
        var ast = sample();
        var parents = new ArrayList<ASTNode>();
        AstTraversal.walk(ast, (node, parent) -> {
            if (node instanceof Program) {
                assertNull(parent);
            } else {
                assertNotNull(parent);
                assertTrue(parent.children().contains(node));
                parents.add(parent);
            }
        });
        assertEquals(13, parents.size());
    }

    @Test
    void testFindNodesByTypeIsWalkSubsequence() {
        var ast = sample();
        for (var type : NodeType.values()) {
            var expected = new ArrayList<ASTNode>();
            AstTraversal.walk(ast, (node, parent) -> {
                if (node.type() == type) {
                    expected.add(node);
                }
            });
            assertEquals(expected, AstTraversal.findNodesByType(ast, type), "mismatch for " + type);
        }
    }

    @Test
    void testWalkWhilePrunesSubtrees() {
        var ast = sample();
        var visited = new ArrayList<NodeType>();
        AstTraversal.walkWhile(ast, (node, parent) -> {
            visited.add(node.type());
            return !(node instanceof FunctionDeclaration);
        });
        assertTrue(visited.contains(NodeType.FUNCTION_DECLARATION));
        assertFalse(visited.contains(NodeType.IF_STATEMENT));
        assertTrue(visited.contains(NodeType.METHOD_DECLARATION));
    }

    @Test
    void testTypedHelpers() {
        var ast = sample();
        assertEquals(List.of("f"), AstTraversal.getFunctions(ast).stream().map(FunctionDeclaration::name).toList());
        assertEquals(List.of("C"), AstTraversal.getClasses(ast).stream().map(ClassDeclaration::name).toList());
        assertEquals(List.of("x"), AstTraversal.getVariables(ast).stream().map(VariableDeclaration::name).toList());
        assertEquals(1, AstTraversal.findNodes(ast, MethodDeclaration.class).size());
    }

    @Test
    void testComplexityIncreasesByOnePerIf() {
        var ast = sample();
        var function = AstTraversal.getFunctions(ast).get(0);
        int before = AstTraversal.calculateComplexity(function);
        assertEquals(2, before);

        var body = function.body();
        assertNotNull(body);
        var extended = new ArrayList<>(body.body());
        extended.add(new IfStatement(new Identifier("b", null), null, null, null));
        var grown = new FunctionDeclaration(
                function.name(), function.params(), new BlockStatement(extended, body.range()), function.range());
        assertEquals(before + 1, AstTraversal.calculateComplexity(grown));
    }

    @Test
    void testLoopsCountTowardsComplexity() {
        var loop = new WhileLoop(new Identifier("go", null), new ForLoop(null, null, null, null, null), null);
        assertEquals(3, AstTraversal.calculateComplexity(loop));
        assertEquals(1, AstTraversal.calculateComplexity(new Identifier("x", null)));
    }

    @Test
    void testFindNodeAtLineReturnsLastPreOrderMatch() {
        var ast = sample();
        var atFour = AstTraversal.findNodeAtLine(ast, 4);
        assertTrue(atFour.isPresent());
        assertEquals(NodeType.IDENTIFIER, atFour.get().type());
        assertEquals(Map.of(), atFour.get().metadata());

        var atSix = AstTraversal.findNodeAtLine(ast, 6);
        assertEquals(NodeType.CLASS_DECLARATION, atSix.orElseThrow().type());

        assertTrue(AstTraversal.findNodeAtLine(ast, 42).isEmpty());
    }

    @Test
    void testFindNodeAtLineOverlappingSiblingsLastWins() {
        var first = new ExpressionStatement(new Identifier("a", null), lines(1, 3));
        var second = new ExpressionStatement(null, lines(2, 2));
        var program = new Program(List.of(first, second), lines(1, 3));
        assertSame(second, AstTraversal.findNodeAtLine(program, 2).orElseThrow());
    }

    @Test
    void testFindNodesAtRange() {
        var ast = sample();
        var found = AstTraversal.findNodesAtRange(ast, SourceLocation.of(3, 0), SourceLocation.of(4, 20));
        assertEquals(
                List.of(
                        NodeType.IF_STATEMENT,
                        NodeType.IDENTIFIER,
                        NodeType.BLOCK_STATEMENT,
                        NodeType.RETURN_STATEMENT,
                        NodeType.IDENTIFIER),
                found.stream().map(ASTNode::type).toList());
    }

    @Test
    void testMaxDepth() {
        assertEquals(0, AstTraversal.getMaxDepth(Program.empty()));
        // Program > FunctionDeclaration > BlockStatement > IfStatement > BlockStatement > ReturnStatement > Identifier
        assertEquals(6, AstTraversal.getMaxDepth(sample()));
    }

    @Test
    void testSymbolTable() {
        var table = AstTraversal.buildSymbolTable(sample());
        assertEquals(List.of("x", "f", "a", "C", "m"), List.copyOf(table.keySet()));

        var x = table.get("x");
        assertEquals(2, x.size());
        assertTrue(x.get(0).isDeclaration());
        assertEquals(NodeType.PROGRAM, x.get(0).enclosingKind());
        assertEquals(SourceLocation.of(1, 0), x.get(0).location());
        assertEquals(NodeType.IDENTIFIER, x.get(1).kind());
        assertEquals(NodeType.RETURN_STATEMENT, x.get(1).enclosingKind());
    }

    @Test
    void testSymbolTableSkipsEmptyNames() {
        var program = new Program(List.of(new ExpressionStatement(new Identifier("", null), null)), null);
        assertTrue(AstTraversal.buildSymbolTable(program).isEmpty());
    }

    @Test
    void testFindUnusedVariables() {
        var used = new VariableDeclaration("used", null, null);
        var unused = new VariableDeclaration("unused", new Identifier("used", null), null);
        var twice = new VariableDeclaration("twice", null, null);
        var again = new VariableDeclaration("twice", null, null);
        var program = new Program(List.of(used, unused, twice, again), null);
        assertEquals(List.of("unused"), AstTraversal.findUnusedVariables(program));
        assertEquals(List.of(), AstTraversal.findUnusedVariables(Program.empty()));
    }

    @Test
    void testExtractMetrics() {
        var metrics = AstTraversal.extractMetrics(sample());
        assertEquals(1, metrics.functions());
        assertEquals(1, metrics.classes());
        assertEquals(1, metrics.variables());
        assertEquals(1, metrics.conditionals());
        assertEquals(0, metrics.loops());
        assertEquals(2, metrics.complexity());
        assertEquals(6, metrics.depth());
        assertEquals(14, metrics.nodeCount());
    }

    @Test
    void testEmptyProgram() {
        var empty = Program.empty();
        assertEquals(1, AstTraversal.countNodes(empty));
        assertEquals(new CodeMetrics(0, 0, 0, 0, 0, 1, 0, 1), AstTraversal.extractMetrics(empty));
        assertTrue(AstTraversal.findNodeAtLine(empty, 1).isEmpty());
    }
}
