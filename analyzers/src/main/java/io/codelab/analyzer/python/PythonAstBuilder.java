package io.codelab.analyzer.python;

import static io.codelab.analyzer.python.PythonTreeSitterNodeTypes.*;

import io.codelab.analyzer.TreeSitterAstBuilder;
import io.codelab.analyzer.TreeSitterNodes;
import io.codelab.ast.ASTNode;
import io.codelab.ast.BlockStatement;
import io.codelab.ast.CallExpression;
import io.codelab.ast.ClassDeclaration;
import io.codelab.ast.ExpressionStatement;
import io.codelab.ast.ForLoop;
import io.codelab.ast.FunctionDeclaration;
import io.codelab.ast.Identifier;
import io.codelab.ast.IfStatement;
import io.codelab.ast.Literal;
import io.codelab.ast.MethodDeclaration;
import io.codelab.ast.Parameter;
import io.codelab.ast.Program;
import io.codelab.ast.ReturnStatement;
import io.codelab.ast.VariableDeclaration;
import io.codelab.ast.VariableKind;
import io.codelab.ast.WhileLoop;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** Maps a Tree-sitter Python tree onto the generic AST. */
final class PythonAstBuilder extends TreeSitterAstBuilder {
    static final String DECORATORS = "decorators";
    static final String CALLEE = "callee";
    static final String ASYNC = "async";

    private static final Set<String> SKIPPED_STATEMENTS = Set.of(
            PASS_STATEMENT,
            BREAK_STATEMENT,
            CONTINUE_STATEMENT,
            IMPORT_STATEMENT,
            IMPORT_FROM_STATEMENT,
            FUTURE_IMPORT_STATEMENT);
    private static final Set<String> SCOPE_BOUNDARIES = Set.of(FUNCTION_DEFINITION, CLASS_DEFINITION, LAMBDA);

    PythonAstBuilder(String source, byte[] srcBytes) {
        super(source, srcBytes);
    }

    @Override
    public Program build(TSNode root) {
        return new Program(convertStatements(root), Program.MODULE, range(root), Map.of());
    }

    @Override
    protected boolean isStatement(String nodeType) {
        return nodeType.endsWith("_statement")
                || nodeType.equals(FUNCTION_DEFINITION)
                || nodeType.equals(CLASS_DEFINITION)
                || nodeType.equals(DECORATED_DEFINITION)
                || nodeType.equals(BLOCK);
    }

    @Override
    protected List<ASTNode> convertStatement(TSNode node) {
        return convertStatement(node, false);
    }

    private List<ASTNode> convertStatement(TSNode node, boolean inClassBody) {
        var type = node.getType();
        if (SKIPPED_STATEMENTS.contains(type)) {
            return List.of();
        }
        return switch (type) {
            case FUNCTION_DEFINITION -> List.of(function(node, List.of(), inClassBody));
            case CLASS_DEFINITION -> List.of(classDeclaration(node, List.of()));
            case DECORATED_DEFINITION -> decorated(node, inClassBody);
            case EXPRESSION_STATEMENT -> expressionStatement(node);
            case IF_STATEMENT -> List.of(ifStatement(node));
            case FOR_STATEMENT -> List.of(forStatement(node));
            case WHILE_STATEMENT -> List.of(new WhileLoop(
                    convertOrNull(TreeSitterNodes.field(node, FIELD_CONDITION)),
                    blockOrNull(TreeSitterNodes.field(node, FIELD_BODY)),
                    range(node)));
            case RETURN_STATEMENT -> {
                var value = TreeSitterNodes.firstNamedChild(node);
                yield List.of(new ReturnStatement(convertOrNull(value), range(node)));
            }
            case TRY_STATEMENT -> List.of(tryStatement(node));
            case WITH_STATEMENT -> List.of(withStatement(node));
            case BLOCK -> List.of(block(node));
            default -> List.of(new ExpressionStatement(operatorCall(node), range(node), Map.of(STATEMENT, type)));
        };
    }

    private List<ASTNode> decorated(TSNode node, boolean inClassBody) {
        var definition = TreeSitterNodes.field(node, FIELD_DEFINITION);
        if (definition == null) {
            return List.of();
        }
        var decorators = decoratorNames(node, srcBytes);
        return switch (definition.getType()) {
            case FUNCTION_DEFINITION -> List.of(function(definition, decorators, inClassBody));
            case CLASS_DEFINITION -> List.of(classDeclaration(definition, decorators));
            default -> convertStatement(definition, inClassBody);
        };
    }

    private ASTNode function(TSNode node, List<String> decorators, boolean inClassBody) {
        var name = text(TreeSitterNodes.field(node, FIELD_NAME));
        var params = parameters(TreeSitterNodes.field(node, FIELD_PARAMETERS));
        var bodyNode = TreeSitterNodes.field(node, FIELD_BODY);
        var body = blockOrNull(bodyNode);
        boolean isAsync = TreeSitterNodes.hasToken(node, ASYNC);
        Map<String, Object> metadata = decorators.isEmpty() ? Map.of() : Map.of(DECORATORS, decorators);
        if (inClassBody) {
            return new MethodDeclaration(
                    name,
                    params,
                    body,
                    decorators.contains("staticmethod"),
                    isAsync,
                    visibility(name),
                    range(node),
                    metadata);
        }
        boolean isGenerator = bodyNode != null && containsYield(bodyNode);
        var returnType = textOrNull(TreeSitterNodes.field(node, FIELD_RETURN_TYPE));
        return new FunctionDeclaration(name, params, body, isAsync, isGenerator, returnType, range(node), metadata);
    }

    private ClassDeclaration classDeclaration(TSNode node, List<String> decorators) {
        var name = text(TreeSitterNodes.field(node, FIELD_NAME));
        var bases = new ArrayList<String>();
        var superclasses = TreeSitterNodes.field(node, FIELD_SUPERCLASSES);
        if (superclasses != null) {
            for (var base : TreeSitterNodes.namedChildren(superclasses)) {
                if (!KEYWORD_ARGUMENT.equals(base.getType())) {
                    bases.add(text(base));
                }
            }
        }
        var members = new ArrayList<ASTNode>();
        var bodyNode = TreeSitterNodes.field(node, FIELD_BODY);
        if (bodyNode != null) {
            for (var statement : TreeSitterNodes.namedChildren(bodyNode)) {
                members.addAll(convertStatement(statement, true));
            }
        }
        String superClass = bases.isEmpty() ? null : bases.get(0);
        var interfaces = bases.size() > 1 ? bases.subList(1, bases.size()) : List.<String>of();
        Map<String, Object> metadata = decorators.isEmpty() ? Map.of() : Map.of(DECORATORS, decorators);
        return new ClassDeclaration(name, superClass, interfaces, members, range(node), metadata);
    }

    private List<Parameter> parameters(@Nullable TSNode parametersNode) {
        if (parametersNode == null) {
            return List.of();
        }
        var result = new ArrayList<Parameter>();
        for (var param : TreeSitterNodes.namedChildren(parametersNode)) {
            switch (param.getType()) {
                case IDENTIFIER -> result.add(Parameter.named(text(param)));
                case TYPED_PARAMETER -> {
                    var target = TreeSitterNodes.firstNamedChild(param);
                    var annotation = textOrNull(TreeSitterNodes.field(param, FIELD_TYPE));
                    boolean splat = target != null && !IDENTIFIER.equals(target.getType());
                    result.add(new Parameter(text(target), annotation, null, splat));
                }
                case DEFAULT_PARAMETER, TYPED_DEFAULT_PARAMETER -> result.add(new Parameter(
                        text(TreeSitterNodes.field(param, FIELD_NAME)),
                        textOrNull(TreeSitterNodes.field(param, FIELD_TYPE)),
                        textOrNull(TreeSitterNodes.field(param, FIELD_VALUE)),
                        true));
                case LIST_SPLAT_PATTERN, DICTIONARY_SPLAT_PATTERN ->
                    result.add(new Parameter(text(param), null, null, true));
                case KEYWORD_SEPARATOR, POSITIONAL_SEPARATOR -> {
                    // markers, not parameters
                }
                default -> result.add(Parameter.named(text(param)));
            }
        }
        return result;
    }

    private List<ASTNode> expressionStatement(TSNode node) {
        var children = TreeSitterNodes.namedChildren(node);
        if (children.isEmpty()) {
            return List.of();
        }
        if (children.size() > 1) {
            var operands = children.stream().map(this::convertAny).toList();
            return List.of(new ExpressionStatement(CallExpression.operator(",", operands, range(node)), range(node)));
        }
        var child = children.get(0);
        if (ASSIGNMENT.equals(child.getType())) {
            var converted = assignment(child, node);
            return List.of(
                    converted instanceof VariableDeclaration ? converted : new ExpressionStatement(converted, range(node)));
        }
        return List.of(new ExpressionStatement(convertExpression(child), range(node)));
    }

    /** Identifier targets become declarations; other targets become an {@code =} operator call. */
    private ASTNode assignment(TSNode node, TSNode rangeNode) {
        var left = TreeSitterNodes.field(node, FIELD_LEFT);
        var right = TreeSitterNodes.field(node, FIELD_RIGHT);
        ASTNode value = null;
        if (right != null) {
            value = ASSIGNMENT.equals(right.getType()) ? assignment(right, right) : convertAny(right);
        }
        if (left != null && IDENTIFIER.equals(left.getType())) {
            return new VariableDeclaration(
                    text(left),
                    VariableKind.VAR,
                    value,
                    textOrNull(TreeSitterNodes.field(node, FIELD_TYPE)),
                    range(rangeNode),
                    Map.of());
        }
        var operands = new ArrayList<ASTNode>();
        if (left != null) {
            operands.add(convertAny(left));
        }
        if (value != null) {
            operands.add(value);
        }
        return CallExpression.operator("=", operands, range(node));
    }

    private IfStatement ifStatement(TSNode node) {
        var alternatives = new ArrayList<TSNode>();
        for (var child : TreeSitterNodes.namedChildren(node)) {
            if (ELIF_CLAUSE.equals(child.getType()) || ELSE_CLAUSE.equals(child.getType())) {
                alternatives.add(child);
            }
        }
        return new IfStatement(
                convertOrNull(TreeSitterNodes.field(node, FIELD_CONDITION)),
                blockOrNull(TreeSitterNodes.field(node, FIELD_CONSEQUENCE)),
                alternate(node, alternatives, 0),
                range(node));
    }

    /** Builds {@code elif} chains as nested {@link IfStatement}s extending to the end of the whole statement. */
    private @Nullable ASTNode alternate(TSNode ifNode, List<TSNode> alternatives, int index) {
        if (index >= alternatives.size()) {
            return null;
        }
        var clause = alternatives.get(index);
        if (ELSE_CLAUSE.equals(clause.getType())) {
            return blockOrNull(TreeSitterNodes.field(clause, FIELD_BODY));
        }
        return new IfStatement(
                convertOrNull(TreeSitterNodes.field(clause, FIELD_CONDITION)),
                blockOrNull(TreeSitterNodes.field(clause, FIELD_CONSEQUENCE)),
                alternate(ifNode, alternatives, index + 1),
                TreeSitterNodes.range(clause, ifNode));
    }

    private ForLoop forStatement(TSNode node) {
        Map<String, Object> metadata = TreeSitterNodes.hasToken(node, ASYNC) ? Map.of(ASYNC, true) : Map.of();
        return new ForLoop(
                convertOrNull(TreeSitterNodes.field(node, FIELD_LEFT)),
                convertOrNull(TreeSitterNodes.field(node, FIELD_RIGHT)),
                null,
                blockOrNull(TreeSitterNodes.field(node, FIELD_BODY)),
                range(node),
                metadata);
    }

    private BlockStatement tryStatement(TSNode node) {
        var body = new ArrayList<ASTNode>();
        var tryBody = TreeSitterNodes.field(node, FIELD_BODY);
        if (tryBody != null) {
            body.add(block(tryBody));
        }
        for (var clause : TreeSitterNodes.namedChildren(node)) {
            var type = clause.getType();
            if (EXCEPT_CLAUSE.equals(type)
                    || EXCEPT_GROUP_CLAUSE.equals(type)
                    || ELSE_CLAUSE.equals(type)
                    || FINALLY_CLAUSE.equals(type)) {
                var clauseBody = new ArrayList<ASTNode>();
                for (var block : TreeSitterNodes.namedChildrenOfType(clause, BLOCK)) {
                    clauseBody.addAll(convertStatements(block));
                }
                body.add(new BlockStatement(clauseBody, range(clause), Map.of(STATEMENT, type)));
            }
        }
        return new BlockStatement(body, range(node), Map.of(STATEMENT, TRY_STATEMENT));
    }

    private BlockStatement withStatement(TSNode node) {
        var body = new ArrayList<ASTNode>();
        for (var clause : TreeSitterNodes.namedChildrenOfType(node, WITH_CLAUSE)) {
            for (var item : TreeSitterNodes.namedChildrenOfType(clause, WITH_ITEM)) {
                var value = TreeSitterNodes.field(item, FIELD_VALUE);
                if (value != null) {
                    body.add(new ExpressionStatement(convertAny(value), range(item)));
                }
            }
        }
        var withBody = TreeSitterNodes.field(node, FIELD_BODY);
        if (withBody != null) {
            body.addAll(convertStatements(withBody));
        }
        return new BlockStatement(body, range(node), Map.of(STATEMENT, WITH_STATEMENT));
    }

    @Override
    protected ASTNode convertExpression(TSNode node) {
        return switch (node.getType()) {
            case IDENTIFIER -> new Identifier(text(node), range(node));
            case ATTRIBUTE -> attribute(node);
            case CALL -> call(node);
            case PARENTHESIZED_EXPRESSION -> {
                var inner = TreeSitterNodes.firstNamedChild(node);
                yield inner == null ? operatorCall(node) : convertAny(inner);
            }
            case KEYWORD_ARGUMENT -> {
                var value = TreeSitterNodes.field(node, FIELD_VALUE);
                yield value == null ? operatorCall(node) : convertAny(value);
            }
            case ASSIGNMENT -> assignment(node, node);
            case INTEGER -> new Literal(integerValue(text(node)), text(node), range(node));
            case FLOAT -> new Literal(floatValue(text(node)), text(node), range(node));
            case TRUE -> new Literal(Boolean.TRUE, text(node), range(node));
            case FALSE -> new Literal(Boolean.FALSE, text(node), range(node));
            case NONE, ELLIPSIS -> new Literal(null, text(node), range(node));
            case STRING -> new Literal(PythonStrings.decode(text(node)), text(node), range(node));
            case CONCATENATED_STRING -> new Literal(
                    PythonStrings.decodeAll(TreeSitterNodes.namedChildrenOfType(node, STRING).stream()
                            .map(this::text)
                            .toList()),
                    text(node),
                    range(node));
            default -> operatorCall(node);
        };
    }

    private ASTNode attribute(TSNode node) {
        var base = node;
        while (ATTRIBUTE.equals(base.getType())) {
            var object = TreeSitterNodes.field(base, FIELD_OBJECT);
            if (object == null) {
                return operatorCall(node);
            }
            base = object;
        }
        if (IDENTIFIER.equals(base.getType())) {
            return pathIdentifier(text(base), node);
        }
        return convertAny(base);
    }

    private CallExpression call(TSNode node) {
        var function = TreeSitterNodes.field(node, FIELD_FUNCTION);
        var arguments = new ArrayList<ASTNode>();
        var argumentsNode = TreeSitterNodes.field(node, FIELD_ARGUMENTS);
        if (argumentsNode != null) {
            if ("argument_list".equals(argumentsNode.getType())) {
                for (var argument : TreeSitterNodes.namedChildren(argumentsNode)) {
                    arguments.add(convertAny(argument));
                }
            } else {
                arguments.add(convertAny(argumentsNode));
            }
        }
        Map<String, Object> metadata =
                function == null ? Map.of() : Map.of(CALLEE, text(function).replaceAll("\\s+", ""));
        return new CallExpression(convertOrNull(function), arguments, range(node), metadata);
    }

    static List<String> decoratorNames(TSNode decoratedDefinition, byte[] srcBytes) {
        var names = new ArrayList<String>();
        for (var decorator : TreeSitterNodes.namedChildrenOfType(decoratedDefinition, DECORATOR)) {
            var expression = TreeSitterNodes.firstNamedChild(decorator);
            if (expression == null) {
                continue;
            }
            if (CALL.equals(expression.getType())) {
                expression = TreeSitterNodes.field(expression, FIELD_FUNCTION);
            }
            if (expression != null
                    && (IDENTIFIER.equals(expression.getType()) || ATTRIBUTE.equals(expression.getType()))) {
                names.add(TreeSitterNodes.text(expression, srcBytes).replaceAll("\\s+", ""));
            }
        }
        return List.copyOf(names);
    }

    static boolean containsYield(TSNode body) {
        return !TreeSitterNodes.findAllNodesRecursive(
                        body, n -> YIELD.equals(n.getType()), n -> !SCOPE_BOUNDARIES.contains(n.getType()))
                .isEmpty();
    }

    /** Python naming conventions: {@code __x} is private, {@code _x} protected, dunder names public. */
    static String visibility(String name) {
        if (name.startsWith("__") && name.endsWith("__")) {
            return "public";
        }
        if (name.startsWith("__")) {
            return "private";
        }
        return name.startsWith("_") ? "protected" : "public";
    }

    static @Nullable Long integerValue(String raw) {
        var digits = raw.replace("_", "").toLowerCase(Locale.ROOT);
        int radix = 10;
        if (digits.startsWith("0x")) {
            radix = 16;
        } else if (digits.startsWith("0o")) {
            radix = 8;
        } else if (digits.startsWith("0b")) {
            radix = 2;
        }
        if (radix != 10) {
            digits = digits.substring(2);
        }
        // complex literals are left undecoded
        if (digits.isEmpty()) {
            return null;
        }
        for (char c : digits.toCharArray()) {
            if (Character.digit(c, radix) < 0) {
                return null;
            }
        }
        var value = new BigInteger(digits, radix);
        return value.bitLength() < 64 ? value.longValue() : null;
    }

    static @Nullable Double floatValue(String raw) {
        var digits = raw.replace("_", "").toLowerCase(Locale.ROOT);
        if (digits.endsWith("j")) {
            return null;
        }
        return Double.parseDouble(digits);
    }
}
