package io.codelab.analyzer.java;

import static io.codelab.analyzer.java.JavaTreeSitterNodeTypes.*;

import io.codelab.analyzer.TreeSitterAstBuilder;
import io.codelab.analyzer.TreeSitterNodes;
import io.codelab.ast.ASTNode;
import io.codelab.ast.BlockStatement;
import io.codelab.ast.CallExpression;
import io.codelab.ast.ClassDeclaration;
import io.codelab.ast.ExpressionStatement;
import io.codelab.ast.ForLoop;
import io.codelab.ast.Identifier;
import io.codelab.ast.IfStatement;
import io.codelab.ast.Literal;
import io.codelab.ast.MethodDeclaration;
import io.codelab.ast.Program;
import io.codelab.ast.ReturnStatement;
import io.codelab.ast.VariableDeclaration;
import io.codelab.ast.VariableKind;
import io.codelab.ast.WhileLoop;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** Maps a Tree-sitter Java tree onto the generic AST. */
final class JavaAstBuilder extends TreeSitterAstBuilder {
    static final String KIND = "kind";
    static final String MODIFIERS_KEY = "modifiers";
    static final String RETURN_TYPE = "returnType";
    static final String CONSTRUCTOR = "constructor";
    static final String CALLEE = "callee";
    static final String PACKAGE = "package";
    static final String IMPORTS = "imports";
    static final String ANNOTATIONS = "annotations";
    static final String THROWS_KEY = "throws";

    private static final Set<String> SKIPPED_STATEMENTS =
            Set.of(PACKAGE_DECLARATION, IMPORT_DECLARATION, BREAK_STATEMENT, CONTINUE_STATEMENT);

    JavaAstBuilder(String source, byte[] srcBytes) {
        super(source, srcBytes);
    }

    @Override
    public Program build(TSNode root) {
        var metadata = new HashMap<String, Object>();
        var packageName = JavaDeclarations.packageName(root, srcBytes);
        if (packageName != null) {
            metadata.put(PACKAGE, packageName);
        }
        var imports = JavaDeclarations.imports(root, srcBytes);
        if (!imports.isEmpty()) {
            metadata.put(IMPORTS, imports);
        }
        return new Program(convertStatements(root), Program.MODULE, range(root), metadata);
    }

    @Override
    protected boolean isStatement(String nodeType) {
        return nodeType.endsWith("_statement")
                || nodeType.endsWith("_declaration")
                || nodeType.equals(BLOCK)
                || nodeType.equals(CONSTRUCTOR_BODY);
    }

    @Override
    protected List<ASTNode> convertStatement(TSNode node) {
        var type = node.getType();
        if (SKIPPED_STATEMENTS.contains(type)) {
            return List.of();
        }
        if (JavaDeclarations.TYPE_KINDS.containsKey(type)) {
            return List.of(classDeclaration(node));
        }
        return switch (type) {
            case METHOD_DECLARATION, CONSTRUCTOR_DECLARATION, COMPACT_CONSTRUCTOR_DECLARATION -> List.of(method(node));
            case FIELD_DECLARATION, CONSTANT_DECLARATION, LOCAL_VARIABLE_DECLARATION -> declarations(node);
            case EXPRESSION_STATEMENT -> {
                var expression = TreeSitterNodes.firstNamedChild(node);
                yield expression == null
                        ? List.of()
                        : List.of(new ExpressionStatement(convertAny(expression), range(node)));
            }
            case IF_STATEMENT -> List.of(new IfStatement(
                    convertOrNull(TreeSitterNodes.field(node, FIELD_CONDITION)),
                    convertOrNull(TreeSitterNodes.field(node, FIELD_CONSEQUENCE)),
                    convertOrNull(TreeSitterNodes.field(node, FIELD_ALTERNATIVE)),
                    range(node)));
            case WHILE_STATEMENT -> List.of(new WhileLoop(
                    convertOrNull(TreeSitterNodes.field(node, FIELD_CONDITION)),
                    convertOrNull(TreeSitterNodes.field(node, FIELD_BODY)),
                    range(node)));
            case DO_STATEMENT -> List.of(new WhileLoop(
                    convertOrNull(TreeSitterNodes.field(node, FIELD_CONDITION)),
                    convertOrNull(TreeSitterNodes.field(node, FIELD_BODY)),
                    range(node),
                    Map.of(STATEMENT, DO_STATEMENT)));
            case FOR_STATEMENT -> List.of(forStatement(node));
            case ENHANCED_FOR_STATEMENT -> List.of(enhancedFor(node));
            case RETURN_STATEMENT -> List.of(
                    new ReturnStatement(convertOrNull(TreeSitterNodes.firstNamedChild(node)), range(node)));
            case BLOCK, CONSTRUCTOR_BODY -> List.of(block(node));
            case TRY_STATEMENT, TRY_WITH_RESOURCES_STATEMENT -> List.of(tryStatement(node));
            default -> List.of(new ExpressionStatement(operatorCall(node), range(node), Map.of(STATEMENT, type)));
        };
    }

    private ClassDeclaration classDeclaration(TSNode node) {
        var name = text(TreeSitterNodes.field(node, FIELD_NAME));
        var superClass = JavaDeclarations.superclass(node, srcBytes);
        var interfaces = JavaDeclarations.interfaces(node, srcBytes);

        var members = new ArrayList<ASTNode>();
        var body = TreeSitterNodes.field(node, FIELD_BODY);
        if (body != null) {
            for (var member : TreeSitterNodes.namedChildren(body)) {
                switch (member.getType()) {
                    case ENUM_CONSTANT -> members.add(new VariableDeclaration(
                            text(TreeSitterNodes.field(member, FIELD_NAME)),
                            VariableKind.CONST,
                            null,
                            name,
                            range(member),
                            Map.of()));
                    case ENUM_BODY_DECLARATIONS -> members.addAll(convertStatements(member));
                    default -> members.addAll(convertStatement(member));
                }
            }
        }

        var metadata = new HashMap<String, Object>();
        metadata.put(KIND, JavaDeclarations.TYPE_KINDS.get(node.getType()));
        var modifiers = JavaDeclarations.modifiers(node);
        if (!modifiers.isEmpty()) {
            metadata.put(MODIFIERS_KEY, modifiers);
        }
        var annotations = JavaDeclarations.annotations(node, srcBytes);
        if (!annotations.isEmpty()) {
            metadata.put(ANNOTATIONS, annotations);
        }
        return new ClassDeclaration(name, superClass, interfaces, members, range(node), metadata);
    }

    private MethodDeclaration method(TSNode node) {
        var modifiers = JavaDeclarations.modifiers(node);
        var metadata = new HashMap<String, Object>();
        var returnType = TreeSitterNodes.field(node, FIELD_TYPE);
        if (returnType != null) {
            metadata.put(RETURN_TYPE, text(returnType));
        }
        if (!METHOD_DECLARATION.equals(node.getType())) {
            metadata.put(CONSTRUCTOR, true);
        }
        if (!modifiers.isEmpty()) {
            metadata.put(MODIFIERS_KEY, modifiers);
        }
        var annotations = JavaDeclarations.annotations(node, srcBytes);
        if (!annotations.isEmpty()) {
            metadata.put(ANNOTATIONS, annotations);
        }
        var throwsTypes = JavaDeclarations.throwsTypes(node, srcBytes);
        if (!throwsTypes.isEmpty()) {
            metadata.put(THROWS_KEY, throwsTypes);
        }
        return new MethodDeclaration(
                text(TreeSitterNodes.field(node, FIELD_NAME)),
                JavaDeclarations.parameters(TreeSitterNodes.field(node, FIELD_PARAMETERS), srcBytes),
                blockOrNull(TreeSitterNodes.field(node, FIELD_BODY)),
                modifiers.contains("static"),
                false,
                visibility(modifiers),
                range(node),
                metadata);
    }

    /** One declaration per declarator; {@code final} declarations are constants. */
    private List<ASTNode> declarations(TSNode node) {
        var kind = JavaDeclarations.modifiers(node).contains("final") ? VariableKind.CONST : VariableKind.VAR;
        var type = textOrNull(TreeSitterNodes.field(node, FIELD_TYPE));
        var declarators = TreeSitterNodes.childrenByField(node, FIELD_DECLARATOR);
        var result = new ArrayList<ASTNode>(declarators.size());
        for (var declarator : declarators) {
            result.add(new VariableDeclaration(
                    text(TreeSitterNodes.field(declarator, FIELD_NAME)),
                    kind,
                    convertOrNull(TreeSitterNodes.field(declarator, FIELD_VALUE)),
                    type,
                    declarators.size() == 1 ? range(node) : range(declarator),
                    Map.of()));
        }
        return result;
    }

    private ForLoop forStatement(TSNode node) {
        return new ForLoop(
                sequence(TreeSitterNodes.childrenByField(node, FIELD_INIT), node),
                convertOrNull(TreeSitterNodes.field(node, FIELD_CONDITION)),
                sequence(TreeSitterNodes.childrenByField(node, FIELD_UPDATE), node),
                convertOrNull(TreeSitterNodes.field(node, FIELD_BODY)),
                range(node));
    }

    /** A single converted node, or a comma operator over several, or null for none. */
    private @Nullable ASTNode sequence(List<TSNode> nodes, TSNode owner) {
        var converted = new ArrayList<ASTNode>();
        for (var node : nodes) {
            if (isStatement(node.getType())) {
                converted.addAll(convertStatement(node));
            } else {
                converted.add(convertExpression(node));
            }
        }
        if (converted.isEmpty()) {
            return null;
        }
        return converted.size() == 1 ? converted.get(0) : CallExpression.operator(",", converted, range(owner));
    }

    private ForLoop enhancedFor(TSNode node) {
        var nameNode = TreeSitterNodes.field(node, FIELD_NAME);
        ASTNode variable = null;
        if (nameNode != null) {
            var kind = JavaDeclarations.modifiers(node).contains("final") ? VariableKind.CONST : VariableKind.VAR;
            variable = new VariableDeclaration(
                    text(nameNode),
                    kind,
                    null,
                    textOrNull(TreeSitterNodes.field(node, FIELD_TYPE)),
                    range(nameNode),
                    Map.of());
        }
        return new ForLoop(
                variable,
                convertOrNull(TreeSitterNodes.field(node, FIELD_VALUE)),
                null,
                convertOrNull(TreeSitterNodes.field(node, FIELD_BODY)),
                range(node),
                Map.of(STATEMENT, ENHANCED_FOR_STATEMENT));
    }

    private BlockStatement tryStatement(TSNode node) {
        var body = new ArrayList<ASTNode>();
        var resources = TreeSitterNodes.field(node, "resources");
        if (resources != null) {
            body.add(new ExpressionStatement(operatorCall(resources), range(resources)));
        }
        var tryBody = TreeSitterNodes.field(node, FIELD_BODY);
        if (tryBody != null) {
            body.add(block(tryBody));
        }
        for (var clause : TreeSitterNodes.namedChildren(node)) {
            if (CATCH_CLAUSE.equals(clause.getType()) || FINALLY_CLAUSE.equals(clause.getType())) {
                var clauseBody = new ArrayList<ASTNode>();
                for (var block : TreeSitterNodes.namedChildrenOfType(clause, BLOCK)) {
                    clauseBody.addAll(convertStatements(block));
                }
                body.add(new BlockStatement(clauseBody, range(clause), Map.of(STATEMENT, clause.getType())));
            }
        }
        return new BlockStatement(body, range(node), Map.of(STATEMENT, node.getType()));
    }

    @Override
    protected ASTNode convertExpression(TSNode node) {
        var type = node.getType();
        var raw = text(node);
        return switch (type) {
            case IDENTIFIER, THIS -> new Identifier(raw, range(node));
            case FIELD_ACCESS -> fieldAccess(node);
            case METHOD_INVOCATION -> methodInvocation(node);
            case OBJECT_CREATION_EXPRESSION -> objectCreation(node);
            case PARENTHESIZED_EXPRESSION -> {
                var inner = TreeSitterNodes.firstNamedChild(node);
                yield inner == null ? operatorCall(node) : convertAny(inner);
            }
            case DECIMAL_INTEGER_LITERAL, HEX_INTEGER_LITERAL, OCTAL_INTEGER_LITERAL, BINARY_INTEGER_LITERAL ->
                new Literal(integerValue(raw), raw, range(node));
            case DECIMAL_FLOATING_POINT_LITERAL -> new Literal(floatValue(raw), raw, range(node));
            case HEX_FLOATING_POINT_LITERAL -> new Literal(null, raw, range(node));
            case STRING_LITERAL -> new Literal(stringValue(raw), raw, range(node));
            case CHARACTER_LITERAL ->
                new Literal(raw.length() >= 2 ? raw.substring(1, raw.length() - 1) : raw, raw, range(node));
            case TRUE -> new Literal(Boolean.TRUE, raw, range(node));
            case FALSE -> new Literal(Boolean.FALSE, raw, range(node));
            case NULL_LITERAL -> new Literal(null, raw, range(node));
            default -> operatorCall(node);
        };
    }

    private ASTNode fieldAccess(TSNode node) {
        var base = baseOf(node);
        if (IDENTIFIER.equals(base.getType()) || THIS.equals(base.getType())) {
            return pathIdentifier(text(base), node);
        }
        return convertAny(base);
    }

    private CallExpression methodInvocation(TSNode node) {
        var nameNode = TreeSitterNodes.field(node, FIELD_NAME);
        var name = text(nameNode);
        var object = TreeSitterNodes.field(node, FIELD_OBJECT);
        ASTNode callee;
        String path = name;
        if (object == null) {
            callee = new Identifier(name, nameNode == null ? range(node) : range(nameNode));
        } else {
            path = text(object).replaceAll("\\s+", "") + "." + name;
            var base = baseOf(object);
            if (IDENTIFIER.equals(base.getType()) || THIS.equals(base.getType())) {
                callee = new Identifier(text(base), range(object), Map.of(Identifier.PATH, path));
            } else {
                callee = convertAny(object);
            }
        }
        return new CallExpression(callee, arguments(node), range(node), Map.of(CALLEE, path));
    }

    private CallExpression objectCreation(TSNode node) {
        var typeNode = TreeSitterNodes.field(node, FIELD_TYPE);
        var callee = typeNode == null ? null : new Identifier(text(typeNode), range(typeNode));
        Map<String, Object> metadata = typeNode == null ? Map.of() : Map.of(CALLEE, "new " + text(typeNode));
        return new CallExpression(callee, arguments(node), range(node), metadata);
    }

    private List<ASTNode> arguments(TSNode node) {
        var argumentsNode = TreeSitterNodes.field(node, FIELD_ARGUMENTS);
        if (argumentsNode == null) {
            return List.of();
        }
        return TreeSitterNodes.namedChildren(argumentsNode).stream().map(this::convertAny).toList();
    }

    private static TSNode baseOf(TSNode node) {
        var base = node;
        while (FIELD_ACCESS.equals(base.getType())) {
            var object = TreeSitterNodes.field(base, FIELD_OBJECT);
            if (object == null) {
                break;
            }
            base = object;
        }
        return base;
    }

    static @Nullable String visibility(List<String> modifiers) {
        for (var candidate : List.of("public", "protected", "private")) {
            if (modifiers.contains(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    static @Nullable Long integerValue(String raw) {
        var digits = raw.replace("_", "").toLowerCase(Locale.ROOT);
        if (digits.endsWith("l")) {
            digits = digits.substring(0, digits.length() - 1);
        }
        int radix = 10;
        if (digits.startsWith("0x")) {
            radix = 16;
            digits = digits.substring(2);
        } else if (digits.startsWith("0b")) {
            radix = 2;
            digits = digits.substring(2);
        } else if (digits.length() > 1 && digits.startsWith("0")) {
            radix = 8;
            digits = digits.substring(1);
        }
        if (digits.isEmpty()) {
            return null;
        }
        for (char c : digits.toCharArray()) {
            if (Character.digit(c, radix) < 0) {
                return null;
            }
        }
        var value = new BigInteger(digits, radix);
        return value.bitLength() <= 64 ? value.longValue() : null;
    }

    static @Nullable Double floatValue(String raw) {
        var digits = raw.replace("_", "");
        var last = Character.toLowerCase(digits.charAt(digits.length() - 1));
        if (last == 'f' || last == 'd') {
            digits = digits.substring(0, digits.length() - 1);
        }
        return Double.parseDouble(digits);
    }

    static String stringValue(String raw) {
        if (raw.startsWith("\"\"\"") && raw.endsWith("\"\"\"") && raw.length() >= 6) {
            var body = raw.substring(3, raw.length() - 3);
            return body.startsWith("\n") ? body.substring(1) : body;
        }
        if (raw.length() >= 2 && raw.startsWith("\"") && raw.endsWith("\"")) {
            return raw.substring(1, raw.length() - 1);
        }
        return raw;
    }
}
