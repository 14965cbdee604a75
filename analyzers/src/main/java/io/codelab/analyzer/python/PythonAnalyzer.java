package io.codelab.analyzer.python;

import static io.codelab.analyzer.python.PythonTreeSitterNodeTypes.*;

import io.codelab.analyzer.TreeSitterNodes;
import io.codelab.parser.ParseProblem;
import io.codelab.util.CodeLabSettings;
import io.codelab.util.TextCanonicalizer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Python-specific analysis over the Tree-sitter Python tree: functions, classes, imports, module globals, cyclomatic
 * complexity, call graph and unused imports.
 *
 * <p>The analyzer keeps no state between calls; each call returns a fresh {@link ModuleAnalysis}.
 */
public class PythonAnalyzer {
    private static final Logger log = LogManager.getLogger(PythonAnalyzer.class);

    private static final Set<String> COMPLEXITY_NODES = Set.of(
            IF_STATEMENT,
            ELIF_CLAUSE,
            FOR_STATEMENT,
            WHILE_STATEMENT,
            EXCEPT_CLAUSE,
            EXCEPT_GROUP_CLAUSE,
            BOOLEAN_OPERATOR);
    private static final Set<String> IMPORT_NODES =
            Set.of(IMPORT_STATEMENT, IMPORT_FROM_STATEMENT, FUTURE_IMPORT_STATEMENT);
    private static final Set<String> SUITES = Set.of(
            BLOCK,
            FUNCTION_DEFINITION,
            CLASS_DEFINITION,
            ELIF_CLAUSE,
            ELSE_CLAUSE,
            EXCEPT_CLAUSE,
            EXCEPT_GROUP_CLAUSE,
            FINALLY_CLAUSE,
            CASE_CLAUSE);
    private static final Set<String> PARAMETER_CONTAINERS = Set.of(
            PARAMETERS, LAMBDA_PARAMETERS, LIST_SPLAT_PATTERN, DICTIONARY_SPLAT_PATTERN, DEFAULT_PARAMETER,
            TYPED_DEFAULT_PARAMETER, TYPED_PARAMETER);

    private final PythonSourceParser parser;
    private final CodeLabSettings settings;

    public PythonAnalyzer() {
        this(new PythonSourceParser(), CodeLabSettings.get());
    }

    public PythonAnalyzer(PythonSourceParser parser, CodeLabSettings settings) {
        this.parser = parser;
        this.settings = settings;
    }

    public ModuleAnalysis analyze(String source) {
        return analyze(source, null);
    }

    public ModuleAnalysis analyze(String source, @Nullable String filename) {
        var problems = new ArrayList<ParseProblem>();
        var text = TextCanonicalizer.stripUtf8Bom(source);
        var root = parser.parseTree(text).getRootNode();
        if (root.isNull()) {
            log.warn("No tree produced for {}", filename == null ? "<string>" : filename);
            problems.add(ParseProblem.syntaxError("parser produced no tree", 1, 0, null));
            return new ModuleAnalysis(
                    text,
                    filename,
                    List.of(),
                    List.of(),
                    List.of(),
                    List.of(),
                    Set.of(),
                    problems,
                    settings.longFunctionThreshold());
        }
        if (root.hasError()) {
            TreeSitterNodes.collectSyntaxErrors(root, text, problems);
            log.debug("{} syntax errors in {}", problems.size(), filename);
        }
        var collector = new Collector(text.getBytes(StandardCharsets.UTF_8));
        collector.visit(root, false);
        collector.collectGlobals(root);
        collector.collectUsedNames(root);
        return new ModuleAnalysis(
                text,
                filename,
                collector.functions,
                collector.classes,
                collector.imports,
                collector.globals,
                collector.usedNames,
                problems,
                settings.longFunctionThreshold());
    }

    /** Reads {@code path} as UTF-8 and analyzes it. */
    public ModuleAnalysis analyzeFile(Path path) throws IOException {
        var source = Files.readString(path, StandardCharsets.UTF_8);
        return analyze(source, path.toString());
    }

    /** Gathers facts from one tree. */
    private static final class Collector {
        private final byte[] srcBytes;
        private final List<FunctionInfo> functions = new ArrayList<>();
        private final List<ClassInfo> classes = new ArrayList<>();
        private final List<ImportInfo> imports = new ArrayList<>();
        private final List<VariableInfo> globals = new ArrayList<>();
        private final Set<String> usedNames = new HashSet<>();

        Collector(byte[] srcBytes) {
            this.srcBytes = srcBytes;
        }

        private String text(@Nullable TSNode node) {
            return TreeSitterNodes.text(node, srcBytes);
        }

        /**
         * Pre-order walk. {@code inClassBody} is true only for statements directly in a class body, whose functions
         * are recorded as methods of that class instead.
         */
        void visit(TSNode node, boolean inClassBody) {
            switch (node.getType()) {
                case FUNCTION_DEFINITION -> {
                    if (!inClassBody) {
                        functions.add(analyzeFunction(node));
                    }
                    visitChildren(node, false);
                }
                case CLASS_DEFINITION -> {
                    classes.add(analyzeClass(node));
                    var body = TreeSitterNodes.field(node, FIELD_BODY);
                    if (body != null) {
                        visitChildren(body, true);
                    }
                }
                case DECORATED_DEFINITION, BLOCK -> visitChildren(node, inClassBody);
                case IMPORT_STATEMENT -> analyzeImport(node);
                case IMPORT_FROM_STATEMENT, FUTURE_IMPORT_STATEMENT -> analyzeFromImport(node);
                default -> visitChildren(node, false);
            }
        }

        private void visitChildren(TSNode node, boolean inClassBody) {
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                var child = node.getNamedChild(i);
                if (TreeSitterNodes.isPresent(child)) {
                    visit(child, inClassBody);
                }
            }
        }

        private FunctionInfo analyzeFunction(TSNode node) {
            var body = TreeSitterNodes.field(node, FIELD_BODY);
            var returnType = TreeSitterNodes.field(node, FIELD_RETURN_TYPE);
            return new FunctionInfo(
                    text(TreeSitterNodes.field(node, FIELD_NAME)),
                    positionalArgs(TreeSitterNodes.field(node, FIELD_PARAMETERS)),
                    returnType == null ? null : text(returnType),
                    docstring(body),
                    TreeSitterNodes.startLine(node),
                    lastCodeLine(node),
                    complexity(node),
                    calls(node),
                    decorators(node));
        }

        private ClassInfo analyzeClass(TSNode node) {
            var bases = new ArrayList<String>();
            var superclasses = TreeSitterNodes.field(node, FIELD_SUPERCLASSES);
            if (superclasses != null) {
                for (var base : TreeSitterNodes.namedChildren(superclasses)) {
                    if (IDENTIFIER.equals(base.getType())) {
                        bases.add(text(base));
                    } else if (ATTRIBUTE.equals(base.getType())) {
                        bases.add(text(TreeSitterNodes.field(base, FIELD_ATTRIBUTE)));
                    }
                }
            }
            var methods = new ArrayList<FunctionInfo>();
            var body = TreeSitterNodes.field(node, FIELD_BODY);
            if (body != null) {
                for (var member : TreeSitterNodes.namedChildren(body)) {
                    var definition = DECORATED_DEFINITION.equals(member.getType())
                            ? TreeSitterNodes.field(member, FIELD_DEFINITION)
                            : member;
                    if (definition != null && FUNCTION_DEFINITION.equals(definition.getType())) {
                        methods.add(analyzeFunction(definition));
                    }
                }
            }
            return new ClassInfo(
                    text(TreeSitterNodes.field(node, FIELD_NAME)),
                    bases,
                    methods,
                    docstring(body),
                    TreeSitterNodes.startLine(node),
                    lastCodeLine(node),
                    decorators(node));
        }

        /** Parameter names up to the first {@code *} marker or {@code *args}; {@code **kwargs} is skipped. */
        private List<String> positionalArgs(@Nullable TSNode parameters) {
            var args = new ArrayList<String>();
            if (parameters == null) {
                return args;
            }
            for (var param : TreeSitterNodes.namedChildren(parameters)) {
                switch (param.getType()) {
                    case IDENTIFIER -> args.add(text(param));
                    case DEFAULT_PARAMETER, TYPED_DEFAULT_PARAMETER ->
                        args.add(text(TreeSitterNodes.field(param, FIELD_NAME)));
                    case TYPED_PARAMETER -> {
                        var target = TreeSitterNodes.firstNamedChild(param);
                        if (target == null || !IDENTIFIER.equals(target.getType())) {
                            if (target != null && LIST_SPLAT_PATTERN.equals(target.getType())) {
                                return args;
                            }
                            continue;
                        }
                        args.add(text(target));
                    }
                    case LIST_SPLAT_PATTERN, KEYWORD_SEPARATOR -> {
                        return args;
                    }
                    default -> {
                        // positional-only marker, **kwargs
                    }
                }
            }
            return args;
        }

        private @Nullable String docstring(@Nullable TSNode body) {
            if (body == null) {
                return null;
            }
            var first = TreeSitterNodes.firstNamedChild(body);
            if (first == null || !EXPRESSION_STATEMENT.equals(first.getType())) {
                return null;
            }
            var children = TreeSitterNodes.namedChildren(first);
            if (children.size() != 1) {
                return null;
            }
            var literal = children.get(0);
            String value = null;
            if (STRING.equals(literal.getType())) {
                value = PythonStrings.decode(text(literal));
            } else if (CONCATENATED_STRING.equals(literal.getType())) {
                value = PythonStrings.decodeAll(TreeSitterNodes.namedChildrenOfType(literal, STRING).stream()
                        .map(this::text)
                        .toList());
            }
            return value == null ? null : PythonStrings.cleandoc(value);
        }

        private List<String> decorators(TSNode definition) {
            var parent = definition.getParent();
            if (!TreeSitterNodes.isPresent(parent) || !DECORATED_DEFINITION.equals(parent.getType())) {
                return List.of();
            }
            return PythonAstBuilder.decoratorNames(parent, srcBytes);
        }

        /**
         * Last line of {@code node} holding code. Comments indented under the final suite belong to the native node
         * but not to the definition.
         */
        static int lastCodeLine(TSNode node) {
            var children = TreeSitterNodes.namedChildren(node);
            if (children.isEmpty()) {
                return TreeSitterNodes.endLine(node);
            }
            var last = children.get(children.size() - 1);
            if (BLOCK.equals(node.getType()) || SUITES.contains(last.getType())) {
                return lastCodeLine(last);
            }
            return TreeSitterNodes.endLine(node);
        }

        private static int complexity(TSNode function) {
            return 1
                    + TreeSitterNodes.findAllNodesRecursive(function, n -> COMPLEXITY_NODES.contains(n.getType()))
                            .size();
        }

        private Set<String> calls(TSNode function) {
            var calls = new LinkedHashSet<String>();
            for (var call : TreeSitterNodes.findAllNodesRecursive(function, n -> CALL.equals(n.getType()))) {
                var callee = TreeSitterNodes.field(call, FIELD_FUNCTION);
                if (callee == null) {
                    continue;
                }
                if (IDENTIFIER.equals(callee.getType())) {
                    calls.add(text(callee));
                } else if (ATTRIBUTE.equals(callee.getType())) {
                    calls.add(text(TreeSitterNodes.field(callee, FIELD_ATTRIBUTE)));
                }
            }
            return calls;
        }

        private void analyzeImport(TSNode node) {
            int line = TreeSitterNodes.startLine(node);
            for (var name : TreeSitterNodes.namedChildren(node)) {
                if (DOTTED_NAME.equals(name.getType())) {
                    imports.add(ImportInfo.plain(text(name), null, line));
                } else if (ALIASED_IMPORT.equals(name.getType())) {
                    var alias = TreeSitterNodes.field(name, FIELD_ALIAS);
                    imports.add(ImportInfo.plain(
                            text(TreeSitterNodes.field(name, FIELD_NAME)), alias == null ? null : text(alias), line));
                }
            }
        }

        private void analyzeFromImport(TSNode node) {
            var moduleNode = TreeSitterNodes.field(node, FIELD_MODULE_NAME);
            var module = FUTURE_IMPORT_STATEMENT.equals(node.getType()) ? "__future__" : text(moduleNode);
            var names = new ArrayList<String>();
            var bindings = new LinkedHashMap<String, String>();
            for (var child : TreeSitterNodes.namedChildren(node)) {
                if (moduleNode != null && child.getStartByte() == moduleNode.getStartByte()) {
                    continue;
                }
                switch (child.getType()) {
                    case DOTTED_NAME -> {
                        names.add(text(child));
                        bindings.put(text(child), text(child));
                    }
                    case ALIASED_IMPORT -> {
                        var imported = text(TreeSitterNodes.field(child, FIELD_NAME));
                        var alias = TreeSitterNodes.field(child, FIELD_ALIAS);
                        names.add(imported);
                        bindings.put(alias == null ? imported : text(alias), imported);
                    }
                    case WILDCARD_IMPORT -> {
                        names.add(ImportInfo.WILDCARD);
                        bindings.put(ImportInfo.WILDCARD, ImportInfo.WILDCARD);
                    }
                    default -> {
                        // relative_import and other non-name children
                    }
                }
            }
            imports.add(ImportInfo.from(module, names, bindings, TreeSitterNodes.startLine(node)));
        }

        /** Plain assignments at column 0 whose targets are names; chained targets are all recorded. */
        void collectGlobals(TSNode root) {
            for (var statement : TreeSitterNodes.namedChildrenOfType(root, EXPRESSION_STATEMENT)) {
                if (statement.getStartPoint().getColumn() != 0) {
                    continue;
                }
                var assignment = TreeSitterNodes.firstNamedChild(statement);
                int line = TreeSitterNodes.startLine(statement);
                // annotated assignments declare rather than assign and are not globals
                while (assignment != null
                        && ASSIGNMENT.equals(assignment.getType())
                        && TreeSitterNodes.field(assignment, FIELD_TYPE) == null) {
                    var left = TreeSitterNodes.field(assignment, FIELD_LEFT);
                    if (left != null && IDENTIFIER.equals(left.getType())) {
                        globals.add(new VariableInfo(text(left), line));
                    }
                    assignment = TreeSitterNodes.field(assignment, FIELD_RIGHT);
                }
            }
        }

        void collectUsedNames(TSNode node) {
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                var child = node.getNamedChild(i);
                if (!TreeSitterNodes.isPresent(child) || IMPORT_NODES.contains(child.getType())) {
                    continue;
                }
                if (IDENTIFIER.equals(child.getType())) {
                    if (isReference(node, child)) {
                        usedNames.add(text(child));
                    }
                } else {
                    collectUsedNames(child);
                }
            }
        }

        /** False for attribute names, definition names, parameter names, keyword-argument names and global lists. */
        private static boolean isReference(TSNode parent, TSNode identifier) {
            return switch (parent.getType()) {
                case ATTRIBUTE -> !TreeSitterNodes.isField(parent, identifier, FIELD_ATTRIBUTE);
                case FUNCTION_DEFINITION, CLASS_DEFINITION, KEYWORD_ARGUMENT ->
                    !TreeSitterNodes.isField(parent, identifier, FIELD_NAME);
                case GLOBAL_STATEMENT, NONLOCAL_STATEMENT -> false;
                default -> !PARAMETER_CONTAINERS.contains(parent.getType())
                        || TreeSitterNodes.isField(parent, identifier, FIELD_TYPE)
                        || TreeSitterNodes.isField(parent, identifier, FIELD_VALUE);
            };
        }
    }
}
