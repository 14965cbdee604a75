package io.codelab.analyzer.java;

import static io.codelab.analyzer.java.JavaTreeSitterNodeTypes.*;

import io.codelab.analyzer.TreeSitterNodes;
import io.codelab.parser.ParseProblem;
import io.codelab.util.TextCanonicalizer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Extracts declarations from Java source: the package, imports, and for every type its modifiers, annotations,
 * supertypes, fields and methods. Works on the native Tree-sitter tree, which keeps the annotations and throws
 * clauses the generic tree reduces to metadata.
 */
public final class JavaAnalyzer {
    private static final Logger log = LogManager.getLogger(JavaAnalyzer.class);

    private final JavaSourceParser parser;

    public JavaAnalyzer() {
        this(new JavaSourceParser());
    }

    public JavaAnalyzer(JavaSourceParser parser) {
        this.parser = parser;
    }

    public JavaFileAnalysis analyze(String source) {
        return analyze(source, null);
    }

    public JavaFileAnalysis analyze(String source, @Nullable String filename) {
        var problems = new ArrayList<ParseProblem>();
        var text = TextCanonicalizer.stripUtf8Bom(source);
        var root = parser.parseTree(text).getRootNode();
        if (root.isNull()) {
            log.warn("No tree produced for {}", filename == null ? "<string>" : filename);
            problems.add(ParseProblem.syntaxError("parser produced no tree", 1, 0, null));
            return new JavaFileAnalysis(text, filename, "", List.of(), List.of(), problems);
        }
        if (root.hasError()) {
            TreeSitterNodes.collectSyntaxErrors(root, text, problems);
            log.debug("{} syntax errors in {}", problems.size(), filename);
        }
        var srcBytes = text.getBytes(StandardCharsets.UTF_8);
        var packageName = JavaDeclarations.packageName(root, srcBytes);
        var classes = TreeSitterNodes.findAllNodesRecursive(root, n -> JavaDeclarations.TYPE_KINDS.containsKey(n.getType())).stream()
                .map(node -> analyzeType(node, srcBytes))
                .toList();
        return new JavaFileAnalysis(
                text,
                filename,
                packageName == null ? "" : packageName,
                JavaDeclarations.imports(root, srcBytes),
                classes,
                problems);
    }

    /** Reads {@code path} as UTF-8 and analyzes it. */
    public JavaFileAnalysis analyzeFile(Path path) throws IOException {
        var source = Files.readString(path, StandardCharsets.UTF_8);
        return analyze(source, path.toString());
    }

    private static JavaClassInfo analyzeType(TSNode node, byte[] srcBytes) {
        var fields = new ArrayList<JavaFieldInfo>();
        var methods = new ArrayList<JavaMethodInfo>();
        for (var member : members(node)) {
            switch (member.getType()) {
                case FIELD_DECLARATION, CONSTANT_DECLARATION -> fields.addAll(fields(member, srcBytes));
                case METHOD_DECLARATION -> methods.add(analyzeMethod(member, srcBytes));
                default -> {
                    // constructors, initializers and nested types are not members here
                }
            }
        }
        return new JavaClassInfo(
                TreeSitterNodes.text(TreeSitterNodes.field(node, FIELD_NAME), srcBytes),
                JavaDeclarations.TYPE_KINDS.get(node.getType()),
                JavaDeclarations.modifiers(node),
                JavaDeclarations.annotations(node, srcBytes),
                JavaDeclarations.superclass(node, srcBytes),
                JavaDeclarations.interfaces(node, srcBytes),
                fields,
                methods,
                TreeSitterNodes.startLine(node),
                TreeSitterNodes.endLine(node));
    }

    /** Declarations directly in the type body; an enum's come after its constants. */
    private static List<TSNode> members(TSNode type) {
        var body = TreeSitterNodes.field(type, FIELD_BODY);
        if (body == null) {
            return List.of();
        }
        var members = new ArrayList<TSNode>();
        for (var child : TreeSitterNodes.namedChildren(body)) {
            if (ENUM_BODY_DECLARATIONS.equals(child.getType())) {
                members.addAll(TreeSitterNodes.namedChildren(child));
            } else {
                members.add(child);
            }
        }
        return members;
    }

    private static List<JavaFieldInfo> fields(TSNode declaration, byte[] srcBytes) {
        var type = TreeSitterNodes.text(TreeSitterNodes.field(declaration, FIELD_TYPE), srcBytes);
        var modifiers = JavaDeclarations.modifiers(declaration);
        return TreeSitterNodes.childrenByField(declaration, FIELD_DECLARATOR).stream()
                .map(declarator -> new JavaFieldInfo(
                        TreeSitterNodes.text(TreeSitterNodes.field(declarator, FIELD_NAME), srcBytes),
                        type,
                        modifiers))
                .toList();
    }

    private static JavaMethodInfo analyzeMethod(TSNode node, byte[] srcBytes) {
        return new JavaMethodInfo(
                TreeSitterNodes.text(TreeSitterNodes.field(node, FIELD_NAME), srcBytes),
                JavaDeclarations.modifiers(node),
                JavaDeclarations.annotations(node, srcBytes),
                TreeSitterNodes.text(TreeSitterNodes.field(node, FIELD_TYPE), srcBytes),
                JavaDeclarations.parameters(TreeSitterNodes.field(node, FIELD_PARAMETERS), srcBytes),
                JavaDeclarations.throwsTypes(node, srcBytes),
                TreeSitterNodes.startLine(node),
                TreeSitterNodes.endLine(node));
    }
}
