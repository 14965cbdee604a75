package io.codelab.analyzer.java;

import io.codelab.analyzer.TreeSitterSourceParser;
import io.codelab.ast.Program;
import io.codelab.util.CodeLabSettings;
import java.util.Set;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TreeSitterJava;

/**
 * Parses Java source into the generic AST. Methods and constructors become {@code MethodDeclaration}s; fields and
 * locals become {@code VariableDeclaration}s, with {@code final} ones marked as constants.
 */
public class JavaSourceParser extends TreeSitterSourceParser {
    public static final String LANGUAGE_ID = "java";
    private static final Set<String> EXTENSIONS = Set.of("java");

    public JavaSourceParser() {
        super();
    }

    public JavaSourceParser(CodeLabSettings settings) {
        super(settings);
    }

    @Override
    protected TSLanguage createTSLanguage() {
        return new TreeSitterJava();
    }

    @Override
    protected Program buildProgram(TSNode root, String source, byte[] srcBytes) {
        return new JavaAstBuilder(source, srcBytes).build(root);
    }

    @Override
    public Set<String> supportedExtensions() {
        return EXTENSIONS;
    }

    @Override
    public String languageId() {
        return LANGUAGE_ID;
    }
}
