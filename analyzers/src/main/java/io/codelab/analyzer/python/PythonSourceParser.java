package io.codelab.analyzer.python;

import io.codelab.analyzer.TreeSitterSourceParser;
import io.codelab.ast.Program;
import io.codelab.util.CodeLabSettings;
import java.util.Set;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TreeSitterPython;

/** Parses Python source into the generic AST using the Tree-sitter Python grammar. */
public class PythonSourceParser extends TreeSitterSourceParser {
    public static final String LANGUAGE_ID = "python";
    private static final Set<String> EXTENSIONS = Set.of("py", "pyw", "python");

    public PythonSourceParser() {
        super();
    }

    public PythonSourceParser(CodeLabSettings settings) {
        super(settings);
    }

    @Override
    protected TSLanguage createTSLanguage() {
        return new TreeSitterPython();
    }

    @Override
    protected Program buildProgram(TSNode root, String source, byte[] srcBytes) {
        return new PythonAstBuilder(source, srcBytes).build(root);
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
