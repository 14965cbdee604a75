package io.codelab.analyzer;

import io.codelab.ast.AstTraversal;
import io.codelab.ast.Program;
import io.codelab.parser.ParseMetadata;
import io.codelab.parser.ParseProblem;
import io.codelab.parser.ParseResult;
import io.codelab.parser.SourceParser;
import io.codelab.util.CodeLabSettings;
import io.codelab.util.TextCanonicalizer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

/**
 * {@link SourceParser} backed by a Tree-sitter grammar.
 *
 * <p>Subclasses provide the grammar and the mapping from native nodes to the generic tree. Tree-sitter recovers from
 * syntax errors, so a result can carry both a partial tree and the errors found in the source.
 */
public abstract class TreeSitterSourceParser implements SourceParser {
    protected static final Logger log = LogManager.getLogger(TreeSitterSourceParser.class);
    // Native library loading is assumed automatic by the io.github.bonede.tree_sitter library.

    // TSParser is not threadsafe, so we keep one parser per thread
    private final ThreadLocal<TSLanguage> threadLocalLanguage = ThreadLocal.withInitial(this::createTSLanguage);
    private final ThreadLocal<TSParser> threadLocalParser = ThreadLocal.withInitial(() -> {
        var parser = new TSParser();
        if (!parser.setLanguage(threadLocalLanguage.get())) {
            log.error("Failed to set language on TSParser for {}", languageId());
        }
        return parser;
    });

    private final CodeLabSettings settings;

    protected TreeSitterSourceParser(CodeLabSettings settings) {
        this.settings = settings;
    }

    protected TreeSitterSourceParser() {
        this(CodeLabSettings.get());
    }

    protected abstract TSLanguage createTSLanguage();

    /** Maps the native root node onto a generic {@link Program}; called once per parse. */
    protected abstract Program buildProgram(TSNode root, String source, byte[] srcBytes);

    /** Parses {@code source} into the native Tree-sitter tree. A leading byte order mark is not stripped here. */
    public TSTree parseTree(String source) {
        return threadLocalParser.get().parseString(null, source);
    }

    @Override
    public ParseResult parse(String source, @Nullable String filename) {
        long startNanos = System.nanoTime();
        var warnings = new ArrayList<ParseProblem>();
        if (TextCanonicalizer.hasUtf8Bom(source)) {
            warnings.add(new ParseProblem(ParseProblem.ENCODING, "Stripped UTF-8 byte order mark", 1, 0, null));
            source = TextCanonicalizer.stripUtf8Bom(source);
        }

        var errors = new ArrayList<ParseProblem>();
        Program program;
        TSNode root = parseTree(source).getRootNode();
        if (root.isNull()) {
            log.warn("Parsing {} produced no root node", filename == null ? "<string>" : filename);
            errors.add(ParseProblem.syntaxError("parser produced no tree", 1, 0, null));
            program = Program.empty();
        } else {
            var srcBytes = source.getBytes(StandardCharsets.UTF_8);
            if (root.hasError()) {
                TreeSitterNodes.collectSyntaxErrors(root, source, errors);
            }
            program = buildProgram(root, source, srcBytes);
        }

        double elapsedMs = (System.nanoTime() - startNanos) / 1_000_000.0;
        if (elapsedMs > settings.slowParseWarnMillis()) {
            log.warn("Slow {} parse of {}: {} ms", languageId(), filename == null ? "<string>" : filename, elapsedMs);
        }
        var metadata = new ParseMetadata(
                languageId(),
                elapsedMs,
                AstTraversal.countNodes(program),
                TextCanonicalizer.lineCount(source),
                filename);
        log.debug("Parsed {} ({}): {} nodes, {} errors", filename, languageId(), metadata.nodeCount(), errors.size());
        return new ParseResult(program, errors, warnings, metadata);
    }
}
