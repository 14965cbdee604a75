package io.codelab.cli;

import io.codelab.analyzer.Parsers;
import io.codelab.analyzer.java.JavaAnalyzer;
import io.codelab.analyzer.java.JavaFileAnalysis;
import io.codelab.analyzer.python.FunctionInfo;
import io.codelab.analyzer.python.PythonAnalyzer;
import io.codelab.ast.AstTraversal;
import io.codelab.exception.ParserConfigurationException;
import io.codelab.parser.ParseProblem;
import io.codelab.util.Json;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "codelab",
        mixinStandardHelpOptions = true,
        description = "Static analysis of source files.",
        subcommands = {CodeLabCli.AnalyzeCommand.class, CodeLabCli.ParseCommand.class})
public final class CodeLabCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CodeLabCli.class);

    @CommandLine.Spec
    @Nullable
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CodeLabCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (spec != null) {
            spec.commandLine().usage(spec.commandLine().getOut());
        }
        return 0;
    }

    static void printJson(CommandLine.Model.CommandSpec spec, Object value) {
        var out = spec.commandLine().getOut();
        out.println(Json.toJson(value));
        out.flush();
    }

    static int fail(CommandLine.Model.CommandSpec spec, String message, Exception e) {
        logger.error(message, e);
        var err = spec.commandLine().getErr();
        err.println("Error: " + message + ": " + e.getMessage());
        err.flush();
        return 1;
    }

    @CommandLine.Command(
            name = "analyze",
            description = "Analyze a Python or Java file and print the report as JSON.")
    static final class AnalyzeCommand implements Callable<Integer> {
        @CommandLine.Spec
        @Nullable
        private CommandLine.Model.CommandSpec spec;

        @CommandLine.Parameters(index = "0", description = "Python (.py) or Java (.java) source file.")
        @Nullable
        private Path file;

        @CommandLine.Option(
                names = "--long-threshold",
                description = "Report functions longer than this many lines (default from codelab.properties).")
        @Nullable
        private Integer longThreshold;

        @CommandLine.Option(names = "--unused", description = "Include unused imports in the report.")
        private boolean unused = false;

        @Override
        public Integer call() {
            var commandSpec = Objects.requireNonNull(spec);
            var path = Objects.requireNonNull(file);
            try {
                if (path.getFileName().toString().endsWith(".java")) {
                    printJson(commandSpec, javaReport(new JavaAnalyzer().analyzeFile(path)));
                    return 0;
                }
                var analysis = new PythonAnalyzer().analyzeFile(path);
                var longFunctions = longThreshold == null
                        ? analysis.findLongFunctions()
                        : analysis.findLongFunctions(longThreshold);
                var report = new LinkedHashMap<String, Object>(analysis.toDict());
                report.put("long_functions", longFunctions.stream().map(FunctionInfo::name).toList());
                if (unused) {
                    report.put("unused_imports", analysis.findUnusedImports());
                }
                if (analysis.hasSyntaxErrors()) {
                    report.put("syntax_errors", describe(analysis.syntaxErrors()));
                }
                printJson(commandSpec, report);
                return 0;
            } catch (IOException e) {
                return fail(commandSpec, "Cannot analyze " + path, e);
            }
        }
    }

    private static Map<String, Object> javaReport(JavaFileAnalysis analysis) {
        var report = new LinkedHashMap<String, Object>(analysis.toDict());
        report.put("inheritance", analysis.getInheritanceTree());
        if (analysis.hasSyntaxErrors()) {
            report.put("syntax_errors", describe(analysis.syntaxErrors()));
        }
        return report;
    }

    @CommandLine.Command(
            name = "parse",
            description = "Parse a file with the parser registered for its extension and print metadata and metrics.")
    static final class ParseCommand implements Callable<Integer> {
        @CommandLine.Spec
        @Nullable
        private CommandLine.Model.CommandSpec spec;

        @CommandLine.Parameters(index = "0", description = "Source file.")
        @Nullable
        private Path file;

        @CommandLine.Option(names = "--unused", description = "Include variables referenced only once.")
        private boolean unused = false;

        @Override
        public Integer call() {
            var commandSpec = Objects.requireNonNull(spec);
            var path = Objects.requireNonNull(file);
            try {
                var result = Parsers.defaultRegistry().parseFile(path);
                var metrics = AstTraversal.extractMetrics(result.ast());
                var report = new LinkedHashMap<String, Object>();
                report.put("metadata", result.metadata());
                report.put("errors", describe(result.errors()));
                report.put("warnings", describe(result.warnings()));
                report.put("metrics", metrics);
                if (unused) {
                    report.put("unused_variables", AstTraversal.findUnusedVariables(result.ast()));
                }
                printJson(commandSpec, report);
                return 0;
            } catch (ParserConfigurationException e) {
                return fail(commandSpec, "No parser for " + path, e);
            } catch (IOException e) {
                return fail(commandSpec, "Cannot parse " + path, e);
            }
        }
    }

    private static List<Map<String, Object>> describe(List<ParseProblem> problems) {
        return problems.stream()
                .<Map<String, Object>>map(p -> {
                    var map = new LinkedHashMap<String, Object>();
                    map.put("kind", p.kind());
                    map.put("message", p.message());
                    map.put("line", p.line());
                    map.put("column", p.column());
                    map.put("text", p.text());
                    return map;
                })
                .toList();
    }
}
