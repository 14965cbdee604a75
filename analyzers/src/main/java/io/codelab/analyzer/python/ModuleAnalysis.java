package io.codelab.analyzer.python;

import io.codelab.parser.ParseProblem;
import io.codelab.util.Json;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * The result of analyzing one Python module with {@link PythonAnalyzer}. Instances are immutable and every query is
 * computed from the collected facts, so a module with syntax errors still answers every query for the parts that
 * could be recovered.
 */
public final class ModuleAnalysis {
    private final String source;
    private final @Nullable String filename;
    private final List<FunctionInfo> functions;
    private final List<ClassInfo> classes;
    private final List<ImportInfo> imports;
    private final List<VariableInfo> globals;
    private final Set<String> usedNames;
    private final List<ParseProblem> syntaxErrors;
    private final int longFunctionThreshold;

    ModuleAnalysis(
            String source,
            @Nullable String filename,
            List<FunctionInfo> functions,
            List<ClassInfo> classes,
            List<ImportInfo> imports,
            List<VariableInfo> globals,
            Set<String> usedNames,
            List<ParseProblem> syntaxErrors,
            int longFunctionThreshold) {
        this.source = source;
        this.filename = filename;
        this.functions = List.copyOf(functions);
        this.classes = List.copyOf(classes);
        this.imports = List.copyOf(imports);
        this.globals = List.copyOf(globals);
        this.usedNames = Set.copyOf(usedNames);
        this.syntaxErrors = List.copyOf(syntaxErrors);
        this.longFunctionThreshold = longFunctionThreshold;
    }

    public String source() {
        return source;
    }

    public @Nullable String filename() {
        return filename;
    }

    /** Functions not defined directly in a class body, including nested functions, in document order. */
    public List<FunctionInfo> functions() {
        return functions;
    }

    /** All classes, nested ones included, in document order. */
    public List<ClassInfo> classes() {
        return classes;
    }

    public List<ImportInfo> imports() {
        return imports;
    }

    public List<VariableInfo> globals() {
        return globals;
    }

    public List<ParseProblem> syntaxErrors() {
        return syntaxErrors;
    }

    public boolean hasSyntaxErrors() {
        return !syntaxErrors.isEmpty();
    }

    /** {@link #functions()} followed by the methods of each class. */
    public List<FunctionInfo> getAllFunctions() {
        var all = new ArrayList<FunctionInfo>(functions);
        for (var cls : classes) {
            all.addAll(cls.methods());
        }
        return all;
    }

    public Optional<FunctionInfo> getFunction(String name) {
        return getAllFunctions().stream().filter(f -> f.name().equals(name)).findFirst();
    }

    public Optional<ClassInfo> getClassInfo(String name) {
        return classes.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    /** Call graph: function name to the names it calls. A later function with the same name replaces an earlier one. */
    public Map<String, Set<String>> getDependencies() {
        var dependencies = new LinkedHashMap<String, Set<String>>();
        for (var function : getAllFunctions()) {
            dependencies.put(function.name(), function.calls());
        }
        return dependencies;
    }

    public List<String> findUnusedImports() {
        var unused = new ArrayList<String>();
        for (var imp : imports) {
            // __future__ imports take effect without being referenced
            if (imp.fromImport() && "__future__".equals(imp.module())) {
                continue;
            }
            for (var bound : imp.bindings().keySet()) {
                if (!ImportInfo.WILDCARD.equals(bound) && !usedNames.contains(bound)) {
                    unused.add(imp.describe(bound));
                }
            }
        }
        return unused;
    }

    /** Function name to complexity, most complex first; ties keep document order. */
    public Map<String, Integer> getComplexityReport() {
        var byName = new LinkedHashMap<String, Integer>();
        for (var function : getAllFunctions()) {
            byName.put(function.name(), function.complexity());
        }
        var report = new LinkedHashMap<String, Integer>();
        byName.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .forEach(e -> report.put(e.getKey(), e.getValue()));
        return report;
    }

    /** Functions whose {@link FunctionInfo#length()} exceeds {@code threshold}, longest first. */
    public List<FunctionInfo> findLongFunctions(int threshold) {
        return getAllFunctions().stream()
                .filter(f -> f.length() > threshold)
                .sorted(Comparator.comparingInt(FunctionInfo::length).reversed())
                .toList();
    }

    public List<FunctionInfo> findLongFunctions() {
        return findLongFunctions(longFunctionThreshold);
    }

    /** Names of functions and methods with a missing or empty docstring. */
    public List<String> findFunctionsWithoutDocstrings() {
        return getAllFunctions().stream()
                .filter(f -> !f.hasDocstring())
                .map(FunctionInfo::name)
                .toList();
    }

    public CodeStatistics getStatistics() {
        var all = getAllFunctions();
        var lines = source.split("\n", -1);
        int nonEmpty = 0;
        for (var line : lines) {
            var stripped = line.strip();
            if (!stripped.isEmpty() && !stripped.startsWith("#")) {
                nonEmpty++;
            }
        }
        double avg = all.stream().mapToInt(FunctionInfo::complexity).average().orElse(0);
        int max = all.stream().mapToInt(FunctionInfo::complexity).max().orElse(0);
        return new CodeStatistics(
                lines.length,
                nonEmpty,
                all.size(),
                classes.size(),
                imports.size(),
                globals.size(),
                avg,
                max,
                findFunctionsWithoutDocstrings().size());
    }

    /** Export with keys {@code functions}, {@code classes}, {@code imports} and {@code statistics}. */
    public Map<String, Object> toDict() {
        var dict = new LinkedHashMap<String, Object>();
        dict.put("functions", getAllFunctions().stream().map(FunctionInfo::toMap).toList());
        dict.put("classes", classes.stream().map(ClassInfo::toMap).toList());
        dict.put("imports", imports.stream().map(ImportInfo::toMap).toList());
        dict.put("statistics", getStatistics().toMap());
        return dict;
    }

    public String toJson() {
        return Json.toJson(toDict());
    }
}
