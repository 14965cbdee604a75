package io.codelab.analyzer.java;

import io.codelab.parser.ParseProblem;
import io.codelab.util.Json;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * The result of analyzing one Java compilation unit with {@link JavaAnalyzer}. Instances are immutable; a file with
 * syntax errors still answers every query for the declarations that could be recovered.
 */
public final class JavaFileAnalysis {
    private final String source;
    private final @Nullable String filename;
    private final String packageName;
    private final List<String> imports;
    private final List<JavaClassInfo> classes;
    private final List<ParseProblem> syntaxErrors;

    JavaFileAnalysis(
            String source,
            @Nullable String filename,
            String packageName,
            List<String> imports,
            List<JavaClassInfo> classes,
            List<ParseProblem> syntaxErrors) {
        this.source = source;
        this.filename = filename;
        this.packageName = packageName;
        this.imports = List.copyOf(imports);
        this.classes = List.copyOf(classes);
        this.syntaxErrors = List.copyOf(syntaxErrors);
    }

    public String source() {
        return source;
    }

    public @Nullable String filename() {
        return filename;
    }

    /** The declared package, or the empty string for the unnamed package. */
    public String packageName() {
        return packageName;
    }

    public List<String> imports() {
        return imports;
    }

    /** Every type declaration in document order, nested and local ones included. */
    public List<JavaClassInfo> classes() {
        return classes;
    }

    public List<ParseProblem> syntaxErrors() {
        return syntaxErrors;
    }

    public boolean hasSyntaxErrors() {
        return !syntaxErrors.isEmpty();
    }

    public List<JavaMethodInfo> getAllMethods() {
        var all = new ArrayList<JavaMethodInfo>();
        for (var cls : classes) {
            all.addAll(cls.methods());
        }
        return all;
    }

    public Optional<JavaClassInfo> getClassInfo(String name) {
        return classes.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    /**
     * Methods carrying {@code annotation}. A leading {@code @} is ignored, and a simple name also matches a qualified
     * use: {@code Test} finds {@code @org.junit.Test}.
     */
    public List<JavaMethodInfo> findMethodsWithAnnotation(String annotation) {
        return getAllMethods().stream()
                .filter(m -> hasAnnotation(m.annotations(), annotation))
                .toList();
    }

    /** Type declarations carrying {@code annotation}, matched as in {@link #findMethodsWithAnnotation}. */
    public List<JavaClassInfo> findClassesWithAnnotation(String annotation) {
        return classes.stream()
                .filter(c -> hasAnnotation(c.annotations(), annotation))
                .toList();
    }

    static boolean hasAnnotation(List<String> annotations, String wanted) {
        var name = wanted.startsWith("@") ? wanted.substring(1) : wanted;
        for (var annotation : annotations) {
            if (annotation.equals(name) || annotation.endsWith("." + name)) {
                return true;
            }
        }
        return false;
    }

    /** Superclass name mapped to the names of the classes extending it, in document order. */
    public Map<String, List<String>> getInheritanceTree() {
        var tree = new LinkedHashMap<String, List<String>>();
        for (var cls : classes) {
            if (cls.superclass() != null) {
                tree.computeIfAbsent(cls.superclass(), k -> new ArrayList<>()).add(cls.name());
            }
        }
        return tree;
    }

    public JavaStatistics getStatistics() {
        var methods = getAllMethods();
        return new JavaStatistics(
                packageName,
                classes.size(),
                imports.size(),
                methods.size(),
                (int) methods.stream().filter(m -> m.hasModifier("public")).count(),
                (int) methods.stream().filter(m -> m.hasModifier("private")).count(),
                (int) methods.stream().filter(m -> m.hasModifier("static")).count());
    }

    /** Export with keys {@code package}, {@code imports}, {@code classes} and {@code statistics}. */
    public Map<String, Object> toDict() {
        var dict = new LinkedHashMap<String, Object>();
        dict.put("package", packageName);
        dict.put("imports", imports);
        dict.put("classes", classes.stream().map(JavaClassInfo::toMap).toList());
        dict.put("statistics", getStatistics().toMap());
        return dict;
    }

    public String toJson() {
        return Json.toJson(toDict());
    }
}
