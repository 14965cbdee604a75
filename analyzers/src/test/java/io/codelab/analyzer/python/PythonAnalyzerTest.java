package io.codelab.analyzer.python;

import static org.junit.jupiter.api.Assertions.*;

import io.codelab.parser.ParseProblem;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public final class PythonAnalyzerTest {

    private static final PythonAnalyzer analyzer = new PythonAnalyzer();

    @Nullable
    private static ModuleAnalysis inventory;

    @BeforeAll
    public static void setup() throws IOException {
        Path testDir = Path.of("src/test/resources", "testcode-py");
        assertTrue(Files.isDirectory(testDir), "Test resource dir missing: " + testDir);
        inventory = analyzer.analyzeFile(testDir.resolve("inventory.py"));
    }

    private static ModuleAnalysis inventory() {
        assertNotNull(inventory);
        return inventory;
    }

    private static FunctionInfo function(ModuleAnalysis analysis, String name) {
        return analysis.getFunction(name).orElseThrow(() -> new AssertionError("no function " + name));
    }

    @Test
    void testSingleFunctionScenario() {
        var analysis = analyzer.analyze("def f(x):\n    if x:\n        return 1\n    return 0\n");
        assertEquals(1, analysis.functions().size());
        var f = analysis.functions().get(0);
        assertEquals("f", f.name());
        assertEquals(List.of("x"), f.args());
        assertEquals(2, f.complexity());
        assertEquals(1, f.lineStart());
        assertEquals(4, f.lineEnd());
        assertNull(f.returns());
        assertFalse(analysis.hasSyntaxErrors());
    }

    @Test
    void testUnusedImportScenario() {
        var analysis = analyzer.analyze("import os\nimport sys\nprint(sys.path)");
        assertEquals(List.of("os"), analysis.findUnusedImports());
    }

    @Test
    void testFunctionsAndMethods() {
        var analysis = inventory();
        assertEquals(List.of("restock"), analysis.functions().stream().map(FunctionInfo::name).toList());
        assertEquals(
                List.of("restock", "__init__", "label", "__init__", "add", "export"),
                analysis.getAllFunctions().stream().map(FunctionInfo::name).toList());

        var label = analysis.getClassInfo("Item").orElseThrow().methods().get(1);
        assertEquals("label", label.name());
        assertEquals(List.of("property"), label.decorators());
        assertEquals(20, label.lineStart());
        assertEquals(21, label.lineEnd());
        assertEquals(List.of("self"), label.args());

        var restock = function(analysis, "restock");
        assertEquals(42, restock.lineStart());
        assertEquals(47, restock.lineEnd());
        assertEquals(List.of("inventory", "names"), restock.args());
    }

    @Test
    void testClasses() {
        var analysis = inventory();
        assertEquals(List.of("Item", "Inventory"), analysis.classes().stream().map(ClassInfo::name).toList());

        var item = analysis.getClassInfo("Item").orElseThrow();
        assertEquals(List.of(), item.bases());
        assertEquals("A single stock keeping unit.", item.docstring());
        assertEquals(12, item.lineStart());
        assertEquals(21, item.lineEnd());
        assertEquals(List.of("__init__", "label"), item.methodNames());

        var inventoryClass = analysis.getClassInfo("Inventory").orElseThrow();
        assertEquals(List.of("Item"), inventoryClass.bases());
        assertEquals(List.of("__init__", "add", "export"), inventoryClass.methodNames());
        assertNull(inventoryClass.docstring());
        assertTrue(analysis.getClassInfo("Missing").isEmpty());
    }

    @Test
    void testComplexity() {
        var analysis = inventory();
        assertEquals(4, function(analysis, "restock").complexity());
        assertEquals(3, function(analysis, "add").complexity());
        assertEquals(2, function(analysis, "export").complexity());
        assertEquals(1, function(analysis, "label").complexity());
    }

    @Test
    void testComplexityCountsEveryBranchKind() {
        var source = """
                def g(a, b, c):
                    if a and b or c:
                        pass
                    elif b:
                        pass
                    for i in range(3):
                        while False:
                            pass
                    try:
                        pass
                    except ValueError:
                        pass
                    except (TypeError, KeyError):
                        pass
                """;
        assertEquals(9, function(analyzer.analyze(source), "g").complexity());
    }

    @Test
    void testCallsAreDistinctInFirstSeenOrder() {
        var analysis = inventory();
        assertEquals(Set.of("add", "Item"), function(analysis, "restock").calls());
        assertEquals(List.of("add", "Item"), List.copyOf(function(analysis, "restock").calls()));
        assertEquals(List.of("ValueError", "info"), List.copyOf(function(analysis, "add").calls()));
    }

    @Test
    void testDependencies() {
        var analysis = analyzer.analyze("def a():\n    b()\n    obj.c()\n    b()\n\ndef b():\n    pass\n");
        var dependencies = analysis.getDependencies();
        assertEquals(List.of("a", "b"), List.copyOf(dependencies.keySet()));
        assertEquals(List.of("b", "c"), List.copyOf(dependencies.get("a")));
        assertTrue(dependencies.get("b").isEmpty());
    }

    @Test
    void testArguments() {
        var source = """
                def h(self, a, b=1, *args, c, **kw):
                    pass

                def k(a, *, b):
                    pass

                def t(x: int, y: str = "") -> Dict[str, int]:
                    pass
                """;
        var analysis = analyzer.analyze(source);
        assertEquals(List.of("self", "a", "b"), function(analysis, "h").args());
        assertEquals(List.of("a"), function(analysis, "k").args());
        var t = function(analysis, "t");
        assertEquals(List.of("x", "y"), t.args());
        assertEquals("Dict[str, int]", t.returns());
    }

    @Test
    void testDocstrings() {
        var source = "def documented():\n"
                + "    \"\"\"Summary line.\n"
                + "\n"
                + "        Indented detail.\n"
                + "    \"\"\"\n"
                + "    return 1\n"
                + "\n"
                + "def short():\n"
                + "    'One line.'\n"
                + "\n"
                + "def not_first():\n"
                + "    x = 1\n"
                + "    \"\"\"Too late.\"\"\"\n";
        var analysis = analyzer.analyze(source);
        assertEquals("Summary line.\n\nIndented detail.", function(analysis, "documented").docstring());
        assertEquals("One line.", function(analysis, "short").docstring());
        assertNull(function(analysis, "not_first").docstring());
        assertEquals(List.of("not_first"), analysis.findFunctionsWithoutDocstrings());
    }

    @Test
    void testEmptyDocstringCountsAsMissing() {
        var analysis = analyzer.analyze("def e():\n    \"\"\n\ndef d():\n    \"Doc.\"\n");
        assertEquals("", function(analysis, "e").docstring());
        assertFalse(function(analysis, "e").hasDocstring());
        assertTrue(function(analysis, "d").hasDocstring());
        assertEquals(List.of("e"), analysis.findFunctionsWithoutDocstrings());
        assertEquals(1, analysis.getStatistics().functionsWithoutDocstrings());
    }

    @Test
    void testDocstringEscapes() {
        var source = "def hex():\n    '''Doc\\x41 line.'''\n"
                + "def uni():\n    'caf\\u00e9 \\U0001F600'\n"
                + "def named():\n    '\\N{BULLET} item'\n"
                + "def octal():\n    '\\101\\0'\n"
                + "def unknown():\n    '\\q \\xZZ \\N{NOT A NAME}'\n"
                + "def controls():\n    'a\\ab\\vc\\\\d'\n"
                + "def raw():\n    r'keep\\x41'\n";
        var analysis = analyzer.analyze(source);
        assertEquals("DocA line.", function(analysis, "hex").docstring());
        assertEquals("caf\u00e9 " + new String(Character.toChars(0x1F600)), function(analysis, "uni").docstring());
        assertEquals("\u2022 item", function(analysis, "named").docstring());
        assertEquals("A\0", function(analysis, "octal").docstring());
        assertEquals("\\q \\xZZ \\N{NOT A NAME}", function(analysis, "unknown").docstring());
        assertEquals("a" + (char) 0x07 + "b" + (char) 0x0B + "c\\d", function(analysis, "controls").docstring());
        assertEquals("keep\\x41", function(analysis, "raw").docstring());
    }

    @Test
    void testLineEndIgnoresTrailingComments() {
        var source = """
                def f():
                    return 1
                    # trailing

                # top comment
                class C:
                    def m(self):
                        if self:
                            pass
                        else:
                            return 2
                        # after else
                    # after method

                def g():
                    pass
                """;
        var analysis = analyzer.analyze(source);
        var f = function(analysis, "f");
        assertEquals(1, f.lineStart());
        assertEquals(2, f.lineEnd());
        assertEquals(11, function(analysis, "m").lineEnd());
        var c = analysis.getClassInfo("C").orElseThrow();
        assertEquals(6, c.lineStart());
        assertEquals(11, c.lineEnd());
        assertEquals(15, function(analysis, "g").lineStart());
        assertEquals(List.of("m"), analysis.findLongFunctions(3).stream().map(FunctionInfo::name).toList());
    }

    @Test
    void testDecorators() {
        var source = """
                @app.route("/x")
                @staticmethod
                @functools.lru_cache(maxsize=None)
                def handler():
                    pass
                """;
        var handler = function(analyzer.analyze(source), "handler");
        assertEquals(List.of("app.route", "staticmethod", "functools.lru_cache"), handler.decorators());
        assertEquals(4, handler.lineStart());
    }

    @Test
    void testNestedDefinitions() {
        var source = """
                class Outer:
                    def method(self):
                        def helper():
                            return 1
                        return helper()

                    class Inner:
                        async def run(self):
                            pass
                """;
        var analysis = analyzer.analyze(source);
        assertEquals(List.of("helper"), analysis.functions().stream().map(FunctionInfo::name).toList());
        assertEquals(List.of("Outer", "Inner"), analysis.classes().stream().map(ClassInfo::name).toList());
        assertEquals(List.of("method"), analysis.classes().get(0).methodNames());
        assertEquals(List.of("run"), analysis.classes().get(1).methodNames());
    }

    @Test
    void testImports() {
        var analysis = inventory();
        var imports = analysis.imports();
        assertEquals(4, imports.size());

        assertEquals("json", imports.get(0).module());
        assertEquals(List.of("json"), imports.get(0).names());
        assertNull(imports.get(0).alias());
        assertEquals(3, imports.get(0).line());

        assertEquals("logging", imports.get(1).module());
        assertEquals("log", imports.get(1).alias());

        assertEquals("collections", imports.get(2).module());
        assertEquals(List.of("OrderedDict", "defaultdict"), imports.get(2).names());
        assertNull(imports.get(2).alias());

        assertEquals("typing", imports.get(3).module());
        assertEquals(List.of("*"), imports.get(3).names());
    }

    @Test
    void testUnusedImports() {
        assertEquals(List.of("collections.defaultdict"), inventory().findUnusedImports());

        var source = """
                import os.path as osp, sys
                from collections import OrderedDict as OD, defaultdict
                from . import sibling
                from .pkg import *
                from __future__ import annotations
                """;
        assertEquals(
                List.of(
                        "os.path as osp",
                        "sys",
                        "collections.OrderedDict",
                        "collections.defaultdict",
                        ".sibling"),
                analyzer.analyze(source).findUnusedImports());

        assertEquals(List.of(), analyzer.analyze("import os.path\nos.getcwd()\n").findUnusedImports());
    }

    @Test
    void testNamesThatDoNotCountAsUse() {
        var source = """
                import path
                import name
                import value
                import other

                def name(path, value=other):
                    return dict(name=1).path
                """;
        // only 'other' is read; the others appear as definition, parameter, keyword or attribute names
        assertEquals(List.of("path", "name", "value"), analyzer.analyze(source).findUnusedImports());
    }

    @Test
    void testGlobals() {
        var analysis = inventory();
        assertEquals(
                List.of("DEFAULT_STOCK", "MAX_ITEMS", "LIMIT"),
                analysis.globals().stream().map(VariableInfo::name).toList());
        assertEquals(8, analysis.globals().get(0).line());
        assertEquals(9, analysis.globals().get(2).line());

        var mixed = analyzer.analyze("y: int = 3\nw: str\nfor i in []:\n    v = 1\nx = 1; z = 2\n");
        assertEquals(List.of("x"), mixed.globals().stream().map(VariableInfo::name).toList());
        assertEquals(5, mixed.globals().get(0).line());
        assertEquals(1, mixed.getStatistics().numGlobals());
    }

    @Test
    void testAnnotatedAssignmentsAreNotGlobals() {
        var analysis = analyzer.analyze("x: int = 1\ny: str\nz = 2\n");
        assertEquals(List.of(new VariableInfo("z", 3)), analysis.globals());
    }

    @Test
    void testStatistics() {
        var stats = analyzer.analyze("import os\n\n# comment\ndef f():\n    return 1\n").getStatistics();
        assertEquals(6, stats.totalLines());
        assertEquals(3, stats.nonEmptyLines());
        assertEquals(1, stats.numFunctions());
        assertEquals(0, stats.numClasses());
        assertEquals(1, stats.numImports());
        assertEquals(0, stats.numGlobals());
        assertEquals(1.0, stats.avgComplexity());
        assertEquals(1, stats.maxComplexity());
        assertEquals(1, stats.functionsWithoutDocstrings());

        var inventoryStats = inventory().getStatistics();
        assertEquals(6, inventoryStats.numFunctions());
        assertEquals(2, inventoryStats.numClasses());
        assertEquals(3, inventoryStats.numGlobals());
        assertEquals(4, inventoryStats.maxComplexity());
        assertEquals(2.0, inventoryStats.avgComplexity(), 1e-9);
    }

    @Test
    void testComplexityReportOrdering() {
        var report = inventory().getComplexityReport();
        var names = List.copyOf(report.keySet());
        assertEquals("restock", names.get(0));
        assertEquals("add", names.get(1));
        assertEquals(4, report.get("restock"));
        assertEquals(List.of("restock", "add", "export", "__init__", "label"), names);
    }

    @Test
    void testLongFunctions() {
        var body = "    x = 1\n".repeat(60);
        var source = "def long_one():\n" + body + "\ndef short():\n    pass\n\ndef longer():\n" + body + body;
        var analysis = analyzer.analyze(source);
        assertEquals(
                List.of("longer", "long_one"),
                analysis.findLongFunctions().stream().map(FunctionInfo::name).toList());
        assertEquals(List.of(), analysis.findLongFunctions(500));
        assertEquals(3, analysis.findLongFunctions(0).size());
        assertEquals(60, function(analysis, "long_one").length());
    }

    @Test
    void testEmptySource() {
        var analysis = analyzer.analyze("");
        assertTrue(analysis.functions().isEmpty());
        assertTrue(analysis.classes().isEmpty());
        assertTrue(analysis.findUnusedImports().isEmpty());
        assertFalse(analysis.hasSyntaxErrors());
        var stats = analysis.getStatistics();
        assertEquals(1, stats.totalLines());
        assertEquals(0, stats.nonEmptyLines());
        assertEquals(0.0, stats.avgComplexity());
        assertEquals(0, stats.maxComplexity());
    }

    @Test
    void testSyntaxErrorsAreReportedAndAnalysisContinues() {
        var analysis = analyzer.analyze("def broken(:\n    pass\n\ndef ok():\n    return 1\n", "broken.py");
        assertTrue(analysis.hasSyntaxErrors());
        assertTrue(analysis.syntaxErrors().stream().allMatch(p -> ParseProblem.SYNTAX_ERROR.equals(p.kind())));
        assertTrue(analysis.getFunction("ok").isPresent());
        assertEquals("broken.py", analysis.filename());
        assertDoesNotThrow(analysis::toJson);
    }

    @Test
    void testToDictShape() {
        var dict = inventory().toDict();
        assertEquals(List.of("functions", "classes", "imports", "statistics"), List.copyOf(dict.keySet()));

        @SuppressWarnings("unchecked")
        var functions = (List<Map<String, Object>>) dict.get("functions");
        assertEquals(6, functions.size());
        assertEquals(
                List.of(
                        "name",
                        "args",
                        "returns",
                        "docstring",
                        "line_start",
                        "line_end",
                        "complexity",
                        "calls",
                        "decorators"),
                List.copyOf(functions.get(0).keySet()));

        @SuppressWarnings("unchecked")
        var classes = (List<Map<String, Object>>) dict.get("classes");
        assertEquals(List.of("__init__", "label"), classes.get(0).get("methods"));
        assertEquals(
                List.of("name", "bases", "methods", "docstring", "line_start", "line_end", "decorators"),
                List.copyOf(classes.get(0).keySet()));

        @SuppressWarnings("unchecked")
        var imports = (List<Map<String, Object>>) dict.get("imports");
        assertEquals(List.of("module", "names", "alias", "line"), List.copyOf(imports.get(0).keySet()));

        @SuppressWarnings("unchecked")
        var statistics = (Map<String, Object>) dict.get("statistics");
        assertEquals(
                List.of(
                        "total_lines",
                        "non_empty_lines",
                        "num_functions",
                        "num_classes",
                        "num_imports",
                        "num_globals",
                        "avg_complexity",
                        "max_complexity",
                        "functions_without_docstrings"),
                List.copyOf(statistics.keySet()));
    }

    @Test
    void testToJson() {
        var json = analyzer.analyze("def f(x):\n    return x\n").toJson();
        assertTrue(json.contains("\"line_start\" : 1"), json);
        assertTrue(json.contains("\"returns\" : null"), json);
    }

    @Test
    void testBomIsIgnored() {
        var analysis = analyzer.analyze("\uFEFFdef f():\n    pass\n");
        assertEquals("f", analysis.functions().get(0).name());
        assertFalse(analysis.source().startsWith("\uFEFF"));
    }

    @Test
    void testAnalyzeFile(@TempDir Path tempDir) throws IOException {
        var file = tempDir.resolve("mod.py");
        Files.writeString(file, "def greet(name):\n    return 'hi ' + name\n");
        var analysis = analyzer.analyzeFile(file);
        assertEquals(file.toString(), analysis.filename());
        assertEquals(List.of("name"), function(analysis, "greet").args());

        assertThrows(NoSuchFileException.class, () -> analyzer.analyzeFile(tempDir.resolve("missing.py")));
    }
}
