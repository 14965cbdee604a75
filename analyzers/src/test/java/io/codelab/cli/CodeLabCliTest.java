package io.codelab.cli;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import io.codelab.util.Json;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

public class CodeLabCliTest {
    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine cli;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        cli = new CommandLine(new CodeLabCli());
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
    }

    private Path write(String name, String content) throws IOException {
        var file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void testAnalyzePrintsReport() throws IOException {
        var file = write("mod.py", "import os\nimport sys\n\ndef f(x):\n    return sys.argv\n");
        int exitCode = cli.execute("analyze", "--unused", "--long-threshold", "0", file.toString());
        assertEquals(0, exitCode, err.toString());

        JsonNode report = Json.fromJson(out.toString(), JsonNode.class);
        assertEquals("f", report.get("functions").get(0).get("name").asText());
        assertEquals(1, report.get("statistics").get("num_functions").asInt());
        assertEquals("os", report.get("unused_imports").get(0).asText());
        assertEquals("f", report.get("long_functions").get(0).asText());
        assertFalse(report.has("syntax_errors"));
    }

    @Test
    void testAnalyzeReportsSyntaxErrors() throws IOException {
        var file = write("broken.py", "def broken(:\n    pass\n");
        assertEquals(0, cli.execute("analyze", file.toString()));
        var report = Json.fromJson(out.toString(), JsonNode.class);
        assertEquals("SyntaxError", report.get("syntax_errors").get(0).get("kind").asText());
        assertFalse(report.has("unused_imports"));
    }

    @Test
    void testAnalyzeJavaFile() throws IOException {
        var file = write("Shapes.java", """
                package geo;

                abstract class Shape {
                    @Deprecated
                    public abstract double area();
                }

                class Circle extends Shape {
                    public double area() {
                        return 1;
                    }
                }
                """);
        assertEquals(0, cli.execute("analyze", file.toString()), err.toString());

        var report = Json.fromJson(out.toString(), JsonNode.class);
        assertEquals("geo", report.get("package").asText());
        assertEquals("Circle", report.get("inheritance").get("Shape").get(0).asText());
        assertEquals("Deprecated", report.get("classes").get(0).get("methods").get(0).get("annotations").get(0).asText());
        assertEquals(2, report.get("statistics").get("public_methods").asInt());
        assertFalse(report.has("long_functions"));
    }

    @Test
    void testAnalyzeMissingFileFails() {
        int exitCode = cli.execute("analyze", tempDir.resolve("missing.py").toString());
        assertEquals(1, exitCode);
        assertTrue(err.toString().startsWith("Error: Cannot analyze"), err.toString());
        assertEquals("", out.toString());
    }

    @Test
    void testParsePrintsMetrics() throws IOException {
        var file = write("loop.py", "total = 0\nunused = 1\nfor i in range(3):\n    total += i\n");
        assertEquals(0, cli.execute("parse", "--unused", file.toString()), err.toString());

        var report = Json.fromJson(out.toString(), JsonNode.class);
        assertEquals("python", report.get("metadata").get("language").asText());
        assertEquals(4, report.get("metadata").get("lineCount").asInt());
        assertEquals(1, report.get("metrics").get("loops").asInt());
        assertEquals(2, report.get("metrics").get("complexity").asInt());
        assertEquals(0, report.get("errors").size());
        assertEquals("unused", report.get("unused_variables").get(0).asText());
    }

    @Test
    void testParseUnknownExtensionFails() throws IOException {
        var file = write("script.rb", "puts 1\n");
        assertEquals(1, cli.execute("parse", file.toString()));
        assertTrue(err.toString().contains("No parser found for file"), err.toString());
    }

    @Test
    void testNoSubcommandPrintsUsage() {
        assertEquals(0, cli.execute());
        assertTrue(out.toString().contains("analyze"));
    }
}
