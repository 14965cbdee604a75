package io.codelab.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import io.codelab.analyzer.java.JavaSourceParser;
import io.codelab.analyzer.python.PythonSourceParser;
import io.codelab.ast.NodeType;
import io.codelab.util.CodeLabSettings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ParsersTest {

    @Test
    void testDefaultRegistryHoldsBundledLanguages() {
        var registry = Parsers.defaultRegistry();
        assertEquals(List.of("python", "java"), registry.registeredLanguages());
        assertInstanceOf(PythonSourceParser.class, registry.getParserByFilename("a.py").orElseThrow());
        assertInstanceOf(JavaSourceParser.class, registry.getParserByFilename("A.java").orElseThrow());
    }

    @Test
    void testConfiguredLanguagesSkipUnknownIds() {
        var props = new Properties();
        props.setProperty(CodeLabSettings.KEY_DEFAULT_LANGUAGES, "java, ruby");
        var registry = Parsers.defaultRegistry(CodeLabSettings.of(props));
        assertEquals(List.of("java"), registry.registeredLanguages());
        assertTrue(registry.getParserByFilename("a.py").isEmpty());
    }

    @Test
    void testCreate() {
        var settings = CodeLabSettings.of(new Properties());
        assertTrue(Parsers.create("PYTHON", settings).isPresent());
        assertTrue(Parsers.create("cobol", settings).isEmpty());
    }

    @Test
    void testRegistryDispatchesByExtension(@TempDir Path tempDir) throws IOException {
        var registry = Parsers.defaultRegistry();
        var py = tempDir.resolve("mod.py");
        Files.writeString(py, "def f():\n    return 1\n");
        var java = tempDir.resolve("Mod.java");
        Files.writeString(java, "class Mod { int f() { return 1; } }\n");

        var pyResult = registry.parseFile(py);
        assertEquals("python", pyResult.metadata().language());
        assertEquals(py.toString(), pyResult.metadata().filename());
        assertEquals(NodeType.FUNCTION_DECLARATION, pyResult.ast().body().get(0).type());

        var javaResult = registry.parseFile(java);
        assertEquals("java", javaResult.metadata().language());
        assertEquals(NodeType.CLASS_DECLARATION, javaResult.ast().body().get(0).type());
    }
}
