package io.codelab.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import org.junit.jupiter.api.Test;

public class SourceParserTest {

    @Test
    void testExtensionOf() {
        assertEquals(Optional.of("py"), SourceParser.extensionOf("module.py"));
        assertEquals(Optional.of("py"), SourceParser.extensionOf("/src/pkg/Module.PY"));
        assertEquals(Optional.of("gz"), SourceParser.extensionOf("archive.tar.gz"));
        assertEquals(Optional.of("java"), SourceParser.extensionOf("C:\\work\\v1.2\\Main.java"));
        assertEquals(Optional.empty(), SourceParser.extensionOf("dir.d/Makefile"));
        assertEquals(Optional.of(""), SourceParser.extensionOf("trailing."));
    }

    @Test
    void testCanParseUsesExtensions() {
        var parser = new ParserRegistryTest.RecordingParser("python", "py", "pyw");
        assertTrue(parser.canParse("a.py"));
        assertTrue(parser.canParse("A.PYW"));
        assertFalse(parser.canParse("a.pyc"));
        assertFalse(parser.canParse("py"));
    }
}
