package io.codelab.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.codelab.ast.Program;
import io.codelab.exception.ParserConfigurationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ParserRegistryTest {

    /** Records what it was asked to parse and returns an empty program. */
    static final class RecordingParser implements SourceParser {
        private final String languageId;
        private final Set<String> extensions;
        final List<String> sources = new ArrayList<>();
        final List<String> filenames = new ArrayList<>();

        RecordingParser(String languageId, String... extensions) {
            this.languageId = languageId;
            this.extensions = Set.of(extensions);
        }

        @Override
        public ParseResult parse(String source, @Nullable String filename) {
            sources.add(source);
            filenames.add(filename);
            return new ParseResult(
                    Program.empty(),
                    List.of(),
                    List.of(),
                    new ParseMetadata(languageId, 0.0, 1, 0, filename));
        }

        @Override
        public Set<String> supportedExtensions() {
            return extensions;
        }

        @Override
        public String languageId() {
            return languageId;
        }
    }

    @Test
    void testFirstRegisteredParserWinsForSharedExtension() {
        var registry = new ParserRegistry();
        var a = new RecordingParser("alpha", "py");
        var b = new RecordingParser("beta", "py");
        registry.register("alpha", a);
        registry.register("beta", b);

        assertSame(a, registry.getParserByFilename("x.py").orElseThrow());

        // re-registering under an existing id keeps that id's position
        registry.register("alpha", b);
        assertSame(b, registry.getParserByFilename("x.py").orElseThrow());
        assertEquals(List.of("alpha", "beta"), registry.registeredLanguages());

        registry.unregister("alpha");
        assertSame(b, registry.getParserByFilename("x.py").orElseThrow());
    }

    @Test
    void testFilenameLookupAgreesWithCanParse() {
        var registry = new ParserRegistry();
        registry.register(new RecordingParser("python", "py", "pyw"));
        registry.register(new RecordingParser("java", "java"));
        for (var filename : List.of("a.py", "B.PYW", "dir.v2/Main.java", "Makefile", "x.js", "notes.py.txt", "")) {
            var found = registry.getParserByFilename(filename);
            if (found.isPresent()) {
                assertTrue(found.get().canParse(filename), filename);
            } else {
                for (var id : registry.registeredLanguages()) {
                    assertFalse(registry.getParser(id).orElseThrow().canParse(filename), filename);
                }
            }
        }
        assertEquals("java", registry.getParserByFilename("dir.v2/Main.java").orElseThrow().languageId());
        assertTrue(registry.getParserByFilename("Makefile").isEmpty());
    }

    @Test
    void testLanguageIdsAreCaseInsensitive() {
        var registry = new ParserRegistry();
        var parser = new RecordingParser("python", "py");
        registry.register("Python", parser);
        assertSame(parser, registry.getParser("PYTHON").orElseThrow());
        assertEquals(List.of("python"), registry.registeredLanguages());
        assertTrue(registry.unregister("pYtHoN"));
        assertFalse(registry.unregister("python"));
        assertTrue(registry.isEmpty());
    }

    @Test
    void testParseDelegatesToRegisteredParser() {
        var registry = new ParserRegistry();
        var parser = new RecordingParser("python", "py");
        registry.register(parser);

        var result = registry.parse("x = 1", "python", "mod.py");
        assertEquals("python", result.metadata().language());
        assertEquals(List.of("x = 1"), parser.sources);
        assertEquals("mod.py", parser.filenames.get(0));

        registry.parse("y = 2", "python");
        assertNull(parser.filenames.get(1));
    }

    @Test
    void testParseUnknownLanguageThrows() {
        var registry = new ParserRegistry();
        var e = assertThrows(ParserConfigurationException.class, () -> registry.parse("x", "cobol"));
        assertEquals("No parser registered for language: cobol", e.getMessage());
    }

    @Test
    void testParseFileReadsUtf8(@TempDir Path tempDir) throws IOException {
        var registry = new ParserRegistry();
        var parser = new RecordingParser("python", "py");
        registry.register(parser);
        var file = tempDir.resolve("greeting.py");
        Files.writeString(file, "print('héllo')\n", StandardCharsets.UTF_8);

        var result = registry.parseFile(file);
        assertEquals(file.toString(), result.metadata().filename());
        assertEquals(List.of("print('héllo')\n"), parser.sources);
    }

    @Test
    void testParseFileWithoutParserDoesNotRead(@TempDir Path tempDir) {
        var registry = new ParserRegistry();
        registry.register(new RecordingParser("python", "py"));
        var missing = tempDir.resolve("does-not-exist.rb");
        var e = assertThrows(ParserConfigurationException.class, () -> registry.parseFile(missing));
        assertTrue(e.getMessage().contains("does-not-exist.rb"));
    }

    @Test
    void testParseFileIoErrorPropagates(@TempDir Path tempDir) {
        var registry = new ParserRegistry();
        registry.register(new RecordingParser("python", "py"));
        assertThrows(NoSuchFileException.class, () -> registry.parseFile(tempDir.resolve("missing.py")));
    }

    @Test
    void testRegistriesAreIndependent() {
        var first = new ParserRegistry();
        var second = new ParserRegistry();
        first.register(new RecordingParser("python", "py"));
        assertTrue(second.isEmpty());
        assertTrue(second.getParserByFilename("a.py").isEmpty());
        first.clear();
        assertTrue(first.isEmpty());
    }
}
