package io.codelab.util;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class JsonTest {

    @Test
    void testNullValuesAreWritten() {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", "f");
        map.put("docstring", null);
        map.put("lines", List.of(1, 2));

        var node = Json.fromJson(Json.toJson(map), JsonNode.class);
        assertTrue(node.has("docstring"));
        assertTrue(node.get("docstring").isNull());
        assertEquals("f", node.get("name").asText());
        assertEquals(2, node.get("lines").get(1).asInt());
    }

    @Test
    void testOutputIsIndented() {
        var json = Json.toJson(Map.of("a", 1));
        assertTrue(json.contains("\n"), json);
    }

    @Test
    void testMalformedInputIsUnchecked() {
        assertThrows(UncheckedIOException.class, () -> Json.fromJson("{not json", JsonNode.class));
    }

    @Test
    void testSharedMapper() {
        assertSame(Json.getMapper(), Json.getMapper());
    }
}
