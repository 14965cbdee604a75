package io.codelab.analyzer.java;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** One declared field; {@code int a, b;} yields two. {@code type} is the declared type as written. */
public record JavaFieldInfo(String name, String type, List<String> modifiers) {

    public JavaFieldInfo {
        Objects.requireNonNull(name);
        Objects.requireNonNull(type);
        modifiers = List.copyOf(modifiers);
    }

    Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", name);
        map.put("type", type);
        map.put("modifiers", modifiers);
        return map;
    }
}
