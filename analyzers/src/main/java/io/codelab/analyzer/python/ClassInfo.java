package io.codelab.analyzer.python;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * A class found by {@link PythonAnalyzer}.
 *
 * @param bases base class names; for dotted bases only the last segment is kept
 * @param methods functions defined directly in the class body
 */
public record ClassInfo(
        String name,
        List<String> bases,
        List<FunctionInfo> methods,
        @Nullable String docstring,
        int lineStart,
        int lineEnd,
        List<String> decorators) {

    public ClassInfo {
        Objects.requireNonNull(name);
        bases = List.copyOf(bases);
        methods = List.copyOf(methods);
        decorators = List.copyOf(decorators);
    }

    public List<String> methodNames() {
        return methods.stream().map(FunctionInfo::name).toList();
    }

    Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", name);
        map.put("bases", bases);
        map.put("methods", methodNames());
        map.put("docstring", docstring);
        map.put("line_start", lineStart);
        map.put("line_end", lineEnd);
        map.put("decorators", decorators);
        return map;
    }
}
