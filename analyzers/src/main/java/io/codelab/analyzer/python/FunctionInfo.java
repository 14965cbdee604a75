package io.codelab.analyzer.python;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * A function or method found by {@link PythonAnalyzer}.
 *
 * @param args positional parameter names in declaration order, up to the first {@code *} or {@code *args}
 * @param returns the return annotation text
 * @param docstring the cleaned docstring
 * @param lineStart 1-based line of the {@code def} keyword (decorators are not included)
 * @param lineEnd 1-based last line of the body
 * @param calls distinct names of called functions, in first-seen order; {@code a.b()} calls {@code b}
 */
public record FunctionInfo(
        String name,
        List<String> args,
        @Nullable String returns,
        @Nullable String docstring,
        int lineStart,
        int lineEnd,
        int complexity,
        Set<String> calls,
        List<String> decorators) {

    public FunctionInfo {
        Objects.requireNonNull(name);
        args = List.copyOf(args);
        calls = Collections.unmodifiableSet(new LinkedHashSet<>(calls));
        decorators = List.copyOf(decorators);
    }

    /** Lines after the first, i.e. {@code lineEnd - lineStart}. */
    public int length() {
        return lineEnd - lineStart;
    }

    /** False for a missing or empty docstring. */
    public boolean hasDocstring() {
        return docstring != null && !docstring.isEmpty();
    }

    Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", name);
        map.put("args", args);
        map.put("returns", returns);
        map.put("docstring", docstring);
        map.put("line_start", lineStart);
        map.put("line_end", lineEnd);
        map.put("complexity", complexity);
        map.put("calls", List.copyOf(calls));
        map.put("decorators", decorators);
        return map;
    }
}
