package io.codelab.analyzer.java;

import io.codelab.ast.Parameter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A method found by {@link JavaAnalyzer}. Constructors are not methods.
 *
 * @param modifiers modifier keywords in source order, e.g. {@code public static}
 * @param annotations annotation names as written, without {@code @}
 * @param returnType the declared return type as written
 * @param throwsTypes the types listed in the {@code throws} clause
 * @param lineStart 1-based first line of the declaration, annotations included
 */
public record JavaMethodInfo(
        String name,
        List<String> modifiers,
        List<String> annotations,
        String returnType,
        List<Parameter> parameters,
        List<String> throwsTypes,
        int lineStart,
        int lineEnd) {

    public JavaMethodInfo {
        Objects.requireNonNull(name);
        Objects.requireNonNull(returnType);
        modifiers = List.copyOf(modifiers);
        annotations = List.copyOf(annotations);
        parameters = List.copyOf(parameters);
        throwsTypes = List.copyOf(throwsTypes);
    }

    public boolean hasModifier(String modifier) {
        return modifiers.contains(modifier);
    }

    Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", name);
        map.put("modifiers", modifiers);
        map.put("return_type", returnType);
        map.put("parameters", parameters.stream()
                .map(p -> {
                    var param = new LinkedHashMap<String, Object>();
                    param.put("name", p.name());
                    param.put("type", p.type());
                    return param;
                })
                .toList());
        map.put("throws", throwsTypes);
        map.put("annotations", annotations);
        map.put("line_start", lineStart);
        map.put("line_end", lineEnd);
        return map;
    }
}
