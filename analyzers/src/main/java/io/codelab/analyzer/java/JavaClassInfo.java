package io.codelab.analyzer.java;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * A type declaration found by {@link JavaAnalyzer}: a class, interface, enum, record or annotation type.
 *
 * @param kind one of {@code class}, {@code interface}, {@code enum}, {@code record} or {@code annotation}
 * @param superclass the extended class without type arguments; always null for interfaces
 * @param interfaces implemented interfaces without type arguments, or the extended ones for an interface
 * @param methods methods declared directly in the body
 */
public record JavaClassInfo(
        String name,
        String kind,
        List<String> modifiers,
        List<String> annotations,
        @Nullable String superclass,
        List<String> interfaces,
        List<JavaFieldInfo> fields,
        List<JavaMethodInfo> methods,
        int lineStart,
        int lineEnd) {

    public JavaClassInfo {
        Objects.requireNonNull(name);
        Objects.requireNonNull(kind);
        modifiers = List.copyOf(modifiers);
        annotations = List.copyOf(annotations);
        interfaces = List.copyOf(interfaces);
        fields = List.copyOf(fields);
        methods = List.copyOf(methods);
    }

    /** The first method named {@code name}; overloads after it are not considered. */
    public Optional<JavaMethodInfo> getMethod(String name) {
        return methods.stream().filter(m -> m.name().equals(name)).findFirst();
    }

    Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", name);
        map.put("kind", kind);
        map.put("modifiers", modifiers);
        map.put("extends", superclass);
        map.put("implements", interfaces);
        map.put("annotations", annotations);
        map.put("fields", fields.stream().map(JavaFieldInfo::toMap).toList());
        map.put("methods", methods.stream().map(JavaMethodInfo::toMap).toList());
        map.put("line_start", lineStart);
        map.put("line_end", lineEnd);
        return map;
    }
}
