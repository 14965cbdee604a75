package io.codelab.analyzer.python;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * One import. A plain {@code import a, b} yields one entry per module; a {@code from m import x, y} statement yields a
 * single entry listing all names.
 *
 * @param module the imported module, or the {@code from} module text (relative dots kept)
 * @param names the imported names; for plain imports the module itself
 * @param alias the {@code as} name of a plain import
 * @param fromImport whether this is a {@code from ... import} statement
 * @param bindings names bound in the importing module mapped to what they refer to: the module for plain imports,
 *     the imported name for {@code from} imports
 */
public record ImportInfo(
        String module,
        List<String> names,
        @Nullable String alias,
        int line,
        boolean fromImport,
        Map<String, String> bindings) {
    public static final String WILDCARD = "*";

    public ImportInfo {
        Objects.requireNonNull(module);
        names = List.copyOf(names);
        bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    /** {@code import module [as alias]}. */
    public static ImportInfo plain(String module, @Nullable String alias, int line) {
        var bound = alias != null ? alias : module.split("\\.", 2)[0];
        return new ImportInfo(module, List.of(module), alias, line, false, Map.of(bound, module));
    }

    /** {@code from module import ...}; {@code bindings} maps each bound name to the imported name. */
    public static ImportInfo from(String module, List<String> names, Map<String, String> bindings, int line) {
        return new ImportInfo(module, names, null, line, true, bindings);
    }

    /** How an unused binding is reported: {@code module}, {@code module as alias} or {@code module.name}. */
    String describe(String boundName) {
        if (!fromImport) {
            return alias != null ? module + " as " + alias : module;
        }
        var imported = bindings.getOrDefault(boundName, boundName);
        return module.endsWith(".") ? module + imported : module + "." + imported;
    }

    Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("module", module);
        map.put("names", names);
        map.put("alias", alias);
        map.put("line", line);
        return map;
    }
}
