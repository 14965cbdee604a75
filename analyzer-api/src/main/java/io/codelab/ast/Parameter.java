package io.codelab.ast;

import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * A formal parameter of a function or method. Parameters are attributes of their declaration, not tree nodes.
 *
 * @param name the parameter name as written
 * @param type the type annotation text, if any
 * @param defaultValue the default value source text, if any
 * @param optional whether callers may omit the argument
 */
public record Parameter(String name, @Nullable String type, @Nullable String defaultValue, boolean optional) {

    public Parameter {
        Objects.requireNonNull(name);
    }

    public static Parameter named(String name) {
        return new Parameter(name, null, null, false);
    }
}
