package io.codelab.util;

import com.google.common.base.Splitter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Engine-wide settings.
 *
 * <p>Defaults come from {@code codelab.properties} on the classpath; any key can be overridden with a system property
 * of the same name prefixed by {@code codelab.}, e.g. {@code -Dcodelab.analysis.longFunctionThreshold=80}. Malformed
 * values are logged and the default is used instead.
 *
 * <p>Keys:
 *
 * <ul>
 *   <li>{@code analysis.longFunctionThreshold}: int, lines
 *   <li>{@code parser.slowParseWarnMillis}: long, milliseconds
 *   <li>{@code registry.defaultLanguages}: comma separated language ids
 * </ul>
 */
public final class CodeLabSettings {
    private static final Logger logger = LogManager.getLogger(CodeLabSettings.class);

    public static final String RESOURCE = "codelab.properties";
    public static final String SYSTEM_PREFIX = "codelab.";

    public static final String KEY_LONG_FUNCTION_THRESHOLD = "analysis.longFunctionThreshold";
    public static final String KEY_SLOW_PARSE_WARN_MILLIS = "parser.slowParseWarnMillis";
    public static final String KEY_DEFAULT_LANGUAGES = "registry.defaultLanguages";

    static final int DEFAULT_LONG_FUNCTION_THRESHOLD = 50;
    static final long DEFAULT_SLOW_PARSE_WARN_MILLIS = 500;
    static final String DEFAULT_LANGUAGES = "python,java";

    private static volatile @Nullable CodeLabSettings cached;

    private final Properties props;

    CodeLabSettings(Properties props) {
        this.props = props;
    }

    /** Settings from the classpath resource and system properties, loaded once. */
    public static CodeLabSettings get() {
        var local = cached;
        if (local != null) {
            return local;
        }
        synchronized (CodeLabSettings.class) {
            if (cached == null) {
                cached = new CodeLabSettings(loadProps());
            }
            return cached;
        }
    }

    /** Settings backed only by {@code props} and system properties; used by tests and embedding hosts. */
    public static CodeLabSettings of(Properties props) {
        var copy = new Properties();
        copy.putAll(props);
        return new CodeLabSettings(copy);
    }

    private static Properties loadProps() {
        var props = new Properties();
        try (InputStream in = CodeLabSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                logger.debug("No {} on classpath, using built-in defaults", RESOURCE);
            } else {
                try (var reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                    props.load(reader);
                }
            }
        } catch (IOException e) {
            logger.warn("Failed to load {}: {}", RESOURCE, e.getMessage());
        }
        return props;
    }

    private @Nullable String raw(String key) {
        var override = System.getProperty(SYSTEM_PREFIX + key);
        if (override != null && !override.isBlank()) {
            return override.strip();
        }
        var value = props.getProperty(key);
        return value == null || value.isBlank() ? null : value.strip();
    }

    public int getInt(String key, int fallback) {
        var value = raw(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}'; using {}", key, value, fallback);
            return fallback;
        }
    }

    public long getLong(String key, long fallback) {
        var value = raw(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}'; using {}", key, value, fallback);
            return fallback;
        }
    }

    public List<String> getList(String key, String fallback) {
        var value = raw(key);
        return Splitter.on(',')
                .trimResults()
                .omitEmptyStrings()
                .splitToStream(value == null ? fallback : value)
                .map(s -> s.toLowerCase(Locale.ROOT))
                .toList();
    }

    public int longFunctionThreshold() {
        int threshold = getInt(KEY_LONG_FUNCTION_THRESHOLD, DEFAULT_LONG_FUNCTION_THRESHOLD);
        if (threshold < 0) {
            logger.warn(
                    "Negative {} {}; using {}",
                    KEY_LONG_FUNCTION_THRESHOLD,
                    threshold,
                    DEFAULT_LONG_FUNCTION_THRESHOLD);
            return DEFAULT_LONG_FUNCTION_THRESHOLD;
        }
        return threshold;
    }

    public long slowParseWarnMillis() {
        return getLong(KEY_SLOW_PARSE_WARN_MILLIS, DEFAULT_SLOW_PARSE_WARN_MILLIS);
    }

    public List<String> defaultLanguages() {
        return getList(KEY_DEFAULT_LANGUAGES, DEFAULT_LANGUAGES);
    }
}
