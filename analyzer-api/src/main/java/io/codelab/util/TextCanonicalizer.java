package io.codelab.util;

import java.util.List;

public final class TextCanonicalizer {
    private TextCanonicalizer() {
        /* utility class – no instances */
    }

    public static boolean hasUtf8Bom(String s) {
        return !s.isEmpty() && s.charAt(0) == '\uFEFF';
    }

    /**
     * Strips a leading UTF-8 BOM (U+FEFF) from the provided String, if present. Returns the original string if no BOM
     * is present.
     */
    public static String stripUtf8Bom(String s) {
        if (hasUtf8Bom(s)) {
            return s.substring(1);
        }
        return s;
    }

    /**
     * Number of lines in {@code s}, where a trailing line terminator does not start another line: {@code ""} has 0
     * lines, {@code "a"} and {@code "a\n"} have 1.
     */
    public static int lineCount(String s) {
        return (int) s.lines().count();
    }

    /** The 1-based line {@code line} of {@code s} without its terminator, or the empty string when out of range. */
    public static String lineAt(String s, int line) {
        if (line < 1) {
            return "";
        }
        List<String> lines = s.lines().skip(line - 1).limit(1).toList();
        return lines.isEmpty() ? "" : lines.get(0);
    }
}
