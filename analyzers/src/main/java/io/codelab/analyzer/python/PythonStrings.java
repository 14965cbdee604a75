package io.codelab.analyzer.python;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Decoding of Python string literal text. */
final class PythonStrings {
    private static final Logger log = LogManager.getLogger(PythonStrings.class);

    private PythonStrings() {}

    /**
     * The value of a single string literal as written in source, or null for byte strings and f-strings. Raw strings
     * are returned verbatim.
     */
    static @Nullable String decode(String literal) {
        int prefixEnd = 0;
        while (prefixEnd < literal.length() && Character.isLetter(literal.charAt(prefixEnd))) {
            prefixEnd++;
        }
        var prefix = literal.substring(0, prefixEnd).toLowerCase(Locale.ROOT);
        if (prefix.contains("b") || prefix.contains("f") || prefix.contains("t")) {
            return null;
        }
        var quoted = literal.substring(prefixEnd);
        int quoteLength = quoted.startsWith("\"\"\"") || quoted.startsWith("'''") ? 3 : 1;
        if (quoted.length() < 2 * quoteLength) {
            return null;
        }
        var body = quoted.substring(quoteLength, quoted.length() - quoteLength);
        return prefix.contains("r") ? body : unescape(body);
    }

    /**
     * Decodes backslash escapes as Python does for str literals, including {@code \\xhh}, octal, {@code \\uXXXX},
     * {@code \\UXXXXXXXX} and {@code \\N{NAME}}. Unknown or malformed escapes are kept as written.
     */
    static String unescape(String body) {
        if (body.indexOf('\\') < 0) {
            return body;
        }
        var sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 == body.length()) {
                sb.append(c);
                i++;
                continue;
            }
            char next = body.charAt(i + 1);
            int consumed = 2;
            switch (next) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case 'a' -> sb.append((char) 0x07);
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'v' -> sb.append((char) 0x0B);
                case '\\' -> sb.append('\\');
                case '\'' -> sb.append('\'');
                case '"' -> sb.append('"');
                case '\n' -> {
                    // line continuation
                }
                case 'x' -> consumed = appendHex(body, i, 2, sb);
                case 'u' -> consumed = appendHex(body, i, 4, sb);
                case 'U' -> consumed = appendHex(body, i, 8, sb);
                case 'N' -> consumed = appendNamed(body, i, sb);
                default -> {
                    if (next >= '0' && next <= '7') {
                        int end = i + 1;
                        while (end < body.length() && end < i + 4 && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
                            end++;
                        }
                        sb.appendCodePoint(Integer.parseInt(body.substring(i + 1, end), 8));
                        consumed = end - i;
                    } else {
                        sb.append('\\').append(next);
                    }
                }
            }
            i += consumed;
        }
        return sb.toString();
    }

    /** Appends the code point of a {@code digits}-long hex escape at {@code start}; returns the characters consumed. */
    private static int appendHex(String body, int start, int digits, StringBuilder sb) {
        int end = start + 2 + digits;
        if (end <= body.length()) {
            var hex = body.substring(start + 2, end);
            if (hex.chars().allMatch(ch -> Character.digit(ch, 16) >= 0)) {
                int codePoint = Integer.parseUnsignedInt(hex, 16);
                if (Character.isValidCodePoint(codePoint)) {
                    sb.appendCodePoint(codePoint);
                    return end - start;
                }
            }
        }
        sb.append(body, start, start + 2);
        return 2;
    }

    private static int appendNamed(String body, int start, StringBuilder sb) {
        int close = body.indexOf('}', start);
        if (start + 2 < body.length() && body.charAt(start + 2) == '{' && close > start + 3) {
            var name = body.substring(start + 3, close);
            try {
                sb.appendCodePoint(Character.codePointOf(name));
                return close + 1 - start;
            } catch (IllegalArgumentException e) {
                log.debug("Unknown character name '{}' in string literal, keeping escape", name);
            }
        }
        sb.append(body, start, start + 2);
        return 2;
    }

    /** Mirrors Python's {@code inspect.cleandoc}: uniform indentation is removed and blank edge lines dropped. */
    static String cleandoc(String doc) {
        var lines = new ArrayList<>(Arrays.asList(expandTabs(doc).split("\n", -1)));
        int margin = Integer.MAX_VALUE;
        for (int i = 1; i < lines.size(); i++) {
            var line = lines.get(i);
            var content = line.stripLeading();
            if (!content.isEmpty()) {
                margin = Math.min(margin, line.length() - content.length());
            }
        }
        lines.set(0, lines.get(0).stripLeading());
        if (margin < Integer.MAX_VALUE) {
            for (int i = 1; i < lines.size(); i++) {
                var line = lines.get(i);
                lines.set(i, line.length() > margin ? line.substring(margin) : "");
            }
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        while (!lines.isEmpty() && lines.get(0).isEmpty()) {
            lines.remove(0);
        }
        return String.join("\n", lines);
    }

    private static String expandTabs(String s) {
        if (s.indexOf('\t') < 0) {
            return s;
        }
        var sb = new StringBuilder();
        int column = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\t') {
                int spaces = 8 - (column % 8);
                sb.append(" ".repeat(spaces));
                column += spaces;
            } else {
                sb.append(c);
                column = c == '\n' || c == '\r' ? 0 : column + 1;
            }
        }
        return sb.toString();
    }

    /** Joins the decoded parts of an implicitly concatenated string, or returns null if any part is not plain text. */
    static @Nullable String decodeAll(List<String> parts) {
        var sb = new StringBuilder();
        for (var part : parts) {
            var decoded = decode(part);
            if (decoded == null) {
                return null;
            }
            sb.append(decoded);
        }
        return sb.toString();
    }
}
