package io.codelab.ast;

import java.util.Comparator;

/**
 * A point in a source file.
 *
 * @param line 1-based line number
 * @param column 0-based offset within the line, in UTF-8 bytes
 */
public record SourceLocation(int line, int column) implements Comparable<SourceLocation> {

    private static final Comparator<SourceLocation> ORDER =
            Comparator.comparingInt(SourceLocation::line).thenComparingInt(SourceLocation::column);

    public SourceLocation {
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("line and column must be non-negative: " + line + ":" + column);
        }
    }

    public static SourceLocation of(int line, int column) {
        return new SourceLocation(line, column);
    }

    @Override
    public int compareTo(SourceLocation other) {
        return ORDER.compare(this, other);
    }

    public boolean isAfter(SourceLocation other) {
        return compareTo(other) > 0;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
