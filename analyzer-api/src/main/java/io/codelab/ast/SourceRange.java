package io.codelab.ast;

import java.util.Objects;

/** Start and end of a node in its source file; {@code start} never comes after {@code end}. */
public record SourceRange(SourceLocation start, SourceLocation end) {

    public SourceRange {
        Objects.requireNonNull(start);
        Objects.requireNonNull(end);
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Range start " + start + " is after end " + end);
        }
    }

    public static SourceRange of(int startLine, int startColumn, int endLine, int endColumn) {
        return new SourceRange(new SourceLocation(startLine, startColumn), new SourceLocation(endLine, endColumn));
    }

    public boolean containsLine(int line) {
        return start.line() <= line && end.line() >= line;
    }

    /** True when this range lies fully inside {@code [lo, hi]}. */
    public boolean isWithin(SourceLocation lo, SourceLocation hi) {
        return start.compareTo(lo) >= 0 && end.compareTo(hi) <= 0;
    }

    public int lineSpan() {
        return end.line() - start.line();
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
