package org.pragmatica.blatte.tree;

/**
 * A range in Blatte source text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public int length() {
        return end.offset() - start.offset();
    }

    /**
     * Smallest span covering both this span and {@code other}.
     */
    public SourceSpan to(SourceSpan other) {
        var newStart = start.offset() <= other.start.offset() ? start : other.start;
        var newEnd = end.offset() >= other.end.offset() ? end : other.end;
        return new SourceSpan(newStart, newEnd);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
