package org.pragmatica.blatte.tree;

/**
 * A position in Blatte source text. Line and column are 1-based, offset is 0-based.
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    /**
     * The location right after consuming {@code c} at this location.
     */
    public SourceLocation next(char c) {
        return c == '\n'
               ? new SourceLocation(line + 1, 1, offset + 1)
               : new SourceLocation(line, column + 1, offset + 1);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
