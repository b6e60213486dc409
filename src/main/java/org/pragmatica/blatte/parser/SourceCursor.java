package org.pragmatica.blatte.parser;

import org.pragmatica.blatte.tree.SourceLocation;

/**
 * Mutable cursor over a shared text buffer.
 *
 * <p>Each successful parse removes the consumed expression from the front of the buffer, so repeated
 * calls walk through a document one expression at a time. The cursor remembers where the buffer
 * currently starts in the original document, so error positions stay meaningful.
 */
public final class SourceCursor {
    private final StringBuilder buffer;
    private SourceLocation origin;

    private SourceCursor(StringBuilder buffer, SourceLocation origin) {
        this.buffer = buffer;
        this.origin = origin;
    }

    public static SourceCursor over(StringBuilder buffer) {
        return new SourceCursor(buffer, SourceLocation.START);
    }

    public static SourceCursor of(String text) {
        return over(new StringBuilder(text));
    }

    public String remaining() {
        return buffer.toString();
    }

    public boolean isEmpty() {
        return buffer.length() == 0;
    }

    /**
     * Position of the first remaining character within the original document.
     */
    public SourceLocation origin() {
        return origin;
    }

    void consume(int count) {
        var location = origin;
        for (int i = 0; i < count; i++) {
            location = location.next(buffer.charAt(i));
        }
        buffer.delete(0, count);
        origin = location;
    }
}
