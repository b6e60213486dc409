package org.pragmatica.blatte.runtime;

import java.util.Objects;

/**
 * Whitespace wrapper: a value together with the whitespace that preceded it in the source.
 * Wrappers may nest; the outermost one wins when rendering.
 */
public record Ws(String whitespace, Object value) {
    public Ws {
        Objects.requireNonNull(whitespace, "whitespace");
    }
}
