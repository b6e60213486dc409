package org.pragmatica.blatte.runtime;

import java.util.Optional;

/**
 * Outcome of visiting part of a value tree.
 *
 * @param value    payload produced by the visitor, if any
 * @param consumed whether the visitor used the whitespace it was offered
 */
public record Traversal<R>(Optional<R> value, boolean consumed) {

    public static <R> Traversal<R> none() {
        return new Traversal<>(Optional.empty(), false);
    }

    public static <R> Traversal<R> used(R value) {
        return new Traversal<>(Optional.ofNullable(value), true);
    }

    public static <R> Traversal<R> unused(R value) {
        return new Traversal<>(Optional.ofNullable(value), false);
    }
}
