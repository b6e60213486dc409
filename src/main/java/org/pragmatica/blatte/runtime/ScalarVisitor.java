package org.pragmatica.blatte.runtime;

import java.util.Optional;

/**
 * Callback for {@link Values#traverse}.
 */
@FunctionalInterface
public interface ScalarVisitor<R> {
    /**
     * Visit one scalar (or callable, or undefined value).
     *
     * @param whitespace whitespace governing this scalar, empty when none applies
     * @param scalar     the unwrapped leaf value
     * @return the result, {@link Traversal#consumed()} telling whether {@code whitespace} was used
     */
    Traversal<R> visit(Optional<String> whitespace, Object scalar);
}
