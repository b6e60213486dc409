package org.pragmatica.blatte.parser;

import org.pragmatica.blatte.tree.Node;

import java.util.Optional;

/**
 * Parses Blatte text one expression at a time.
 *
 * <p>Failures are reported by throwing {@link org.pragmatica.blatte.error.BlatteException}.
 */
public interface Parser {

    /**
     * Parse the first expression of {@code input}.
     *
     * @return the expression wrapped with its leading whitespace, or empty if only whitespace remains
     */
    Optional<Node> parse(String input);

    /**
     * Parse the first expression remaining in {@code cursor} and remove it from the buffer.
     * Nothing is consumed when the parse fails or only whitespace remains.
     */
    Optional<Node> parse(SourceCursor cursor);

    /**
     * Consume whitespace, comments and forget-whitespace markers at the front of {@code cursor}.
     *
     * @return the whitespace that would precede the next expression, after comments are dropped and
     *         forgotten runs cancelled
     */
    String skipWhitespace(SourceCursor cursor);

    ParserConfig config();
}
