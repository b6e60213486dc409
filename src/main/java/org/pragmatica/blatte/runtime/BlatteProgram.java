package org.pragmatica.blatte.runtime;

import java.util.List;

/**
 * A compiled Blatte document. {@code run} evaluates the top-level expressions in order and returns
 * their values; flattening that list renders the document.
 */
public interface BlatteProgram {
    List<Object> run(Environment env);
}
