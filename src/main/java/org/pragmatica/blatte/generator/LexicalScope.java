package org.pragmatica.blatte.generator;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps Blatte variables bound by lambda parameters and let forms to the Java locals holding them.
 * Names not found in any enclosing scope are globals.
 */
final class LexicalScope {
    private final LexicalScope parent;
    private final Map<String, String> locals = new HashMap<>();

    private LexicalScope(LexicalScope parent) {
        this.parent = parent;
    }

    static LexicalScope root() {
        return new LexicalScope(null);
    }

    LexicalScope child() {
        return new LexicalScope(this);
    }

    void bind(String name, String javaName) {
        locals.put(name, javaName);
    }

    Optional<String> resolve(String name) {
        for (var scope = this; scope != null; scope = scope.parent) {
            var javaName = scope.locals.get(name);
            if (javaName != null) {
                return Optional.of(javaName);
            }
        }
        return Optional.empty();
    }
}
