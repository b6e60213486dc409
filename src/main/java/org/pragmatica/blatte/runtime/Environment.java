package org.pragmatica.blatte.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Global variables of a running Blatte program. Builtin libraries populate it with {@link #define}
 * before the program runs.
 */
public final class Environment {
    private static final Logger LOG = LoggerFactory.getLogger(Environment.class);

    private final Map<String, Var> variables = new HashMap<>();

    private Environment() {}

    public static Environment create() {
        return new Environment();
    }

    /**
     * Create or replace a global variable.
     *
     * @return the stored value
     */
    public Object define(String name, Object value) {
        LOG.trace("define {}", name);
        return variables.computeIfAbsent(name, key -> new Var()).set(value);
    }

    public Environment defineFunction(String name, BlatteFunction function) {
        define(name, function);
        return this;
    }

    public boolean isDefined(String name) {
        return variables.containsKey(name);
    }

    public Object get(String name) {
        return lookup(name).get();
    }

    /**
     * Assign an existing global variable.
     *
     * @return the stored value
     */
    public Object set(String name, Object value) {
        return lookup(name).set(value);
    }

    private Var lookup(String name) {
        var variable = variables.get(name);
        if (variable == null) {
            throw new BlatteRuntimeException("Undefined variable \\" + name);
        }
        return variable;
    }
}
