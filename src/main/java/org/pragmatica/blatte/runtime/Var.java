package org.pragmatica.blatte.runtime;

/**
 * Mutable variable cell. Generated code declares cells as final locals so closures can share and
 * update them.
 */
public final class Var {
    private Object value;

    public Var() {
    }

    public Var(Object value) {
        this.value = value;
    }

    public Object get() {
        return value;
    }

    /**
     * Store {@code value} and return it, like an assignment expression.
     */
    public Object set(Object value) {
        this.value = value;
        return value;
    }
}
