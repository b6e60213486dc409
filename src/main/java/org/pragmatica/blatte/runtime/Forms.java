package org.pragmatica.blatte.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Helpers that generated code calls to express Blatte forms which have no direct Java expression
 * equivalent.
 */
public final class Forms {
    /**
     * The empty list, Blatte's canonical false value.
     */
    public static final List<Object> EMPTY = List.of();

    private Forms() {}

    /**
     * Value of the last argument. Java evaluates arguments left to right, so
     * {@code last(e1, e2, e3)} runs a body of expressions in order.
     */
    public static Object last(Object... values) {
        return values.length == 0
               ? EMPTY
               : values[values.length - 1];
    }

    /**
     * Run a block of statements in expression position.
     */
    public static Object block(Supplier<Object> body) {
        return body.get();
    }

    /**
     * Evaluate operands in order, stopping at the first false one; the value of the last one evaluated.
     */
    @SafeVarargs
    public static Object and(Supplier<Object>... operands) {
        Object result = EMPTY;
        for (var operand : operands) {
            result = operand.get();
            if (!Values.isTrue(result)) {
                return result;
            }
        }
        return result;
    }

    /**
     * Evaluate operands in order, stopping at the first true one; the value of the last one evaluated.
     */
    @SafeVarargs
    public static Object or(Supplier<Object>... operands) {
        Object result = EMPTY;
        for (var operand : operands) {
            result = operand.get();
            if (Values.isTrue(result)) {
                return result;
            }
        }
        return result;
    }

    /**
     * Unmodifiable list of {@code items}; {@code null} (undefined) elements are kept.
     */
    public static List<Object> list(Object... items) {
        return items.length == 0
               ? EMPTY
               : Collections.unmodifiableList(new ArrayList<>(Arrays.asList(items)));
    }

    /**
     * Named-argument map from alternating names and values, in call order.
     */
    public static Map<String, Object> named(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Named arguments must come in name/value pairs");
        }
        if (namesAndValues.length == 0) {
            return Map.of();
        }
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            map.put((String) namesAndValues[i], namesAndValues[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }

    /**
     * A generic group {@code {head arg...}}: a call when {@code head} evaluates to a callable, otherwise a
     * plain list of the head and the positional arguments.
     */
    public static Object apply(Object head, Map<String, Object> named, Object... arguments) {
        if (Values.unwrapws(head) instanceof BlatteFunction function) {
            return function.call(named, list(arguments));
        }
        var items = new ArrayList<Object>(arguments.length + 1);
        items.add(head);
        items.addAll(Arrays.asList(arguments));
        return Collections.unmodifiableList(items);
    }
}
