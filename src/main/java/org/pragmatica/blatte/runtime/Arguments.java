package org.pragmatica.blatte.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Call arguments distributed over a function's declared parameters.
 *
 * <p>Positional parameters take the first positional arguments in order, the rest parameter takes
 * whatever remains, named parameters take the value supplied under their name or stay undefined
 * ({@code null}). Named arguments without a matching parameter are ignored.
 */
public final class Arguments {
    private final Map<String, Object> named;
    private final List<Object> positional;
    private final int positionalCount;

    private Arguments(Map<String, Object> named, List<Object> positional, int positionalCount) {
        this.named = named;
        this.positional = positional;
        this.positionalCount = positionalCount;
    }

    /**
     * Check the argument counts of a call.
     *
     * @param function        function name for error messages
     * @param positionalCount number of declared positional parameters
     * @param hasRest         whether a rest parameter is declared
     * @throws BlatteRuntimeException if arguments are missing, or surplus remains without a rest parameter
     */
    public static Arguments bind(String function,
                                 Map<String, Object> named,
                                 List<Object> positional,
                                 int positionalCount,
                                 boolean hasRest) {
        if (positional.size() < positionalCount) {
            throw new BlatteRuntimeException(function + " expects " + (hasRest ? "at least " : "")
                                             + positionalCount + " positional argument"
                                             + (positionalCount == 1 ? "" : "s") + ", got " + positional.size());
        }
        if (!hasRest && positional.size() > positionalCount) {
            throw new BlatteRuntimeException(function + " expects " + positionalCount + " positional argument"
                                             + (positionalCount == 1 ? "" : "s") + ", got " + positional.size());
        }
        return new Arguments(named, positional, positionalCount);
    }

    public Object named(String name) {
        return named.get(name);
    }

    public Object positional(int index) {
        return positional.get(index);
    }

    /**
     * Positional arguments beyond the declared positional parameters, in call order.
     */
    public List<Object> rest() {
        if (positional.size() == positionalCount) {
            return Forms.EMPTY;
        }
        return Collections.unmodifiableList(new ArrayList<>(positional.subList(positionalCount, positional.size())));
    }
}
