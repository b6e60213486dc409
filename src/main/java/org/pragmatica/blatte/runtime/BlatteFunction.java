package org.pragmatica.blatte.runtime;

import java.util.List;
import java.util.Map;

/**
 * A callable Blatte value.
 *
 * <p>Every callable, generated or supplied by a builtin library, receives the named arguments first
 * (empty when none were given) and then the positional arguments in call order.
 */
@FunctionalInterface
public interface BlatteFunction {
    Object call(Map<String, Object> named, List<Object> positional);
}
