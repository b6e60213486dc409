package org.pragmatica.blatte.runtime;

import java.util.List;
import java.util.Optional;

/**
 * Utilities for value trees produced by running generated Blatte code.
 *
 * <p>A value tree consists of whitespace wrappers ({@link Ws}), lists, scalars (strings and numbers),
 * callables and {@code null} for undefined values. None of these methods modify the tree.
 */
public final class Values {
    private Values() {}

    // === Whitespace wrappers ===

    public static Ws wrapws(String whitespace, Object value) {
        return new Ws(whitespace, value);
    }

    /**
     * Strip as many wrappers as needed to reach a non-wrapper value.
     */
    public static Object unwrapws(Object value) {
        var current = value;
        while (current instanceof Ws ws) {
            current = ws.value();
        }
        return current;
    }

    /**
     * Whitespace of the outermost wrapper, or the empty string for an unwrapped value.
     */
    public static String wsof(Object value) {
        return value instanceof Ws ws
               ? ws.whitespace()
               : "";
    }

    // === Truth ===

    /**
     * Blatte truth: {@code 0}, the empty string, the empty list and undefined are false, everything else
     * is true. A non-empty list is true whatever it contains.
     */
    public static boolean isTrue(Object value) {
        var bare = unwrapws(value);
        if (bare == null) {
            return false;
        }
        if (bare instanceof List<?> list) {
            return !list.isEmpty();
        }
        if (bare instanceof String text) {
            return !text.isEmpty() && !"0".equals(text);
        }
        if (bare instanceof Boolean flag) {
            return flag;
        }
        if (bare instanceof Number number) {
            return number.doubleValue() != 0.0;
        }
        return true;
    }

    // === Quoting ===

    /**
     * Quote {@code text} so that it reads back as a single Blatte word or string literal.
     */
    public static String quote(String text) {
        if (text.isEmpty()) {
            return "\\\"\\\"";
        }
        if (text.chars().anyMatch(Character::isWhitespace)) {
            return "\\\"" + text.replace("\\", "\\\\") + "\\\"";
        }
        var sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' || c == '{' || c == '}') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    // === Traversal ===

    /**
     * Walk {@code value} depth-first, left to right, calling {@code visitor} on every leaf with the
     * whitespace of its nearest wrapper.
     */
    public static <R> Traversal<R> traverse(Object value, ScalarVisitor<R> visitor) {
        return walk(value, visitor, Optional.empty());
    }

    /**
     * Walk {@code value} offering {@code whitespace} in place of the outer wrappers' whitespace.
     *
     * <p>The override is offered to leaves until one of them reports it consumed; every later leaf gets
     * its own wrapper's whitespace again.
     */
    public static <R> Traversal<R> traverse(Object value, ScalarVisitor<R> visitor, String whitespace) {
        return walk(value, visitor, Optional.ofNullable(whitespace));
    }

    private static <R> Traversal<R> walk(Object value, ScalarVisitor<R> visitor, Optional<String> whitespace) {
        if (value instanceof Ws ws) {
            return walk(ws.value(),
                        visitor,
                        whitespace.isPresent() ? whitespace : Optional.of(ws.whitespace()));
        }
        if (value instanceof List<?> list) {
            if (list.isEmpty()) {
                return Traversal.none();
            }
            var result = walk(list.get(0), visitor, whitespace);
            for (var element : list.subList(1, list.size())) {
                var next = walk(element, visitor, result.consumed() ? Optional.empty() : whitespace);
                if (!result.consumed()) {
                    result = next;
                }
            }
            return result;
        }
        return visitor.visit(whitespace, value);
    }

    /**
     * Render {@code value} as text.
     */
    public static String flatten(Object value) {
        return flatten(value, null);
    }

    /**
     * Render {@code value} as text, with {@code whitespace} (if not {@code null}) taking the place of the
     * outermost leading whitespace.
     */
    public static String flatten(Object value, String whitespace) {
        var sb = new StringBuilder();
        traverse(value, (ws, scalar) -> {
            ws.ifPresent(sb::append);
            if (scalar != null) {
                sb.append(scalar);
            }
            return Traversal.used(sb);
        }, whitespace);
        return sb.toString();
    }
}
