package org.pragmatica.blatte.tree;

/**
 * A parameter declared by a function literal.
 *
 * <p>Written {@code \VAR} (positional), {@code \=VAR} (named) or {@code \&VAR} (rest).
 */
public record Parameter(Kind kind, String name) {

    public enum Kind {
        POSITIONAL,
        NAMED,
        REST
    }

    public static Parameter positional(String name) {
        return new Parameter(Kind.POSITIONAL, name);
    }

    public static Parameter named(String name) {
        return new Parameter(Kind.NAMED, name);
    }

    public static Parameter rest(String name) {
        return new Parameter(Kind.REST, name);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case POSITIONAL -> "\\" + name;
            case NAMED -> "\\=" + name;
            case REST -> "\\&" + name;
        };
    }
}
