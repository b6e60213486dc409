package org.pragmatica.blatte.tree;

import java.util.List;

/**
 * Blatte syntax tree.
 *
 * <p>Every expression the parser recognizes is wrapped in {@link Wrapped} carrying the whitespace
 * that preceded it in the source, so rendering the evaluated tree reproduces the original layout.
 */
public sealed interface Node {

    /**
     * Source span of this node (excluding its leading whitespace).
     */
    SourceSpan span();

    /**
     * This node with all whitespace wrappers removed.
     */
    default Node bare() {
        Node node = this;
        while (node instanceof Wrapped wrapped) {
            node = wrapped.inner();
        }
        return node;
    }

    // === Whitespace ===

    /**
     * An expression together with the whitespace run that preceded it.
     */
    record Wrapped(SourceSpan span, String whitespace, Node inner) implements Node {}

    // === Atoms ===

    /**
     * A run of non-whitespace text with metacharacter escapes already resolved.
     */
    record Word(SourceSpan span, String text) implements Node {}

    /**
     * Delimited string: {@code \"text\"}
     */
    record Str(SourceSpan span, String text) implements Node {}

    /**
     * Variable reference: {@code \name}
     */
    record Variable(SourceSpan span, String name) implements Node {}

    // === Groups ===

    /**
     * Generic group {@code {e1 e2 ...}}. Whether it is a call or a plain list is only known once the
     * first element has been evaluated.
     */
    record Group(SourceSpan span, List<Node> elements) implements Node {}

    /**
     * Named call argument: {@code \name=expr}
     */
    record NamedArgument(SourceSpan span, String name, Node value) implements Node {}

    // === Special forms ===

    /**
     * {@code {\define \name value}}; the function form stores a {@link Lambda} as value.
     */
    record Define(SourceSpan span, String name, Node value) implements Node {}

    /**
     * {@code {\set! \name value}}
     */
    record SetVariable(SourceSpan span, String name, Node value) implements Node {}

    /**
     * {@code {\if test then else...}}
     */
    record If(SourceSpan span, Node test, Node then, List<Node> otherwise) implements Node {}

    /**
     * {@code {\and e1 e2 ...}}
     */
    record And(SourceSpan span, List<Node> operands) implements Node {}

    /**
     * {@code {\or e1 e2 ...}}
     */
    record Or(SourceSpan span, List<Node> operands) implements Node {}

    /**
     * {@code {\cond {test body...} ...}}
     */
    record Cond(SourceSpan span, List<Clause> clauses) implements Node {
        public record Clause(SourceSpan span, Node test, List<Node> body) {}
    }

    /**
     * {@code {\while test body...}}
     */
    record While(SourceSpan span, Node test, List<Node> body) implements Node {}

    /**
     * {@code {\lambda {param...} body...}}
     */
    record Lambda(SourceSpan span, List<Parameter> parameters, List<Node> body) implements Node {}

    /**
     * {@code {\let {{\name value}...} body...}} and its {@code let*} / {@code letrec} variants.
     */
    record Let(SourceSpan span, Kind kind, List<Binding> bindings, List<Node> body) implements Node {
        public enum Kind {
            LET,
            LET_STAR,
            LETREC
        }

        public record Binding(SourceSpan span, String name, Node value) {}
    }
}
