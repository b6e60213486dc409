package org.pragmatica.blatte;

import org.pragmatica.blatte.generator.JavaGenerator;
import org.pragmatica.blatte.generator.ProgramGenerator;
import org.pragmatica.blatte.parser.BlatteParser;
import org.pragmatica.blatte.parser.Parser;
import org.pragmatica.blatte.parser.ParserConfig;
import org.pragmatica.blatte.parser.SourceCursor;
import org.pragmatica.blatte.runtime.ScalarVisitor;
import org.pragmatica.blatte.runtime.Traversal;
import org.pragmatica.blatte.runtime.Values;
import org.pragmatica.blatte.runtime.Ws;
import org.pragmatica.blatte.syntax.SpecialForm;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point for compiling Blatte to Java.
 *
 * <p>Example usage:
 * <pre>{@code
 * var cursor = SourceCursor.of("Hello, {\\greet \\name=World}!");
 * var first = Blatte.parse(cursor);   // Optional of the Java expression for "Hello,"
 *
 * var source = Blatte.compileDocument(document, "com.example.pages", "Index");
 * }</pre>
 *
 * <p>Compile errors are reported as {@link org.pragmatica.blatte.error.BlatteException}.
 */
public final class Blatte {
    private Blatte() {}

    // The default parser is built on first use.
    private static final class DefaultParser {
        private static final Parser INSTANCE = BlatteParser.create();
    }

    public static Parser defaultParser() {
        return DefaultParser.INSTANCE;
    }

    /**
     * Compile the first expression of {@code input} to a Java expression.
     *
     * @return the Java source, or empty if {@code input} holds only whitespace and comments
     */
    public static Optional<String> parse(String input) {
        return parse(defaultParser(), SourceCursor.of(input));
    }

    /**
     * Compile the first expression remaining in {@code cursor}, consuming it.
     */
    public static Optional<String> parse(SourceCursor cursor) {
        return parse(defaultParser(), cursor);
    }

    /**
     * Compile the first expression remaining in {@code cursor} with a custom parser.
     */
    public static Optional<String> parse(Parser parser, SourceCursor cursor) {
        return parser.parse(cursor)
                     .map(node -> JavaGenerator.create(parser.config())
                                               .generate(node));
    }

    /**
     * Generate a Java class running every expression of {@code document}.
     *
     * @param document    Blatte source
     * @param packageName target package for the generated class, or empty for the default package
     * @param className   name of the generated class
     * @return generated Java source code
     */
    public static String compileDocument(String document, String packageName, String className) {
        return compileDocument(defaultParser(), document, packageName, className);
    }

    public static String compileDocument(Parser parser, String document, String packageName, String className) {
        return ProgramGenerator.create(parser, packageName, className)
                               .generate(document);
    }

    // === Runtime utilities ===

    public static <R> Traversal<R> traverse(Object value, ScalarVisitor<R> visitor) {
        return Values.traverse(value, visitor);
    }

    public static <R> Traversal<R> traverse(Object value, ScalarVisitor<R> visitor, String whitespace) {
        return Values.traverse(value, visitor, whitespace);
    }

    public static String flatten(Object value) {
        return Values.flatten(value);
    }

    public static String flatten(Object value, String whitespace) {
        return Values.flatten(value, whitespace);
    }

    public static Ws wrapws(String whitespace, Object value) {
        return Values.wrapws(whitespace, value);
    }

    public static Object unwrapws(Object value) {
        return Values.unwrapws(value);
    }

    public static String wsof(Object value) {
        return Values.wsof(value);
    }

    public static boolean isTrue(Object value) {
        return Values.isTrue(value);
    }

    public static String quote(String text) {
        return Values.quote(text);
    }

    /**
     * Create a builder for a parser with non-default settings.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Set<SpecialForm> specialForms = EnumSet.noneOf(SpecialForm.class);
        private String environmentName = ParserConfig.DEFAULT.environmentName();
        private int maxDepth = ParserConfig.DEFAULT.maxDepth();
        private int maxInputSize = ParserConfig.DEFAULT.maxInputSize();

        private Builder() {
            specialForms.addAll(ParserConfig.DEFAULT.specialForms());
        }

        /**
         * Recognize exactly {@code forms}; any other keyword parses as a plain call.
         */
        public Builder specialForms(Set<SpecialForm> forms) {
            specialForms.clear();
            specialForms.addAll(forms);
            return this;
        }

        /**
         * Stop recognizing {@code form}, leaving its keyword free for a user-defined function.
         */
        public Builder without(SpecialForm form) {
            specialForms.remove(form);
            return this;
        }

        public Builder environmentName(String name) {
            this.environmentName = name;
            return this;
        }

        public Builder maxDepth(int depth) {
            this.maxDepth = depth;
            return this;
        }

        public Builder maxInputSize(int size) {
            this.maxInputSize = size;
            return this;
        }

        public Parser build() {
            return BlatteParser.create(new ParserConfig(specialForms, environmentName, maxDepth, maxInputSize));
        }
    }
}
