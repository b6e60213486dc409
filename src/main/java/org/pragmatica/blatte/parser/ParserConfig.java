package org.pragmatica.blatte.parser;

import org.pragmatica.blatte.syntax.SpecialForm;

import javax.lang.model.SourceVersion;
import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parser configuration options.
 *
 * @param specialForms    forms recognized when their keyword heads a group; others parse as plain calls
 * @param environmentName name of the global environment variable referenced by generated Java code; must be
 *                        a Java name that is not a keyword, not a type the generated code refers to by simple
 *                        name, and not of the {@code name_N} shape used for generated locals
 * @param maxDepth        maximum nesting of groups
 * @param maxInputSize    maximum number of characters handed to a single parse call
 */
public record ParserConfig(
    Set<SpecialForm> specialForms,
    String environmentName,
    int maxDepth,
    int maxInputSize
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        EnumSet.allOf(SpecialForm.class),
        "env",
        512,
        10_000_000
    );

    private static final Set<String> GENERATED_TYPES = Set.of(
        "Arguments", "ArrayList", "BlatteFunction", "BlatteProgram", "BlatteRuntimeException", "Environment",
        "Forms", "List", "Object", "ScalarVisitor", "String", "Traversal", "Values", "Var", "Ws"
    );
    private static final Pattern GENERATED_LOCAL = Pattern.compile(".*_[0-9]+");

    public ParserConfig {
        specialForms = Set.copyOf(specialForms);
        if (environmentName == null || !SourceVersion.isName(environmentName) || environmentName.contains(".")) {
            throw new IllegalArgumentException("Environment name is not a Java identifier: " + environmentName);
        }
        if (GENERATED_TYPES.contains(environmentName)) {
            throw new IllegalArgumentException("Environment name hides a type used by generated code: " + environmentName);
        }
        if (GENERATED_LOCAL.matcher(environmentName).matches()) {
            throw new IllegalArgumentException("Environment name may clash with a generated local: " + environmentName);
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Maximum depth must be positive: " + maxDepth);
        }
        if (maxInputSize < 0) {
            throw new IllegalArgumentException("Maximum input size must not be negative: " + maxInputSize);
        }
    }

    public boolean recognizes(SpecialForm form) {
        return specialForms.contains(form);
    }
}
