package org.pragmatica.blatte.generator;

import org.junit.jupiter.api.Test;
import org.pragmatica.blatte.Blatte;
import org.pragmatica.blatte.error.BlatteError;
import org.pragmatica.blatte.error.BlatteException;
import org.pragmatica.blatte.parser.BlatteParser;
import org.pragmatica.blatte.parser.Parser;
import org.pragmatica.blatte.parser.ParserConfig;
import org.pragmatica.blatte.syntax.SpecialForm;
import org.pragmatica.blatte.tree.Node;
import org.pragmatica.blatte.tree.SourceLocation;
import org.pragmatica.blatte.tree.SourceSpan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JavaGeneratorTest {
    private final Parser parser = BlatteParser.create();

    @Test
    void word_becomesWrappedStringLiteral() {
        assertThat(generate("hello")).isEqualTo("Values.wrapws(\"\", \"hello\")");
        assertThat(generate("\n hello")).isEqualTo("Values.wrapws(\"\\n \", \"hello\")");
    }

    @Test
    void string_escapesForJava() {
        assertThat(generate("\\\"tab\there \\\\ \\\""))
            .isEqualTo("Values.wrapws(\"\", \"tab\\there \\\\ \")");
    }

    @Test
    void globalVariable_readsEnvironment() {
        assertThat(generate("\\x")).isEqualTo("Values.wrapws(\"\", env.get(\"x\"))");
    }

    @Test
    void environmentName_isConfigurable() {
        var custom = Blatte.builder().environmentName("globals").build();
        var node = custom.parse("\\x").orElseThrow();

        assertThat(JavaGenerator.create(custom.config()).generate(node))
            .isEqualTo("Values.wrapws(\"\", globals.get(\"x\"))");
    }

    @Test
    void functionDefinition_bindsArgumentsIntoCells() {
        assertThat(generate("{\\define {\\f \\a} \\a}"))
            .isEqualTo("Values.wrapws(\"\", env.define(\"f\", (BlatteFunction) (named_1, args_1) -> { "
                       + "var arguments_1 = Arguments.bind(\"f\", named_1, args_1, 1, false); "
                       + "final Var a_2 = new Var(arguments_1.positional(0)); "
                       + "return Values.wrapws(\" \", a_2.get()); }))");
    }

    @Test
    void lambda_allParameterKinds() {
        var code = generate("{\\lambda {\\a \\=n \\b \\&r} \\r}");

        assertThat(code).contains("Arguments.bind(\"lambda\", named_1, args_1, 2, true)")
                        .contains("final Var a_2 = new Var(arguments_1.positional(0))")
                        .contains("final Var n_3 = new Var(arguments_1.named(\"n\"))")
                        .contains("final Var b_4 = new Var(arguments_1.positional(1))")
                        .contains("final Var r_5 = new Var(arguments_1.rest())")
                        .contains("return Values.wrapws(\" \", r_5.get());");
    }

    @Test
    void nestedLambdas_neverReuseJavaNames() {
        var code = generate("{\\lambda {\\x} {\\lambda {\\x} \\x}}");

        assertThat(code).contains("(named_1, args_1)")
                        .contains("(named_3, args_3)")
                        .contains("final Var x_2 = ")
                        .contains("final Var x_4 = ")
                        .contains("return Values.wrapws(\" \", x_4.get());");
    }

    @Test
    void emptyLambdaBody_returnsEmptyList() {
        assertThat(generate("{\\lambda {}}")).contains("return Forms.EMPTY; }");
    }

    @Test
    void if_withoutElse_yieldsEmptyList() {
        assertThat(generate("{\\if \\c yes}"))
            .isEqualTo("Values.wrapws(\"\", (Values.isTrue(Values.wrapws(\" \", env.get(\"c\"))) ? "
                       + "Values.wrapws(\" \", \"yes\") : Forms.EMPTY))");
    }

    @Test
    void if_withSeveralElseExpressions_usesLast() {
        assertThat(generate("{\\if \\c a b c}"))
            .contains(" : Forms.last(Values.wrapws(\" \", \"b\"), Values.wrapws(\" \", \"c\")))");
    }

    @Test
    void andOr_delayOperands() {
        assertThat(generate("{\\and a b}"))
            .isEqualTo("Values.wrapws(\"\", Forms.and(() -> Values.wrapws(\" \", \"a\"), () -> Values.wrapws(\" \", \"b\")))");
        assertThat(generate("{\\or a}")).contains("Forms.or(() -> ");
    }

    @Test
    void cond_nestsClausesInOrder() {
        var code = generate("{\\cond {\\a one} {\\b}}");

        assertThat(code).isEqualTo("Values.wrapws(\"\", (Values.isTrue(Values.wrapws(\"\", env.get(\"a\"))) ? "
                                   + "Values.wrapws(\" \", \"one\") : "
                                   + "Forms.or(() -> Values.wrapws(\"\", env.get(\"b\")), () -> Forms.EMPTY)))");
    }

    @Test
    void while_loopsInsideBlock() {
        assertThat(generate("{\\while \\go x}"))
            .isEqualTo("Values.wrapws(\"\", Forms.block(() -> { while (Values.isTrue(Values.wrapws(\" \", env.get(\"go\")))) { "
                       + "Forms.last(Values.wrapws(\" \", \"x\")); } return Forms.EMPTY; }))");
    }

    @Test
    void let_valuesSeeOuterScope() {
        var code = generate("{\\let {{\\a 1}} {\\let {{\\a \\a}} \\a}}");

        assertThat(code).contains("final Var a_1 = new Var(Values.wrapws(\" \", \"1\"));")
                        .contains("final Var a_2 = new Var(Values.wrapws(\" \", a_1.get()));")
                        .contains("return Values.wrapws(\" \", a_2.get()); })");
    }

    @Test
    void letStar_valuesSeeEarlierBindings() {
        var code = generate("{\\let* {{\\a 1} {\\b \\a}} \\b}");

        assertThat(code).contains("final Var b_2 = new Var(Values.wrapws(\" \", a_1.get()));");
    }

    @Test
    void letrec_declaresCellsBeforeEvaluatingValues() {
        var code = generate("{\\letrec {{\\f {\\lambda {} {\\g}}} {\\g {\\lambda {} done}}} {\\f}}");

        assertThat(code).startsWith("Values.wrapws(\"\", Forms.block(() -> { final Var f_1 = new Var(); final Var g_2 = new Var(); ")
                        .contains("final Object[] values_3 = new Object[] {")
                        .contains("f_1.set(values_3[0]); g_2.set(values_3[1]);")
                        .contains("g_2.get()");
    }

    @Test
    void set_targetsLocalCellOrGlobal() {
        assertThat(generate("{\\set! \\x v}"))
            .isEqualTo("Values.wrapws(\"\", env.set(\"x\", Values.wrapws(\" \", \"v\")))");
        assertThat(generate("{\\let {{\\x 1}} {\\set! \\x 2}}"))
            .contains("x_1.set(Values.wrapws(\" \", \"2\"))");
    }

    @Test
    void group_passesNamedArgumentsSeparately() {
        assertThat(generate("{\\f a \\n=b}"))
            .isEqualTo("Values.wrapws(\"\", Forms.apply(Values.wrapws(\"\", env.get(\"f\")), "
                       + "Forms.named(\"n\", Values.wrapws(\"\", \"b\")), Values.wrapws(\" \", \"a\")))");
    }

    @Test
    void emptyGroup_isEmptyList() {
        assertThat(generate("{}")).isEqualTo("Values.wrapws(\"\", Forms.EMPTY)");
    }

    @Test
    void disabledSpecialForm_becomesCall() {
        var custom = Blatte.builder().without(SpecialForm.WHILE).build();
        var node = custom.parse("{\\while x}").orElseThrow();

        assertThat(JavaGenerator.create(custom.config()).generate(node))
            .isEqualTo("Values.wrapws(\"\", Forms.apply(Values.wrapws(\"\", env.get(\"while\")), Forms.named(), "
                       + "Values.wrapws(\" \", \"x\")))");
    }

    @Test
    void namedArgumentInExpressionPosition_isCodeGenError() {
        var span = SourceSpan.at(SourceLocation.START);
        var node = new Node.NamedArgument(span, "n", new Node.Word(span, "x"));

        assertThatThrownBy(() -> JavaGenerator.create(ParserConfig.DEFAULT).generate(node))
            .isInstanceOf(BlatteException.class)
            .hasMessageStartingWith("Cannot generate code")
            .satisfies(e -> assertThat(((BlatteException) e).error()).isInstanceOf(BlatteError.CodeGenError.class));
    }

    @Test
    void javaLiterals_escapeControlCharacters() {
        var text = "a\"b\\c\n" + (char) 1;

        assertThat(JavaLiterals.string(text)).isEqualTo("\"a\\\"b\\\\c\\n\\001\"");
    }

    private String generate(String source) {
        var node = parser.parse(source).orElseThrow();
        return JavaGenerator.create(parser.config()).generate(node);
    }
}
