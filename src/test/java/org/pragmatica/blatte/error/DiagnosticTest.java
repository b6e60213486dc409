package org.pragmatica.blatte.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.blatte.Blatte;
import org.pragmatica.blatte.tree.SourceLocation;
import org.pragmatica.blatte.tree.SourceSpan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class DiagnosticTest {

    @Test
    void format_showsLineAndUnderlinesSpan() {
        var source = "Hello {\\if x}";
        var exception = catchThrowableOfType(() -> Blatte.compileDocument(source, "p", "Page"),
                                             BlatteException.class);

        var output = Diagnostic.of(exception)
                               .withHelp("\\if needs a test and a consequent")
                               .format(source, "page.blt");

        assertThat(output).contains("parse error: Malformed if: expected at least 2 sub-expressions")
                          .contains("  --> page.blt:1:7")
                          .contains("1 | Hello {\\if x}")
                          .contains("  |       ^^^^^^^ Malformed if")
                          .contains("= help: \\if needs a test and a consequent");
    }

    @Test
    void formatSimple_isSingleLine() {
        var source = "ok\n  }";
        var exception = catchThrowableOfType(() -> Blatte.compileDocument(source, "p", "Page"),
                                             BlatteException.class);

        assertThat(Diagnostic.of(exception).formatSimple("page.blt"))
            .isEqualTo("page.blt:2:3: parse error: Unmatched '}'");
        assertThat(Diagnostic.of(exception).formatSimple(null))
            .startsWith("input:2:3:");
    }

    @Test
    void lexErrors_areLabelled() {
        var exception = catchThrowableOfType(() -> Blatte.parse("\\\"open"), BlatteException.class);

        var diagnostic = Diagnostic.of(exception);

        assertThat(diagnostic.kind()).isEqualTo("lex error");
        assertThat(diagnostic.span().start().column()).isEqualTo(1);
    }

    @Test
    void codeGenErrors_reportStage() {
        var error = new BlatteError.CodeGenError(SourceSpan.at(SourceLocation.START), "bad tree");

        assertThat(error.message()).isEqualTo("Cannot generate code: bad tree at 1:1");
        assertThat(Diagnostic.of(error).kind()).isEqualTo("internal error");
    }
}
