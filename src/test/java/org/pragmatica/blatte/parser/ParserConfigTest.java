package org.pragmatica.blatte.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.blatte.syntax.SpecialForm;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParserConfigTest {

    @Test
    void environmentName_acceptsPlainIdentifiers() {
        for (var name : List.of("env", "globals", "$scope", "page_env", "results")) {
            assertThat(config(name).environmentName()).isEqualTo(name);
        }
    }

    @Test
    void environmentName_rejectsNonIdentifiers() {
        for (var name : List.of("not valid", "1env", "a.b", "")) {
            assertThatThrownBy(() -> config(name))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a Java identifier");
        }
    }

    @Test
    void environmentName_rejectsKeywordsAndLiterals() {
        for (var name : List.of("class", "return", "null", "true", "_")) {
            assertThatThrownBy(() -> config(name))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a Java identifier");
        }
    }

    @Test
    void environmentName_rejectsTypesUsedByGeneratedCode() {
        for (var name : List.of("Values", "Forms", "Var", "Arguments", "BlatteFunction", "Environment", "List")) {
            assertThatThrownBy(() -> config(name))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("hides a type");
        }
    }

    @Test
    void environmentName_rejectsGeneratedLocalShape() {
        for (var name : List.of("results_0", "named_1", "x_42")) {
            assertThatThrownBy(() -> config(name))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("generated local");
        }
    }

    @Test
    void limits_areValidated() {
        var forms = EnumSet.allOf(SpecialForm.class);

        assertThatThrownBy(() -> new ParserConfig(forms, "env", 0, 10))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ParserConfig(forms, "env", 1, -1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static ParserConfig config(String environmentName) {
        return new ParserConfig(EnumSet.allOf(SpecialForm.class), environmentName, 512, 1000);
    }
}
