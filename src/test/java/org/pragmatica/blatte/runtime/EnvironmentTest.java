package org.pragmatica.blatte.runtime;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvironmentTest {

    @Test
    void define_createsAndReplaces() {
        var env = Environment.create();

        assertThat(env.define("x", "1")).isEqualTo("1");
        assertThat(env.get("x")).isEqualTo("1");

        env.define("x", "2");
        assertThat(env.get("x")).isEqualTo("2");
    }

    @Test
    void set_updatesExistingVariable() {
        var env = Environment.create();
        env.define("x", "1");

        assertThat(env.set("x", "3")).isEqualTo("3");
        assertThat(env.get("x")).isEqualTo("3");
    }

    @Test
    void undefinedVariable_failsOnGetAndSet() {
        var env = Environment.create();

        assertThat(env.isDefined("missing")).isFalse();
        assertThatThrownBy(() -> env.get("missing"))
            .isInstanceOf(BlatteRuntimeException.class)
            .hasMessage("Undefined variable \\missing");
        assertThatThrownBy(() -> env.set("missing", "x"))
            .isInstanceOf(BlatteRuntimeException.class);
    }

    @Test
    void definedAsUndefined_isStillDefined() {
        var env = Environment.create();
        env.define("nothing", null);

        assertThat(env.isDefined("nothing")).isTrue();
        assertThat(env.get("nothing")).isNull();
    }

    @Test
    void defineFunction_isFluent() {
        BlatteFunction first = (named, args) -> "1";
        BlatteFunction second = (named, args) -> "2";

        var env = Environment.create()
                             .defineFunction("first", first)
                             .defineFunction("second", second);

        assertThat(env.get("first")).isSameAs(first);
        assertThat(env.get("second")).isSameAs(second);
    }
}
