package org.pragmatica.blatte.runtime;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormsTest {

    @Test
    void last_returnsFinalValueOrEmpty() {
        assertThat(Forms.last("a", "b", "c")).isEqualTo("c");
        assertThat(Forms.last()).isSameAs(Forms.EMPTY);
    }

    @Test
    void and_stopsAtFirstFalseValue() {
        var evaluated = new AtomicInteger();

        var result = Forms.and(() -> {
                                   evaluated.incrementAndGet();
                                   return "x";
                               },
                               () -> {
                                   evaluated.incrementAndGet();
                                   return "0";
                               },
                               () -> {
                                   evaluated.incrementAndGet();
                                   return "never";
                               });

        assertThat(result).isEqualTo("0");
        assertThat(evaluated).hasValue(2);
    }

    @Test
    void or_stopsAtFirstTrueValue() {
        var evaluated = new AtomicInteger();

        var result = Forms.or(() -> {
                                  evaluated.incrementAndGet();
                                  return Forms.EMPTY;
                              },
                              () -> {
                                  evaluated.incrementAndGet();
                                  return "yes";
                              },
                              () -> {
                                  evaluated.incrementAndGet();
                                  return "never";
                              });

        assertThat(result).isEqualTo("yes");
        assertThat(evaluated).hasValue(2);
    }

    @Test
    void orWithoutTrueOperand_returnsLastValue() {
        assertThat(Forms.or(() -> "", () -> "0")).isEqualTo("0");
    }

    @Test
    void list_keepsUndefinedElementsAndIsUnmodifiable() {
        var list = Forms.list("a", null, "b");

        assertThat(list).containsExactly("a", null, "b");
        assertThatThrownBy(() -> list.add("c")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void named_keepsCallOrder() {
        var named = Forms.named("z", 1, "a", 2);

        assertThat(named.keySet()).containsExactly("z", "a");
        assertThat(Forms.named()).isEmpty();
        assertThatThrownBy(() -> Forms.named("lonely")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void apply_callsFunctionHead() {
        var calls = new ArrayList<Object>();
        BlatteFunction function = (named, args) -> {
            calls.add(named);
            calls.add(args);
            return "called";
        };

        var result = Forms.apply(Values.wrapws(" ", function), Forms.named("k", "v"), "a", "b");

        assertThat(result).isEqualTo("called");
        assertThat(calls).containsExactly(Map.of("k", "v"), List.of("a", "b"));
    }

    @Test
    void apply_buildsListForOtherHeads() {
        var head = Values.wrapws("", "word");

        var result = Forms.apply(head, Forms.named("ignored", "x"), "a");

        assertThat(result).isEqualTo(List.of(head, "a"));
    }

    @Test
    void block_runsStatements() {
        var counter = new AtomicInteger();

        var result = Forms.block(() -> {
            while (counter.get() < 3) {
                counter.incrementAndGet();
            }
            return Forms.EMPTY;
        });

        assertThat(result).isSameAs(Forms.EMPTY);
        assertThat(counter).hasValue(3);
    }
}
