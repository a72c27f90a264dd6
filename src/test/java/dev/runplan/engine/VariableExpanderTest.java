package dev.runplan.engine;

import dev.runplan.error.SubstitutionDepthException;
import dev.runplan.model.VariableStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VariableExpanderTest {

    private VariableStore variables;
    private VariableExpander expander;

    @BeforeEach
    void setUp() {
        variables = new VariableStore();
        variables.define("x", "bar");
        variables.define("empty", "");
        expander = new VariableExpander(variables);
    }

    @Test
    void textWithoutPlaceholdersIsUnchanged() {
        assertThat(expander.expand("text")).isEqualTo("text");
    }

    @Test
    void replacesPlaceholder() {
        assertThat(expander.expand("${x}")).isEqualTo("bar");
        assertThat(expander.expand("foo ${x} baz ${x}")).isEqualTo("foo bar baz bar");
    }

    @Test
    void unsetVariableExpandsToEmpty() {
        assertThat(expander.expand("a${y}b")).isEqualTo("ab");
        assertThat(expander.expand("a${empty}b")).isEqualTo("ab");
    }

    @Test
    void unterminatedPlaceholderLeavesRestUntouched() {
        assertThat(expander.expand("${x} and ${x")).isEqualTo("bar and ${x");
    }

    @Test
    void nullExpandsToEmpty() {
        assertThat(expander.expand(null)).isEmpty();
    }

    @Test
    void valuesAreExpandedInTurn() {
        variables.define("greeting", "hello ${x}");

        assertThat(expander.expand("${greeting}!")).isEqualTo("hello bar!");
    }

    @Test
    void selfReferenceHitsTheLimit() {
        variables.define("loop", "again ${loop}");

        assertThatThrownBy(() -> new VariableExpander(variables, 50).expand("${loop}"))
            .isInstanceOf(SubstitutionDepthException.class)
            .hasMessageContaining("after 50 substitutions");
    }

    @Test
    void limitCountsOnlyPerformedSubstitutions() {
        assertThat(new VariableExpander(variables, 2).expand("${x}${x}")).isEqualTo("barbar");
    }
}
