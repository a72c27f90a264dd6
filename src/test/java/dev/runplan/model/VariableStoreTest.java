package dev.runplan.model;

import dev.runplan.error.PlanConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class VariableStoreTest {

    @Test
    void undefinedVariableReadsAsEmpty() {
        var store = new VariableStore();

        assertThat(store.get("nope")).isEmpty();
        assertThat(store.contains("nope")).isFalse();
    }

    @Test
    void nullValueIsStoredAsEmpty() {
        var store = new VariableStore();
        store.define("host", null);

        assertThat(store.contains("host")).isTrue();
        assertThat(store.get("host")).isEmpty();
    }

    @Test
    void assignOnlyUpdatesDefinedVariables() {
        var store = new VariableStore();
        store.define("host", "a");

        assertThat(store.assign("host", "b")).isTrue();
        assertThat(store.assign("port", "22")).isFalse();

        assertThat(store.asMap()).containsExactly(entry("host", "b"));
    }

    @Test
    void duplicateDefinitionIsRejected() {
        var store = new VariableStore();
        store.define("host", "a");

        assertThatThrownBy(() -> store.define("host", "b"))
            .isInstanceOf(PlanConfigurationException.class)
            .hasMessageContaining("host");
    }
}
