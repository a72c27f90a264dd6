package dev.runplan.model;

import dev.runplan.error.PlanConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named substitution values of a plan, in definition order.
 */
public final class VariableStore {
    private final Map<String, String> values = new LinkedHashMap<>();

    /**
     * Define a new variable. A null value is stored as the empty string.
     */
    public void define(String name, String value) {
        if (values.containsKey(name)) {
            throw new PlanConfigurationException("Variable '%s' is defined more than once".formatted(name));
        }
        values.put(name, value == null ? "" : value);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /**
     * Current value of a variable, or the empty string if it is not defined.
     */
    public String get(String name) {
        return values.getOrDefault(name, "");
    }

    /**
     * Overwrite the value of an existing variable.
     *
     * @return false, leaving the store untouched, if the variable is not defined
     */
    public boolean assign(String name, String value) {
        if (name == null || !values.containsKey(name)) {
            return false;
        }
        values.put(name, value == null ? "" : value);
        return true;
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(values);
    }
}
