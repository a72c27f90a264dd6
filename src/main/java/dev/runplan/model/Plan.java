package dev.runplan.model;

import dev.runplan.error.PlanConfigurationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A plan owns its steps and variables, both kept in definition order.
 */
public final class Plan {
    private final String sourceReference; // nullable: plans built in memory have no source
    private final Map<String, Step> steps = new LinkedHashMap<>();
    private final VariableStore variables = new VariableStore();

    public Plan(String sourceReference) {
        this.sourceReference = sourceReference;
    }

    public String sourceReference() { return sourceReference; }
    public VariableStore variables() { return variables; }

    public void addStep(Step step) {
        if (steps.containsKey(step.name())) {
            throw new PlanConfigurationException("Step '%s' is defined more than once".formatted(step.name()));
        }
        steps.put(step.name(), step);
    }

    public void addVariable(String name, String value) {
        variables.define(name, value);
    }

    public Optional<Step> step(String name) {
        return Optional.ofNullable(steps.get(name));
    }

    public Collection<Step> steps() {
        return Collections.unmodifiableCollection(steps.values());
    }

    public boolean anyFailed() {
        return steps.values().stream().anyMatch(s -> s.state() == StepState.FAILED);
    }

    /**
     * Move every FAILED step back to PENDING so it gets another chance.
     */
    public void resetFailed() {
        for (Step step : steps.values()) {
            if (step.state() == StepState.FAILED) {
                step.reset();
            }
        }
    }
}
