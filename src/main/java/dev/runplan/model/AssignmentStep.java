package dev.runplan.model;

import java.util.Collection;

/**
 * Sets a variable, offering the expanded default value to the operator who may override it.
 * Fails if the variable was never defined by the plan.
 */
public final class AssignmentStep extends Step {
    private final String variable;
    private final String defaultValue;

    public AssignmentStep(String name, Collection<String> predecessors, String variable, String defaultValue) {
        super(name, predecessors);
        this.variable = variable;
        this.defaultValue = defaultValue == null ? "" : defaultValue;
    }

    public String variable() { return variable; }
    public String defaultValue() { return defaultValue; }

    @Override
    public StepKind kind() {
        return StepKind.ASSIGNMENT;
    }

    @Override
    protected boolean execute(StepContext context) {
        context.operator().announce(name(), "\tSetting the value of variable " + variable);
        String expandedDefault = context.expand(defaultValue);
        String answer = context.operator().ask(
            "Provide a value for %s\n (just pressing enter defaults it to %s)".formatted(variable, expandedDefault));
        String value = answer == null || answer.isEmpty() ? expandedDefault : answer;
        return context.assign(variable, value);
    }
}
