package dev.runplan.engine;

import dev.runplan.backend.CommandRunner;
import dev.runplan.backend.Operator;
import dev.runplan.model.ExecutionMode;
import dev.runplan.model.Plan;
import dev.runplan.model.StepContext;

/**
 * The context steps of one plan run in.
 */
public record PlanContext(
    Plan plan,
    Operator operator,
    CommandRunner commandRunner,
    ExecutionMode mode,
    int maxSubstitutions
) implements StepContext {

    public PlanContext(Plan plan, Operator operator, CommandRunner commandRunner, ExecutionMode mode) {
        this(plan, operator, commandRunner, mode, RunOptions.DEFAULT_MAX_SUBSTITUTIONS);
    }

    @Override
    public String expand(String text) {
        return new VariableExpander(plan.variables(), maxSubstitutions).expand(text);
    }

    @Override
    public boolean assign(String variable, String value) {
        return plan.variables().assign(variable, value);
    }
}
