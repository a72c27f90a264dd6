package dev.runplan.model;

import dev.runplan.backend.CommandRunner;
import dev.runplan.backend.Operator;

/**
 * Everything a step may touch while it runs. Handed to {@link Step#run(StepContext)} by the runner,
 * so steps never hold on to the plan that owns them.
 */
public interface StepContext {

    /** Expand all {@code ${name}} placeholders in a text against the plan's variables. */
    String expand(String text);

    /**
     * Set the value of an existing variable.
     *
     * @return false if no variable with that name is defined; nothing is created in that case
     */
    boolean assign(String variable, String value);

    Operator operator();

    CommandRunner commandRunner();

    ExecutionMode mode();
}
