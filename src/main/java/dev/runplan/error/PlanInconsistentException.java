package dev.runplan.error;

import java.util.List;

/**
 * The dependency graph has a cycle or a reference to a step that does not exist.
 */
public class PlanInconsistentException extends PlanException {
    private final List<String> problems;

    public PlanInconsistentException(List<String> problems) {
        super("The plan is inconsistent.");
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
