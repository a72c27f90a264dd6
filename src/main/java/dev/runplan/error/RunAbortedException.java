package dev.runplan.error;

/**
 * A step hit an error that is not a step failure, such as runaway placeholder expansion or a broken
 * console. Steps that completed before keep their state; the aborted step stays PENDING.
 */
public class RunAbortedException extends PlanException {
    private final String stepName;

    public RunAbortedException(String stepName, RuntimeException cause) {
        super("Step %s aborted: %s".formatted(stepName, cause.getMessage()), cause);
        this.stepName = stepName;
    }

    public String stepName() {
        return stepName;
    }
}
