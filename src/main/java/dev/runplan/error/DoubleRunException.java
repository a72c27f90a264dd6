package dev.runplan.error;

/**
 * A step was asked to run although it already ran. This is a bug in the caller, not a plan problem.
 */
public class DoubleRunException extends PlanException {

    public DoubleRunException(String stepName, String state) {
        super("Step %s executed twice (state %s)".formatted(stepName, state));
    }
}
