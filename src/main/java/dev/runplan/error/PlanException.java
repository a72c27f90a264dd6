package dev.runplan.error;

/**
 * Base class for errors that stop a plan from being loaded, run or restored.
 * A step that merely fails is recorded as FAILED and never raises one of these.
 */
public class PlanException extends RuntimeException {

    public PlanException(String message) {
        super(message);
    }

    public PlanException(String message, Throwable cause) {
        super(message, cause);
    }
}
