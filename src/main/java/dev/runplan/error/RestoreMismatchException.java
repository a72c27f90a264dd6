package dev.runplan.error;

/**
 * A state document does not fit the plan definition it points at.
 */
public class RestoreMismatchException extends PlanException {

    public RestoreMismatchException(String message) {
        super(message);
    }
}
