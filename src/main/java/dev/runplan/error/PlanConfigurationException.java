package dev.runplan.error;

/**
 * A plan definition cannot be turned into steps: a descriptor without a name, one matching no kind or
 * several kinds, a duplicate name, or a document that is not a plan at all.
 */
public class PlanConfigurationException extends PlanException {

    public PlanConfigurationException(String message) {
        super(message);
    }

    public PlanConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
