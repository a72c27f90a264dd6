package dev.runplan.error;

/**
 * Placeholder expansion did not settle, typically because a variable's value contains a placeholder
 * for itself.
 */
public class SubstitutionDepthException extends PlanException {

    public SubstitutionDepthException(String text, int limit) {
        super("Gave up expanding '%s' after %d substitutions".formatted(text, limit));
    }
}
