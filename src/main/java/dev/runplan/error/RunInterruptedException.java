package dev.runplan.error;

/**
 * The operator or the JVM interrupted a running step. The runner stops without touching any state.
 */
public class RunInterruptedException extends PlanException {

    public RunInterruptedException(String message) {
        super(message);
    }

    public RunInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
