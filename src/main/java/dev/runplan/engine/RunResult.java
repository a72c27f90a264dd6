package dev.runplan.engine;

/**
 * How a run of a plan ended.
 */
public enum RunResult {
    /** Every step is DONE. */
    SUCCEEDED,

    /** Nothing is eligible any more and at least one step is FAILED. */
    FAILED,

    /** A step was interrupted; states are as they were before that step started. */
    INTERRUPTED
}
