package dev.runplan.model;

/**
 * How command steps treat their external commands.
 */
public enum ExecutionMode {
    /** Commands are executed. */
    NORMAL,

    /** Commands are announced but never invoked; command steps always succeed. */
    DRY_RUN
}
