package dev.runplan.model;

/**
 * The closed set of step kinds a plan definition can describe.
 */
public enum StepKind {
    CONFIRMATION,
    ASSIGNMENT,
    COMMAND
}
