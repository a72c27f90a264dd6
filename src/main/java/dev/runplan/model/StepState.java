package dev.runplan.model;

/**
 * Lifecycle of a step. Every step starts out PENDING and moves to DONE or FAILED exactly once per run.
 */
public enum StepState {
    PENDING,
    DONE,
    FAILED
}
