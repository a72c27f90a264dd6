package dev.runplan.engine;

import dev.runplan.model.ExecutionMode;

import java.util.Objects;

/**
 * Settings for a single run of a plan.
 */
public record RunOptions(
    ExecutionMode mode,
    Long seed, // nullable: no seed means a fresh, unpredictable order on every run
    int maxSubstitutions
) {
    public static final int DEFAULT_MAX_SUBSTITUTIONS = 1000;

    public RunOptions {
        Objects.requireNonNull(mode, "mode");
        if (maxSubstitutions < 1) {
            throw new IllegalArgumentException("maxSubstitutions must be positive: " + maxSubstitutions);
        }
    }

    public static RunOptions defaults() {
        return new RunOptions(ExecutionMode.NORMAL, null, DEFAULT_MAX_SUBSTITUTIONS);
    }

    public RunOptions withMode(ExecutionMode mode) {
        return new RunOptions(mode, seed, maxSubstitutions);
    }

    public RunOptions withSeed(Long seed) {
        return new RunOptions(mode, seed, maxSubstitutions);
    }
}
