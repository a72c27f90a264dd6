package dev.runplan.model;

import dev.runplan.error.DoubleRunException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A single executable unit of a plan.
 *
 * <p>A step is identified by its name, which is also the only way other steps refer to it in their
 * predecessor lists. Running a step performs its kind-specific effect and then moves it to DONE or
 * FAILED; running it again without a reset is a caller bug and throws {@link DoubleRunException}.
 */
public abstract sealed class Step permits ConfirmationStep, AssignmentStep, CommandStep {
    private final String name;
    private final Set<String> predecessors;
    private StepState state = StepState.PENDING;

    protected Step(String name, Collection<String> predecessors) {
        this.name = Objects.requireNonNull(name, "name");
        this.predecessors = predecessors == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(predecessors));
    }

    public String name() { return name; }
    public Set<String> predecessors() { return predecessors; }
    public StepState state() { return state; }

    public boolean isPending() {
        return state == StepState.PENDING;
    }

    public abstract StepKind kind();

    /**
     * Perform the step and record the outcome.
     *
     * @throws DoubleRunException if the step is not PENDING
     */
    public final void run(StepContext context) {
        if (!isPending()) {
            throw new DoubleRunException(name, state.name());
        }
        state = execute(context) ? StepState.DONE : StepState.FAILED;
    }

    /**
     * Kind-specific effect.
     *
     * @return true if the step succeeded
     */
    protected abstract boolean execute(StepContext context);

    public void markDone() { this.state = StepState.DONE; }
    public void markFailed() { this.state = StepState.FAILED; }
    public void reset() { this.state = StepState.PENDING; }

    @Override
    public String toString() {
        return "%s[%s, %s]".formatted(getClass().getSimpleName(), name, state);
    }
}
