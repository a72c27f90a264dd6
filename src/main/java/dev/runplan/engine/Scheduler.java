package dev.runplan.engine;

import dev.runplan.model.Plan;
import dev.runplan.model.Step;
import dev.runplan.model.StepState;

import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Picks the next step to run.
 *
 * <p>The pick among eligible steps is uniformly random on purpose: steps that do not declare a dependency
 * on each other run in a different order from one run to the next, which flushes out dependencies that
 * exist in reality but are missing from the plan.
 */
public final class Scheduler {
    private final Random random;

    public Scheduler(Random random) {
        this.random = random;
    }

    /**
     * Steps, in definition order, that are PENDING and whose predecessors are all DONE.
     */
    public List<Step> eligible(Plan plan) {
        return plan.steps().stream()
            .filter(Step::isPending)
            .filter(step -> step.predecessors().stream().allMatch(name -> isDone(plan, name)))
            .toList();
    }

    public Optional<Step> selectNext(Plan plan) {
        List<Step> candidates = eligible(plan);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(candidates.get(random.nextInt(candidates.size())));
    }

    private static boolean isDone(Plan plan, String name) {
        return plan.step(name).map(s -> s.state() == StepState.DONE).orElse(false);
    }
}
