package dev.runplan.engine;

import dev.runplan.model.Plan;
import dev.runplan.model.Step;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checks the dependency graph of a plan before it runs.
 */
public final class PlanValidator {

    private PlanValidator() {}

    /**
     * Validate the predecessor graph of a plan. Returns an empty list if it is well formed,
     * or a list of error messages if not.
     */
    public static List<String> validate(Plan plan) {
        var errors = new ArrayList<String>();

        for (Step step : plan.steps()) {
            // Rule 1: predecessors must exist
            for (String predecessor : step.predecessors()) {
                if (plan.step(predecessor).isEmpty()) {
                    errors.add("Step '%s': predecessor '%s' not found in plan"
                        .formatted(step.name(), predecessor));
                }
            }

            // Rule 2: no step may (transitively) precede itself
            if (reachesItself(plan, step)) {
                errors.add("Step '%s' is part of a dependency cycle".formatted(step.name()));
            }
        }

        return errors;
    }

    public static boolean wellFormed(Plan plan) {
        return validate(plan).isEmpty();
    }

    /**
     * Depth-first walk over the predecessor chain of a step. Nodes are visited at most once, so cycles
     * that do not pass through the starting step still terminate.
     */
    private static boolean reachesItself(Plan plan, Step start) {
        Deque<String> pending = new ArrayDeque<>(start.predecessors());
        Set<String> visited = new HashSet<>();
        while (!pending.isEmpty()) {
            String name = pending.pop();
            if (name.equals(start.name())) {
                return true;
            }
            if (!visited.add(name)) {
                continue;
            }
            Optional<Step> predecessor = plan.step(name);
            predecessor.ifPresent(p -> p.predecessors().forEach(pending::push));
        }
        return false;
    }
}
