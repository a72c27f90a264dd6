package dev.runplan.support;

import dev.runplan.model.CommandStep;
import dev.runplan.model.Plan;
import dev.runplan.model.Step;

import java.util.List;

/**
 * Small plans shared by several tests.
 */
public final class PlanFixtures {

    private PlanFixtures() {}

    public static Step command(String name, String command, String... after) {
        return new CommandStep(name, List.of(after), command);
    }

    /**
     * A and B have no predecessors, C needs both and D needs C.
     */
    public static Plan diamond() {
        Plan plan = new Plan("diamond.yaml");
        plan.addStep(command("A", "ok"));
        plan.addStep(command("B", "ok"));
        plan.addStep(command("C", "ok", "A", "B"));
        plan.addStep(command("D", "ok", "C"));
        return plan;
    }
}
