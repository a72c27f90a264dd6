package dev.runplan.engine;

import dev.runplan.model.AssignmentStep;
import dev.runplan.model.ConfirmationStep;
import dev.runplan.model.Plan;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.runplan.support.PlanFixtures.command;
import static org.assertj.core.api.Assertions.assertThat;

class GraphRendererTest {

    @Test
    void emptyPlanHasOnlyStartAndEnd() {
        assertThat(GraphRenderer.render(new Plan(null))).isEqualTo("""
            digraph {
              "start" [ shape=circle fillcolor=gray ]
              "end" [ shape=octagon fillcolor=gray ]
            }
            """);
    }

    @Test
    void rendersNodesEdgesAndStates() {
        Plan plan = new Plan(null);
        plan.addVariable("host", "");
        plan.addStep(command("run", "true", "ask", "set"));
        plan.addStep(new ConfirmationStep("ask", List.of(), "Ready?", null));
        plan.addStep(new AssignmentStep("set", List.of(), "host", "db1"));
        plan.step("ask").orElseThrow().markDone();
        plan.step("set").orElseThrow().markFailed();

        assertThat(GraphRenderer.render(plan)).isEqualTo("""
            digraph {
              "start" [ shape=circle fillcolor=gray ]
              "end" [ shape=octagon fillcolor=gray ]
              "ask" [ shape=note fillcolor=green ]
              "run" [ shape=component fillcolor=gray ]
              "set" [ shape=polygon fillcolor=red ]
              "ask" -> "run"
              "set" -> "run"
              "start" -> "ask"
              "run" -> "end"
              "start" -> "set"
            }
            """);
    }
}
