package dev.runplan.engine;

import dev.runplan.model.Plan;
import org.junit.jupiter.api.Test;

import static dev.runplan.support.PlanFixtures.command;
import static org.assertj.core.api.Assertions.assertThat;

class PlanValidatorTest {

    @Test
    void emptyPlanIsWellFormed() {
        assertThat(PlanValidator.wellFormed(new Plan(null))).isTrue();
    }

    @Test
    void singleStepIsWellFormed() {
        Plan plan = new Plan(null);
        plan.addStep(command("test", "true"));

        assertThat(PlanValidator.validate(plan)).isEmpty();
    }

    @Test
    void detectsTwoStepLoop() {
        Plan plan = new Plan(null);
        plan.addStep(command("a1", "true", "a2"));
        plan.addStep(command("a2", "true", "a1"));

        assertThat(PlanValidator.wellFormed(plan)).isFalse();
        assertThat(PlanValidator.validate(plan)).anyMatch(e -> e.contains("'a1' is part of a dependency cycle"));
    }

    @Test
    void detectsThreeStepLoop() {
        Plan plan = new Plan(null);
        plan.addStep(command("a1", "true", "a2"));
        plan.addStep(command("a2", "true", "a3"));
        plan.addStep(command("a3", "true", "a1"));

        assertThat(PlanValidator.wellFormed(plan)).isFalse();
    }

    @Test
    void detectsSelfLoop() {
        Plan plan = new Plan(null);
        plan.addStep(command("a1", "true", "a1"));

        assertThat(PlanValidator.wellFormed(plan)).isFalse();
    }

    @Test
    void loopBehindAnInnocentStepTerminates() {
        Plan plan = new Plan(null);
        plan.addStep(command("entry", "true", "a2"));
        plan.addStep(command("a2", "true", "a3"));
        plan.addStep(command("a3", "true", "a2"));

        var errors = PlanValidator.validate(plan);

        assertThat(errors).hasSize(2);
        assertThat(errors).noneMatch(e -> e.contains("'entry'"));
    }

    @Test
    void detectsDanglingPredecessor() {
        Plan plan = new Plan(null);
        plan.addStep(command("a1", "true", "a2"));
        plan.addStep(command("a2", "true", "a3"));

        assertThat(PlanValidator.wellFormed(plan)).isFalse();
        assertThat(PlanValidator.validate(plan))
            .containsExactly("Step 'a2': predecessor 'a3' not found in plan");
    }

    @Test
    void diamondIsWellFormed() {
        Plan plan = new Plan(null);
        plan.addStep(command("a1", "true", "a2", "a3"));
        plan.addStep(command("a2", "true", "a4"));
        plan.addStep(command("a3", "true", "a4"));
        plan.addStep(command("a4", "true"));

        assertThat(PlanValidator.wellFormed(plan)).isTrue();
    }

    @Test
    void isolatedStepsAreWellFormed() {
        Plan plan = new Plan(null);
        plan.addStep(command("a1", "true"));
        plan.addStep(command("a2", "true"));
        plan.addStep(command("a3", "true"));

        assertThat(PlanValidator.wellFormed(plan)).isTrue();
    }
}
