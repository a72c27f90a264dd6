package dev.runplan.engine;

import dev.runplan.model.Plan;
import dev.runplan.model.Step;
import dev.runplan.support.PlanFixtures;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulerTest {

    private final Scheduler scheduler = new Scheduler(new Random(42));

    private static Step step(Plan plan, String name) {
        return plan.step(name).orElseThrow();
    }

    @Test
    void diamondStartsWithItsRoots() {
        Plan plan = PlanFixtures.diamond();

        assertThat(scheduler.eligible(plan)).extracting(Step::name).containsExactly("A", "B");
    }

    @Test
    void joinBecomesEligibleOnceAllPredecessorsAreDone() {
        Plan plan = PlanFixtures.diamond();
        step(plan, "A").markDone();

        assertThat(scheduler.eligible(plan)).extracting(Step::name).containsExactly("B");

        step(plan, "B").markDone();

        assertThat(scheduler.eligible(plan)).extracting(Step::name).containsExactly("C");
    }

    @Test
    void failedPredecessorBlocksForGood() {
        Plan plan = PlanFixtures.diamond();
        step(plan, "A").markDone();
        step(plan, "B").markFailed();

        assertThat(scheduler.eligible(plan)).isEmpty();
        assertThat(scheduler.selectNext(plan)).isEmpty();
    }

    @Test
    void finishedStepsAreNeverEligible() {
        Plan plan = new Plan(null);
        plan.addStep(PlanFixtures.command("done", "true"));
        plan.addStep(PlanFixtures.command("failed", "true"));
        step(plan, "done").markDone();
        step(plan, "failed").markFailed();

        assertThat(scheduler.eligible(plan)).isEmpty();
    }

    @Test
    void unknownPredecessorBlocks() {
        Plan plan = new Plan(null);
        plan.addStep(PlanFixtures.command("orphan", "true", "ghost"));

        assertThat(scheduler.eligible(plan)).isEmpty();
    }

    @Test
    void selectionVariesAmongIndependentSteps() {
        Plan plan = new Plan(null);
        for (int i = 0; i < 5; i++) {
            plan.addStep(PlanFixtures.command("s" + i, "true"));
        }

        Set<String> picked = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            picked.add(scheduler.selectNext(plan).orElseThrow().name());
        }

        assertThat(picked).containsExactlyInAnyOrder("s0", "s1", "s2", "s3", "s4");
    }

    @Test
    void sameSeedPicksTheSameStep() {
        Plan plan = PlanFixtures.diamond();

        String first = new Scheduler(new Random(7)).selectNext(plan).orElseThrow().name();
        String second = new Scheduler(new Random(7)).selectNext(plan).orElseThrow().name();

        assertThat(first).isEqualTo(second);
    }
}
