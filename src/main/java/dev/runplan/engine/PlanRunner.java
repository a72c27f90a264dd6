package dev.runplan.engine;

import dev.runplan.backend.CommandRunner;
import dev.runplan.backend.Operator;
import dev.runplan.error.PlanException;
import dev.runplan.error.PlanInconsistentException;
import dev.runplan.error.RunAbortedException;
import dev.runplan.error.RunInterruptedException;
import dev.runplan.model.Plan;
import dev.runplan.model.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Runs a plan one step at a time until no step is eligible.
 */
public final class PlanRunner {
    private static final Logger log = LoggerFactory.getLogger(PlanRunner.class);

    private final RunOptions options;
    private final Operator operator;
    private final CommandRunner commandRunner;
    private final Scheduler scheduler;

    public PlanRunner(RunOptions options, Operator operator, CommandRunner commandRunner) {
        this.options = options;
        this.operator = operator;
        this.commandRunner = commandRunner;
        this.scheduler = new Scheduler(options.seed() == null ? new Random() : new Random(options.seed()));
    }

    /**
     * Run the plan.
     *
     * @return true if every step ended DONE
     * @throws PlanInconsistentException if the dependency graph is malformed; no step has run in that case
     */
    public boolean run(Plan plan) {
        return execute(plan) == RunResult.SUCCEEDED;
    }

    /**
     * Run the plan and report how the run ended.
     *
     * <p>Steps left FAILED by an earlier run are reset to PENDING first, so a restored plan retries them.
     *
     * @throws PlanInconsistentException if the dependency graph is malformed; no step has run in that case
     * @throws RunAbortedException if a step raised an error instead of ending DONE or FAILED; the states
     *     reached so far are kept so the plan can still be snapshotted
     */
    public RunResult execute(Plan plan) {
        List<String> problems = PlanValidator.validate(plan);
        if (!problems.isEmpty()) {
            problems.forEach(p -> log.debug("Plan problem: {}", p));
            throw new PlanInconsistentException(problems);
        }
        plan.resetFailed();

        var context = new PlanContext(plan, operator, commandRunner, options.mode(), options.maxSubstitutions());
        Step step = null;
        try {
            Optional<Step> next = scheduler.selectNext(plan);
            while (next.isPresent()) {
                step = next.get();
                log.debug("Running step {} ({})", step.name(), step.kind());
                step.run(context);
                log.debug("Step {} is now {}", step.name(), step.state());
                next = scheduler.selectNext(plan);
            }
        } catch (RunInterruptedException e) {
            log.info("Run interrupted: {}", e.getMessage());
            return RunResult.INTERRUPTED;
        } catch (PlanException | UncheckedIOException e) {
            log.debug("Step {} aborted the run", step.name(), e);
            throw new RunAbortedException(step.name(), e);
        }

        RunResult result = plan.anyFailed() ? RunResult.FAILED : RunResult.SUCCEEDED;
        log.info("Plan {} finished: {}", plan.sourceReference(), result);
        return result;
    }
}
