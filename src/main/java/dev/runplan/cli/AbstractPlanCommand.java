package dev.runplan.cli;

import dev.runplan.backend.ConsoleOperator;
import dev.runplan.backend.ProcessCommandRunner;
import dev.runplan.engine.PlanRunner;
import dev.runplan.engine.PlanSnapshots;
import dev.runplan.engine.RunOptions;
import dev.runplan.engine.RunResult;
import dev.runplan.error.RunAbortedException;
import dev.runplan.model.ExecutionMode;
import dev.runplan.model.Plan;
import picocli.CommandLine;
import picocli.CommandLine.Mixin;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Loads a plan, runs it and on failure leaves a state file behind to resume from.
 */
abstract class AbstractPlanCommand implements Callable<Integer> {

    @Mixin
    ExecutionOptions execution;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    protected abstract Plan loadPlan() throws IOException;

    protected ExecutionMode mode() {
        return ExecutionMode.NORMAL;
    }

    @Override
    public Integer call() throws IOException {
        if (execution.verbose) {
            // must happen before the first logger is created
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        }
        PrintWriter out = spec.commandLine().getOut();

        Plan plan = loadPlan();
        var options = new RunOptions(mode(), execution.seed, execution.maxSubstitutions);
        var runner = new PlanRunner(options, ConsoleOperator.system(out), new ProcessCommandRunner());

        RunResult result;
        try {
            result = runner.execute(plan);
        } catch (RunAbortedException e) {
            printResumeHint(out, "Execution aborted", saveState(plan));
            throw e;
        }
        switch (result) {
            case SUCCEEDED:
                return CommandLine.ExitCode.OK;
            case INTERRUPTED:
                out.println();
                out.println("Execution interrupted, no state was saved.");
                out.flush();
                return RunPlanCli.EXIT_INTERRUPTED;
            default:
                printResumeHint(out, "Execution failed", saveState(plan));
                return RunPlanCli.EXIT_FAILED;
        }
    }

    private static void printResumeHint(PrintWriter out, String outcome, Path stateFile) {
        out.println();
        out.println();
        out.println(outcome + ", you can resume by running");
        out.println("\trun-plan resume " + stateFile);
        out.flush();
    }

    private Path saveState(Plan plan) throws IOException {
        Path dir = execution.stateDir != null ? execution.stateDir : Path.of(System.getProperty("java.io.tmpdir"));
        Files.createDirectories(dir);
        Path stateFile = Files.createTempFile(dir, "run-plan-", ".yaml");
        PlanSnapshots.write(PlanSnapshots.snapshot(plan), stateFile);
        return stateFile;
    }
}
