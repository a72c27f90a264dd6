package dev.runplan.cli;

import dev.runplan.engine.PlanLoader;
import dev.runplan.model.ExecutionMode;
import dev.runplan.model.Plan;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;

@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a plan from the beginning.")
class RunCommand extends AbstractPlanCommand {

    @Parameters(index = "0", description = "Plan file (YAML)")
    Path file;

    @Option(names = {"--dry-run", "--dryrun"}, description = "Announce commands without running them")
    boolean dryRun;

    @Override
    protected Plan loadPlan() throws IOException {
        return PlanLoader.loadFromFile(file);
    }

    @Override
    protected ExecutionMode mode() {
        return dryRun ? ExecutionMode.DRY_RUN : ExecutionMode.NORMAL;
    }
}
