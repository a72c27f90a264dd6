package dev.runplan.cli;

import dev.runplan.engine.PlanSnapshots;
import dev.runplan.model.Plan;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;

@Command(name = "resume", mixinStandardHelpOptions = true,
    description = "Resume a failed run from the state file it left behind. Failed steps are retried.")
class ResumeCommand extends AbstractPlanCommand {

    @Parameters(index = "0", description = "State file written by a failed run")
    Path file;

    @Override
    protected Plan loadPlan() throws IOException {
        return PlanSnapshots.restore(PlanSnapshots.read(file));
    }
}
