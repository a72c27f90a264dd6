package dev.runplan.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * CLI entry point for run-plan.
 */
@Command(
    name = "run-plan",
    mixinStandardHelpOptions = true,
    description = "Execute plans: procedures on their way from manual to fully automated.",
    subcommands = {
        RunCommand.class,
        ResumeCommand.class,
        GraphCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class RunPlanCli implements Runnable {

    /** A step failed; a state file to resume from was written. */
    public static final int EXIT_FAILED = 1;

    /** The plan could not be loaded, validated or restored. */
    public static final int EXIT_ERROR = 2;

    /** The operator aborted the run. */
    public static final int EXIT_INTERRUPTED = 130;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static CommandLine newCommandLine() {
        return new CommandLine(new RunPlanCli())
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand: run, resume or graph");
    }
}
