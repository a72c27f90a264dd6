package dev.runplan.cli;

import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options shared by the commands that execute a plan.
 */
class ExecutionOptions {

    @Option(names = "--seed", description = "Seed for the step order, to reproduce an earlier run")
    Long seed;

    @Option(names = "--state-dir",
        description = "Directory for state files written when a run fails (default: system temp directory)")
    Path stateDir;

    @Option(names = "--max-substitutions", defaultValue = "1000",
        description = "Upper bound on placeholder substitutions per text (default: ${DEFAULT-VALUE})")
    int maxSubstitutions;

    @Option(names = {"-v", "--verbose"}, description = "Log scheduling decisions and step transitions")
    boolean verbose;
}
