package dev.runplan.model;

import dev.runplan.error.RunInterruptedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Runs an external command. A zero exit status is success; a nonzero status, an unknown program or an
 * empty command line is failure. The command line is split on whitespace, there is no shell involved.
 */
public final class CommandStep extends Step {
    private static final Logger log = LoggerFactory.getLogger(CommandStep.class);

    private final String command;

    public CommandStep(String name, Collection<String> predecessors, String command) {
        super(name, predecessors);
        this.command = command == null ? "" : command;
    }

    public String command() { return command; }

    @Override
    public StepKind kind() {
        return StepKind.COMMAND;
    }

    @Override
    protected boolean execute(StepContext context) {
        String expanded = context.expand(command);
        context.operator().announce(name(), "\tRunning the following command:\n\t\t" + expanded);
        if (context.mode() == ExecutionMode.DRY_RUN) {
            context.operator().message("\t\tAction not done, because this is a dry-run");
            return true;
        }

        List<String> argv = split(expanded);
        if (argv.isEmpty()) {
            log.debug("Step {} has an empty command line", name());
            return false;
        }
        try {
            int status = context.commandRunner().run(argv);
            log.debug("Step {} command exited with status {}", name(), status);
            return status == 0;
        } catch (IOException e) {
            log.debug("Step {} could not start '{}': {}", name(), argv.get(0), e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunInterruptedException("Interrupted while running step " + name(), e);
        }
    }

    static List<String> split(String commandLine) {
        String trimmed = commandLine.strip();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(trimmed.split("\\s+"));
    }
}
