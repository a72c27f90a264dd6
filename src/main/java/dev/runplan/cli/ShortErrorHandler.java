package dev.runplan.cli;

import dev.runplan.error.PlanInconsistentException;
import picocli.CommandLine;

/**
 * Keeps CLI failures short and focused on the root cause.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        var err = commandLine.getErr();
        err.println(commandLine.getColorScheme().errorText(message));
        if (ex instanceof PlanInconsistentException inconsistent) {
            inconsistent.problems().forEach(p -> err.println("  " + p));
        }
        if (Boolean.getBoolean("runplan.debug")) {
            ex.printStackTrace(err);
        }
        err.flush();
        return RunPlanCli.EXIT_ERROR;
    }
}
