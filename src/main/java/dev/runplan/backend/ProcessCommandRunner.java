package dev.runplan.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Runs commands as child processes that share the console of this process.
 */
public final class ProcessCommandRunner implements CommandRunner {
    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    @Override
    public int run(List<String> command) throws IOException, InterruptedException {
        log.debug("Starting {}", command);
        Process process = new ProcessBuilder(command)
            .inheritIO()
            .start();
        try {
            return process.waitFor();
        } catch (InterruptedException e) {
            process.destroy();
            throw e;
        }
    }
}
