package dev.runplan.backend;

import java.io.IOException;
import java.util.List;

/**
 * Abstraction over starting external programs.
 */
public interface CommandRunner {

    /**
     * Run a program and wait for it.
     *
     * @param command program followed by its arguments
     * @return the exit status
     * @throws IOException if the program cannot be started, e.g. because it does not exist
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    int run(List<String> command) throws IOException, InterruptedException;
}
