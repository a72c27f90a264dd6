package dev.runplan.backend;

import dev.runplan.error.RunInterruptedException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Talks to the operator on a text console. End of input is treated as the operator aborting the run.
 */
public final class ConsoleOperator implements Operator {
    private final BufferedReader in;
    private final PrintWriter out;

    public ConsoleOperator(BufferedReader in, PrintWriter out) {
        this.in = in;
        this.out = out;
    }

    public static ConsoleOperator system(PrintWriter out) {
        return new ConsoleOperator(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), out);
    }

    @Override
    public void announce(String stepName, String detail) {
        out.println("---[ %s ] ---------------------".formatted(stepName));
        if (detail != null && !detail.isEmpty()) {
            out.println(detail);
        }
        out.flush();
    }

    @Override
    public void show(String text) {
        out.println(TextWrapper.wrap(text));
        out.flush();
    }

    @Override
    public void message(String line) {
        out.println(line);
        out.flush();
    }

    @Override
    public boolean confirm(String question) {
        return ResponseParser.isAffirmative(ask(question));
    }

    @Override
    public String ask(String question) {
        out.print(question + " ");
        out.flush();
        try {
            String line = in.readLine();
            if (line == null) {
                throw new RunInterruptedException("Input closed while waiting for an answer");
            }
            return line;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read answer from console", e);
        }
    }
}
