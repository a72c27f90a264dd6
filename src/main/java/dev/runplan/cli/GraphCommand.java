package dev.runplan.cli;

import dev.runplan.engine.GraphRenderer;
import dev.runplan.engine.PlanLoader;
import dev.runplan.model.Plan;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "graph", mixinStandardHelpOptions = true,
    description = "Print the dependency graph of a plan or state file in GraphViz DOT format.")
class GraphCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Plan file or state file")
    Path file;

    @Option(names = {"-o", "--output"}, description = "Write the graph to this file instead of standard output")
    Path output;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws IOException {
        Plan plan = PlanLoader.load(file);
        if (output == null) {
            PrintWriter out = spec.commandLine().getOut();
            GraphRenderer.render(plan, out);
            out.flush();
        } else {
            try (var writer = Files.newBufferedWriter(output)) {
                GraphRenderer.render(plan, writer);
            }
        }
        return CommandLine.ExitCode.OK;
    }
}
