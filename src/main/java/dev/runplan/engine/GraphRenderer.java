package dev.runplan.engine;

import dev.runplan.model.Plan;
import dev.runplan.model.Step;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Renders the dependency graph of a plan as GraphViz DOT.
 *
 * <p>Two synthetic nodes frame the graph: {@code start} leads to every step without predecessors and every
 * step nothing depends on leads to {@code end}. Node shapes tell the step kinds apart, fill colours show
 * the state, which makes graphs of restored plans useful for seeing how far a run got.
 */
public final class GraphRenderer {

    private GraphRenderer() {}

    public static String render(Plan plan) {
        var sb = new StringBuilder();
        try {
            render(plan, sb);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    public static void render(Plan plan, Appendable out) throws IOException {
        List<Step> steps = plan.steps().stream()
            .sorted(Comparator.comparing(Step::name))
            .toList();

        out.append("digraph {\n");
        out.append("  \"start\" [ shape=circle fillcolor=gray ]\n");
        out.append("  \"end\" [ shape=octagon fillcolor=gray ]\n");

        Set<String> precedesSomething = new HashSet<>();
        for (Step step : steps) {
            out.append("  \"%s\" [ shape=%s fillcolor=%s ]\n".formatted(step.name(), shape(step), color(step)));
            precedesSomething.addAll(step.predecessors());
        }
        for (Step step : steps) {
            for (String predecessor : step.predecessors()) {
                out.append("  \"%s\" -> \"%s\"\n".formatted(predecessor, step.name()));
            }
        }
        for (Step step : steps) {
            if (step.predecessors().isEmpty()) {
                out.append("  \"start\" -> \"%s\"\n".formatted(step.name()));
            }
            if (!precedesSomething.contains(step.name())) {
                out.append("  \"%s\" -> \"end\"\n".formatted(step.name()));
            }
        }
        out.append("}\n");
    }

    static String shape(Step step) {
        return switch (step.kind()) {
            case CONFIRMATION -> "note";
            case ASSIGNMENT -> "polygon";
            case COMMAND -> "component";
        };
    }

    static String color(Step step) {
        return switch (step.state()) {
            case PENDING -> "gray";
            case DONE -> "green";
            case FAILED -> "red";
        };
    }
}
