package dev.runplan.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.runplan.error.PlanConfigurationException;
import dev.runplan.error.RestoreMismatchException;
import dev.runplan.model.Plan;
import dev.runplan.model.Step;
import dev.runplan.model.StepState;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Captures the mutable state of a plan and puts it back, for checkpoint and resume.
 *
 * <p>On disk a snapshot is a YAML document:
 * <pre>
 * plan: /path/to/plan.yaml
 * actions:
 *   - name: ping
 *     state: DONE
 * variables:
 *   host: example.org
 * </pre>
 */
public final class PlanSnapshots {

    private PlanSnapshots() {}

    public static PlanSnapshot snapshot(Plan plan) {
        var actions = new ArrayList<PlanSnapshot.StepStatus>();
        for (Step step : plan.steps()) {
            actions.add(new PlanSnapshot.StepStatus(step.name(), step.state().name()));
        }
        return new PlanSnapshot(plan.sourceReference(), actions, plan.variables().asMap());
    }

    public static PlanSnapshot read(Path path) throws IOException {
        return parse(PlanLoader.MAPPER.readTree(path.toFile()));
    }

    /**
     * Reload the plan the snapshot points at and apply the snapshot to it.
     */
    public static Plan restore(PlanSnapshot snapshot) throws IOException {
        if (snapshot.plan() == null) {
            throw new RestoreMismatchException("State document does not name the plan it belongs to");
        }
        Plan plan = PlanLoader.loadFromFile(Path.of(snapshot.plan()));
        apply(plan, snapshot);
        return plan;
    }

    /**
     * Apply a snapshot to a freshly loaded plan. DONE and FAILED states are set, everything else is left
     * PENDING; variable values are overwritten.
     *
     * @throws RestoreMismatchException if the snapshot names a step or variable the plan does not have;
     *                                  the plan is left untouched in that case
     */
    public static void apply(Plan plan, PlanSnapshot snapshot) {
        var problems = new ArrayList<String>();
        for (PlanSnapshot.StepStatus status : snapshot.actions()) {
            if (plan.step(status.name()).isEmpty()) {
                problems.add("step '%s'".formatted(status.name()));
            }
        }
        for (String name : snapshot.variables().keySet()) {
            if (!plan.variables().contains(name)) {
                problems.add("variable '%s'".formatted(name));
            }
        }
        if (!problems.isEmpty()) {
            throw new RestoreMismatchException("State document does not match plan %s, unknown %s"
                .formatted(snapshot.plan(), String.join(", ", problems)));
        }

        for (PlanSnapshot.StepStatus status : snapshot.actions()) {
            Step step = plan.step(status.name()).orElseThrow();
            if (StepState.DONE.name().equals(status.state())) {
                step.markDone();
            } else if (StepState.FAILED.name().equals(status.state())) {
                step.markFailed();
            }
        }
        snapshot.variables().forEach((name, value) -> plan.variables().assign(name, value));
    }

    public static void write(PlanSnapshot snapshot, Path path) throws IOException {
        try (var out = Files.newBufferedWriter(path)) {
            PlanLoader.MAPPER.writeValue(out, toTree(snapshot));
        }
    }

    static JsonNode toTree(PlanSnapshot snapshot) {
        ObjectNode root = PlanLoader.MAPPER.createObjectNode();
        root.put("plan", snapshot.plan());
        ArrayNode actions = root.putArray("actions");
        for (PlanSnapshot.StepStatus status : snapshot.actions()) {
            actions.addObject()
                .put("name", status.name())
                .put("state", status.state());
        }
        ObjectNode variables = root.putObject("variables");
        snapshot.variables().forEach(variables::put);
        return root;
    }

    static PlanSnapshot parse(JsonNode root) {
        if (!PlanLoader.isStateDocument(root)) {
            throw new PlanConfigurationException("Not a state document: no 'plan' field");
        }
        JsonNode planNode = root.get("plan");
        String plan = planNode.isNull() ? null : planNode.asText();

        List<PlanSnapshot.StepStatus> actions = new ArrayList<>();
        JsonNode actionsNode = root.get("actions");
        if (actionsNode != null && !actionsNode.isNull()) {
            if (!actionsNode.isArray()) {
                throw new PlanConfigurationException(
                    "Field 'actions' of the state document for %s must be a list".formatted(plan));
            }
            for (JsonNode action : actionsNode) {
                if (!action.hasNonNull("name")) {
                    throw new PlanConfigurationException("State document has an action without a name");
                }
                JsonNode state = action.get("state");
                actions.add(new PlanSnapshot.StepStatus(action.get("name").asText(),
                    state == null || state.isNull() ? StepState.PENDING.name() : state.asText()));
            }
        }

        Map<String, String> variables = new LinkedHashMap<>();
        JsonNode variablesNode = root.get("variables");
        if (variablesNode != null && !variablesNode.isNull()) {
            if (!variablesNode.isObject()) {
                throw new PlanConfigurationException(
                    "Field 'variables' of the state document for %s must be a mapping".formatted(plan));
            }
            for (var entry : variablesNode.properties()) {
                JsonNode value = entry.getValue();
                variables.put(entry.getKey(), value.isNull() ? "" : value.asText());
            }
        }

        return new PlanSnapshot(plan, actions, variables);
    }
}
