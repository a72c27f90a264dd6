package dev.runplan.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.runplan.error.PlanConfigurationException;
import dev.runplan.model.AssignmentStep;
import dev.runplan.model.CommandStep;
import dev.runplan.model.ConfirmationStep;
import dev.runplan.model.Step;
import dev.runplan.model.StepKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds steps from descriptors. The kind of a step is inferred from the keys its descriptor carries:
 * {@code command} for a command, {@code variable}/{@code default} for an assignment and
 * {@code text}/{@code prompt} for a confirmation.
 */
public final class StepFactory {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private StepFactory() {}

    /**
     * Build a step from a plain map, as produced by a YAML or JSON parser.
     */
    public static Step create(Map<String, ?> descriptor) {
        JsonNode node = MAPPER.valueToTree(descriptor);
        return create(node);
    }

    /**
     * Build a step from a descriptor node.
     *
     * @throws PlanConfigurationException if the descriptor has no name, or matches no kind or several kinds
     */
    public static Step create(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new PlanConfigurationException("Step descriptor is not a mapping: " + node);
        }
        if (!node.hasNonNull("name")) {
            throw new PlanConfigurationException("Step descriptor has no name: " + node);
        }
        String name = node.get("name").asText();
        StepKind kind = inferKind(name, node);
        List<String> after = parseAfter(name, node.get("after"));

        return switch (kind) {
            case COMMAND -> new CommandStep(name, after, text(node, "command"));
            case ASSIGNMENT -> new AssignmentStep(name, after, text(node, "variable"), text(node, "default"));
            case CONFIRMATION -> new ConfirmationStep(name, after, text(node, "text"), text(node, "prompt"));
        };
    }

    private static StepKind inferKind(String name, JsonNode node) {
        StepKind kind = null;

        if (node.has("command")) {
            kind = StepKind.COMMAND;
        }

        if (node.has("variable") || node.has("default")) {
            if (kind != null) {
                throw new PlanConfigurationException(
                    "Step '%s' mixes command and assignment keys".formatted(name));
            }
            kind = StepKind.ASSIGNMENT;
        }

        if (node.has("text") || node.has("prompt")) {
            if (kind != null) {
                throw new PlanConfigurationException(
                    "Step '%s' mixes confirmation keys with command or assignment keys".formatted(name));
            }
            kind = StepKind.CONFIRMATION;
        }

        if (kind == null) {
            var keys = new ArrayList<String>();
            node.fieldNames().forEachRemaining(keys::add);
            throw new PlanConfigurationException(
                "Step '%s' is of no known kind, keys are %s".formatted(name, keys));
        }
        return kind;
    }

    private static List<String> parseAfter(String name, JsonNode after) {
        var predecessors = new ArrayList<String>();
        if (after == null || after.isNull()) {
            return predecessors;
        }
        if (after.isArray()) {
            after.forEach(n -> predecessors.add(n.asText()));
        } else if (after.isValueNode()) {
            predecessors.add(after.asText());
        } else {
            throw new PlanConfigurationException(
                "Step '%s': 'after' must be a list of step names".formatted(name));
        }
        return predecessors;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
