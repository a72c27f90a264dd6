package dev.runplan.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import dev.runplan.error.PlanConfigurationException;
import dev.runplan.model.Plan;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Loads plan definitions from YAML (or JSON) documents.
 *
 * <pre>
 * variables:
 *   - name: host
 *     value: example.org
 * actions:
 *   - name: ping
 *     command: ping -c 1 ${host}
 *   - name: check
 *     text: Is ${host} up?
 *     after: [ping]
 * </pre>
 */
public final class PlanLoader {

    static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory());

    private PlanLoader() {}

    /**
     * Load a plan definition from a file. The absolute path of the file becomes the plan's source reference.
     */
    public static Plan loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parsePlan(root, sourceReference(path));
    }

    /**
     * Load a plan definition from a string.
     */
    public static Plan loadFromString(String yaml, String sourceReference) throws IOException {
        JsonNode root = MAPPER.readTree(yaml);
        return parsePlan(root, sourceReference);
    }

    /**
     * Load either a plan definition or a state document. A state document is recognised by its
     * {@code plan} field; its plan is loaded and the recorded state applied on top.
     */
    public static Plan load(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        if (isStateDocument(root)) {
            return PlanSnapshots.restore(PlanSnapshots.parse(root));
        }
        return parsePlan(root, sourceReference(path));
    }

    public static boolean isStateDocument(JsonNode root) {
        return root != null && root.isObject() && root.has("plan");
    }

    static String sourceReference(Path path) {
        return path.toAbsolutePath().normalize().toString();
    }

    static Plan parsePlan(JsonNode root, String sourceReference) {
        Plan plan = new Plan(sourceReference);
        if (root == null || root.isNull() || root.isMissingNode()) {
            return plan;
        }
        if (!root.isObject()) {
            throw new PlanConfigurationException("Plan %s is not a mapping".formatted(sourceReference));
        }

        JsonNode variables = root.get("variables");
        if (variables != null && !variables.isNull()) {
            for (JsonNode variable : elements(variables, "variables", sourceReference)) {
                if (!variable.hasNonNull("name")) {
                    throw new PlanConfigurationException("Variable without a name in plan " + sourceReference);
                }
                JsonNode value = variable.get("value");
                plan.addVariable(variable.get("name").asText(),
                    value == null || value.isNull() ? "" : value.asText());
            }
        }

        JsonNode actions = root.get("actions");
        if (actions != null && !actions.isNull()) {
            for (JsonNode action : elements(actions, "actions", sourceReference)) {
                plan.addStep(StepFactory.create(action));
            }
        }

        return plan;
    }

    private static JsonNode elements(JsonNode node, String field, String sourceReference) {
        if (!node.isArray()) {
            throw new PlanConfigurationException(
                "Field '%s' of plan %s must be a list".formatted(field, sourceReference));
        }
        return node;
    }
}
