package dev.runplan.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time state of a plan: where its definition lives, the state of every step and the value of
 * every variable.
 */
public record PlanSnapshot(
    String plan,
    List<StepStatus> actions,
    Map<String, String> variables
) {
    public PlanSnapshot {
        actions = List.copyOf(actions);
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    /** State of one step, as recorded. States other than DONE and FAILED restore as PENDING. */
    public record StepStatus(String name, String state) {}
}
