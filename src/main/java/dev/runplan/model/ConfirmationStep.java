package dev.runplan.model;

import java.util.Collection;

/**
 * Shows a text to the operator and asks a yes/no question. Only an affirmative answer counts as success,
 * so prompts should be phrased accordingly.
 */
public final class ConfirmationStep extends Step {
    public static final String DEFAULT_PROMPT = "Done?";

    private final String text;
    private final String prompt;

    public ConfirmationStep(String name, Collection<String> predecessors, String text, String prompt) {
        super(name, predecessors);
        this.text = text;
        this.prompt = prompt == null ? DEFAULT_PROMPT : prompt;
    }

    public String text() { return text; }
    public String prompt() { return prompt; }

    @Override
    public StepKind kind() {
        return StepKind.CONFIRMATION;
    }

    @Override
    protected boolean execute(StepContext context) {
        context.operator().announce(name(), "");
        context.operator().show(context.expand(text));
        return context.operator().confirm(prompt);
    }
}
