package dev.runplan.engine;

import dev.runplan.error.SubstitutionDepthException;
import dev.runplan.model.VariableStore;

/**
 * Replaces {@code ${name}} placeholders with variable values.
 *
 * <p>The first complete placeholder is replaced and the result is scanned again from the start, so a value
 * may itself contain placeholders. Undefined variables expand to the empty string. An opening marker
 * without a closing brace ends expansion and the rest of the text is kept as is.
 */
public final class VariableExpander {
    private static final String OPEN = "${";
    private static final char CLOSE = '}';

    private final VariableStore variables;
    private final int maxSubstitutions;

    public VariableExpander(VariableStore variables) {
        this(variables, RunOptions.DEFAULT_MAX_SUBSTITUTIONS);
    }

    public VariableExpander(VariableStore variables, int maxSubstitutions) {
        this.variables = variables;
        this.maxSubstitutions = maxSubstitutions;
    }

    /**
     * Expand all placeholders in a text. A null text expands to the empty string.
     *
     * @throws SubstitutionDepthException if more than the configured number of substitutions is needed
     */
    public String expand(String text) {
        if (text == null) {
            return "";
        }
        String current = text;
        int substitutions = 0;
        while (true) {
            int start = current.indexOf(OPEN);
            if (start < 0) {
                return current;
            }
            int end = current.indexOf(CLOSE, start);
            if (end < 0) {
                return current;
            }
            if (substitutions == maxSubstitutions) {
                throw new SubstitutionDepthException(text, maxSubstitutions);
            }
            String name = current.substring(start + OPEN.length(), end);
            current = current.substring(0, start) + variables.get(name) + current.substring(end + 1);
            substitutions++;
        }
    }
}
