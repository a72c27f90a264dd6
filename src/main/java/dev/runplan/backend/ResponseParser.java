package dev.runplan.backend;

import java.util.Locale;
import java.util.Set;

/**
 * Interprets operator answers to yes/no questions.
 */
public final class ResponseParser {

    private static final Set<String> AFFIRMATIVE = Set.of("t", "true", "y", "yes");

    private ResponseParser() {}

    /**
     * Only an explicit yes counts; anything else, including an empty answer, is a no.
     */
    public static boolean isAffirmative(String answer) {
        return answer != null && AFFIRMATIVE.contains(answer.toLowerCase(Locale.ROOT));
    }
}
