package dev.runplan.backend;

/**
 * The human side of a plan run: steps report to the operator and ask for answers through it.
 */
public interface Operator {

    /**
     * Announce that a step starts.
     *
     * @param stepName name of the step
     * @param detail   extra lines describing what the step does, may be empty
     */
    void announce(String stepName, String detail);

    /** Present a (possibly long) explanatory text. */
    void show(String text);

    /** Print a single line as is. */
    void message(String line);

    /**
     * Ask a yes/no question.
     *
     * @return true only for an affirmative answer
     */
    boolean confirm(String question);

    /**
     * Ask for a free-form answer.
     *
     * @return the answer, empty if the operator just pressed enter
     */
    String ask(String question);
}
