package io.cflow.model;

/**
 * Which resolution rule produced a call edge.
 */
public enum ResolutionReason {
    CONSTRUCTOR("constructor"),
    MODULE_FUNCTION("module function"),
    TRACKED_RECEIVER("tracked receiver"),
    CLASS_QUALIFIED("class-qualified call"),
    SELF_RECEIVER("self receiver"),
    INHERITED("inherited method"),
    UNIQUE_METHOD("unique method name"),
    AMBIGUOUS_FIRST_MATCH("ambiguous, first match");

    private final String description;

    ResolutionReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    /**
     * True when the target was picked from several candidates and may be wrong.
     */
    public boolean isGuess() {
        return this == AMBIGUOUS_FIRST_MATCH;
    }
}
