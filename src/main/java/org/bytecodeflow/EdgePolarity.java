package org.bytecodeflow;

/**
 * Labels for the two outgoing edges of a conditional branch: the edge to the
 * resolved target and the fall-through edge.
 */
public enum EdgePolarity {
    NONE("jump", "fall-through"),
    IF_TRUE("true", "false"),
    IF_FALSE("false", "true"),
    ITERATOR("iteration", "exhausted"),
    GENERIC("branch", "fall-through");

    public final String takenLabel;
    public final String notTakenLabel;

    EdgePolarity(String takenLabel, String notTakenLabel) {
        this.takenLabel = takenLabel;
        this.notTakenLabel = notTakenLabel;
    }
}
