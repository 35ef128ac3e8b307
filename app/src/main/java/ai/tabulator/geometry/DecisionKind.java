package ai.tabulator.geometry;

public enum DecisionKind {
    UNCHANGED,
    /** Rewrite to the unpadded single-line rendering. */
    SINGLE_LINE,
    /** Rewrite (or pad) so the anchor lands on the decision's column. */
    ALIGNED
}
