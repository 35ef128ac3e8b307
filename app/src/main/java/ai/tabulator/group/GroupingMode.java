package ai.tabulator.group;

/**
 * Rule deciding which eligible candidates may share one alignment column.
 */
public enum GroupingMode {
    /** Maximal runs of line-adjacent candidates at the same indentation. */
    ADJACENT_LINES,
    /** All eligible children of one parent; ineligible siblings leave gaps but do not split the group. */
    SHARED_PARENT,
    /** Every candidate stands alone. */
    SINGLE
}
