package ai.tabulator.geometry;

/**
 * What a group gives up when its shared alignment column would overflow the width budget.
 */
public enum DegradationMode {
    /** Fall back to unaligned rewrites; members that overflow even unaligned stay as they are. */
    PER_MEMBER,
    /** Abandon the alignment of the whole group. */
    WHOLE_GROUP,
    /** No alignment at all; each candidate is rewritten when its own rendering fits. */
    NONE
}
