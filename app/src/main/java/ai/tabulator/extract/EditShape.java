package ai.tabulator.extract;

/**
 * How a decision about a candidate becomes text.
 */
public enum EditShape {
    /** Replace the whole node span with the rendering. */
    REPLACE_NODE,
    /** Leave the text alone and insert padding spaces at the candidate's insert offset. */
    INSERT_PADDING
}
