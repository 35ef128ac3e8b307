package ai.tabulator.tree;

/**
 * Notable sub-tokens a node may expose a span for.
 */
public enum TokenRole {
    /** Introducer keyword, e.g. the branch or routine keyword. */
    KEYWORD,
    /** Assignment operator of an assignment node. */
    OPERATOR,
    /** Equals sign of an expression-bodied routine. */
    ASSIGNMENT,
    NAME
}
