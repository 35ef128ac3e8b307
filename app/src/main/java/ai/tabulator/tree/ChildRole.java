package ai.tabulator.tree;

/**
 * Role of a child relative to its parent node.
 */
public enum ChildRole {
    STATEMENT,
    SUBJECT,
    LABEL,
    BODY,
    ELSE,
    CONDITION,
    TARGET,
    VALUE,
    RECEIVER,
    PARAMETERS,
    ARGUMENT,
    HANDLER
}
