package ai.tabulator.tree;

public enum NodeFlag {
    /** Verbatim multi-line string literal. */
    HEREDOC,
    /** Conditional written as a trailing clause after its action. */
    MODIFIER,
    /** Routine spelled as {@code def name = body}. */
    ENDLESS
}
