package ai.tabulator.tree;

/**
 * Syntactic categories the engine distinguishes. Anything else a host parser produces maps to
 * {@link #EXPRESSION} or {@link #LITERAL}.
 */
public enum NodeKind {
    PROGRAM,
    /** Compound block holding more than one statement. */
    SEQUENCE,
    /** Multi-branch conditional ({@code case}). */
    SELECTOR,
    /** One arm of a selector ({@code when}). */
    BRANCH,
    CONDITIONAL,
    LOOP,
    /** Single-target assignment to a local, instance, class, global or constant name. */
    ASSIGNMENT,
    /** Operator assignment such as {@code +=}, {@code ||=} or {@code &&=}. */
    COMPOUND_ASSIGNMENT,
    MULTI_ASSIGNMENT,
    /** Routine definition ({@code def}). */
    ROUTINE,
    /** Any call-like reference, including operator sends and subscript assignment. */
    CALL,
    /** Closure attached to a call ({@code do ... end} or braces). */
    BLOCK,
    STRING,
    RESCUE,
    ENSURE,
    /** Class or module body. */
    CONTAINER,
    EXPRESSION,
    LITERAL
}
