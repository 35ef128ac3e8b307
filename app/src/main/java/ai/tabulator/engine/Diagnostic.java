package ai.tabulator.engine;

import ai.tabulator.edit.Edit;
import ai.tabulator.policy.PolicyKind;
import ai.tabulator.tree.Span;
import java.util.Objects;

/**
 * Offense reported for one node together with the edit that corrects it.
 */
public record Diagnostic(PolicyKind policy, Span span, String message, Edit edit) {

    public Diagnostic {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(edit, "edit");
    }

    public int line() {
        return span.firstLine();
    }

    @Override
    public String toString() {
        return span.firstLine() + ":" + span.column() + " " + policy.id() + ": " + message;
    }
}
