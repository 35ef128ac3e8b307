package ai.tabulator.engine;

import ai.tabulator.edit.EditSet;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one engine pass over a single source unit.
 *
 * @param diagnostics accepted offenses in policy order
 * @param edits the conflict-free edits of this pass
 * @param deferred edits rejected for overlapping an accepted one or landing on a line it rewrites; they are left for the next pass
 * @param source the text the pass ran against
 */
public record PassResult(List<Diagnostic> diagnostics, EditSet edits, int deferred, String source) {

    public PassResult {
        diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
        Objects.requireNonNull(edits, "edits");
        Objects.requireNonNull(source, "source");
        if (deferred < 0) {
            throw new IllegalArgumentException("deferred must not be negative");
        }
    }

    public boolean isEmpty() {
        return edits.isEmpty();
    }

    public String rewrittenSource() {
        return edits.apply(source);
    }
}
