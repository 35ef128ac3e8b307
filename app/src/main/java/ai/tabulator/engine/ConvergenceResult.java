package ai.tabulator.engine;

import java.util.Objects;

/**
 * Final text after repeated passes.
 *
 * @param passes number of passes that produced edits
 * @param converged whether a pass finished without edits before the cap
 */
public record ConvergenceResult(String source, int passes, boolean converged) {

    public ConvergenceResult {
        Objects.requireNonNull(source, "source");
    }
}
