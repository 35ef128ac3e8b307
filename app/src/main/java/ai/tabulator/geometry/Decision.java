package ai.tabulator.geometry;

import ai.tabulator.extract.Candidate;
import java.util.Objects;

/**
 * Chosen outcome for one candidate.
 */
public record Decision(Candidate candidate, DecisionKind kind, int column) {

    public Decision {
        Objects.requireNonNull(candidate, "candidate");
        Objects.requireNonNull(kind, "kind");
        if (kind == DecisionKind.ALIGNED && column < candidate.anchor()) {
            throw new IllegalArgumentException("Alignment column " + column + " precedes anchor " + candidate.anchor());
        }
    }

    public static Decision unchanged(Candidate candidate) {
        return new Decision(candidate, DecisionKind.UNCHANGED, -1);
    }

    public static Decision singleLine(Candidate candidate) {
        return new Decision(candidate, DecisionKind.SINGLE_LINE, -1);
    }

    public static Decision aligned(Candidate candidate, int column) {
        return new Decision(candidate, DecisionKind.ALIGNED, column);
    }

    public boolean changesSource() {
        return kind != DecisionKind.UNCHANGED;
    }

    /** Spaces the anchor moves right by; zero unless aligned. */
    public int padding() {
        return kind == DecisionKind.ALIGNED ? column - candidate.anchor() : 0;
    }
}
