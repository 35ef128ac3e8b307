package ai.tabulator.edit;

import ai.tabulator.tree.Span;
import java.util.Objects;

/**
 * Replacement of a half-open range of the original source buffer. An empty range is an insertion.
 */
public record Edit(int start, int end, String replacement) {

    public Edit {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid edit range: " + start + ".." + end);
        }
        Objects.requireNonNull(replacement, "replacement");
    }

    public static Edit replace(Span span, String replacement) {
        Objects.requireNonNull(span, "span");
        return new Edit(span.start(), span.end(), replacement);
    }

    public static Edit insert(int offset, String text) {
        return new Edit(offset, offset, text);
    }

    public boolean isInsertion() {
        return start == end;
    }

    /**
     * Two edits conflict when their ranges intersect or both begin at the same offset, since their
     * relative order would then be ambiguous.
     */
    public boolean conflictsWith(Edit other) {
        if (start == other.start) {
            return true;
        }
        return start < other.end && other.start < end;
    }
}
