package ai.tabulator.edit;

import ai.tabulator.extract.Candidate;
import ai.tabulator.extract.Rendering;
import ai.tabulator.geometry.Decision;
import ai.tabulator.geometry.DecisionKind;
import ai.tabulator.tree.SourceText;
import ai.tabulator.tree.Span;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns decisions into edits. Pure padding becomes an insertion at the anchor rather than a rewrite
 * of the whole line.
 */
public class EditBuilder {

    public Optional<Edit> build(Decision decision, SourceText source) {
        Objects.requireNonNull(decision, "decision");
        Objects.requireNonNull(source, "source");
        if (!decision.changesSource()) {
            return Optional.empty();
        }
        Candidate candidate = decision.candidate();
        return switch (candidate.shape()) {
            case REPLACE_NODE -> replacement(decision, candidate, source);
            case INSERT_PADDING -> padding(decision, candidate);
        };
    }

    private Optional<Edit> replacement(Decision decision, Candidate candidate, SourceText source) {
        Rendering rendering = candidate.rendering();
        String text = decision.kind() == DecisionKind.ALIGNED ? rendering.padded(decision.column()) : rendering.text();
        Span span = candidate.node().span();
        if (source.slice(span.start(), span.end()).equals(text)) {
            return Optional.empty();
        }
        return Optional.of(Edit.replace(span, text));
    }

    private Optional<Edit> padding(Decision decision, Candidate candidate) {
        int padding = decision.padding();
        if (padding <= 0 || candidate.insertOffset() < 0) {
            return Optional.empty();
        }
        return Optional.of(Edit.insert(candidate.insertOffset(), Rendering.spaces(padding)));
    }
}
