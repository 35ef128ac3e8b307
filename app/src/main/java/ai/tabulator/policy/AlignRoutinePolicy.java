package ai.tabulator.policy;

import ai.tabulator.extract.Candidate;
import ai.tabulator.extract.Rendering;
import ai.tabulator.extract.ShapeInspector;
import ai.tabulator.geometry.Decision;
import ai.tabulator.tree.ChildRole;
import ai.tabulator.tree.NodeFlag;
import ai.tabulator.tree.NodeKind;
import ai.tabulator.tree.SourceText;
import ai.tabulator.tree.Span;
import ai.tabulator.tree.SyntaxNode;
import ai.tabulator.tree.SyntaxTree;
import ai.tabulator.tree.TokenRole;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Aligns contiguous single-line routine definitions so their bodies start at the same column. Endless
 * routines align on their {@code =}; traditional one-liners align as if an invisible {@code =} stood two
 * columns before the body.
 */
public class AlignRoutinePolicy implements RewritePolicy {

    static final String MESSAGE = "Align routine body with other routines in group";

    private static final int IMPLIED_OPERATOR_WIDTH = 2;

    @Override
    public PolicyKind kind() {
        return PolicyKind.ALIGN_ROUTINE;
    }

    @Override
    public List<Candidate> extract(SyntaxTree tree) {
        List<Candidate> candidates = new ArrayList<>();
        for (SyntaxNode node : tree.nodes()) {
            if (node.is(NodeKind.ROUTINE)) {
                candidates.add(inspect(tree, node));
            }
        }
        candidates.sort(Comparator.comparingInt(Candidate::firstLine)
                .thenComparingInt(candidate -> candidate.node().span().start()));
        return candidates;
    }

    Candidate inspect(SyntaxTree tree, SyntaxNode routine) {
        if (!routine.isSingleLine()) {
            return Candidate.ineligible(routine, "spans several lines");
        }
        Optional<SyntaxNode> body = routine.child(ChildRole.BODY);
        if (body.isEmpty()) {
            return Candidate.ineligible(routine, "routine has no body");
        }
        if (ShapeInspector.containsHeredoc(routine)) {
            return Candidate.ineligible(routine, "heredoc");
        }

        SourceText source = tree.source();
        Span keyword = routine.token(TokenRole.KEYWORD).orElse(routine.span());
        int anchorOffset;
        int insertOffset;
        if (routine.has(NodeFlag.ENDLESS)) {
            Optional<Span> equals = routine.token(TokenRole.ASSIGNMENT);
            if (equals.isEmpty()) {
                return Candidate.ineligible(routine, "endless routine without equals token");
            }
            anchorOffset = equals.get().start();
            insertOffset = anchorOffset;
        } else {
            insertOffset = body.get().span().start();
            anchorOffset = insertOffset - IMPLIED_OPERATOR_WIDTH;
        }
        if (anchorOffset <= keyword.start()) {
            return Candidate.ineligible(routine, "body starts inside the routine header");
        }
        Rendering rendering = new Rendering(
                source.slice(keyword.start(), anchorOffset),
                source.slice(anchorOffset, source.lineEnd(keyword.firstLine())));
        return Candidate.padding(routine, keyword.column(), rendering, insertOffset);
    }

    @Override
    public String message(Decision decision) {
        return MESSAGE;
    }
}
