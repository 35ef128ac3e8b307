package ai.tabulator.policy;

import ai.tabulator.extract.Candidate;
import ai.tabulator.extract.Rendering;
import ai.tabulator.extract.ShapeInspector;
import ai.tabulator.geometry.Decision;
import ai.tabulator.tree.ChildRole;
import ai.tabulator.tree.NodeKind;
import ai.tabulator.tree.SourceText;
import ai.tabulator.tree.Span;
import ai.tabulator.tree.SyntaxNode;
import ai.tabulator.tree.SyntaxTree;
import ai.tabulator.tree.TokenRole;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalInt;

/**
 * Aligns the operators of consecutive single-target assignments by inserting spaces before them.
 */
public class AlignAssignmentPolicy implements RewritePolicy {

    static final String MESSAGE = "Align assignment with other assignments in group";

    private static final String OPERATOR_PREFIX_CHARS = "+-*/%|&^<>";

    @Override
    public PolicyKind kind() {
        return PolicyKind.ALIGN_ASSIGNMENT;
    }

    @Override
    public List<Candidate> extract(SyntaxTree tree) {
        List<Candidate> candidates = new ArrayList<>();
        for (SyntaxNode node : tree.nodes()) {
            if (node.is(NodeKind.ASSIGNMENT) || node.is(NodeKind.COMPOUND_ASSIGNMENT)) {
                candidates.add(inspect(tree, node));
            }
        }
        candidates.sort(Comparator.comparingInt(Candidate::firstLine)
                .thenComparingInt(candidate -> candidate.node().span().start()));
        return candidates;
    }

    Candidate inspect(SyntaxTree tree, SyntaxNode node) {
        if (node.role().filter(ChildRole.TARGET::equals).isPresent()
                || node.parent().filter(parent -> parent.is(NodeKind.MULTI_ASSIGNMENT)).isPresent()) {
            return Candidate.ineligible(node, "target of a multi-assignment");
        }
        if (node.hasAncestor(NodeKind.ASSIGNMENT)
                || node.hasAncestor(NodeKind.COMPOUND_ASSIGNMENT)
                || node.hasAncestor(NodeKind.MULTI_ASSIGNMENT)) {
            return Candidate.ineligible(node, "nested in another assignment");
        }
        if (node.hasAncestor(NodeKind.BLOCK)) {
            return Candidate.ineligible(node, "inside a block");
        }
        if (!node.isSingleLine()) {
            return Candidate.ineligible(node, "spans several lines");
        }
        if (ShapeInspector.containsHeredoc(node)) {
            return Candidate.ineligible(node, "heredoc");
        }
        OptionalInt operator = operatorOffset(tree.source(), node);
        if (operator.isEmpty()) {
            return Candidate.ineligible(node, "no assignment operator");
        }

        SourceText source = tree.source();
        int line = node.span().firstLine();
        int indentation = source.indentation(line);
        int contentStart = source.lineStart(line) + indentation;
        int anchorOffset = operator.getAsInt();
        if (anchorOffset < contentStart) {
            return Candidate.ineligible(node, "operator precedes line content");
        }
        Rendering rendering = new Rendering(
                source.slice(contentStart, anchorOffset),
                source.slice(anchorOffset, source.lineEnd(line)));
        return Candidate.padding(node, indentation, rendering, anchorOffset);
    }

    /**
     * Operator token from the tree, or else the first {@code =} after the target name that is not part of
     * {@code ==}, {@code =~} or {@code =>}, widened left over compound operator characters.
     */
    static OptionalInt operatorOffset(SourceText source, SyntaxNode node) {
        if (node.token(TokenRole.OPERATOR).isPresent()) {
            return OptionalInt.of(node.token(TokenRole.OPERATOR).get().start());
        }
        Span span = node.span();
        int from = node.token(TokenRole.NAME).map(Span::end).orElse(span.start());
        String text = source.text();
        for (int i = from; i < span.end(); i++) {
            if (text.charAt(i) != '=') {
                continue;
            }
            char next = i + 1 < text.length() ? text.charAt(i + 1) : ' ';
            char previous = i > 0 ? text.charAt(i - 1) : ' ';
            if (next == '=' || next == '~' || next == '>' || previous == '=' || previous == '!') {
                continue;
            }
            int start = i;
            while (start > from && OPERATOR_PREFIX_CHARS.indexOf(text.charAt(start - 1)) >= 0) {
                start--;
            }
            return OptionalInt.of(start);
        }
        return OptionalInt.empty();
    }

    @Override
    public String message(Decision decision) {
        return MESSAGE;
    }
}
