package ai.tabulator.policy;

import ai.tabulator.extract.Candidate;
import ai.tabulator.extract.Rendering;
import ai.tabulator.extract.ShapeInspector;
import ai.tabulator.geometry.Decision;
import ai.tabulator.tree.ChildRole;
import ai.tabulator.tree.NodeKind;
import ai.tabulator.tree.Span;
import ai.tabulator.tree.SyntaxNode;
import ai.tabulator.tree.SyntaxTree;
import ai.tabulator.tree.TokenRole;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Condenses multi-line selector branches to {@code when <labels> then <body>} and aligns the
 * {@code then} keywords of sibling branches.
 */
public class CondenseBranchPolicy implements RewritePolicy {

    static final String MESSAGE = "Condense branch to a single line with aligned `then`";

    private static final String DEFAULT_KEYWORD = "when";
    private static final String SEPARATOR = " then ";

    @Override
    public PolicyKind kind() {
        return PolicyKind.CONDENSE_BRANCH;
    }

    @Override
    public List<Candidate> extract(SyntaxTree tree) {
        List<Candidate> candidates = new ArrayList<>();
        for (SyntaxNode node : tree.nodes()) {
            if (node.is(NodeKind.BRANCH)) {
                candidates.add(inspect(tree, node));
            }
        }
        return candidates;
    }

    Candidate inspect(SyntaxTree tree, SyntaxNode branch) {
        Optional<SyntaxNode> maybeBody = branch.child(ChildRole.BODY);
        if (maybeBody.isEmpty()) {
            return Candidate.ineligible(branch, "branch has no body");
        }
        SyntaxNode body = maybeBody.get();
        List<SyntaxNode> labels = branch.children(ChildRole.LABEL);
        if (labels.isEmpty()) {
            return Candidate.ineligible(branch, "branch has no match values");
        }
        if (body.is(NodeKind.SEQUENCE) && body.children().size() > 1) {
            return Candidate.ineligible(branch, "body holds several statements");
        }
        if (ShapeInspector.containsHeredoc(body) || labels.stream().anyMatch(ShapeInspector::containsHeredoc)) {
            return Candidate.ineligible(branch, "heredoc");
        }
        if (ShapeInspector.containsMultilineString(body)) {
            return Candidate.ineligible(branch, "multi-line string");
        }
        Span keyword = branch.token(TokenRole.KEYWORD).orElse(branch.span());
        if (ShapeInspector.hasCommentOnLines(tree, keyword.firstLine(), body.span().lastLine())) {
            return Candidate.ineligible(branch, "comment inside branch");
        }
        if (labels.get(0).span().firstLine() != labels.get(labels.size() - 1).span().lastLine()) {
            return Candidate.ineligible(branch, "match values span several lines");
        }
        if (ShapeInspector.containsMultilineKeywordConstruct(body) || ShapeInspector.containsMultiStatementBlock(body)) {
            return Candidate.ineligible(branch, "body needs statement separators");
        }

        String keywordText = branch.tokenText(TokenRole.KEYWORD).orElse(DEFAULT_KEYWORD);
        String labelText = labels.stream()
                .map(label -> label.source().strip())
                .collect(Collectors.joining(", "));
        Rendering rendering = new Rendering(keywordText + " " + labelText, SEPARATOR + Rendering.collapse(body.source()));
        return Candidate.replacing(branch, keyword.column(), rendering);
    }

    @Override
    public String message(Decision decision) {
        return MESSAGE;
    }
}
