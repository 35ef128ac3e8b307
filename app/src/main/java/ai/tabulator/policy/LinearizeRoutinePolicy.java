package ai.tabulator.policy;

import ai.tabulator.extract.Candidate;
import ai.tabulator.extract.Rendering;
import ai.tabulator.extract.ShapeInspector;
import ai.tabulator.geometry.Decision;
import ai.tabulator.tree.ChildRole;
import ai.tabulator.tree.NodeFlag;
import ai.tabulator.tree.NodeKind;
import ai.tabulator.tree.Span;
import ai.tabulator.tree.SyntaxNode;
import ai.tabulator.tree.SyntaxTree;
import ai.tabulator.tree.TokenRole;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Converts multi-line single-expression routines to a single line.
 *
 * <p>The endless spelling {@code def name(args) = body} is preferred. A body that is a trailing-clause
 * conditional referencing another routine uses {@code def name(args) body end} instead, since calls
 * reached through the endless spelling can fail to resolve their scope when the definition is evaluated
 * dynamically.
 */
public class LinearizeRoutinePolicy implements RewritePolicy {

    static final String MESSAGE_ENDLESS = "Use endless method: `%s`";
    static final String MESSAGE_TRADITIONAL = "Use single-line method: `%s`";

    private static final String KEYWORD = "def";
    private static final Set<String> COMPARISON_NAMES = Set.of("==", "!=", "===", "<=", ">=");

    private final int maxLineLength;

    public LinearizeRoutinePolicy(int maxLineLength) {
        if (maxLineLength <= 0) {
            throw new IllegalArgumentException("maxLineLength must be greater than zero");
        }
        this.maxLineLength = maxLineLength;
    }

    @Override
    public PolicyKind kind() {
        return PolicyKind.LINEARIZE_ROUTINE;
    }

    @Override
    public List<Candidate> extract(SyntaxTree tree) {
        List<Candidate> candidates = new ArrayList<>();
        for (SyntaxNode node : tree.nodes()) {
            if (node.is(NodeKind.ROUTINE)) {
                candidates.add(inspect(tree, node));
            }
        }
        return candidates;
    }

    Candidate inspect(SyntaxTree tree, SyntaxNode routine) {
        if (routine.isSingleLine()) {
            return Candidate.ineligible(routine, "already single line");
        }
        Optional<SyntaxNode> maybeBody = routine.child(ChildRole.BODY);
        if (maybeBody.isEmpty()) {
            return Candidate.ineligible(routine, "routine has no body");
        }
        SyntaxNode body = maybeBody.get();
        if (body.is(NodeKind.SEQUENCE)) {
            return Candidate.ineligible(routine, "body holds several statements");
        }
        if (ShapeInspector.containsKind(routine, NodeKind.RESCUE) || ShapeInspector.containsKind(routine, NodeKind.ENSURE)) {
            return Candidate.ineligible(routine, "error-handling clause");
        }
        if (ShapeInspector.containsHeredoc(body)) {
            return Candidate.ineligible(routine, "heredoc");
        }
        if (ShapeInspector.containsMultilineString(body)) {
            return Candidate.ineligible(routine, "multi-line string");
        }
        if (ShapeInspector.containsMultiStatementBlock(body) || ShapeInspector.containsMultilineKeywordConstruct(body)) {
            return Candidate.ineligible(routine, "body needs statement separators");
        }
        Optional<String> name = routine.tokenText(TokenRole.NAME);
        if (name.isEmpty()) {
            return Candidate.ineligible(routine, "routine has no name");
        }
        if (isSetter(name.get())) {
            return Candidate.ineligible(routine, "setter routine");
        }
        Span keyword = routine.token(TokenRole.KEYWORD).orElse(routine.span());
        if (ShapeInspector.hasCommentOnLines(tree, keyword.firstLine(), routine.span().lastLine())) {
            return Candidate.ineligible(routine, "comment inside routine");
        }

        String signature = signature(routine, name.get());
        String parameters = routine.child(ChildRole.PARAMETERS)
                .map(SyntaxNode::source)
                .map(Rendering::collapse)
                .filter(value -> !value.isEmpty())
                .map(value -> value.startsWith("(") ? value : "(" + value + ")")
                .orElse("");
        String bodyText = Rendering.collapse(body.source());

        String endless = signature + parameters + " = " + bodyText;
        String traditional = signature + (parameters.isEmpty() ? "()" : parameters) + " " + bodyText + " end";
        if (keyword.column() + Math.min(endless.length(), traditional.length()) > maxLineLength) {
            return Candidate.ineligible(routine, "exceeds line length in both spellings");
        }
        String chosen = usesTrailingClauseSpelling(body) ? traditional : endless;
        return Candidate.replacing(routine, keyword.column(), new Rendering(chosen, ""));
    }

    static boolean isSetter(String name) {
        return name.endsWith("=") && !COMPARISON_NAMES.contains(name);
    }

    static boolean usesTrailingClauseSpelling(SyntaxNode body) {
        return body.is(NodeKind.CONDITIONAL) && body.has(NodeFlag.MODIFIER) && ShapeInspector.containsCall(body);
    }

    private static String signature(SyntaxNode routine, String name) {
        Optional<SyntaxNode> receiver = routine.child(ChildRole.RECEIVER);
        return receiver
                .map(node -> KEYWORD + " " + node.source().strip() + "." + name)
                .orElse(KEYWORD + " " + name);
    }

    @Override
    public String message(Decision decision) {
        String rendering = decision.candidate().rendering().text();
        Optional<SyntaxNode> body = decision.candidate().node().child(ChildRole.BODY);
        boolean traditional = body.isPresent() && usesTrailingClauseSpelling(body.get());
        return String.format(traditional ? MESSAGE_TRADITIONAL : MESSAGE_ENDLESS, rendering);
    }
}
