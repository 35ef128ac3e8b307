package ai.tabulator.extract;

import ai.tabulator.tree.SyntaxNode;
import java.util.Objects;

/**
 * A node scanned by a policy, with its eligibility verdict and the ingredients needed to render it.
 *
 * @param node the scanned node
 * @param eligible whether the node passed every structural predicate of the policy
 * @param reason why the node was rejected; empty for eligible candidates
 * @param indent column the candidate's line starts at, used for grouping and width checks
 * @param rendering single-line form split at the anchor; {@code null} for ineligible candidates
 * @param shape how the rendering is realized as an edit
 * @param insertOffset source offset padding goes in at, for {@link EditShape#INSERT_PADDING}
 * @param alreadySingleLine whether the node is single-line already (considered for alignment only)
 */
public record Candidate(
        SyntaxNode node,
        boolean eligible,
        String reason,
        int indent,
        Rendering rendering,
        EditShape shape,
        int insertOffset,
        boolean alreadySingleLine
) {

    public Candidate {
        Objects.requireNonNull(node, "node");
        reason = reason == null ? "" : reason;
        if (eligible) {
            Objects.requireNonNull(rendering, "rendering");
            Objects.requireNonNull(shape, "shape");
        }
        if (indent < 0) {
            throw new IllegalArgumentException("indent must not be negative");
        }
    }

    public static Candidate ineligible(SyntaxNode node, String reason) {
        return new Candidate(node, false, reason, node.span().column(), null, null, -1, node.isSingleLine());
    }

    public static Candidate replacing(SyntaxNode node, int indent, Rendering rendering) {
        return new Candidate(node, true, "", indent, rendering, EditShape.REPLACE_NODE, -1, node.isSingleLine());
    }

    public static Candidate padding(SyntaxNode node, int indent, Rendering rendering, int insertOffset) {
        return new Candidate(node, true, "", indent, rendering, EditShape.INSERT_PADDING, insertOffset, true);
    }

    public int firstLine() {
        return node.span().firstLine();
    }

    public int lastLine() {
        return node.span().lastLine();
    }

    public int anchor() {
        return rendering == null ? 0 : rendering.anchor();
    }

    /** Whether the unpadded rendering fits on a line of the given maximum width. */
    public boolean fits(int maxLineLength) {
        return rendering != null && indent + rendering.width() <= maxLineLength;
    }

    public boolean fitsPadded(int column, int maxLineLength) {
        return rendering != null && indent + rendering.paddedWidth(column) <= maxLineLength;
    }
}
