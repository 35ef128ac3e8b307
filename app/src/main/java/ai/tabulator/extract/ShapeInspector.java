package ai.tabulator.extract;

import ai.tabulator.tree.ChildRole;
import ai.tabulator.tree.NodeFlag;
import ai.tabulator.tree.NodeKind;
import ai.tabulator.tree.SyntaxNode;
import ai.tabulator.tree.SyntaxTree;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Structural predicates shared by the policies. Every check tolerates absent structure and answers
 * with a plain boolean.
 */
public final class ShapeInspector {

    private static final Set<NodeKind> KEYWORD_CONSTRUCTS = EnumSet.of(
            NodeKind.SELECTOR, NodeKind.LOOP, NodeKind.ROUTINE, NodeKind.CONTAINER,
            NodeKind.RESCUE, NodeKind.ENSURE, NodeKind.SEQUENCE);

    private ShapeInspector() {
    }

    public static boolean containsHeredoc(SyntaxNode node) {
        if (node == null) {
            return false;
        }
        for (SyntaxNode candidate : selfAndDescendants(node)) {
            if (candidate.has(NodeFlag.HEREDOC)) {
                return true;
            }
        }
        return false;
    }

    /** Plain (non-heredoc) string literal whose source spans more than one line. */
    public static boolean containsMultilineString(SyntaxNode node) {
        if (node == null) {
            return false;
        }
        for (SyntaxNode candidate : selfAndDescendants(node)) {
            if (candidate.is(NodeKind.STRING)
                    && !candidate.has(NodeFlag.HEREDOC)
                    && candidate.source().indexOf('\n') >= 0) {
                return true;
            }
        }
        return false;
    }

    public static boolean hasCommentOnLines(SyntaxTree tree, int firstLine, int lastLine) {
        return tree != null && lastLine >= firstLine && tree.hasCommentOnLines(firstLine, lastLine);
    }

    /** Block (closure) anywhere in the subtree whose body holds several statements. */
    public static boolean containsMultiStatementBlock(SyntaxNode node) {
        if (node == null) {
            return false;
        }
        for (SyntaxNode candidate : selfAndDescendants(node)) {
            if (candidate.is(NodeKind.BLOCK)
                    && candidate.child(ChildRole.BODY).filter(body -> body.is(NodeKind.SEQUENCE)).isPresent()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Keyword construct spread over several lines that would need statement separators once joined,
     * e.g. a full if/else or a nested selector.
     */
    public static boolean containsMultilineKeywordConstruct(SyntaxNode node) {
        if (node == null) {
            return false;
        }
        for (SyntaxNode candidate : selfAndDescendants(node)) {
            if (candidate.isSingleLine()) {
                continue;
            }
            if (KEYWORD_CONSTRUCTS.contains(candidate.kind())) {
                return true;
            }
            if (candidate.is(NodeKind.CONDITIONAL) && !candidate.has(NodeFlag.MODIFIER)) {
                return true;
            }
        }
        return false;
    }

    public static boolean containsCall(SyntaxNode node) {
        if (node == null) {
            return false;
        }
        for (SyntaxNode candidate : selfAndDescendants(node)) {
            if (candidate.is(NodeKind.CALL)) {
                return true;
            }
        }
        return false;
    }

    public static boolean containsKind(SyntaxNode node, NodeKind kind) {
        if (node == null) {
            return false;
        }
        for (SyntaxNode candidate : selfAndDescendants(node)) {
            if (candidate.is(kind)) {
                return true;
            }
        }
        return false;
    }

    private static List<SyntaxNode> selfAndDescendants(SyntaxNode node) {
        List<SyntaxNode> all = new ArrayList<>();
        all.add(node);
        all.addAll(node.descendants());
        return all;
    }
}
