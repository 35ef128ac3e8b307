package ai.tabulator.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed source unit as supplied by the host parser.
 */
public interface SyntaxTree {

    SourceText source();

    SyntaxNode root();

    /** Spans of every comment token, in source order. */
    List<Span> comments();

    /** Root followed by all of its descendants in pre-order. */
    default List<SyntaxNode> nodes() {
        List<SyntaxNode> all = new ArrayList<>();
        all.add(root());
        all.addAll(root().descendants());
        return all;
    }

    default boolean hasCommentOnLines(int firstLine, int lastLine) {
        for (Span comment : comments()) {
            if (comment.firstLine() >= firstLine && comment.firstLine() <= lastLine) {
                return true;
            }
        }
        return false;
    }
}
