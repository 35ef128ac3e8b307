package ai.tabulator.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Read-only handle onto one node of a {@link SyntaxTree}.
 */
public interface SyntaxNode {

    NodeKind kind();

    Span span();

    /** Children in source order. */
    List<SyntaxNode> children();

    Optional<SyntaxNode> parent();

    /** Role under the parent; {@link Optional#empty()} for the root. */
    Optional<ChildRole> role();

    Optional<Span> token(TokenRole role);

    boolean has(NodeFlag flag);

    /** Raw source covered by {@link #span()}. */
    String source();

    default boolean is(NodeKind candidate) {
        return kind() == candidate;
    }

    default List<SyntaxNode> children(ChildRole childRole) {
        List<SyntaxNode> matching = new ArrayList<>();
        for (SyntaxNode child : children()) {
            if (child.role().filter(childRole::equals).isPresent()) {
                matching.add(child);
            }
        }
        return matching;
    }

    default Optional<SyntaxNode> child(ChildRole childRole) {
        for (SyntaxNode child : children()) {
            if (child.role().filter(childRole::equals).isPresent()) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    default Optional<String> tokenText(TokenRole tokenRole) {
        return token(tokenRole).map(tokenSpan -> {
            int offset = tokenSpan.start() - span().start();
            int end = tokenSpan.end() - span().start();
            if (offset >= 0 && end <= source().length()) {
                return source().substring(offset, end);
            }
            return null;
        });
    }

    default boolean isSingleLine() {
        return span().isSingleLine();
    }

    /** All nodes strictly below this one, in pre-order. */
    default List<SyntaxNode> descendants() {
        List<SyntaxNode> collected = new ArrayList<>();
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        List<SyntaxNode> direct = children();
        for (int i = direct.size() - 1; i >= 0; i--) {
            stack.push(direct.get(i));
        }
        while (!stack.isEmpty()) {
            SyntaxNode current = stack.pop();
            collected.add(current);
            List<SyntaxNode> nested = current.children();
            for (int i = nested.size() - 1; i >= 0; i--) {
                stack.push(nested.get(i));
            }
        }
        return collected;
    }

    default boolean hasAncestor(NodeKind ancestorKind) {
        Optional<SyntaxNode> current = parent();
        while (current.isPresent()) {
            if (current.get().kind() == ancestorKind) {
                return true;
            }
            current = current.get().parent();
        }
        return false;
    }
}
