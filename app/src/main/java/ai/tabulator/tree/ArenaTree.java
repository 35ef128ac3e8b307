package ai.tabulator.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link SyntaxTree} backed by an arena of nodes addressed by index. Hosts adapt their parser output
 * through {@link Builder}; the finished tree is immutable.
 */
public final class ArenaTree implements SyntaxTree {

    private final SourceText source;
    private final List<Entry> entries;
    private final List<Span> comments;
    private final int rootIndex;
    private final List<ArenaNode> views;

    private ArenaTree(SourceText source, List<Entry> entries, List<Span> comments, int rootIndex) {
        this.source = source;
        this.entries = entries;
        this.comments = comments;
        this.rootIndex = rootIndex;
        List<ArenaNode> created = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            created.add(new ArenaNode(i));
        }
        this.views = Collections.unmodifiableList(created);
    }

    public static Builder builder(String text) {
        return new Builder(new SourceText(text));
    }

    @Override
    public SourceText source() {
        return source;
    }

    @Override
    public SyntaxNode root() {
        return views.get(rootIndex);
    }

    @Override
    public List<Span> comments() {
        return comments;
    }

    public int size() {
        return entries.size();
    }

    public SyntaxNode node(int index) {
        return views.get(index);
    }

    private static final class Entry {
        private final NodeKind kind;
        private final Span span;
        private final List<Integer> children = new ArrayList<>();
        private final Map<TokenRole, Span> tokens = new EnumMap<>(TokenRole.class);
        private final Set<NodeFlag> flags = EnumSet.noneOf(NodeFlag.class);
        private int parent = -1;
        private ChildRole role;

        private Entry(NodeKind kind, Span span) {
            this.kind = kind;
            this.span = span;
        }
    }

    private final class ArenaNode implements SyntaxNode {

        private final int index;

        private ArenaNode(int index) {
            this.index = index;
        }

        private Entry entry() {
            return entries.get(index);
        }

        @Override
        public NodeKind kind() {
            return entry().kind;
        }

        @Override
        public Span span() {
            return entry().span;
        }

        @Override
        public List<SyntaxNode> children() {
            List<SyntaxNode> result = new ArrayList<>(entry().children.size());
            for (int child : entry().children) {
                result.add(views.get(child));
            }
            return result;
        }

        @Override
        public Optional<SyntaxNode> parent() {
            int parent = entry().parent;
            return parent < 0 ? Optional.empty() : Optional.of(views.get(parent));
        }

        @Override
        public Optional<ChildRole> role() {
            return Optional.ofNullable(entry().role);
        }

        @Override
        public Optional<Span> token(TokenRole tokenRole) {
            return Optional.ofNullable(entry().tokens.get(tokenRole));
        }

        @Override
        public boolean has(NodeFlag flag) {
            return entry().flags.contains(flag);
        }

        @Override
        public String source() {
            Span span = entry().span;
            return source.slice(span.start(), span.end());
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof ArenaNode node && node.index == index && node.tree() == ArenaTree.this;
        }

        @Override
        public int hashCode() {
            return Objects.hash(System.identityHashCode(ArenaTree.this), index);
        }

        @Override
        public String toString() {
            Span span = entry().span;
            return entry().kind + "@" + span.firstLine() + ":" + span.column();
        }

        private ArenaTree tree() {
            return ArenaTree.this;
        }
    }

    /**
     * Collects nodes by half-open source offsets. Children are attached after creation so a parser
     * can build bottom-up; attach order becomes source order only after {@link #build()} sorts them.
     */
    public static final class Builder {

        private final SourceText source;
        private final List<Entry> entries = new ArrayList<>();
        private final List<Span> comments = new ArrayList<>();
        private int rootIndex = -1;

        private Builder(SourceText source) {
            this.source = source;
        }

        public SourceText source() {
            return source;
        }

        public int node(NodeKind kind, int start, int end) {
            Objects.requireNonNull(kind, "kind");
            entries.add(new Entry(kind, source.span(start, end)));
            return entries.size() - 1;
        }

        public Builder token(int node, TokenRole tokenRole, int start, int end) {
            Objects.requireNonNull(tokenRole, "tokenRole");
            entry(node).tokens.put(tokenRole, source.span(start, end));
            return this;
        }

        public Builder flag(int node, NodeFlag flag) {
            entry(node).flags.add(Objects.requireNonNull(flag, "flag"));
            return this;
        }

        public Builder child(int parent, ChildRole childRole, int child) {
            Objects.requireNonNull(childRole, "childRole");
            if (parent == child) {
                throw new IllegalArgumentException("A node cannot be its own child: " + parent);
            }
            Entry childEntry = entry(child);
            if (childEntry.parent >= 0) {
                throw new IllegalArgumentException("Node " + child + " already has parent " + childEntry.parent);
            }
            childEntry.parent = parent;
            childEntry.role = childRole;
            entry(parent).children.add(child);
            return this;
        }

        public Builder comment(int start, int end) {
            comments.add(source.span(start, end));
            return this;
        }

        public Builder root(int node) {
            entry(node);
            rootIndex = node;
            return this;
        }

        public ArenaTree build() {
            if (rootIndex < 0) {
                throw new IllegalStateException("Root node has not been set");
            }
            if (entries.get(rootIndex).parent >= 0) {
                throw new IllegalStateException("Root node must not have a parent");
            }
            for (Entry entry : entries) {
                entry.children.sort((left, right) -> Integer.compare(entries.get(left).span.start(), entries.get(right).span.start()));
            }
            List<Span> sortedComments = new ArrayList<>(comments);
            sortedComments.sort((left, right) -> Integer.compare(left.start(), right.start()));
            return new ArenaTree(source, List.copyOf(entries), List.copyOf(sortedComments), rootIndex);
        }

        private Entry entry(int node) {
            if (node < 0 || node >= entries.size()) {
                throw new IllegalArgumentException("Unknown node index: " + node);
            }
            return entries.get(node);
        }
    }
}
