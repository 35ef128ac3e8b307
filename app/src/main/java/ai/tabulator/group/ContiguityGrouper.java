package ai.tabulator.group;

import ai.tabulator.extract.Candidate;
import ai.tabulator.tree.SyntaxNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Partitions a position-ordered candidate stream into groups.
 */
public class ContiguityGrouper {

    private static final int MIN_ALIGNED_GROUP_SIZE = 2;

    public List<Group> group(List<Candidate> ordered, GroupingMode mode) {
        Objects.requireNonNull(mode, "mode");
        if (ordered == null || ordered.isEmpty()) {
            return List.of();
        }
        return switch (mode) {
            case ADJACENT_LINES -> adjacentRuns(ordered);
            case SHARED_PARENT -> byParent(ordered);
            case SINGLE -> singles(ordered);
        };
    }

    /**
     * Linear scan with two states, inside a run and between runs. A run survives only with at least two
     * members.
     */
    private List<Group> adjacentRuns(List<Candidate> ordered) {
        List<Group> groups = new ArrayList<>();
        List<Candidate> run = new ArrayList<>();
        for (Candidate candidate : ordered) {
            if (!candidate.eligible()) {
                if (!run.isEmpty() && candidate.firstLine() > last(run).lastLine()) {
                    close(run, groups);
                }
                continue;
            }
            if (!run.isEmpty() && !continuesRun(last(run), candidate)) {
                close(run, groups);
            }
            run.add(candidate);
        }
        close(run, groups);
        return groups;
    }

    static boolean continuesRun(Candidate previous, Candidate next) {
        return next.firstLine() == previous.lastLine() + 1 && next.indent() == previous.indent();
    }

    private List<Group> byParent(List<Candidate> ordered) {
        Map<SyntaxNode, List<Candidate>> siblings = new LinkedHashMap<>();
        for (Candidate candidate : ordered) {
            if (!candidate.eligible()) {
                continue;
            }
            SyntaxNode parent = candidate.node().parent().orElse(candidate.node());
            siblings.computeIfAbsent(parent, key -> new ArrayList<>()).add(candidate);
        }
        List<Group> groups = new ArrayList<>(siblings.size());
        for (List<Candidate> members : siblings.values()) {
            groups.add(new Group(members));
        }
        return groups;
    }

    private List<Group> singles(List<Candidate> ordered) {
        List<Group> groups = new ArrayList<>();
        for (Candidate candidate : ordered) {
            if (candidate.eligible()) {
                groups.add(new Group(List.of(candidate)));
            }
        }
        return groups;
    }

    private static void close(List<Candidate> run, List<Group> groups) {
        if (run.size() >= MIN_ALIGNED_GROUP_SIZE) {
            groups.add(new Group(run));
        }
        run.clear();
    }

    private static Candidate last(List<Candidate> run) {
        return run.get(run.size() - 1);
    }
}
