package ai.tabulator.group;

import ai.tabulator.extract.Candidate;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, non-empty run of eligible candidates that are aligned together.
 */
public record Group(List<Candidate> members) {

    public Group {
        Objects.requireNonNull(members, "members");
        if (members.isEmpty()) {
            throw new IllegalArgumentException("A group needs at least one member");
        }
        members = List.copyOf(members);
    }

    public int size() {
        return members.size();
    }

    public int indent() {
        return members.get(0).indent();
    }

    public Candidate first() {
        return members.get(0);
    }

    public Candidate last() {
        return members.get(members.size() - 1);
    }
}
