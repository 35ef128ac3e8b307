package ai.tabulator.policy;

import ai.tabulator.geometry.DegradationMode;
import ai.tabulator.group.GroupingMode;
import java.util.Locale;

/**
 * The closed set of rewrite policies, each tagged with how its candidates are grouped and how a group
 * degrades under the width budget.
 */
public enum PolicyKind {
    LINEARIZE_ROUTINE("linearize-routine", GroupingMode.SINGLE, DegradationMode.NONE),
    CONDENSE_BRANCH("condense-branch", GroupingMode.SHARED_PARENT, DegradationMode.PER_MEMBER),
    ALIGN_ROUTINE("align-routine", GroupingMode.ADJACENT_LINES, DegradationMode.WHOLE_GROUP),
    ALIGN_ASSIGNMENT("align-assignment", GroupingMode.ADJACENT_LINES, DegradationMode.WHOLE_GROUP);

    private final String id;
    private final GroupingMode grouping;
    private final DegradationMode degradation;

    PolicyKind(String id, GroupingMode grouping, DegradationMode degradation) {
        this.id = id;
        this.grouping = grouping;
        this.degradation = degradation;
    }

    public String id() {
        return id;
    }

    public GroupingMode grouping() {
        return grouping;
    }

    public DegradationMode degradation() {
        return degradation;
    }

    public static PolicyKind from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Policy id must be provided");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (PolicyKind kind : values()) {
            if (kind.id.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported policy: " + raw);
    }
}
