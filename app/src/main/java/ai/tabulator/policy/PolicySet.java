package ai.tabulator.policy;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Selects the enabled policies in their fixed run order.
 */
public final class PolicySet {

    private final List<RewritePolicy> policies;

    private PolicySet(List<RewritePolicy> policies) {
        this.policies = List.copyOf(policies);
    }

    public static PolicySet of(Set<PolicyKind> enabled, int maxLineLength) {
        Objects.requireNonNull(enabled, "enabled");
        Set<PolicyKind> selected = enabled.isEmpty() ? EnumSet.noneOf(PolicyKind.class) : EnumSet.copyOf(enabled);
        List<RewritePolicy> policies = new ArrayList<>();
        for (PolicyKind kind : PolicyKind.values()) {
            if (selected.contains(kind)) {
                policies.add(create(kind, maxLineLength));
            }
        }
        return new PolicySet(policies);
    }

    public static PolicySet all(int maxLineLength) {
        return of(EnumSet.allOf(PolicyKind.class), maxLineLength);
    }

    private static RewritePolicy create(PolicyKind kind, int maxLineLength) {
        return switch (kind) {
            case LINEARIZE_ROUTINE -> new LinearizeRoutinePolicy(maxLineLength);
            case CONDENSE_BRANCH -> new CondenseBranchPolicy();
            case ALIGN_ROUTINE -> new AlignRoutinePolicy();
            case ALIGN_ASSIGNMENT -> new AlignAssignmentPolicy();
        };
    }

    public List<RewritePolicy> policies() {
        return policies;
    }

    public boolean isEmpty() {
        return policies.isEmpty();
    }
}
