package ai.tabulator.geometry;

import ai.tabulator.extract.Candidate;
import ai.tabulator.group.Group;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the shared alignment column of a group and checks every member against the width budget.
 */
public class GeometryCalculator {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeometryCalculator.class);

    private final int maxLineLength;

    public GeometryCalculator(int maxLineLength) {
        if (maxLineLength <= 0) {
            throw new IllegalArgumentException("maxLineLength must be greater than zero");
        }
        this.maxLineLength = maxLineLength;
    }

    public int maxLineLength() {
        return maxLineLength;
    }

    public List<Decision> decide(Group group, DegradationMode mode) {
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(mode, "mode");
        return switch (mode) {
            case PER_MEMBER -> decidePerMember(group);
            case WHOLE_GROUP -> decideWholeGroup(group);
            case NONE -> decideIndividually(group);
        };
    }

    static int alignmentColumn(List<Candidate> members) {
        int column = 0;
        for (Candidate member : members) {
            column = Math.max(column, member.anchor());
        }
        return column;
    }

    private List<Decision> decidePerMember(Group group) {
        List<Candidate> fitting = new ArrayList<>();
        for (Candidate member : group.members()) {
            if (member.fits(maxLineLength)) {
                fitting.add(member);
            }
        }
        int column = alignmentColumn(fitting);
        boolean alignAll = fitting.size() > 1;
        for (Candidate member : fitting) {
            if (!member.alreadySingleLine() && !member.fitsPadded(column, maxLineLength)) {
                alignAll = false;
                break;
            }
        }
        if (fitting.size() > 1 && !alignAll) {
            LOGGER.debug("Group at line {} exceeds {} columns when aligned to {}; rewriting unaligned",
                    group.first().firstLine(), maxLineLength, column);
        }

        List<Decision> decisions = new ArrayList<>(group.size());
        for (Candidate member : group.members()) {
            if (!fitting.contains(member) || member.alreadySingleLine()) {
                decisions.add(Decision.unchanged(member));
            } else if (alignAll) {
                decisions.add(Decision.aligned(member, column));
            } else {
                decisions.add(Decision.singleLine(member));
            }
        }
        return decisions;
    }

    private List<Decision> decideWholeGroup(Group group) {
        List<Decision> decisions = new ArrayList<>(group.size());
        int column = alignmentColumn(group.members());
        boolean fits = group.size() > 1;
        for (Candidate member : group.members()) {
            if (!member.fitsPadded(column, maxLineLength)) {
                fits = false;
                break;
            }
        }
        if (!fits) {
            if (group.size() > 1) {
                LOGGER.debug("Abandoning alignment of {} lines starting at line {}: column {} overflows {}",
                        group.size(), group.first().firstLine(), column, maxLineLength);
            }
            for (Candidate member : group.members()) {
                decisions.add(Decision.unchanged(member));
            }
            return decisions;
        }
        for (Candidate member : group.members()) {
            decisions.add(member.anchor() < column ? Decision.aligned(member, column) : Decision.unchanged(member));
        }
        return decisions;
    }

    private List<Decision> decideIndividually(Group group) {
        List<Decision> decisions = new ArrayList<>(group.size());
        for (Candidate member : group.members()) {
            if (member.alreadySingleLine() || !member.fits(maxLineLength)) {
                decisions.add(Decision.unchanged(member));
            } else {
                decisions.add(Decision.singleLine(member));
            }
        }
        return decisions;
    }
}
