package ai.tabulator.engine;

import ai.tabulator.edit.Edit;
import ai.tabulator.edit.EditBuilder;
import ai.tabulator.edit.EditSet;
import ai.tabulator.extract.Candidate;
import ai.tabulator.geometry.Decision;
import ai.tabulator.geometry.GeometryCalculator;
import ai.tabulator.group.ContiguityGrouper;
import ai.tabulator.group.Group;
import ai.tabulator.policy.PolicyKind;
import ai.tabulator.policy.PolicySet;
import ai.tabulator.policy.RewritePolicy;
import ai.tabulator.tree.SourceText;
import ai.tabulator.tree.SyntaxTree;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every enabled policy once over a tree and merges their edits into a single conflict-free set.
 * <p>
 * Each policy sizes its edits against the unmodified lines, so a line accepts at most one edit per pass.
 * A later edit on a line that is already being rewritten is deferred to the next pass.
 */
public class TabulationEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(TabulationEngine.class);

    private final PolicySet policies;
    private final ContiguityGrouper grouper;
    private final GeometryCalculator geometry;
    private final EditBuilder editBuilder;

    public TabulationEngine(PolicySet policies, int maxLineLength) {
        this(policies, new ContiguityGrouper(), new GeometryCalculator(maxLineLength), new EditBuilder());
    }

    TabulationEngine(PolicySet policies, ContiguityGrouper grouper, GeometryCalculator geometry, EditBuilder editBuilder) {
        this.policies = Objects.requireNonNull(policies, "policies");
        this.grouper = Objects.requireNonNull(grouper, "grouper");
        this.geometry = Objects.requireNonNull(geometry, "geometry");
        this.editBuilder = Objects.requireNonNull(editBuilder, "editBuilder");
    }

    public PassResult run(SyntaxTree tree) {
        Objects.requireNonNull(tree, "tree");
        SourceText source = tree.source();
        EditSet edits = EditSet.empty();
        BitSet touchedLines = new BitSet();
        List<Diagnostic> diagnostics = new ArrayList<>();
        int deferred = 0;
        for (RewritePolicy policy : policies.policies()) {
            PolicyKind kind = policy.kind();
            List<Candidate> candidates = policy.extract(tree);
            List<Group> groups = grouper.group(candidates, kind.grouping());
            int accepted = 0;
            for (Group group : groups) {
                for (Decision decision : geometry.decide(group, kind.degradation())) {
                    Optional<Edit> edit = editBuilder.build(decision, source);
                    if (edit.isEmpty()) {
                        continue;
                    }
                    int firstLine = source.lineOf(edit.get().start());
                    int lastLine = lastLineOf(edit.get(), source);
                    int taken = touchedLines.nextSetBit(firstLine);
                    boolean lineTaken = taken != -1 && taken <= lastLine;
                    if (!lineTaken && edits.add(edit.get())) {
                        touchedLines.set(firstLine, lastLine + 1);
                        diagnostics.add(new Diagnostic(kind, decision.candidate().node().span(),
                                policy.message(decision), edit.get()));
                        accepted++;
                    } else {
                        deferred++;
                        LOGGER.warn("Deferred {} edit at line {}: shares text or a line with an edit accepted earlier in this pass",
                                kind.id(), firstLine);
                    }
                }
            }
            LOGGER.debug("{}: {} candidates, {} groups, {} edits", kind.id(), candidates.size(), groups.size(), accepted);
        }
        return new PassResult(diagnostics, edits, deferred, source.text());
    }

    private static int lastLineOf(Edit edit, SourceText source) {
        return edit.end() > edit.start() ? source.lineOf(edit.end() - 1) : source.lineOf(edit.start());
    }
}
