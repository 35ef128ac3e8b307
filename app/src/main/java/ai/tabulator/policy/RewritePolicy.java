package ai.tabulator.policy;

import ai.tabulator.extract.Candidate;
import ai.tabulator.geometry.Decision;
import ai.tabulator.tree.SyntaxTree;
import java.util.List;

/**
 * One rewrite rule plugged into the shared extract, group, decide and edit pipeline.
 */
public interface RewritePolicy {

    PolicyKind kind();

    /**
     * Scans the tree and returns every node this policy looks at, eligible or not, ordered by position.
     */
    List<Candidate> extract(SyntaxTree tree);

    /** Human-readable description of the rewrite a decision performs. */
    String message(Decision decision);
}
