package ai.tabulator.engine;

import ai.tabulator.tree.SyntaxTree;

/**
 * Host-supplied parser used to re-read the rewritten text between passes.
 */
@FunctionalInterface
public interface SourceParser {

    SyntaxTree parse(String source);
}
