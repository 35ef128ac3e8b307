package ai.tabulator.engine;

import ai.tabulator.logging.SimpleJsonLayout;
import ai.tabulator.tree.SyntaxTree;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Repeats engine passes, re-parsing in between, until the text stops changing or the pass cap is hit.
 */
public class ConvergenceRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConvergenceRunner.class);
    static final String MDC_PASS = SimpleJsonLayout.PASS_KEY;

    private final TabulationEngine engine;
    private final SourceParser parser;
    private final int maxPasses;

    public ConvergenceRunner(TabulationEngine engine, SourceParser parser, int maxPasses) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.parser = Objects.requireNonNull(parser, "parser");
        if (maxPasses <= 0) {
            throw new IllegalArgumentException("maxPasses must be greater than zero");
        }
        this.maxPasses = maxPasses;
    }

    public ConvergenceResult run(String source) {
        Objects.requireNonNull(source, "source");
        String current = source;
        int passes = 0;
        try {
            while (passes < maxPasses) {
                MDC.put(MDC_PASS, String.valueOf(passes + 1));
                SyntaxTree tree = parser.parse(current);
                PassResult result = engine.run(tree);
                if (result.isEmpty()) {
                    LOGGER.info("Converged after {} pass(es)", passes);
                    return new ConvergenceResult(current, passes, true);
                }
                String rewritten = result.rewrittenSource();
                passes++;
                if (rewritten.equals(current)) {
                    LOGGER.info("Converged after {} pass(es); last edits left the text unchanged", passes);
                    return new ConvergenceResult(current, passes, true);
                }
                LOGGER.debug("Pass {} applied {} edit(s), deferred {}", passes, result.edits().size(), result.deferred());
                current = rewritten;
            }
        } finally {
            MDC.remove(MDC_PASS);
        }
        LOGGER.warn("Stopped after {} passes without reaching a fixed point", maxPasses);
        return new ConvergenceResult(current, passes, false);
    }
}
