package ai.tabulator.engine;

import ai.tabulator.config.ConfigLoader;
import ai.tabulator.config.EngineConfig;
import ai.tabulator.config.SystemEnvironmentReader;
import ai.tabulator.logging.LoggingConfigurator;
import ai.tabulator.policy.PolicySet;
import ai.tabulator.tree.SyntaxTree;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for hosts: report offenses, apply one pass, or iterate to a fixed point.
 */
public class Tabulator {

    private final EngineConfig config;
    private final TabulationEngine engine;

    public Tabulator(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.engine = new TabulationEngine(PolicySet.of(config.enabledPolicies(), config.maxLineLength()),
                config.maxLineLength());
    }

    public static Tabulator fromEnvironment() {
        return new Tabulator(new ConfigLoader(new SystemEnvironmentReader()).load());
    }

    public EngineConfig config() {
        return config;
    }

    /**
     * Switches the host's logback root appenders to the configured log format. Construction alone
     * never changes logging.
     *
     * @return the number of appenders that were reconfigured, zero when logback is not the backend
     */
    public int configureLogging() {
        return LoggingConfigurator.configure(config.logFormat());
    }

    /** Diagnostics for one pass without touching the source. */
    public List<Diagnostic> check(SyntaxTree tree) {
        return engine.run(tree).diagnostics();
    }

    /** Text after applying one pass of edits. */
    public String fix(SyntaxTree tree) {
        return engine.run(tree).rewrittenSource();
    }

    public ConvergenceResult converge(String source, SourceParser parser) {
        return new ConvergenceRunner(engine, parser, config.maxPasses()).run(source);
    }
}
