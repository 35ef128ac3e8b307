package ai.tabulator.config;

import ai.tabulator.policy.PolicyKind;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable engine settings, validated up front so no pass ever runs with nonsensical geometry.
 */
public record EngineConfig(
        int maxLineLength,
        Set<PolicyKind> enabledPolicies,
        int maxPasses,
        LogFormat logFormat
) {

    public static final int DEFAULT_MAX_LINE_LENGTH = 120;
    public static final int DEFAULT_MAX_PASSES = 10;

    public EngineConfig {
        if (maxLineLength <= 0) {
            throw new IllegalArgumentException("maxLineLength must be greater than zero, got " + maxLineLength);
        }
        if (maxPasses <= 0) {
            throw new IllegalArgumentException("maxPasses must be greater than zero, got " + maxPasses);
        }
        Objects.requireNonNull(enabledPolicies, "enabledPolicies");
        enabledPolicies = enabledPolicies.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(enabledPolicies));
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
    }

    public static EngineConfig defaults() {
        return new EngineConfig(DEFAULT_MAX_LINE_LENGTH, EnumSet.allOf(PolicyKind.class), DEFAULT_MAX_PASSES, LogFormat.TEXT);
    }

    public EngineConfig withMaxLineLength(int value) {
        return new EngineConfig(value, enabledPolicies, maxPasses, logFormat);
    }

    public EngineConfig withEnabledPolicies(Set<PolicyKind> value) {
        return new EngineConfig(maxLineLength, value, maxPasses, logFormat);
    }

    public boolean isEnabled(PolicyKind kind) {
        return enabledPolicies.contains(kind);
    }
}
