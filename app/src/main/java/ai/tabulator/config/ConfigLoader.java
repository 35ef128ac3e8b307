package ai.tabulator.config;

import ai.tabulator.policy.PolicyKind;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds an {@link EngineConfig} from environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_MAX_LINE_LENGTH = "TABULATOR_MAX_LINE_LENGTH";
    static final String ENV_ENABLED_POLICIES = "TABULATOR_ENABLED_POLICIES";
    static final String ENV_DISABLED_POLICIES = "TABULATOR_DISABLED_POLICIES";
    static final String ENV_MAX_PASSES = "TABULATOR_MAX_PASSES";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public EngineConfig load() {
        int maxLineLength = environmentReader.value(ENV_MAX_LINE_LENGTH)
                .map(value -> parsePositiveInteger(value, ENV_MAX_LINE_LENGTH))
                .orElse(EngineConfig.DEFAULT_MAX_LINE_LENGTH);

        int maxPasses = environmentReader.value(ENV_MAX_PASSES)
                .map(value -> parsePositiveInteger(value, ENV_MAX_PASSES))
                .orElse(EngineConfig.DEFAULT_MAX_PASSES);

        Set<PolicyKind> enabled = environmentReader.value(ENV_ENABLED_POLICIES)
                .map(ConfigLoader::parsePolicies)
                .orElse(EnumSet.allOf(PolicyKind.class));
        environmentReader.value(ENV_DISABLED_POLICIES)
                .map(ConfigLoader::parsePolicies)
                .ifPresent(enabled::removeAll);

        LogFormat logFormat = environmentReader.value(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);

        return new EngineConfig(maxLineLength, enabled, maxPasses, logFormat);
    }

    private static int parsePositiveInteger(String raw, String key) {
        try {
            int value = Integer.parseInt(raw);
            if (value <= 0) {
                throw new IllegalArgumentException(key + " must be greater than zero");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static Set<PolicyKind> parsePolicies(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(PolicyKind::from)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(PolicyKind.class)));
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
