package ai.tabulator.config;

import java.util.Optional;

/**
 * Source of raw configuration values keyed by environment variable name.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /** The value with surrounding whitespace removed; blank values count as absent. */
    default Optional<String> value(String key) {
        return get(key).map(String::trim).filter(trimmed -> !trimmed.isEmpty());
    }
}
