package ai.tabulator.config;

import java.util.Optional;

/**
 * Reads environment variables, falling back to a JVM system property of the same name for hosts
 * that embed the engine and cannot change the process environment.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return Optional.ofNullable(value);
    }
}
