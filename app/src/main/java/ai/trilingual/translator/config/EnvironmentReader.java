package ai.trilingual.translator.config;

import java.util.Optional;

/**
 * Source of environment values; tests substitute a map-backed reader.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }
}
