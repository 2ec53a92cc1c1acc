package ai.trilingual.translator.config;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Holds runtime settings for the translation model provider.
 */
public record TranslatorConfig(LlmProvider provider, String modelName, Optional<String> baseUrl, Duration timeout) {

    public TranslatorConfig {
        provider = Objects.requireNonNull(provider, "provider");
        modelName = requireNonBlank(modelName, "modelName");
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
        timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
