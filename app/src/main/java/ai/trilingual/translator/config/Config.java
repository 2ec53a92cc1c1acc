package ai.trilingual.translator.config;

import ai.trilingual.translator.language.Language;
import ai.trilingual.translator.translate.RetryPolicy;
import ai.trilingual.translator.translate.TranslationMode;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        String sessionId,
        Language language,
        TranslationMode translationMode,
        LogFormat logFormat,
        TranslatorConfig translatorConfig,
        Secrets secrets,
        RetryPolicy retryPolicy,
        int fallbackWorkers,
        Duration fallbackTimeout,
        int maxLineLength
) {

    public Config {
        sessionId = requireNonBlank(sessionId, "sessionId");
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(translationMode, "translationMode");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        Objects.requireNonNull(translatorConfig, "translatorConfig");
        secrets = secrets == null ? Secrets.none() : secrets;
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        if (fallbackWorkers < 1) {
            throw new IllegalArgumentException("fallbackWorkers must be at least 1");
        }
        Objects.requireNonNull(fallbackTimeout, "fallbackTimeout");
        if (fallbackTimeout.isNegative() || fallbackTimeout.isZero()) {
            throw new IllegalArgumentException("fallbackTimeout must be positive");
        }
        if (maxLineLength < 1) {
            throw new IllegalArgumentException("maxLineLength must be at least 1");
        }
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value.trim();
    }
}
