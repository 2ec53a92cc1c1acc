package ai.trilingual.translator.config;

import ai.trilingual.translator.cli.CliArguments;
import ai.trilingual.translator.language.Language;
import ai.trilingual.translator.translate.RetryPolicy;
import ai.trilingual.translator.translate.Segmenter;
import ai.trilingual.translator.translate.TranslationMode;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_SESSION_ID = "SESSION_ID";
    static final String ENV_TRANSLATION_MODE = "TRANSLATION_MODE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_LLM_TIMEOUT_SECONDS = "LLM_TIMEOUT_SECONDS";
    static final String ENV_LLM_MAX_RETRY_ATTEMPTS = "LLM_MAX_RETRY_ATTEMPTS";
    static final String ENV_LLM_INITIAL_BACKOFF_MILLIS = "LLM_INITIAL_BACKOFF_MILLIS";
    static final String ENV_LLM_MAX_BACKOFF_MILLIS = "LLM_MAX_BACKOFF_MILLIS";
    static final String ENV_LLM_RETRY_JITTER_FACTOR = "LLM_RETRY_JITTER_FACTOR";
    static final String ENV_FALLBACK_WORKERS = "FALLBACK_WORKERS";
    static final String ENV_FALLBACK_TIMEOUT_SECONDS = "FALLBACK_TIMEOUT_SECONDS";
    static final String ENV_SEGMENT_MAX_LINE_LENGTH = "SEGMENT_MAX_LINE_LENGTH";

    static final String DEFAULT_SESSION_ID = "shared_translation_session";
    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final int DEFAULT_LLM_TIMEOUT_SECONDS = 30;
    private static final int DEFAULT_LLM_MAX_RETRY_ATTEMPTS = 3;
    private static final int DEFAULT_LLM_INITIAL_BACKOFF_MILLIS = 500;
    private static final int DEFAULT_LLM_MAX_BACKOFF_MILLIS = 8000;
    private static final double DEFAULT_LLM_RETRY_JITTER_FACTOR = 0.3;
    private static final int DEFAULT_FALLBACK_WORKERS = 2;
    private static final int DEFAULT_FALLBACK_TIMEOUT_SECONDS = 30;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        String sessionId = firstNonBlank(arguments.sessionId(), ENV_SESSION_ID, DEFAULT_SESSION_ID);
        Language language = arguments.language() != null ? arguments.language() : Language.ENGLISH;
        TranslationMode translationMode = resolveTranslationMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        LlmProvider provider = env(ENV_LLM_PROVIDER)
                .map(LlmProvider::from)
                .orElse(LlmProvider.GEMINI);
        String modelName = env(ENV_LLM_MODEL).orElse(defaultModelFor(provider));
        Optional<String> baseUrl = Optional.empty();
        if (provider == LlmProvider.OLLAMA) {
            baseUrl = Optional.of(env(ENV_OLLAMA_BASE_URL).orElse(DEFAULT_OLLAMA_BASE_URL));
        }
        Duration timeout = Duration.ofSeconds(intValue(ENV_LLM_TIMEOUT_SECONDS, DEFAULT_LLM_TIMEOUT_SECONDS));

        Optional<String> geminiApiKey = env(ENV_GEMINI_API_KEY);
        if (translationMode.isRemote() && provider == LlmProvider.GEMINI && geminiApiKey.isEmpty()) {
            throw new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini unless running in mock or dry-run mode");
        }

        RetryPolicy retryPolicy = new RetryPolicy(
                intValue(ENV_LLM_MAX_RETRY_ATTEMPTS, DEFAULT_LLM_MAX_RETRY_ATTEMPTS),
                Duration.ofMillis(intValue(ENV_LLM_INITIAL_BACKOFF_MILLIS, DEFAULT_LLM_INITIAL_BACKOFF_MILLIS)),
                Duration.ofMillis(intValue(ENV_LLM_MAX_BACKOFF_MILLIS, DEFAULT_LLM_MAX_BACKOFF_MILLIS)),
                env(ENV_LLM_RETRY_JITTER_FACTOR).map(raw -> parseDouble(ENV_LLM_RETRY_JITTER_FACTOR, raw))
                        .orElse(DEFAULT_LLM_RETRY_JITTER_FACTOR));

        int fallbackWorkers = intValue(ENV_FALLBACK_WORKERS, DEFAULT_FALLBACK_WORKERS);
        Duration fallbackTimeout = Duration.ofSeconds(intValue(ENV_FALLBACK_TIMEOUT_SECONDS, DEFAULT_FALLBACK_TIMEOUT_SECONDS));
        int maxLineLength = intValue(ENV_SEGMENT_MAX_LINE_LENGTH, Segmenter.DEFAULT_MAX_LINE_LENGTH);

        TranslatorConfig translatorConfig = new TranslatorConfig(provider, modelName, baseUrl, timeout);
        return new Config(sessionId, language, translationMode, logFormat, translatorConfig, new Secrets(geminiApiKey),
                retryPolicy, fallbackWorkers, fallbackTimeout, maxLineLength);
    }

    private String defaultModelFor(LlmProvider provider) {
        return switch (provider) {
            case GEMINI -> "gemini-2.5-flash";
            case OLLAMA -> "llama3.1";
        };
    }

    private TranslationMode resolveTranslationMode(CliArguments arguments) {
        TranslationMode cliMode = arguments.translationMode();
        if (cliMode != null) {
            return cliMode;
        }
        return env(ENV_TRANSLATION_MODE)
                .map(TranslationMode::from)
                .orElse(TranslationMode.PRODUCTION);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return env(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private Optional<String> env(String key) {
        return environmentReader.get(key)
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank);
    }

    private int intValue(String key, int defaultValue) {
        return env(key)
                .map(raw -> parsePositiveInteger(key, raw))
                .orElse(defaultValue);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return env(envKey).orElse(defaultValue);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static int parsePositiveInteger(String key, String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(key + " must be greater than zero");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static double parseDouble(String key, String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid double value for " + key + ": " + raw, ex);
        }
    }
}
