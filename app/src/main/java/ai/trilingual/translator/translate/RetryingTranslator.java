package ai.trilingual.translator.translate;

import dev.langchain4j.exception.RateLimitException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorates a {@link Translator} with exponential backoff for rate-limited calls. Other failures are rethrown
 * immediately so the orchestrator can move on to its fallback path.
 */
public class RetryingTranslator implements Translator {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetryingTranslator.class);
    private static final Pattern RETRY_DELAY_PATTERN = Pattern.compile("(?:retry in |retryDelay\"?:\\s*\")([0-9]+(?:\\.[0-9]+)?)s", Pattern.CASE_INSENSITIVE);

    private final Translator delegate;
    private final RetryPolicy policy;

    public RetryingTranslator(Translator delegate, RetryPolicy policy) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    @Override
    public List<String> translate(TranslationRequest request) {
        TranslationException lastFailure = null;
        for (int attempt = 0; attempt < policy.maxAttempts(); attempt++) {
            try {
                return delegate.translate(request);
            } catch (TranslationException ex) {
                lastFailure = ex;
                Optional<Duration> maybeDelay = calculateRetryDelay(ex, attempt);
                if (maybeDelay.isEmpty() || attempt == policy.maxAttempts() - 1) {
                    if (isRateLimitError(ex)) {
                        LOGGER.error("Translation {} -> {} rate limited; max retries ({}) exceeded",
                                request.source(), request.targets(), policy.maxAttempts());
                    }
                    throw ex;
                }
                Duration delay = maybeDelay.get();
                LOGGER.warn("Translation rate limited (429/RESOURCE_EXHAUSTED); retrying in {} ms (attempt {}/{})",
                        delay.toMillis(), attempt + 1, policy.maxAttempts());
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException interruptedException) {
                    Thread.currentThread().interrupt();
                    LOGGER.warn("Translation retry interrupted");
                    throw ex;
                }
            }
        }
        throw lastFailure == null ? new TranslationException("Unknown translation failure") : lastFailure;
    }

    Optional<Duration> calculateRetryDelay(Throwable throwable, int attemptNumber) {
        if (!isRateLimitError(throwable)) {
            return Optional.empty();
        }

        Optional<Duration> providerDelay = extractProviderRetryAfter(throwable);
        if (providerDelay.isPresent()) {
            return providerDelay;
        }

        // initialBackoff * 2^attempt, capped, then jittered by +/- jitterFactor
        long baseDelayMillis = policy.initialBackoff().toMillis() * (1L << Math.min(attemptNumber, 30));
        long cappedDelayMillis = Math.min(baseDelayMillis, policy.maxBackoff().toMillis());
        double jitterMultiplier = 1.0 + (Math.random() * 2.0 - 1.0) * policy.jitterFactor();
        long finalDelayMillis = Math.max(1, (long) (cappedDelayMillis * jitterMultiplier));

        return Optional.of(Duration.ofMillis(finalDelayMillis));
    }

    static boolean isRateLimitError(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof RateLimitException) {
                return true;
            }
            String message = cause.getMessage();
            if (message != null && (message.contains("RESOURCE_EXHAUSTED") || message.contains("429"))) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private Optional<Duration> extractProviderRetryAfter(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            String message = cause.getMessage();
            if (message != null) {
                Matcher matcher = RETRY_DELAY_PATTERN.matcher(message);
                if (matcher.find()) {
                    double seconds = Double.parseDouble(matcher.group(1));
                    long millis = Math.max(0, (long) (seconds * 1000));
                    return Optional.of(Duration.ofMillis(millis));
                }
            }
            cause = cause.getCause();
        }
        return Optional.empty();
    }
}
