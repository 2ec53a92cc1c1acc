package ai.trilingual.translator.translate;

import ai.trilingual.translator.language.Language;
import ai.trilingual.translator.language.LanguageTexts;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Turns one edited passage into translations for the two other languages.
 *
 * <p>Each unit is first sent as a single combined request for both targets. When that call fails or its response
 * does not yield two usable lines, the unit is retried as two per-language requests that run concurrently on a
 * task group of its own, so one passage's slow fallback never queues behind another's. Failures stay local to the
 * unit and language they hit: a single failed language carries {@link #ERROR_MARKER}, a unit where every call failed
 * keeps its source text. {@link #translate(String, Language)} never throws for remote failures.
 */
public class TranslationOrchestrator implements AutoCloseable {

    public static final String ERROR_MARKER = "[Translation error]";
    public static final int DEFAULT_FALLBACK_WORKERS = 2;
    public static final Duration DEFAULT_FALLBACK_TIMEOUT = Duration.ofSeconds(30);

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationOrchestrator.class);

    private final Translator translator;
    private final Segmenter segmenter;
    private final int fallbackWorkers;
    private final Duration fallbackTimeout;
    private final ThreadFactory threadFactory = new FallbackThreadFactory();
    private final Set<ExecutorService> activeGroups = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;
    private final CombinedResponseParser parser = new CombinedResponseParser();

    public TranslationOrchestrator(Translator translator) {
        this(translator, new Segmenter(), DEFAULT_FALLBACK_WORKERS, DEFAULT_FALLBACK_TIMEOUT);
    }

    /**
     * @param fallbackWorkers threads of each per-unit fallback group; every fallback gets its own group
     */
    public TranslationOrchestrator(Translator translator, Segmenter segmenter, int fallbackWorkers, Duration fallbackTimeout) {
        this.translator = Objects.requireNonNull(translator, "translator");
        this.segmenter = Objects.requireNonNull(segmenter, "segmenter");
        this.fallbackWorkers = requirePositive(fallbackWorkers);
        this.fallbackTimeout = Objects.requireNonNull(fallbackTimeout, "fallbackTimeout");
        if (fallbackTimeout.isNegative() || fallbackTimeout.isZero()) {
            throw new IllegalArgumentException("fallbackTimeout must be positive");
        }
    }

    public TranslationResult translate(String text, Language source) {
        Objects.requireNonNull(source, "source");
        if (closed) {
            throw new IllegalStateException("TranslationOrchestrator is closed");
        }
        String passage = text == null ? "" : text;
        List<TranslationUnit> units = segmenter.segment(passage);
        if (units.isEmpty()) {
            return TranslationResult.empty(source, passage);
        }

        long started = System.nanoTime();
        List<Language> targets = Language.targetsFor(source);
        LOGGER.info("Translating {} characters from {} into {} as {} units", passage.length(), source, targets, units.size());

        List<UnitTranslation> translatedUnits = new ArrayList<>(units.size());
        for (TranslationUnit unit : units) {
            translatedUnits.add(translateUnit(unit, source, targets));
        }

        LanguageTexts texts = LanguageTexts.empty().with(source, passage);
        Set<Language> degraded = EnumSet.noneOf(Language.class);
        for (Language target : targets) {
            List<String> pieces = new ArrayList<>(translatedUnits.size());
            for (UnitTranslation translatedUnit : translatedUnits) {
                pieces.add(translatedUnit.texts().get(target));
                if (translatedUnit.failedLanguages().contains(target)) {
                    degraded.add(target);
                }
            }
            texts = texts.with(target, segmenter.join(units, pieces, passage));
        }

        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        if (degraded.isEmpty()) {
            LOGGER.info("Translation from {} completed in {} ms", source, elapsedMillis);
        } else {
            LOGGER.warn("Translation from {} completed in {} ms with degraded output for {}", source, elapsedMillis, degraded);
        }
        return new TranslationResult(source, texts, degraded, translatedUnits);
    }

    private UnitTranslation translateUnit(TranslationUnit unit, Language source, List<Language> targets) {
        RemoteOutcome combined = call(new TranslationRequest(source, targets, unit.text()));
        if (combined.isSuccess()) {
            List<String> lines = parser.parseCombined(combined.lines());
            if (lines.size() >= 2) {
                LanguageTexts texts = LanguageTexts.empty()
                        .with(source, unit.text())
                        .with(targets.get(0), lines.get(0))
                        .with(targets.get(1), lines.get(1));
                return new UnitTranslation(unit, texts, UnitStatus.COMBINED, Set.of());
            }
            LOGGER.warn("Combined response for unit {} had {} usable lines; falling back to per-language calls",
                    unit.index(), lines.size());
        } else {
            LOGGER.warn("Combined call for unit {} failed ({}); falling back to per-language calls",
                    unit.index(), combined.failure());
        }
        return translateWithFallback(unit, source, targets);
    }

    private UnitTranslation translateWithFallback(TranslationUnit unit, Language source, List<Language> targets) {
        long started = System.nanoTime();
        LanguageTexts texts = LanguageTexts.empty().with(source, unit.text());
        Set<Language> failed = EnumSet.noneOf(Language.class);
        ExecutorService group = Executors.newFixedThreadPool(Math.min(fallbackWorkers, targets.size()), threadFactory);
        activeGroups.add(group);
        try {
            Map<String, String> mdc = MDC.getCopyOfContextMap();
            List<Future<RemoteOutcome>> futures = new ArrayList<>(targets.size());
            for (Language target : targets) {
                futures.add(submitSingle(group, mdc, source, target, unit.text()));
            }

            long deadline = System.nanoTime() + fallbackTimeout.toNanos();
            for (int i = 0; i < targets.size(); i++) {
                Language target = targets.get(i);
                RemoteOutcome outcome = await(futures.get(i), deadline);
                if (outcome.isSuccess()) {
                    texts = texts.with(target, outcome.lines().get(0));
                } else {
                    LOGGER.error("Failed to translate unit {} to {}: {}", unit.index(), target, outcome.failure());
                    failed.add(target);
                }
            }
        } finally {
            activeGroups.remove(group);
            group.shutdownNow();
        }

        UnitStatus status;
        if (failed.isEmpty()) {
            status = UnitStatus.FALLBACK;
        } else if (failed.size() == targets.size()) {
            status = UnitStatus.FAILED;
            for (Language target : targets) {
                texts = texts.with(target, unit.text());
            }
        } else {
            status = UnitStatus.PARTIAL;
            for (Language target : failed) {
                texts = texts.with(target, ERROR_MARKER);
            }
        }
        LOGGER.info("Fallback for unit {} finished as {} in {} ms", unit.index(), status,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        return new UnitTranslation(unit, texts, status, failed);
    }

    private Future<RemoteOutcome> submitSingle(ExecutorService group, Map<String, String> mdc,
                                               Language source, Language target, String text) {
        try {
            return group.submit(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    return callSingle(TranslationRequest.single(source, target, text));
                } finally {
                    MDC.clear();
                }
            });
        } catch (RejectedExecutionException ex) {
            LOGGER.error("Fallback executor rejected translation to {}", target, ex);
            return CompletableFuture.completedFuture(RemoteOutcome.failure("fallback executor unavailable"));
        }
    }

    // Only the value returned here is merged; a cancelled call's late result is dropped with its future.
    private RemoteOutcome await(Future<RemoteOutcome> future, long deadlineNanos) {
        long remaining = deadlineNanos - System.nanoTime();
        try {
            return future.get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            return RemoteOutcome.failure("timed out after " + fallbackTimeout.toMillis() + " ms");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            return RemoteOutcome.failure(cause.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return RemoteOutcome.failure("interrupted");
        }
    }

    private RemoteOutcome callSingle(TranslationRequest request) {
        RemoteOutcome outcome = call(request);
        if (!outcome.isSuccess()) {
            return outcome;
        }
        String translated = parser.parseSingle(outcome.lines());
        if (translated.isEmpty()) {
            return RemoteOutcome.failure("Empty response");
        }
        return RemoteOutcome.success(List.of(translated));
    }

    private RemoteOutcome call(TranslationRequest request) {
        try {
            List<String> lines = translator.translate(request);
            if (lines == null || lines.stream().allMatch(line -> line == null || line.isBlank())) {
                return RemoteOutcome.failure("Empty response");
            }
            return RemoteOutcome.success(lines);
        } catch (RuntimeException ex) {
            LOGGER.debug("Remote translation {} -> {} failed", request.source(), request.targets(), ex);
            return RemoteOutcome.failure(ex.getMessage());
        }
    }

    /**
     * Rejects further passages and cancels fallback calls still in flight.
     */
    @Override
    public void close() {
        closed = true;
        for (ExecutorService group : activeGroups) {
            group.shutdownNow();
        }
    }

    private static int requirePositive(int fallbackWorkers) {
        if (fallbackWorkers < 1) {
            throw new IllegalArgumentException("fallbackWorkers must be at least 1");
        }
        return fallbackWorkers;
    }

    private static final class FallbackThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "translation-fallback-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
