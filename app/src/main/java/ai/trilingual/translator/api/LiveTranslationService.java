package ai.trilingual.translator.api;

import ai.trilingual.translator.language.Language;
import ai.trilingual.translator.session.SessionSubscriber;
import ai.trilingual.translator.session.SessionSynchronizer;
import ai.trilingual.translator.session.Subscription;
import ai.trilingual.translator.translate.TranslationOrchestrator;
import ai.trilingual.translator.translate.TranslationResult;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Request-level entry point used by the boundary layer: validates requests, translates passages and routes edits
 * through the {@link SessionSynchronizer}.
 */
public class LiveTranslationService {

    public static final String GENERIC_FAILURE_MESSAGE = "Translation failed. Please try again.";
    public static final String MDC_SESSION_ID = "sessionId";

    private static final Logger LOGGER = LoggerFactory.getLogger(LiveTranslationService.class);

    private final TranslationOrchestrator orchestrator;
    private final SessionSynchronizer synchronizer;

    public LiveTranslationService(TranslationOrchestrator orchestrator, SessionSynchronizer synchronizer) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.synchronizer = Objects.requireNonNull(synchronizer, "synchronizer");
    }

    public PassageResponse translate(PassageRequest request) {
        Objects.requireNonNull(request, "request");
        Language source = parseLanguage(request.sourceLanguage(), "sourceLanguage");
        String text = normalizeText(request.text());
        try {
            TranslationResult result = orchestrator.translate(text, source);
            return PassageResponse.success(result.texts(), result.degradedLanguages());
        } catch (RuntimeException ex) {
            LOGGER.error("Translation error: {}", ex.getMessage(), ex);
            return PassageResponse.failure(GENERIC_FAILURE_MESSAGE);
        }
    }

    /**
     * Translates the edited text, applies it to the session and broadcasts the new state.
     *
     * @throws InvalidRequestException when the session id or language is missing or unknown
     */
    public EditAcknowledgement submitEdit(EditRequest request) {
        Objects.requireNonNull(request, "request");
        String sessionId = requireSessionId(request.sessionId());
        Language language = parseLanguage(request.language(), "language");
        String text = normalizeText(request.text());
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_SESSION_ID, sessionId)) {
            TranslationResult result = orchestrator.translate(text, language);
            long revision = synchronizer.applyEdit(sessionId, language, text, result);
            return new EditAcknowledgement(sessionId, revision, result.degradedLanguages());
        }
    }

    public PollResponse poll(PollRequest request) {
        Objects.requireNonNull(request, "request");
        String sessionId = requireSessionId(request.sessionId());
        if (request.sinceRevision() < 0) {
            throw new InvalidRequestException("sinceRevision must not be negative");
        }
        return PollResponse.from(synchronizer.poll(sessionId, request.sinceRevision()));
    }

    /**
     * Subscribes a device to a session; the current state is pushed before this method returns.
     */
    public Subscription connect(String sessionId, SessionSubscriber subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        return synchronizer.subscribe(requireSessionId(sessionId), subscriber);
    }

    private static String requireSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new InvalidRequestException("sessionId must be provided");
        }
        return sessionId.trim();
    }

    private static Language parseLanguage(String raw, String fieldName) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidRequestException(fieldName + " must be provided");
        }
        try {
            return Language.from(raw);
        } catch (IllegalArgumentException ex) {
            throw new InvalidRequestException(ex.getMessage(), ex);
        }
    }

    private static String normalizeText(String text) {
        return text == null ? "" : text.strip();
    }
}
