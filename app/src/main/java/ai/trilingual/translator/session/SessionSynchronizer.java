package ai.trilingual.translator.session;

import ai.trilingual.translator.language.Language;
import ai.trilingual.translator.language.LanguageTexts;
import ai.trilingual.translator.translate.TranslationResult;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies edits to the {@link SessionStore} and propagates the resulting state to every device of the session.
 *
 * <p>Edits to one session are last-writer-wins in order of arrival at the store; the per-session critical section
 * covers only the in-memory write. Subscribers are notified after the write, outside the store lock but on the
 * editing thread, so a slow subscriber delays the return of {@link #applyEdit}. Polling readers use
 * {@link #poll(String, long)} with the last revision they saw.
 */
public class SessionSynchronizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionSynchronizer.class);

    private final SessionStore store;
    private final Clock clock;
    private final ConcurrentMap<String, List<Subscription>> subscriptions = new ConcurrentHashMap<>();

    public SessionSynchronizer(SessionStore store) {
        this(store, Clock.systemUTC());
    }

    public SessionSynchronizer(SessionStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Writes the edited text and its translations as the new session state and notifies subscribers.
     *
     * @return the new revision
     * @throws SessionStoreException when the store cannot persist the edit; nothing is written or pushed then
     */
    public long applyEdit(String sessionId, Language language, String text, TranslationResult translations) {
        requireSessionId(sessionId);
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(translations, "translations");
        if (translations.source() != language) {
            throw new IllegalArgumentException("Translations were produced from %s but the edit is in %s"
                    .formatted(translations.source(), language));
        }
        String edited = text == null ? "" : text;
        LanguageTexts texts = LanguageTexts.empty();
        if (!edited.isEmpty()) {
            texts = texts.with(language, edited);
            for (Language target : translations.targets()) {
                texts = texts.with(target, translations.translation(target));
            }
        }
        LanguageTexts newTexts = texts;

        SessionState updated = store.upsert(sessionId, current -> current.withEdit(newTexts, language, clock.instant()));
        LOGGER.info("Session {} advanced to revision {} by an edit in {}", sessionId, updated.revision(), language);
        broadcast(updated);
        return updated.revision();
    }

    /**
     * Registers {@code subscriber} for pushes of {@code sessionId} and immediately sends it the current state.
     */
    public Subscription subscribe(String sessionId, SessionSubscriber subscriber) {
        requireSessionId(sessionId);
        Subscription subscription = new Subscription(sessionId, subscriber, this::unsubscribe);
        subscriptions.compute(sessionId, (key, existing) -> {
            List<Subscription> list = existing == null ? new CopyOnWriteArrayList<>() : existing;
            list.add(subscription);
            return list;
        });
        LOGGER.debug("Subscriber joined session {} ({} active)", sessionId, subscriberCount(sessionId));
        deliver(subscription, store.getOrCreate(sessionId));
        return subscription;
    }

    public PollResult poll(String sessionId, long sinceRevision) {
        SessionState state = snapshot(sessionId);
        return state.revision() > sinceRevision ? PollResult.changed(state) : PollResult.unchanged();
    }

    public SessionState snapshot(String sessionId) {
        return store.getOrCreate(requireSessionId(sessionId));
    }

    public int subscriberCount(String sessionId) {
        List<Subscription> list = subscriptions.get(sessionId);
        return list == null ? 0 : list.size();
    }

    private void unsubscribe(Subscription subscription) {
        subscriptions.computeIfPresent(subscription.sessionId(), (key, list) -> {
            list.remove(subscription);
            return list.isEmpty() ? null : list;
        });
        LOGGER.debug("Subscriber left session {}", subscription.sessionId());
    }

    private void broadcast(SessionState state) {
        List<Subscription> list = subscriptions.get(state.sessionId());
        if (list == null) {
            return;
        }
        for (Subscription subscription : list) {
            deliver(subscription, state);
        }
    }

    private void deliver(Subscription subscription, SessionState state) {
        try {
            subscription.deliver(state);
        } catch (RuntimeException ex) {
            LOGGER.warn("Subscriber of session {} failed to handle revision {}", state.sessionId(), state.revision(), ex);
        }
    }

    private static String requireSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        return sessionId;
    }
}
