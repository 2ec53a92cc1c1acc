package ai.trilingual.translator.session;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Keyed table of {@link SessionState}s.
 *
 * <p>{@link #upsert(String, UnaryOperator)} is atomic per session id: mutators for the same id run one at a time,
 * mutators for different ids never wait on each other. Implementations signal an unavailable backing store with
 * {@link SessionStoreException}.
 */
public interface SessionStore {

    Optional<SessionState> get(String sessionId);

    /**
     * Applies {@code mutator} to the current state, or to a fresh initial state when the id is unseen, and stores
     * the result. A mutator that throws leaves the stored state untouched.
     */
    SessionState upsert(String sessionId, UnaryOperator<SessionState> mutator);

    default SessionState getOrCreate(String sessionId) {
        return get(sessionId).orElseGet(() -> upsert(sessionId, UnaryOperator.identity()));
    }
}
