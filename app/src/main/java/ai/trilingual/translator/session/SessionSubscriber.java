package ai.trilingual.translator.session;

/**
 * Receives full session snapshots pushed by the {@link SessionSynchronizer}.
 *
 * <p>Callbacks run on the editing thread while the subscription's delivery lock is held, so
 * {@link SessionSynchronizer#applyEdit} returns only after every subscriber has handled the snapshot.
 * Implementations must not block; hand slow work such as network writes to a queue of their own.
 */
@FunctionalInterface
public interface SessionSubscriber {

    void onSessionUpdate(SessionState state);
}
