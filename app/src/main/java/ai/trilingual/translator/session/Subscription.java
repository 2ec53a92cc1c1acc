package ai.trilingual.translator.session;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * A device's registration for pushes of one session. Snapshots reach the subscriber one at a time, in strictly
 * increasing revision order; an older or repeated revision is skipped.
 */
public final class Subscription implements AutoCloseable {

    private final String sessionId;
    private final SessionSubscriber subscriber;
    private final Consumer<Subscription> onClose;
    private long lastDeliveredRevision = -1L;
    private volatile boolean closed;

    Subscription(String sessionId, SessionSubscriber subscriber, Consumer<Subscription> onClose) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.subscriber = Objects.requireNonNull(subscriber, "subscriber");
        this.onClose = Objects.requireNonNull(onClose, "onClose");
    }

    public String sessionId() {
        return sessionId;
    }

    public boolean isClosed() {
        return closed;
    }

    // Runs the callback under this subscription's lock on the caller's thread; see SessionSubscriber.
    synchronized boolean deliver(SessionState state) {
        if (closed || state.revision() <= lastDeliveredRevision) {
            return false;
        }
        lastDeliveredRevision = state.revision();
        subscriber.onSessionUpdate(state);
        return true;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        onClose.accept(this);
    }
}
