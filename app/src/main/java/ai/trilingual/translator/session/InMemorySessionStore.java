package ai.trilingual.translator.session;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * {@link SessionStore} kept in memory with one lock per session id.
 */
public class InMemorySessionStore implements SessionStore {

    private final ConcurrentMap<String, Slot> slots = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySessionStore() {
        this(Clock.systemUTC());
    }

    public InMemorySessionStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<SessionState> get(String sessionId) {
        Slot slot = slots.get(requireSessionId(sessionId));
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.state);
    }

    @Override
    public SessionState upsert(String sessionId, UnaryOperator<SessionState> mutator) {
        Objects.requireNonNull(mutator, "mutator");
        Slot slot = slots.computeIfAbsent(requireSessionId(sessionId), key -> new Slot());
        slot.lock.lock();
        try {
            SessionState current = slot.state != null ? slot.state : SessionState.initial(sessionId, clock.instant());
            SessionState next = mutator.apply(current);
            if (next == null) {
                throw new IllegalStateException("Session mutator returned null for " + sessionId);
            }
            if (!next.sessionId().equals(sessionId)) {
                throw new IllegalStateException("Session mutator changed the id of " + sessionId);
            }
            if (next.revision() < current.revision()) {
                throw new IllegalStateException("Session revision of %s would go back from %d to %d"
                        .formatted(sessionId, current.revision(), next.revision()));
            }
            slot.state = next;
            return next;
        } finally {
            slot.lock.unlock();
        }
    }

    public int size() {
        return slots.size();
    }

    private static String requireSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        return sessionId;
    }

    private static final class Slot {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile SessionState state;
    }
}
