package ai.trilingual.translator.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.trilingual.translator.language.Language;
import ai.trilingual.translator.language.LanguageTexts;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class InMemorySessionStoreTest {

    @Test
    void unseenSessionIsCreatedEmptyAtRevisionZero() {
        InMemorySessionStore store = new InMemorySessionStore();

        assertThat(store.get("room")).isEmpty();
        SessionState created = store.getOrCreate("room");

        assertThat(created.revision()).isZero();
        assertThat(created.texts().isEmpty()).isTrue();
        assertThat(created.activeLanguage()).isEqualTo(Language.ENGLISH);
        assertThat(store.get("room")).contains(created);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void mutatorsForTheSameSessionNeverInterleave() throws Exception {
        InMemorySessionStore store = new InMemorySessionStore();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<SessionState>> futures = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                futures.add(executor.submit(() -> store.upsert("room", current -> {
                    maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                    Thread.yield();
                    inside.decrementAndGet();
                    return current.withEdit(LanguageTexts.empty(), Language.FRENCH, Instant.now());
                })));
            }
            for (Future<SessionState> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(store.get("room")).hasValueSatisfying(state -> assertThat(state.revision()).isEqualTo(50));
    }

    @Test
    void lockedSessionDoesNotBlockAnotherSession() throws Exception {
        InMemorySessionStore store = new InMemorySessionStore();
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<SessionState> blocked = executor.submit(() -> store.upsert("slow", current -> {
                holding.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
                return current;
            }));
            assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();

            SessionState other = store.upsert("fast",
                    current -> current.withEdit(LanguageTexts.empty().with(Language.POLISH, "Cześć"), Language.POLISH, Instant.now()));

            assertThat(other.revision()).isEqualTo(1);
            assertThat(blocked.isDone()).isFalse();
            release.countDown();
            blocked.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void failingMutatorLeavesStateUntouched() {
        InMemorySessionStore store = new InMemorySessionStore();
        SessionState first = store.upsert("room",
                current -> current.withEdit(LanguageTexts.empty().with(Language.ENGLISH, "Hi"), Language.ENGLISH, Instant.now()));

        assertThatThrownBy(() -> store.upsert("room", current -> {
            throw new SessionStoreException("disk full");
        })).isInstanceOf(SessionStoreException.class);

        assertThat(store.get("room")).contains(first);
    }

    @Test
    void rejectsMutatorsThatBreakSessionInvariants() {
        InMemorySessionStore store = new InMemorySessionStore();
        store.upsert("room", current -> current.withEdit(LanguageTexts.empty(), Language.ENGLISH, Instant.now()));

        assertThatThrownBy(() -> store.upsert("room", current -> null))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> store.upsert("room", current -> SessionState.initial("other", Instant.now())))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> store.upsert("room", current -> SessionState.initial("room", Instant.now())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("would go back");
        assertThatThrownBy(() -> store.get(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
