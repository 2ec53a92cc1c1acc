package ai.trilingual.translator.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.trilingual.translator.language.Language;
import ai.trilingual.translator.language.LanguageTexts;
import ai.trilingual.translator.translate.TranslationResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.junit.jupiter.api.Test;

class SessionSynchronizerTest {

    private static final String SESSION = "shared_translation_session";

    @Test
    void subscribePushesCurrentStateImmediately() {
        SessionSynchronizer synchronizer = new SessionSynchronizer(new InMemorySessionStore());
        List<SessionState> received = new CopyOnWriteArrayList<>();

        synchronizer.subscribe(SESSION, received::add);

        assertThat(received).hasSize(1);
        assertThat(received.get(0).revision()).isZero();
        assertThat(received.get(0).texts().isEmpty()).isTrue();
    }

    @Test
    void everySubscriberReceivesTheEditExactlyOnce() {
        SessionSynchronizer synchronizer = new SessionSynchronizer(new InMemorySessionStore());
        List<SessionState> phone = new CopyOnWriteArrayList<>();
        List<SessionState> laptop = new CopyOnWriteArrayList<>();
        synchronizer.subscribe(SESSION, phone::add);
        synchronizer.subscribe(SESSION, laptop::add);

        long revision = synchronizer.applyEdit(SESSION, Language.ENGLISH, "Hello.", hello());

        assertThat(revision).isEqualTo(1);
        for (List<SessionState> device : List.of(phone, laptop)) {
            assertThat(device).extracting(SessionState::revision).containsExactly(0L, 1L);
            SessionState latest = device.get(1);
            assertThat(latest.text(Language.ENGLISH)).isEqualTo("Hello.");
            assertThat(latest.text(Language.FRENCH)).isEqualTo("Bonjour.");
            assertThat(latest.text(Language.POLISH)).isEqualTo("Witaj.");
            assertThat(latest.activeLanguage()).isEqualTo(Language.ENGLISH);
        }
    }

    @Test
    void subscribersOfOtherSessionsAreNotNotified() {
        SessionSynchronizer synchronizer = new SessionSynchronizer(new InMemorySessionStore());
        List<SessionState> other = new CopyOnWriteArrayList<>();
        synchronizer.subscribe("other-room", other::add);

        synchronizer.applyEdit(SESSION, Language.ENGLISH, "Hello.", hello());

        assertThat(other).hasSize(1);
    }

    @Test
    void pollReturnsStateOnlyWhenNewer() {
        SessionSynchronizer synchronizer = new SessionSynchronizer(new InMemorySessionStore());
        synchronizer.applyEdit(SESSION, Language.ENGLISH, "Hello.", hello());

        PollResult stale = synchronizer.poll(SESSION, 0);
        PollResult current = synchronizer.poll(SESSION, 1);

        assertThat(stale.changed()).isTrue();
        assertThat(stale.state()).hasValueSatisfying(state -> assertThat(state.revision()).isEqualTo(1));
        assertThat(current.changed()).isFalse();
        assertThat(current.state()).isEmpty();
    }

    @Test
    void emptyEditClearsEveryLanguage() {
        SessionSynchronizer synchronizer = new SessionSynchronizer(new InMemorySessionStore());
        synchronizer.applyEdit(SESSION, Language.ENGLISH, "Hello.", hello());

        synchronizer.applyEdit(SESSION, Language.POLISH, "", TranslationResult.empty(Language.POLISH, ""));

        SessionState state = synchronizer.snapshot(SESSION);
        assertThat(state.texts()).isEqualTo(LanguageTexts.empty());
        assertThat(state.activeLanguage()).isEqualTo(Language.POLISH);
        assertThat(state.revision()).isEqualTo(2);
    }

    @Test
    void rejectsTranslationsFromAnotherSourceLanguage() {
        SessionSynchronizer synchronizer = new SessionSynchronizer(new InMemorySessionStore());

        assertThatThrownBy(() -> synchronizer.applyEdit(SESSION, Language.FRENCH, "Hello.", hello()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(synchronizer.snapshot(SESSION).revision()).isZero();
    }

    @Test
    void concurrentEditsAdvanceTheRevisionOncePerEdit() throws Exception {
        SessionSynchronizer synchronizer = new SessionSynchronizer(new InMemorySessionStore());
        List<SessionState> received = new CopyOnWriteArrayList<>();
        synchronizer.subscribe(SESSION, received::add);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Long>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                String text = "Edit " + i;
                futures.add(executor.submit(() -> synchronizer.applyEdit(SESSION, Language.FRENCH, text,
                        new TranslationResult(Language.FRENCH,
                                LanguageTexts.empty().with(Language.FRENCH, text), Set.of(), List.of()))));
            }
            List<Long> revisions = new ArrayList<>();
            for (Future<Long> future : futures) {
                revisions.add(future.get(5, TimeUnit.SECONDS));
            }
            assertThat(revisions).doesNotHaveDuplicates().allMatch(revision -> revision >= 1 && revision <= 20);
        } finally {
            executor.shutdownNow();
        }

        assertThat(synchronizer.snapshot(SESSION).revision()).isEqualTo(20);
        assertThat(received).extracting(SessionState::revision).isSorted().doesNotHaveDuplicates();
        assertThat(received.get(received.size() - 1).revision()).isEqualTo(20);
    }

    @Test
    void failingSubscriberDoesNotAffectOthers() {
        SessionSynchronizer synchronizer = new SessionSynchronizer(new InMemorySessionStore());
        List<SessionState> healthy = new CopyOnWriteArrayList<>();
        synchronizer.subscribe(SESSION, state -> {
            if (state.revision() > 0) {
                throw new IllegalStateException("device disconnected");
            }
        });
        synchronizer.subscribe(SESSION, healthy::add);

        long revision = synchronizer.applyEdit(SESSION, Language.ENGLISH, "Hello.", hello());

        assertThat(revision).isEqualTo(1);
        assertThat(healthy).extracting(SessionState::revision).containsExactly(0L, 1L);
    }

    @Test
    void applyEditReturnsOnlyAfterSubscribersHandledTheSnapshot() {
        SessionSynchronizer synchronizer = new SessionSynchronizer(new InMemorySessionStore());
        List<Thread> deliveryThreads = new CopyOnWriteArrayList<>();
        synchronizer.subscribe(SESSION, state -> {
            if (state.revision() > 0) {
                deliveryThreads.add(Thread.currentThread());
            }
        });

        synchronizer.applyEdit(SESSION, Language.ENGLISH, "Hello.", hello());

        assertThat(deliveryThreads).containsExactly(Thread.currentThread());
    }

    @Test
    void closedSubscriptionStopsReceivingPushes() {
        SessionSynchronizer synchronizer = new SessionSynchronizer(new InMemorySessionStore());
        List<SessionState> received = new CopyOnWriteArrayList<>();
        Subscription subscription = synchronizer.subscribe(SESSION, received::add);

        subscription.close();
        subscription.close();
        synchronizer.applyEdit(SESSION, Language.ENGLISH, "Hello.", hello());

        assertThat(subscription.isClosed()).isTrue();
        assertThat(received).hasSize(1);
        assertThat(synchronizer.subscriberCount(SESSION)).isZero();
    }

    @Test
    void storeFailurePropagatesWithoutNotifyingSubscribers() {
        FlakySessionStore store = new FlakySessionStore();
        SessionSynchronizer synchronizer = new SessionSynchronizer(store);
        List<SessionState> received = new CopyOnWriteArrayList<>();
        synchronizer.subscribe(SESSION, received::add);
        store.failWrites = true;

        assertThatThrownBy(() -> synchronizer.applyEdit(SESSION, Language.ENGLISH, "Hello.", hello()))
                .isInstanceOf(SessionStoreException.class);

        assertThat(received).hasSize(1);
        assertThat(store.get(SESSION)).hasValueSatisfying(state -> assertThat(state.revision()).isZero());
    }

    private static TranslationResult hello() {
        LanguageTexts texts = LanguageTexts.empty()
                .with(Language.ENGLISH, "Hello.")
                .with(Language.FRENCH, "Bonjour.")
                .with(Language.POLISH, "Witaj.");
        return new TranslationResult(Language.ENGLISH, texts, Set.of(), List.of());
    }

    private static final class FlakySessionStore implements SessionStore {

        private final InMemorySessionStore delegate = new InMemorySessionStore();
        private volatile boolean failWrites;

        @Override
        public Optional<SessionState> get(String sessionId) {
            return delegate.get(sessionId);
        }

        @Override
        public SessionState upsert(String sessionId, UnaryOperator<SessionState> mutator) {
            if (failWrites) {
                throw new SessionStoreException("store unavailable");
            }
            return delegate.upsert(sessionId, mutator);
        }
    }
}
