package com.planit.gamification.sync;

import com.planit.gamification.aggregate.WindowedAggregator;
import com.planit.gamification.domain.UserXpState;
import com.planit.gamification.domain.XpEvent;
import com.planit.gamification.ledger.LedgerStoreAdapter;
import com.planit.gamification.ledger.XpDocumentMapper;
import com.planit.gamification.store.DocumentPath;
import com.planit.gamification.store.StoreUnavailableException;
import com.planit.gamification.store.memory.InMemoryDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("LiveSyncController Tests")
class LiveSyncControllerTest {

    private static final Instant NOW = Instant.parse("2025-03-15T12:00:00Z");
    private static final String USER = "alice";

    private InMemoryDocumentStore documentStore;
    private LedgerStoreAdapter ledgerStore;

    @BeforeEach
    void setUp() {
        documentStore = spy(new InMemoryDocumentStore());
        ledgerStore = new LedgerStoreAdapter(documentStore,
                new XpDocumentMapper(new WindowedAggregator(), Clock.fixed(NOW, ZoneOffset.UTC)));
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("Should initialize a missing ledger exactly once on start")
        void shouldInitializeMissingLedger() {
            LiveSyncController controller = new LiveSyncController(USER, ledgerStore);

            controller.start();
            controller.start();

            assertThat(controller.getState()).isEqualTo(LiveSyncController.State.SUBSCRIBED);
            assertThat(controller.currentState().exists()).isTrue();
            assertThat(controller.currentState().getCurrentXp()).isZero();
            assertThat(controller.currentState().getLevel()).isEqualTo(1);
            verify(documentStore, times(1)).compareAndSet(eq(DocumentPath.user(USER)), anyMap(), eq(0L));
            assertThat(documentStore.activeSubscriptionCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should not overwrite an existing ledger")
        void shouldNotInitializeExistingLedger() {
            commit(state(700, "e1"));
            LiveSyncController controller = new LiveSyncController(USER, ledgerStore);

            controller.start();

            assertThat(controller.currentState().getCurrentXp()).isEqualTo(700);
            assertThat(controller.currentState().getLevel()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should cancel the subscription on stop")
        void shouldCancelOnStop() {
            LiveSyncController controller = new LiveSyncController(USER, ledgerStore);
            controller.start();
            long versionBeforeStop = controller.currentState().getVersion();

            controller.stop();
            controller.stop();
            commit(controller.currentState().toBuilder().currentXp(50).build());

            assertThat(controller.getState()).isEqualTo(LiveSyncController.State.UNSUBSCRIBED);
            assertThat(documentStore.activeSubscriptionCount()).isZero();
            assertThat(controller.currentState().getVersion()).isEqualTo(versionBeforeStop);
        }

        @Test
        @DisplayName("Should refuse to restart after close")
        void shouldRefuseRestartAfterClose() {
            LiveSyncController controller = new LiveSyncController(USER, ledgerStore);
            controller.start();
            controller.close();

            assertThatThrownBy(controller::start).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Should keep the subscription when initialization fails")
        void shouldSurviveFailedInitialization() {
            doThrow(new StoreUnavailableException("down"))
                    .doCallRealMethod()
                    .when(documentStore).compareAndSet(any(), anyMap(), anyLong());
            LiveSyncController controller = new LiveSyncController(USER, ledgerStore);

            controller.start();

            assertThat(controller.getState()).isEqualTo(LiveSyncController.State.SUBSCRIBED);
            assertThat(controller.currentState().exists()).isFalse();

            documentStore.set(DocumentPath.user(USER), Map.of("username", "alice"));
            assertThat(controller.currentState().exists()).isTrue();
        }
    }

    @Nested
    @DisplayName("Snapshots")
    class SnapshotTests {

        @Test
        @DisplayName("Should emit every snapshot and complete on close")
        void shouldEmitSnapshots() {
            LiveSyncController controller = new LiveSyncController(USER, ledgerStore);

            StepVerifier.create(controller.snapshots())
                    .then(controller::start)
                    .assertNext(snapshot -> assertThat(snapshot.exists()).isFalse())
                    .assertNext(snapshot -> assertThat(snapshot.getVersion()).isEqualTo(1))
                    .then(() -> commit(controller.currentState().toBuilder().currentXp(50).build()))
                    .assertNext(snapshot -> assertThat(snapshot.getCurrentXp()).isEqualTo(50))
                    .then(controller::close)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should replace local state wholesale on each notification")
        void shouldReplaceState() {
            LiveSyncController controller = new LiveSyncController(USER, ledgerStore);
            controller.start();

            commit(state(300, "e1").toBuilder().version(controller.currentState().getVersion()).build());
            UserXpState afterFirst = controller.currentState();
            commit(state(900, "e2").toBuilder().version(afterFirst.getVersion()).build());

            UserXpState current = controller.currentState();
            assertThat(current.getCurrentXp()).isEqualTo(900);
            assertThat(current.getLevel()).isEqualTo(2);
            assertThat(current.getHistory()).extracting(XpEvent::getId).containsExactly("e2");
        }

        @Test
        @DisplayName("Should converge two devices watching the same user")
        void shouldConvergeDevices() {
            LiveSyncController phone = new LiveSyncController(USER, ledgerStore);
            LiveSyncController tablet = new LiveSyncController(USER, ledgerStore);
            phone.start();
            tablet.start();

            commit(phone.currentState().toBuilder().currentXp(50).build());
            commit(tablet.currentState().toBuilder().currentXp(250).build());
            commit(phone.currentState().toBuilder().currentXp(265).build());

            assertThat(phone.currentState()).isEqualTo(tablet.currentState());
            assertThat(phone.currentState().getCurrentXp()).isEqualTo(265);
            assertThat(phone.currentState()).isEqualTo(ledgerStore.read(USER).getState());
        }
    }

    private void commit(UserXpState state) {
        ledgerStore.commit(state.toBuilder().level((int) (state.getCurrentXp() / 500 + 1)).lastUpdate(NOW).build())
                .orElseThrow();
    }

    private static UserXpState state(long xp, String eventId) {
        XpEvent event = XpEvent.builder().id(eventId).eventKind("Visited Place").xpAmount((int) xp).timestamp(NOW).build();
        return UserXpState.empty(USER).toBuilder().currentXp(xp).history(List.of(event)).weeklyXp(xp).build();
    }
}
