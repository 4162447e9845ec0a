package com.planit.gamification.leaderboard;

import com.planit.gamification.aggregate.WindowedAggregator;
import com.planit.gamification.domain.LeaderboardEntry;
import com.planit.gamification.domain.RankedEntry;
import com.planit.gamification.ledger.LedgerStoreAdapter;
import com.planit.gamification.ledger.XpDocumentMapper;
import com.planit.gamification.store.DocumentStore;
import com.planit.gamification.store.memory.InMemoryDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("LeaderboardRanker Tests")
class LeaderboardRankerTest {

    private static final String PERIOD = "2025-03";
    private static final Instant T0 = Instant.parse("2025-03-10T08:00:00Z");

    private LedgerStoreAdapter ledgerStore;
    private LeaderboardRanker ranker;

    @BeforeEach
    void setUp() {
        ledgerStore = new LedgerStoreAdapter(new InMemoryDocumentStore(),
                new XpDocumentMapper(new WindowedAggregator(), Clock.systemUTC()));
        ranker = new LeaderboardRanker(ledgerStore, 10);
    }

    @Nested
    @DisplayName("Global ranking")
    class GlobalTests {

        @Test
        @DisplayName("Should rank by XP with distinct ranks and break ties by earliest update")
        void shouldRankWithTieBreak() {
            // Given
            ledgerStore.upsertLeaderboardEntry(entry("A", 900, T0));
            ledgerStore.upsertLeaderboardEntry(entry("B", 1200, T0.plusSeconds(60)));
            ledgerStore.upsertLeaderboardEntry(entry("C", 1200, T0));
            ledgerStore.upsertLeaderboardEntry(entry("D", 300, T0));

            // When
            List<RankedEntry> ranking = ranker.rank(PERIOD, LeaderboardScope.global(50));

            // Then
            assertThat(ranking).extracting(RankedEntry::getUserId).containsExactly("C", "B", "A", "D");
            assertThat(ranking).extracting(RankedEntry::getRank).containsExactly(1, 2, 3, 4);
        }

        @Test
        @DisplayName("Should fall back to user id when XP and update time tie")
        void shouldBreakRemainingTiesByUserId() {
            ledgerStore.upsertLeaderboardEntry(entry("zoe", 500, T0));
            ledgerStore.upsertLeaderboardEntry(entry("amy", 500, T0));

            assertThat(ranker.rank(PERIOD, LeaderboardScope.global(10)))
                    .extracting(RankedEntry::getUserId)
                    .containsExactly("amy", "zoe");
        }

        @Test
        @DisplayName("Should only rank entries of the requested period up to the limit")
        void shouldScopeToPeriodAndLimit() {
            ledgerStore.upsertLeaderboardEntry(entry("A", 900, T0));
            ledgerStore.upsertLeaderboardEntry(entry("B", 800, T0));
            ledgerStore.upsertLeaderboardEntry(entry("C", 700, T0));
            ledgerStore.upsertLeaderboardEntry(entry("A", 5000, T0).toBuilder().periodKey("2025-02").build());

            List<RankedEntry> ranking = ranker.rank(PERIOD, LeaderboardScope.global(2));

            assertThat(ranking).extracting(RankedEntry::getUserId).containsExactly("A", "B");
            assertThat(ranking.get(0).getEntry().getCurrentXp()).isEqualTo(900);
        }

        @Test
        @DisplayName("Should find a user's rank in a ranking")
        void shouldFindRank() {
            ledgerStore.upsertLeaderboardEntry(entry("A", 900, T0));
            ledgerStore.upsertLeaderboardEntry(entry("B", 1200, T0));
            List<RankedEntry> ranking = ranker.rank(PERIOD, LeaderboardScope.global(10));

            assertThat(LeaderboardRanker.findRank(ranking, "A")).contains(2);
            assertThat(LeaderboardRanker.findRank(ranking, "nobody")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Friends ranking")
    class FriendsTests {

        @Mock
        private DocumentStore documentStore;

        @Mock
        private LedgerStoreAdapter mockLedgerStore;

        @Test
        @DisplayName("Should return an empty ranking without querying the store")
        void shouldNotQueryForEmptyFriendSet() {
            LedgerStoreAdapter adapter = new LedgerStoreAdapter(documentStore,
                    new XpDocumentMapper(new WindowedAggregator(), Clock.systemUTC()));

            List<RankedEntry> ranking = new LeaderboardRanker(adapter, 10).rank(PERIOD, LeaderboardScope.friends(List.of()));

            assertThat(ranking).isEmpty();
            verifyNoInteractions(documentStore);
        }

        @Test
        @DisplayName("Should query in batches bounded by the batch size")
        void shouldBatchMembershipQueries() {
            List<String> friends = IntStream.range(0, 25).mapToObj(i -> "user-" + i).toList();
            when(mockLedgerStore.entriesFor(eq(PERIOD), anyCollection())).thenReturn(List.of());

            new LeaderboardRanker(mockLedgerStore, 10).rank(PERIOD, LeaderboardScope.friends(friends));

            verify(mockLedgerStore, times(3)).entriesFor(eq(PERIOD), argThat((Collection<String> ids) -> ids.size() <= 10));
        }

        @Test
        @DisplayName("Should rank only known friends and skip users without an entry")
        void shouldRankFriends() {
            ledgerStore.upsertLeaderboardEntry(entry("A", 900, T0));
            ledgerStore.upsertLeaderboardEntry(entry("B", 1200, T0));
            ledgerStore.upsertLeaderboardEntry(entry("stranger", 9000, T0));

            List<RankedEntry> ranking = ranker.rank(PERIOD, LeaderboardScope.friends(List.of("A", "B", "ghost", "A")));

            assertThat(ranking).extracting(RankedEntry::getUserId).containsExactly("B", "A");
        }
    }

    private static LeaderboardEntry entry(String userId, long xp, Instant lastUpdated) {
        return LeaderboardEntry.builder()
                .userId(userId)
                .username(userId.toLowerCase())
                .displayName(userId)
                .currentXp(xp)
                .level((int) (xp / 500 + 1))
                .lastUpdated(lastUpdated)
                .periodKey(PERIOD)
                .build();
    }
}
