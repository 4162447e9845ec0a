package com.planit.gamification.store.memory;

import com.planit.gamification.store.DocumentNotFoundException;
import com.planit.gamification.store.DocumentPath;
import com.planit.gamification.store.Filter;
import com.planit.gamification.store.QuerySpec;
import com.planit.gamification.store.StoredDocument;
import com.planit.gamification.store.SubscriptionHandle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

@DisplayName("InMemoryDocumentStore Tests")
class InMemoryDocumentStoreTest {

    private static final DocumentPath ALICE = DocumentPath.user("alice");

    private final InMemoryDocumentStore store = new InMemoryDocumentStore();

    @Nested
    @DisplayName("Writes")
    class WriteTests {

        @Test
        @DisplayName("Should version every write starting at one")
        void shouldVersionWrites() {
            StoredDocument first = store.set(ALICE, Map.of("xp", 10));
            StoredDocument second = store.updateFields(ALICE, Map.of("level", 1));

            assertThat(first.getVersion()).isEqualTo(1);
            assertThat(second.getVersion()).isEqualTo(2);
            assertThat(store.get(ALICE)).get()
                    .extracting(StoredDocument::getFields)
                    .isEqualTo(Map.of("xp", 10, "level", 1));
        }

        @Test
        @DisplayName("Should reject field updates of a missing document")
        void shouldRejectUpdateOfMissingDocument() {
            assertThatThrownBy(() -> store.updateFields(ALICE, Map.of("xp", 1)))
                    .isInstanceOf(DocumentNotFoundException.class);
        }

        @Test
        @DisplayName("Should append array values once")
        void shouldAppendWithoutDuplicates() {
            store.appendToArrayField(ALICE, "friends", "bob");
            store.appendToArrayField(ALICE, "friends", "carol");
            StoredDocument doc = store.appendToArrayField(ALICE, "friends", "bob");

            assertThat((List<Object>) doc.get("friends")).containsExactly("bob", "carol");
        }
    }

    @Nested
    @DisplayName("Compare and set")
    class CompareAndSetTests {

        @Test
        @DisplayName("Should create only when absent with expected version zero")
        void shouldCreateIfAbsent() {
            assertThat(store.compareAndSet(ALICE, Map.of("xp", 0), 0)).isPresent();
            assertThat(store.compareAndSet(ALICE, Map.of("xp", 99), 0)).isEmpty();
            assertThat(store.get(ALICE).orElseThrow().getLong("xp", -1)).isZero();
        }

        @Test
        @DisplayName("Should reject a stale version and keep untouched fields")
        void shouldRejectStaleVersion() {
            store.set(ALICE, Map.of("xp", 10, "username", "alice"));
            StoredDocument updated = store.compareAndSet(ALICE, Map.of("xp", 20), 1).orElseThrow();

            assertThat(updated.getVersion()).isEqualTo(2);
            assertThat(updated.getString("username")).isEqualTo("alice");
            assertThat(store.compareAndSet(ALICE, Map.of("xp", 30), 1)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Queries")
    class QueryTests {

        @Test
        @DisplayName("Should filter, order descending and limit")
        void shouldFilterOrderAndLimit() {
            store.set(DocumentPath.leaderboard("2025-03_a"), Map.of("monthYear", "2025-03", "xp", 900));
            store.set(DocumentPath.leaderboard("2025-03_b"), Map.of("monthYear", "2025-03", "xp", 1200));
            store.set(DocumentPath.leaderboard("2025-03_c"), Map.of("monthYear", "2025-03", "xp", 300));
            store.set(DocumentPath.leaderboard("2025-02_a"), Map.of("monthYear", "2025-02", "xp", 5000));

            List<StoredDocument> results = store.query(QuerySpec.builder()
                    .collection(DocumentPath.LEADERBOARD)
                    .filter(Filter.equalTo("monthYear", "2025-03"))
                    .orderBy("xp")
                    .descending(true)
                    .limit(2)
                    .build());

            assertThat(results).extracting(StoredDocument::getId).containsExactly("2025-03_b", "2025-03_a");
        }

        @Test
        @DisplayName("Should match document ids by membership")
        void shouldMatchDocumentIds() {
            store.set(DocumentPath.leaderboard("2025-03_a"), Map.of("xp", 1));
            store.set(DocumentPath.leaderboard("2025-03_b"), Map.of("xp", 2));

            List<StoredDocument> results = store.query(QuerySpec.builder()
                    .collection(DocumentPath.LEADERBOARD)
                    .filter(Filter.documentIdIn(List.of("2025-03_b", "2025-03_z")))
                    .build());

            assertThat(results).extracting(StoredDocument::getId).containsExactly("2025-03_b");
        }
    }

    @Nested
    @DisplayName("Subscriptions")
    class SubscriptionTests {

        @Test
        @DisplayName("Should deliver the current snapshot and then every change")
        void shouldDeliverSnapshots() {
            List<Optional<StoredDocument>> received = new ArrayList<>();
            SubscriptionHandle handle = store.subscribe(ALICE, received::add);

            store.set(ALICE, Map.of("xp", 10));
            store.set(DocumentPath.user("bob"), Map.of("xp", 99));
            store.updateFields(ALICE, Map.of("xp", 20));

            assertThat(received).hasSize(3);
            assertThat(received.get(0)).isEmpty();
            assertThat(received.get(2).orElseThrow().getLong("xp", 0)).isEqualTo(20);
            assertThat(handle.isActive()).isTrue();
        }

        @Test
        @DisplayName("Should stop delivering after cancel")
        void shouldStopAfterCancel() {
            List<Optional<StoredDocument>> received = new ArrayList<>();
            SubscriptionHandle handle = store.subscribe(ALICE, received::add);

            handle.cancel();
            handle.cancel();
            store.set(ALICE, Map.of("xp", 10));

            assertThat(received).hasSize(1);
            assertThat(handle.isActive()).isFalse();
            assertThat(store.activeSubscriptionCount()).isZero();
        }

        @Test
        @DisplayName("Should re-run watched queries on collection changes")
        void shouldNotifyQuerySubscribers() {
            List<List<StoredDocument>> received = new ArrayList<>();
            QuerySpec top = QuerySpec.builder()
                    .collection(DocumentPath.LEADERBOARD)
                    .orderBy("xp")
                    .descending(true)
                    .limit(1)
                    .build();
            store.subscribeQuery(top, received::add);

            store.set(DocumentPath.leaderboard("2025-03_a"), Map.of("xp", 10));
            store.set(DocumentPath.leaderboard("2025-03_b"), Map.of("xp", 20));

            assertThat(received).hasSize(3);
            assertThat(received.get(0)).isEmpty();
            assertThat(received.get(2)).extracting(StoredDocument::getId).containsExactly("2025-03_b");
        }
    }
}
