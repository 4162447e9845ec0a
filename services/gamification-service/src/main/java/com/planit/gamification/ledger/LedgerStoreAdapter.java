package com.planit.gamification.ledger;

import com.planit.gamification.domain.LeaderboardEntry;
import com.planit.gamification.domain.UserXpState;
import com.planit.gamification.store.DocumentListener;
import com.planit.gamification.store.DocumentPath;
import com.planit.gamification.store.DocumentStore;
import com.planit.gamification.store.Filter;
import com.planit.gamification.store.QueryListener;
import com.planit.gamification.store.QuerySpec;
import com.planit.gamification.store.StoredDocument;
import com.planit.gamification.store.SubscriptionHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translates ledger operations into reads and writes of {@code users/{userId}} and
 * {@code leaderboard/{periodKey}_{userId}}.
 */
@Slf4j
@RequiredArgsConstructor
public class LedgerStoreAdapter {

    private final DocumentStore store;
    private final XpDocumentMapper mapper;

    public LedgerRecord read(String userId) {
        Optional<StoredDocument> document = store.get(DocumentPath.user(userId));
        return new LedgerRecord(mapper.toState(userId, document), mapper.toProfile(document));
    }

    public UserXpState toState(String userId, Optional<StoredDocument> document) {
        return mapper.toState(userId, document);
    }

    /**
     * Writes {@code next} only if the ledger is still at the version {@code next} was derived
     * from.
     *
     * @return the committed state carrying its new version, or empty on a version conflict
     */
    public Optional<UserXpState> commit(UserXpState next) {
        Map<String, Object> fields = mapper.toLedgerFields(next);
        return store.compareAndSet(DocumentPath.user(next.getUserId()), fields, next.getVersion())
                .map(written -> next.toBuilder().version(written.getVersion()).build());
    }

    /**
     * Creates the zero ledger if no document exists. Harmless when another writer got there
     * first.
     */
    public boolean initializeIfAbsent(String userId) {
        UserXpState zero = UserXpState.empty(userId);
        boolean created = store.compareAndSet(DocumentPath.user(userId), mapper.toLedgerFields(zero), 0).isPresent();
        if (created) {
            log.info("Initialized empty XP ledger: userId={}", userId);
        }
        return created;
    }

    public LeaderboardEntry upsertLeaderboardEntry(LeaderboardEntry entry) {
        store.set(DocumentPath.leaderboard(entry.documentId()), mapper.toEntryFields(entry));
        return entry;
    }

    public Optional<LeaderboardEntry> findLeaderboardEntry(String periodKey, String userId) {
        return store.get(DocumentPath.leaderboard(LeaderboardEntry.documentId(periodKey, userId)))
                .map(mapper::toEntry);
    }

    public List<LeaderboardEntry> topEntries(String periodKey, int limit) {
        return store.query(topEntriesQuery(periodKey, limit)).stream()
                .map(mapper::toEntry)
                .toList();
    }

    /**
     * One membership query; callers keep {@code userIds} within the store's IN arity.
     */
    public List<LeaderboardEntry> entriesFor(String periodKey, Collection<String> userIds) {
        List<String> documentIds = userIds.stream()
                .map(userId -> LeaderboardEntry.documentId(periodKey, userId))
                .toList();
        QuerySpec query = QuerySpec.builder()
                .collection(DocumentPath.LEADERBOARD)
                .filter(Filter.documentIdIn(documentIds))
                .build();
        return store.query(query).stream()
                .map(mapper::toEntry)
                .toList();
    }

    public SubscriptionHandle watchLedger(String userId, DocumentListener listener) {
        return store.subscribe(DocumentPath.user(userId), listener);
    }

    public SubscriptionHandle watchTopEntries(String periodKey, int limit, QueryListener listener) {
        return store.subscribeQuery(topEntriesQuery(periodKey, limit), listener);
    }

    public List<LeaderboardEntry> toEntries(List<StoredDocument> documents) {
        return documents.stream().map(mapper::toEntry).toList();
    }

    private static QuerySpec topEntriesQuery(String periodKey, int limit) {
        return QuerySpec.builder()
                .collection(DocumentPath.LEADERBOARD)
                .filter(Filter.equalTo(XpDocumentMapper.ENTRY_PERIOD, periodKey))
                .orderBy(XpDocumentMapper.XP)
                .descending(true)
                .limit(limit)
                .build();
    }
}
