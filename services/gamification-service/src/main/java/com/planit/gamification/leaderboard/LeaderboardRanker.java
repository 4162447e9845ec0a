package com.planit.gamification.leaderboard;

import com.planit.gamification.domain.LeaderboardEntry;
import com.planit.gamification.domain.RankedEntry;
import com.planit.gamification.ledger.LedgerStoreAdapter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds ranked leaderboards for a period at query time.
 *
 * <p>Friend-scoped rankings fetch entries by document id in chunks of {@code batchSize},
 * the store's bound on membership-query arity. Entries may be of different recency; the
 * ranking is over whatever snapshot the store returned.
 */
@Slf4j
public class LeaderboardRanker {

    private final LedgerStoreAdapter ledgerStore;
    private final int batchSize;

    public LeaderboardRanker(LedgerStoreAdapter ledgerStore, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.ledgerStore = ledgerStore;
        this.batchSize = batchSize;
    }

    public List<RankedEntry> rank(String periodKey, LeaderboardScope scope) {
        return switch (scope.getKind()) {
            case GLOBAL -> LeaderboardOrdering.rank(ledgerStore.topEntries(periodKey, scope.getLimit()));
            case FRIENDS -> rankFriends(periodKey, List.copyOf(scope.getUserIds()));
        };
    }

    public static Optional<Integer> findRank(List<RankedEntry> ranking, String userId) {
        return ranking.stream()
                .filter(ranked -> userId.equals(ranked.getUserId()))
                .map(RankedEntry::getRank)
                .findFirst();
    }

    private List<RankedEntry> rankFriends(String periodKey, List<String> userIds) {
        if (userIds.isEmpty()) {
            return List.of();
        }
        Map<String, LeaderboardEntry> byUser = new LinkedHashMap<>();
        int batches = 0;
        for (int from = 0; from < userIds.size(); from += batchSize) {
            List<String> batch = userIds.subList(from, Math.min(from + batchSize, userIds.size()));
            for (LeaderboardEntry entry : ledgerStore.entriesFor(periodKey, batch)) {
                byUser.merge(entry.getUserId(), entry, LeaderboardRanker::fresher);
            }
            batches++;
        }
        log.debug("Friends leaderboard fetched: periodKey={}, requested={}, found={}, batches={}",
                periodKey, userIds.size(), byUser.size(), batches);
        return LeaderboardOrdering.rank(new ArrayList<>(byUser.values()));
    }

    private static LeaderboardEntry fresher(LeaderboardEntry a, LeaderboardEntry b) {
        return a.getCurrentXp() >= b.getCurrentXp() ? a : b;
    }
}
