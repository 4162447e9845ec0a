package com.planit.gamification.sync;

import com.planit.gamification.domain.RankedEntry;
import com.planit.gamification.leaderboard.LeaderboardOrdering;
import com.planit.gamification.ledger.LedgerStoreAdapter;
import com.planit.gamification.store.QueryListener;
import com.planit.gamification.store.StoredDocument;
import com.planit.gamification.store.SubscriptionHandle;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Live top-N leaderboard of one period. Each change to any entry of the period re-ranks the
 * query result and emits it whole.
 */
@Slf4j
public class LeaderboardLiveFeed implements AutoCloseable {

    private final String periodKey;
    private final int limit;
    private final LedgerStoreAdapter ledgerStore;
    private final Sinks.Many<List<RankedEntry>> rankings = Sinks.many().replay().latest();

    private volatile SubscriptionHandle subscription;
    private Map<String, Integer> lastRanks = Map.of();

    public LeaderboardLiveFeed(String periodKey, int limit, LedgerStoreAdapter ledgerStore) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        this.periodKey = periodKey;
        this.limit = limit;
        this.ledgerStore = ledgerStore;
    }

    public synchronized void start() {
        if (subscription != null) {
            return;
        }
        subscription = ledgerStore.watchTopEntries(periodKey, limit, new RankingListener());
        log.info("Live leaderboard started: periodKey={}, limit={}", periodKey, limit);
    }

    public synchronized void stop() {
        if (subscription == null) {
            return;
        }
        subscription.cancel();
        subscription = null;
        log.info("Live leaderboard stopped: periodKey={}", periodKey);
    }

    @Override
    public void close() {
        stop();
        synchronized (rankings) {
            rankings.tryEmitComplete();
        }
    }

    public Flux<List<RankedEntry>> rankings() {
        return rankings.asFlux();
    }

    public String getPeriodKey() {
        return periodKey;
    }

    void apply(List<StoredDocument> results) {
        List<RankedEntry> ranking = LeaderboardOrdering.rank(ledgerStore.toEntries(results));
        synchronized (rankings) {
            logRankChanges(ranking);
            rankings.tryEmitNext(ranking);
        }
    }

    private void logRankChanges(List<RankedEntry> ranking) {
        Map<String, Integer> ranks = new HashMap<>();
        for (RankedEntry ranked : ranking) {
            ranks.put(ranked.getUserId(), ranked.getRank());
            Integer previous = lastRanks.get(ranked.getUserId());
            if (previous != null && previous != ranked.getRank()) {
                log.debug("Rank changed: periodKey={}, userId={}, rank={} -> {}",
                        periodKey, ranked.getUserId(), previous, ranked.getRank());
            }
        }
        lastRanks = ranks;
    }

    private class RankingListener implements QueryListener {

        @Override
        public void onResults(List<StoredDocument> results) {
            apply(results);
        }

        @Override
        public void onError(Throwable error) {
            log.error("Live leaderboard subscription failed: periodKey={}", periodKey, error);
        }
    }
}
