package com.planit.gamification.service;

import com.planit.gamification.aggregate.PeriodKeys;
import com.planit.gamification.aggregate.WindowedAggregator;
import com.planit.gamification.config.GamificationProperties;
import com.planit.gamification.domain.RankedEntry;
import com.planit.gamification.domain.UserXpState;
import com.planit.gamification.domain.XpEvent;
import com.planit.gamification.domain.XpReward;
import com.planit.gamification.exception.InvalidXpAmountException;
import com.planit.gamification.exception.SessionClosedException;
import com.planit.gamification.leaderboard.LeaderboardRanker;
import com.planit.gamification.leaderboard.LeaderboardScope;
import com.planit.gamification.ledger.LedgerStoreAdapter;
import com.planit.gamification.session.UserSession;
import com.planit.gamification.session.UserSessionFactory;
import com.planit.gamification.sync.LeaderboardLiveFeed;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for the rest of the app: awards, ledger reads and leaderboards.
 *
 * <p>Awards go through the user's session so that awards from one client apply in call
 * order. Sessions are opened on first use and closed after a period of inactivity.
 */
@Slf4j
public class XpLedgerService {

    private final UserSessionFactory sessionFactory;
    private final LedgerStoreAdapter ledgerStore;
    private final LeaderboardRanker ranker;
    private final WindowedAggregator aggregator;
    private final PeriodKeys periodKeys;
    private final GamificationProperties properties;
    private final Clock clock;
    private final Map<String, UserSession> sessions = new ConcurrentHashMap<>();

    public XpLedgerService(UserSessionFactory sessionFactory,
                           LedgerStoreAdapter ledgerStore,
                           LeaderboardRanker ranker,
                           WindowedAggregator aggregator,
                           PeriodKeys periodKeys,
                           GamificationProperties properties,
                           Clock clock) {
        this.sessionFactory = sessionFactory;
        this.ledgerStore = ledgerStore;
        this.ranker = ranker;
        this.aggregator = aggregator;
        this.periodKeys = periodKeys;
        this.properties = properties;
        this.clock = clock;
    }

    // Awards

    public PendingAward awardXp(String userId, int amount, String eventKind, String subjectRef, String details) {
        return awardXp(AwardCommand.builder()
                .userId(userId)
                .amount(amount)
                .eventKind(eventKind)
                .subjectRef(subjectRef)
                .details(details)
                .build());
    }

    /**
     * Queues an award on the user's session. Amount validation happens here so that a bad
     * request fails synchronously instead of through the pending result.
     *
     * <p>If the session is closed between lookup and submit, the award goes to a fresh one.
     */
    public PendingAward awardXp(AwardCommand command) {
        if (command.getAmount() <= 0) {
            throw new InvalidXpAmountException(command.getAmount());
        }
        UserSession session = openSession(command.getUserId());
        try {
            return session.submit(command);
        } catch (SessionClosedException e) {
            log.debug("Session closed before submit, reopening: userId={}", command.getUserId());
            sessions.remove(command.getUserId(), session);
            return openSession(command.getUserId()).submit(command);
        }
    }

    public PendingAward awardReward(String userId, XpReward reward, String subjectRef, String details) {
        return awardXp(userId, reward.getXp(), reward.getEventKind(), subjectRef, details);
    }

    public PendingAward awardPlaceVisit(String userId, String placeId, String placeName, boolean firstVisit) {
        XpReward reward = firstVisit ? XpReward.FIRST_VISIT : XpReward.VISIT_PLACE;
        return awardReward(userId, reward, placeId, placeName);
    }

    /**
     * Credits a completed mission with the mission's own reward.
     */
    public PendingAward awardMissionCompletion(String userId, String missionId, String missionTitle, int xpReward) {
        return awardXp(userId, xpReward, XpReward.COMPLETE_MISSION.getEventKind(), missionId, missionTitle);
    }

    // Reads

    /**
     * Live state of an open session, otherwise a direct read of the ledger.
     */
    public UserXpState currentState(String userId) {
        UserSession session = sessions.get(userId);
        if (session != null && !session.isClosed() && session.currentState().exists()) {
            return session.currentState();
        }
        return ledgerStore.read(userId).getState();
    }

    public List<XpEvent> recentEvents(String userId) {
        return aggregator.recent(currentState(userId).getHistory(), properties.getRecentEventsLimit());
    }

    public String currentPeriodKey() {
        return periodKeys.currentPeriodKey();
    }

    public List<RankedEntry> globalLeaderboard(String periodKey, Integer limit) {
        int effectiveLimit = limit == null ? properties.getLeaderboard().getDefaultLimit() : limit;
        return ranker.rank(periodKey, LeaderboardScope.global(effectiveLimit));
    }

    public List<RankedEntry> friendsLeaderboard(String periodKey, Collection<String> friendIds) {
        return ranker.rank(periodKey, LeaderboardScope.friends(friendIds));
    }

    /**
     * Rank of {@code userId} on the current period's global top list, if they are on it.
     */
    public Optional<Integer> findRank(String userId) {
        return LeaderboardRanker.findRank(globalLeaderboard(currentPeriodKey(), null), userId);
    }

    /**
     * Unstarted live feed of the current period's top list.
     */
    public LeaderboardLiveFeed liveLeaderboard(Integer limit) {
        int effectiveLimit = limit == null ? properties.getLeaderboard().getDefaultLimit() : limit;
        return new LeaderboardLiveFeed(currentPeriodKey(), effectiveLimit, ledgerStore);
    }

    // Sessions

    public UserSession openSession(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        return sessions.compute(userId, (id, existing) -> {
            if (existing == null || existing.isClosed()) {
                return sessionFactory.open(id);
            }
            existing.markActive();
            return existing;
        });
    }

    public void closeSession(String userId) {
        UserSession session = sessions.remove(userId);
        if (session != null) {
            session.close();
        }
    }

    public int openSessionCount() {
        return sessions.size();
    }

    /**
     * Closes sessions idle for longer than the configured timeout. The idle check and the
     * removal are one atomic step per user, so a session reused after the sweep started
     * stays open.
     */
    @Scheduled(fixedDelayString = "${gamification.session.eviction-interval:PT1M}")
    public int evictIdleSessions() {
        Instant cutoff = clock.instant().minus(properties.getSession().getIdleTimeout());
        List<UserSession> evicted = new ArrayList<>();
        for (String userId : new ArrayList<>(sessions.keySet())) {
            sessions.computeIfPresent(userId, (id, session) -> {
                if (session.isClosed() || session.getLastActivity().isBefore(cutoff)) {
                    evicted.add(session);
                    return null;
                }
                return session;
            });
        }
        evicted.forEach(UserSession::close);
        if (!evicted.isEmpty()) {
            log.info("Closed idle user sessions: count={}, remaining={}", evicted.size(), sessions.size());
        }
        return evicted.size();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Closing user sessions: count={}", sessions.size());
        new ArrayList<>(sessions.keySet()).forEach(this::closeSession);
    }
}
