package com.planit.gamification.config;

import com.planit.gamification.aggregate.PeriodKeys;
import com.planit.gamification.aggregate.WindowedAggregator;
import com.planit.gamification.event.GamificationEventPublisher;
import com.planit.gamification.exception.LedgerConflictException;
import com.planit.gamification.leaderboard.LeaderboardRanker;
import com.planit.gamification.ledger.LedgerStoreAdapter;
import com.planit.gamification.ledger.XpDocumentMapper;
import com.planit.gamification.service.AwardCoordinator;
import com.planit.gamification.service.LeaderboardProjector;
import com.planit.gamification.service.MilestoneDetector;
import com.planit.gamification.service.ProjectionReconciler;
import com.planit.gamification.service.XpLedgerService;
import com.planit.gamification.session.UserSessionFactory;
import com.planit.gamification.store.DocumentStore;
import com.planit.gamification.store.StoreUnavailableException;
import com.planit.gamification.store.memory.InMemoryDocumentStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;
import java.time.ZoneId;
import java.util.List;

/**
 * Wiring of the ledger, leaderboard and award components.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(GamificationProperties.class)
public class GamificationConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "gamification.store", name = "type", havingValue = "memory", matchIfMissing = true)
    public DocumentStore inMemoryDocumentStore() {
        log.warn("Using in-memory document store; ledger data is lost on restart");
        return new InMemoryDocumentStore();
    }

    @Bean
    public WindowedAggregator windowedAggregator(GamificationProperties properties) {
        return new WindowedAggregator(properties.getWeeklyWindow());
    }

    @Bean
    public PeriodKeys periodKeys(GamificationProperties properties, Clock clock) {
        return new PeriodKeys(ZoneId.of(properties.getPeriodZone()), clock);
    }

    @Bean
    public LedgerStoreAdapter ledgerStoreAdapter(DocumentStore documentStore, WindowedAggregator aggregator, Clock clock) {
        return new LedgerStoreAdapter(documentStore, new XpDocumentMapper(aggregator, clock));
    }

    @Bean
    public LeaderboardRanker leaderboardRanker(LedgerStoreAdapter ledgerStore, GamificationProperties properties) {
        return new LeaderboardRanker(ledgerStore, properties.getLeaderboard().getBatchSize());
    }

    @Bean
    public LeaderboardProjector leaderboardProjector(LedgerStoreAdapter ledgerStore) {
        return new LeaderboardProjector(ledgerStore);
    }

    @Bean
    public ProjectionReconciler projectionReconciler(LedgerStoreAdapter ledgerStore,
                                                     LeaderboardProjector projector,
                                                     GamificationProperties properties,
                                                     Clock clock,
                                                     MeterRegistry meterRegistry) {
        return new ProjectionReconciler(ledgerStore, projector, properties.getReconciliation(), clock, meterRegistry);
    }

    /**
     * Retries version conflicts and transient store failures. Anything else, including
     * cancellation, fails the award on the first attempt.
     */
    @Bean
    public RetryTemplate awardRetryTemplate(GamificationProperties properties) {
        GamificationProperties.Award award = properties.getAward();
        return RetryTemplate.builder()
                .maxAttempts(award.getMaxAttempts())
                .exponentialBackoff(award.getInitialBackoff().toMillis(), award.getBackoffMultiplier(),
                        award.getMaxBackoff().toMillis())
                .retryOn(List.of(LedgerConflictException.class, StoreUnavailableException.class))
                .build();
    }

    @Bean
    public AwardCoordinator awardCoordinator(LedgerStoreAdapter ledgerStore,
                                             WindowedAggregator aggregator,
                                             PeriodKeys periodKeys,
                                             LeaderboardProjector projector,
                                             ProjectionReconciler reconciler,
                                             GamificationEventPublisher eventPublisher,
                                             RetryTemplate awardRetryTemplate,
                                             Clock clock,
                                             MeterRegistry meterRegistry) {
        return AwardCoordinator.builder()
                .ledgerStore(ledgerStore)
                .aggregator(aggregator)
                .periodKeys(periodKeys)
                .milestoneDetector(new MilestoneDetector())
                .projector(projector)
                .reconciler(reconciler)
                .eventPublisher(eventPublisher)
                .retryTemplate(awardRetryTemplate)
                .clock(clock)
                .meterRegistry(meterRegistry)
                .build();
    }

    @Bean
    public UserSessionFactory userSessionFactory(LedgerStoreAdapter ledgerStore, AwardCoordinator coordinator, Clock clock) {
        return new UserSessionFactory(ledgerStore, coordinator, clock);
    }

    @Bean
    public XpLedgerService xpLedgerService(UserSessionFactory sessionFactory,
                                           LedgerStoreAdapter ledgerStore,
                                           LeaderboardRanker ranker,
                                           WindowedAggregator aggregator,
                                           PeriodKeys periodKeys,
                                           GamificationProperties properties,
                                           Clock clock) {
        return new XpLedgerService(sessionFactory, ledgerStore, ranker, aggregator, periodKeys, properties, clock);
    }
}
