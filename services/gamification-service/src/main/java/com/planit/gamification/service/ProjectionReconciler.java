package com.planit.gamification.service;

import com.planit.gamification.config.GamificationProperties;
import com.planit.gamification.ledger.LedgerRecord;
import com.planit.gamification.ledger.LedgerStoreAdapter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Self-healing for leaderboard entries whose write failed after the ledger committed.
 *
 * <p>Repairs recompute the entry from the authoritative ledger, so it does not matter how
 * many awards happened in between; one pending repair per user and period is enough.
 * Failed repairs are rescheduled with backoff and never dropped.
 */
@Slf4j
public class ProjectionReconciler {

    private final LedgerStoreAdapter ledgerStore;
    private final LeaderboardProjector projector;
    private final GamificationProperties.Reconciliation settings;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final ConcurrentMap<String, ProjectionRepair> pending = new ConcurrentHashMap<>();

    public ProjectionReconciler(LedgerStoreAdapter ledgerStore,
                                LeaderboardProjector projector,
                                GamificationProperties.Reconciliation settings,
                                Clock clock,
                                MeterRegistry meterRegistry) {
        this.ledgerStore = ledgerStore;
        this.projector = projector;
        this.settings = settings;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        meterRegistry.gaugeMapSize("gamification.projection.pending", List.of(), pending);
    }

    public void enqueue(String userId, String periodKey, String reason) {
        ProjectionRepair repair = new ProjectionRepair(userId, periodKey, clock.instant(), reason);
        if (pending.putIfAbsent(repair.key(), repair) == null) {
            log.warn("Leaderboard projection queued for repair: userId={}, periodKey={}, reason={}",
                    userId, periodKey, reason);
            meterRegistry.counter("gamification.projection.drift").increment();
        }
    }

    /**
     * Runs every due repair once.
     *
     * @return number of repairs completed
     */
    @Scheduled(fixedDelayString = "${gamification.reconciliation.interval:PT30S}")
    public int reconcilePending() {
        Instant now = clock.instant();
        List<ProjectionRepair> due = new ArrayList<>();
        for (ProjectionRepair repair : pending.values()) {
            if (repair.isDue(now)) {
                due.add(repair);
            }
        }
        int repaired = 0;
        for (ProjectionRepair repair : due) {
            if (repair(repair, now)) {
                repaired++;
            }
        }
        if (!due.isEmpty()) {
            log.info("Projection reconciliation pass: due={}, repaired={}, stillPending={}",
                    due.size(), repaired, pending.size());
        }
        return repaired;
    }

    public boolean isPending(String userId, String periodKey) {
        return pending.containsKey(ProjectionRepair.key(userId, periodKey));
    }

    public int pendingCount() {
        return pending.size();
    }

    public List<ProjectionRepair> pendingRepairs() {
        return List.copyOf(pending.values());
    }

    private boolean repair(ProjectionRepair repair, Instant now) {
        try {
            LedgerRecord record = ledgerStore.read(repair.getUserId());
            projector.project(record.getState(), record.getProfile(), repair.getPeriodKey());
            pending.remove(repair.key(), repair);
            meterRegistry.counter("gamification.projection.repaired").increment();
            log.info("Leaderboard projection repaired: userId={}, periodKey={}, xp={}, attempts={}",
                    repair.getUserId(), repair.getPeriodKey(), record.getState().getCurrentXp(), repair.getAttempts() + 1);
            return true;
        } catch (RuntimeException e) {
            repair.recordFailure(now, settings.getInitialBackoff(), settings.getMaxBackoff(), e.getMessage());
            meterRegistry.counter("gamification.projection.repair.failed").increment();
            if (repair.getAttempts() >= settings.getAlertAfterAttempts()) {
                log.error("Leaderboard projection still failing: userId={}, periodKey={}, attempts={}, nextAttemptAt={}",
                        repair.getUserId(), repair.getPeriodKey(), repair.getAttempts(), repair.getNextAttemptAt(), e);
            } else {
                log.warn("Leaderboard projection repair failed: userId={}, periodKey={}, attempts={}, error={}",
                        repair.getUserId(), repair.getPeriodKey(), repair.getAttempts(), e.getMessage());
            }
            return false;
        }
    }
}
