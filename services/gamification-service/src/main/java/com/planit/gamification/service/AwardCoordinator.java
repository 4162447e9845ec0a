package com.planit.gamification.service;

import com.planit.gamification.aggregate.PeriodKeys;
import com.planit.gamification.aggregate.WindowedAggregator;
import com.planit.gamification.domain.AwardReceipt;
import com.planit.gamification.domain.Milestone;
import com.planit.gamification.domain.UserProfile;
import com.planit.gamification.domain.UserXpState;
import com.planit.gamification.domain.XpEvent;
import com.planit.gamification.event.AwardFailedEvent;
import com.planit.gamification.event.GamificationEventPublisher;
import com.planit.gamification.event.LevelUpEvent;
import com.planit.gamification.event.MilestoneReachedEvent;
import com.planit.gamification.event.XpGainedEvent;
import com.planit.gamification.exception.AwardFailedException;
import com.planit.gamification.exception.GamificationException;
import com.planit.gamification.exception.InvalidXpAmountException;
import com.planit.gamification.exception.LedgerConflictException;
import com.planit.gamification.ledger.LedgerRecord;
import com.planit.gamification.ledger.LedgerStoreAdapter;
import com.planit.gamification.level.LevelCalculator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * The XP write path.
 *
 * <p>Reading the ledger, appending the event and writing the new totals is one optimistic
 * transaction: the write is conditional on the version that was read, and a lost race is
 * retried from a fresh read. Because the event id is checked against the history on every
 * read, retrying after a write whose outcome is unknown can never credit XP twice.
 *
 * <p>Once the ledger write commits the award is final. The leaderboard projection and the
 * signals follow; a failed projection is handed to the {@link ProjectionReconciler} and
 * does not fail the award.
 */
@Slf4j
@Builder
@AllArgsConstructor
public class AwardCoordinator {

    private final LedgerStoreAdapter ledgerStore;
    private final WindowedAggregator aggregator;
    private final PeriodKeys periodKeys;
    private final MilestoneDetector milestoneDetector;
    private final LeaderboardProjector projector;
    private final ProjectionReconciler reconciler;
    private final GamificationEventPublisher eventPublisher;
    private final RetryTemplate retryTemplate;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public AwardReceipt award(AwardCommand command) {
        AwardCommand normalized = normalize(command);
        return award(normalized, new PendingAward(normalized.getUserId(), normalized.getEventId()));
    }

    /**
     * Runs the award to completion on the calling thread and completes {@code pending} with
     * the outcome.
     *
     * @throws InvalidXpAmountException if the amount is not positive; nothing was read or written
     * @throws CancellationException if {@code pending} was cancelled before the commit write
     * @throws AwardFailedException if the ledger could not be written within the retry budget
     */
    public AwardReceipt award(AwardCommand command, PendingAward pending) {
        try {
            AwardReceipt receipt = execute(command, pending);
            pending.complete(receipt);
            return receipt;
        } catch (RuntimeException e) {
            pending.fail(e);
            throw e;
        }
    }

    private AwardReceipt execute(AwardCommand command, PendingAward pending) {
        if (command.getAmount() <= 0) {
            meterRegistry.counter("gamification.award.rejected", "reason", "non_positive_amount").increment();
            throw new InvalidXpAmountException(command.getAmount());
        }
        if (command.getUserId() == null || command.getUserId().isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        AwardCommand normalized = normalize(command);
        Timer.Sample sample = Timer.start(meterRegistry);

        LedgerCommit commit;
        try {
            commit = retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.debug("Retrying XP award: userId={}, eventId={}, attempt={}, cause={}",
                            normalized.getUserId(), normalized.getEventId(), context.getRetryCount() + 1,
                            context.getLastThrowable() == null ? null : context.getLastThrowable().getMessage());
                }
                return attemptCommit(normalized, pending);
            });
        } catch (CancellationException e) {
            meterRegistry.counter("gamification.award.cancelled").increment();
            log.info("XP award cancelled before commit: userId={}, eventId={}", normalized.getUserId(), normalized.getEventId());
            throw e;
        } catch (GamificationException e) {
            throw failed(normalized, e);
        }

        AwardReceipt receipt = afterCommit(normalized, commit);
        sample.stop(meterRegistry.timer("gamification.award.duration", "outcome", receipt.isDuplicate() ? "duplicate" : "recorded"));
        return receipt;
    }

    private LedgerCommit attemptCommit(AwardCommand command, PendingAward pending) {
        if (pending.isCancelled()) {
            throw new CancellationException("Award " + command.getEventId() + " cancelled");
        }
        LedgerRecord record = ledgerStore.read(command.getUserId());
        UserXpState current = record.getState();

        if (current.containsEvent(command.getEventId())) {
            if (pending.hasStartedCommit() && pending.getCommitBase() != null) {
                // an earlier attempt of this award committed but its response was lost
                log.warn("XP award found committed after an unclear write: userId={}, eventId={}",
                        command.getUserId(), command.getEventId());
                return LedgerCommit.builder()
                        .before(pending.getCommitBase())
                        .after(pending.getCommitTarget())
                        .latest(current)
                        .profile(record.getProfile())
                        .build();
            }
            return LedgerCommit.builder()
                    .before(current)
                    .after(current)
                    .latest(current)
                    .profile(record.getProfile())
                    .duplicate(true)
                    .build();
        }

        Instant now = clock.instant();
        XpEvent event = XpEvent.builder()
                .id(command.getEventId())
                .eventKind(command.getEventKind())
                .xpAmount(command.getAmount())
                .timestamp(now)
                .subjectRef(command.getSubjectRef())
                .details(command.getDetails())
                .build();

        List<XpEvent> history = new ArrayList<>(current.getHistory().size() + 1);
        history.add(event);
        history.addAll(current.getHistory());
        long newXp = current.getCurrentXp() + command.getAmount();

        UserXpState next = current.toBuilder()
                .currentXp(newXp)
                .level(LevelCalculator.level(newXp))
                .history(List.copyOf(history))
                .weeklyXp(aggregator.weeklyXp(history, now))
                .lastUpdate(now)
                .build();

        if (!pending.beginCommit()) {
            throw new CancellationException("Award " + command.getEventId() + " cancelled");
        }
        pending.recordCommitAttempt(current, next);
        UserXpState committed = ledgerStore.commit(next)
                .orElseThrow(() -> {
                    meterRegistry.counter("gamification.award.conflict").increment();
                    return new LedgerConflictException(command.getUserId(), current.getVersion());
                });
        return LedgerCommit.builder()
                .before(current)
                .after(committed)
                .latest(committed)
                .profile(record.getProfile())
                .build();
    }

    private AwardReceipt afterCommit(AwardCommand command, LedgerCommit commit) {
        UserXpState before = commit.before;
        UserXpState after = commit.after;

        if (commit.duplicate) {
            meterRegistry.counter("gamification.award.duplicate").increment();
            log.info("XP award already recorded, skipping: userId={}, eventId={}", command.getUserId(), command.getEventId());
            return receipt(command, after, after, true, List.of());
        }

        String periodKey = periodKeys.periodKey(after.getLastUpdate());
        try {
            projector.project(commit.latest, commit.profile, periodKey);
        } catch (RuntimeException e) {
            log.warn("Leaderboard projection failed after ledger commit: userId={}, periodKey={}, error={}",
                    command.getUserId(), periodKey, e.getMessage());
            reconciler.enqueue(command.getUserId(), periodKey, e.getMessage());
        }

        boolean leveledUp = LevelCalculator.crossesLevel(before.getCurrentXp(), after.getCurrentXp());
        List<Milestone> milestones = milestoneDetector.detect(before, after);
        if (leveledUp) {
            log.info("Level up: userId={}, level={} -> {}", command.getUserId(), before.getLevel(), after.getLevel());
            eventPublisher.publish(LevelUpEvent.builder()
                    .eventId(UUID.randomUUID().toString())
                    .userId(command.getUserId())
                    .timestamp(after.getLastUpdate())
                    .newLevel(after.getLevel())
                    .build());
        }
        publishGained(command, after);
        for (Milestone milestone : milestones) {
            eventPublisher.publish(MilestoneReachedEvent.builder()
                    .eventId(UUID.randomUUID().toString())
                    .userId(command.getUserId())
                    .timestamp(after.getLastUpdate())
                    .milestone(milestone)
                    .build());
        }

        meterRegistry.counter("gamification.award.recorded", "event_kind", kindTag(command)).increment();
        log.info("Awarded XP: userId={}, amount={}, eventKind={}, xp={}, level={}, eventId={}",
                command.getUserId(), command.getAmount(), command.getEventKind(),
                after.getCurrentXp(), after.getLevel(), command.getEventId());
        return receipt(command, before, after, false, milestones);
    }

    private void publishGained(AwardCommand command, UserXpState after) {
        eventPublisher.publish(XpGainedEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .userId(command.getUserId())
                .timestamp(after.getLastUpdate())
                .amount(command.getAmount())
                .eventKind(command.getEventKind())
                .build());
    }

    private AwardFailedException failed(AwardCommand command, GamificationException cause) {
        meterRegistry.counter("gamification.award.failed", "reason", cause.getErrorCode()).increment();
        log.error("XP award not recorded: userId={}, eventId={}, amount={}, errorCode={}, error={}",
                command.getUserId(), command.getEventId(), command.getAmount(), cause.getErrorCode(), cause.getMessage());
        AwardFailedException failure = new AwardFailedException(command.getUserId(), command.getEventId(), cause);
        eventPublisher.publish(AwardFailedEvent.builder()
                .eventId(failure.getErrorId())
                .userId(command.getUserId())
                .timestamp(clock.instant())
                .awardEventId(command.getEventId())
                .amount(command.getAmount())
                .eventKind(command.getEventKind())
                .errorCode(cause.getErrorCode())
                .reason(cause.getMessage())
                .build());
        return failure;
    }

    private static AwardReceipt receipt(AwardCommand command, UserXpState before, UserXpState after,
                                        boolean duplicate, List<Milestone> milestones) {
        return AwardReceipt.builder()
                .eventId(command.getEventId())
                .userId(command.getUserId())
                .amount(command.getAmount())
                .eventKind(command.getEventKind())
                .previousXp(before.getCurrentXp())
                .newXp(after.getCurrentXp())
                .newLevel(after.getLevel())
                .leveledUp(LevelCalculator.crossesLevel(before.getCurrentXp(), after.getCurrentXp()))
                .duplicate(duplicate)
                .committedAt(after.getLastUpdate())
                .milestones(milestones)
                .build();
    }

    public static AwardCommand normalize(AwardCommand command) {
        if (command.getEventId() != null && !command.getEventId().isBlank()) {
            return command;
        }
        return command.toBuilder().eventId(UUID.randomUUID().toString()).build();
    }

    private static String kindTag(AwardCommand command) {
        return command.getEventKind() == null ? "unknown" : command.getEventKind();
    }

    @Builder
    private static class LedgerCommit {
        private final UserXpState before;
        private final UserXpState after;
        private final UserXpState latest;
        private final UserProfile profile;
        private final boolean duplicate;
    }
}
