package com.planit.gamification.service;

import com.planit.gamification.domain.AwardReceipt;
import com.planit.gamification.domain.UserXpState;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle on an award that has been submitted but may not have run yet.
 *
 * <p>{@link #cancel()} only succeeds until the coordinator starts the commit write; from
 * then on the award is final and cancel returns {@code false}.
 */
public class PendingAward {

    public enum Phase {
        PENDING,
        COMMITTING,
        CANCELLED,
        COMPLETED,
        FAILED
    }

    private final String userId;
    private final String eventId;
    private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.PENDING);
    private final CompletableFuture<AwardReceipt> result = new CompletableFuture<>();
    private volatile UserXpState commitBase;
    private volatile UserXpState commitTarget;

    public PendingAward(String userId, String eventId) {
        this.userId = userId;
        this.eventId = eventId;
    }

    public boolean cancel() {
        if (phase.compareAndSet(Phase.PENDING, Phase.CANCELLED)) {
            result.cancel(false);
            return true;
        }
        return false;
    }

    /**
     * Moves to {@link Phase#COMMITTING}. Returns {@code false} if the award was cancelled
     * first; repeated calls during conflict retries keep returning {@code true}.
     */
    boolean beginCommit() {
        return phase.compareAndSet(Phase.PENDING, Phase.COMMITTING) || phase.get() == Phase.COMMITTING;
    }

    /**
     * Remembers the state the latest commit write read and the state it wrote, so a retry
     * that finds the write already applied can still report the transition.
     */
    void recordCommitAttempt(UserXpState base, UserXpState target) {
        this.commitBase = base;
        this.commitTarget = target;
    }

    UserXpState getCommitBase() {
        return commitBase;
    }

    UserXpState getCommitTarget() {
        return commitTarget;
    }

    void complete(AwardReceipt receipt) {
        phase.set(Phase.COMPLETED);
        result.complete(receipt);
    }

    void fail(Throwable error) {
        if (phase.get() != Phase.CANCELLED) {
            phase.set(Phase.FAILED);
        }
        result.completeExceptionally(error);
    }

    /**
     * Completion of the award. Cancelling the returned future does not cancel the award.
     */
    public CompletableFuture<AwardReceipt> result() {
        return result.copy();
    }

    public String getUserId() {
        return userId;
    }

    public String getEventId() {
        return eventId;
    }

    public Phase getPhase() {
        return phase.get();
    }

    public boolean isCancelled() {
        return phase.get() == Phase.CANCELLED;
    }

    boolean hasStartedCommit() {
        Phase current = phase.get();
        return current == Phase.COMMITTING || current == Phase.COMPLETED;
    }
}
