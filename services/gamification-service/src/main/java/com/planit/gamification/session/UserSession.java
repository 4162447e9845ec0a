package com.planit.gamification.session;

import com.planit.gamification.domain.UserXpState;
import com.planit.gamification.exception.SessionClosedException;
import com.planit.gamification.service.AwardCommand;
import com.planit.gamification.service.AwardCoordinator;
import com.planit.gamification.service.PendingAward;
import com.planit.gamification.sync.LiveSyncController;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * One signed-in user on one client: the live view of their ledger plus an ordered award
 * queue.
 *
 * <p>Awards submitted to a session run one at a time in submission order. Awards of
 * different sessions, including two devices of the same user, run concurrently and are
 * serialized by the ledger's optimistic concurrency.
 */
@Slf4j
public class UserSession implements AutoCloseable {

    private final String userId;
    private final LiveSyncController liveSync;
    private final AwardCoordinator coordinator;
    private final ExecutorService awardExecutor;
    private final Clock clock;
    private volatile Instant lastActivity;
    private volatile boolean closed;

    UserSession(String userId,
                LiveSyncController liveSync,
                AwardCoordinator coordinator,
                ExecutorService awardExecutor,
                Clock clock) {
        this.userId = userId;
        this.liveSync = liveSync;
        this.coordinator = coordinator;
        this.awardExecutor = awardExecutor;
        this.clock = clock;
        this.lastActivity = clock.instant();
    }

    /**
     * Queues an award and returns immediately.
     *
     * @throws SessionClosedException if the session has been closed
     */
    public PendingAward submit(AwardCommand command) {
        if (closed) {
            throw new SessionClosedException(userId);
        }
        AwardCommand normalized = AwardCoordinator.normalize(command.toBuilder().userId(userId).build());
        PendingAward pending = new PendingAward(userId, normalized.getEventId());
        markActive();
        try {
            awardExecutor.execute(() -> runAward(normalized, pending));
        } catch (RejectedExecutionException e) {
            throw new SessionClosedException(userId);
        }
        return pending;
    }

    public UserXpState currentState() {
        markActive();
        return liveSync.currentState();
    }

    public Flux<UserXpState> snapshots() {
        return liveSync.snapshots();
    }

    public String getUserId() {
        return userId;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Stops live sync and lets queued awards finish.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        liveSync.close();
        awardExecutor.shutdown();
        try {
            if (!awardExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Awards still running after session close: userId={}", userId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("User session closed: userId={}", userId);
    }

    void start() {
        liveSync.start();
    }

    private void runAward(AwardCommand command, PendingAward pending) {
        if (pending.isCancelled()) {
            return;
        }
        try {
            coordinator.award(command, pending);
        } catch (RuntimeException e) {
            // outcome is delivered through pending.result()
            log.debug("Queued award finished exceptionally: userId={}, eventId={}, error={}",
                    userId, command.getEventId(), e.toString());
        }
    }

    /**
     * Resets the idle timer.
     */
    public void markActive() {
        lastActivity = clock.instant();
    }
}
