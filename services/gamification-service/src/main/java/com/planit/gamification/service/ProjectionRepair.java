package com.planit.gamification.service;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * A leaderboard entry known to lag its ledger, waiting to be rewritten.
 */
@Getter
@ToString
public class ProjectionRepair {

    private final String userId;
    private final String periodKey;
    private final Instant enqueuedAt;
    private int attempts;
    private Instant nextAttemptAt;
    private String lastError;

    public ProjectionRepair(String userId, String periodKey, Instant enqueuedAt, String reason) {
        this.userId = userId;
        this.periodKey = periodKey;
        this.enqueuedAt = enqueuedAt;
        this.nextAttemptAt = enqueuedAt;
        this.lastError = reason;
    }

    public String key() {
        return key(userId, periodKey);
    }

    public static String key(String userId, String periodKey) {
        return periodKey + "_" + userId;
    }

    public boolean isDue(Instant now) {
        return !nextAttemptAt.isAfter(now);
    }

    /**
     * Exponential backoff from {@code initialBackoff}, doubling per failure, capped at
     * {@code maxBackoff}.
     */
    public synchronized void recordFailure(Instant now, Duration initialBackoff, Duration maxBackoff, String error) {
        attempts++;
        lastError = error;
        long factor = 1L << Math.min(attempts - 1, 20);
        Duration backoff = initialBackoff.multipliedBy(factor);
        if (backoff.compareTo(maxBackoff) > 0) {
            backoff = maxBackoff;
        }
        nextAttemptAt = now.plus(backoff);
    }
}
