package com.planit.gamification.exception;

import org.springframework.http.HttpStatus;

/**
 * The ledger document changed between read and conditional write.
 */
public class LedgerConflictException extends GamificationException {

    private final String userId;
    private final long expectedVersion;

    public LedgerConflictException(String userId, long expectedVersion) {
        super("LEDGER_CONFLICT",
                "Ledger of user " + userId + " changed since version " + expectedVersion,
                HttpStatus.CONFLICT, null);
        this.userId = userId;
        this.expectedVersion = expectedVersion;
    }

    public String getUserId() {
        return userId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
