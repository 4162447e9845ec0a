package com.planit.gamification.exception;

import org.springframework.http.HttpStatus;

/**
 * An award could not be recorded. Nothing was written to the ledger; retrying with the same
 * event id is safe.
 */
public class AwardFailedException extends GamificationException {

    private final String userId;
    private final String eventId;

    public AwardFailedException(String userId, String eventId, Throwable cause) {
        super("AWARD_FAILED",
                "XP award " + eventId + " for user " + userId + " was not recorded",
                HttpStatus.SERVICE_UNAVAILABLE, cause);
        this.userId = userId;
        this.eventId = eventId;
    }

    public String getUserId() {
        return userId;
    }

    public String getEventId() {
        return eventId;
    }
}
