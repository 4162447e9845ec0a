package com.planit.gamification.exception;

import org.springframework.http.HttpStatus;

public class SessionClosedException extends GamificationException {

    public SessionClosedException(String userId) {
        super("SESSION_CLOSED", "Session of user " + userId + " is closed", HttpStatus.GONE, null);
    }
}
