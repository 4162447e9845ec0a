package com.planit.gamification.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Base exception for the gamification service.
 *
 * <p>Carries a stable error code for the error channel and an HTTP status for the REST
 * surface. Unique error ids let a failed award be correlated between the log and the
 * {@code award-failed} signal.
 */
@Getter
public class GamificationException extends RuntimeException {

    private final String errorId;
    private final String errorCode;
    private final HttpStatus status;
    private final Instant timestamp;

    public GamificationException(String errorCode, String message) {
        this(errorCode, message, HttpStatus.INTERNAL_SERVER_ERROR, null);
    }

    public GamificationException(String errorCode, String message, Throwable cause) {
        this(errorCode, message, HttpStatus.INTERNAL_SERVER_ERROR, cause);
    }

    public GamificationException(String errorCode, String message, HttpStatus status, Throwable cause) {
        super(message, cause);
        this.errorId = UUID.randomUUID().toString();
        this.errorCode = errorCode;
        this.status = status;
        this.timestamp = Instant.now();
    }
}
