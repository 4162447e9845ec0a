package com.planit.gamification.store;

import com.planit.gamification.exception.GamificationException;

/**
 * The store could not be reached or did not answer. Nothing is known to have been written,
 * so the operation may be retried.
 */
public class StoreUnavailableException extends GamificationException {

    public StoreUnavailableException(String message) {
        super("STORE_UNAVAILABLE", message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super("STORE_UNAVAILABLE", message, cause);
    }
}
