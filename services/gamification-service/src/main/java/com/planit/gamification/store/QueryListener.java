package com.planit.gamification.store;

import java.util.List;

/**
 * Receives the full result of a watched query each time any matching document changes.
 */
@FunctionalInterface
public interface QueryListener {

    void onResults(List<StoredDocument> results);

    default void onError(Throwable error) {
    }
}
