package com.planit.gamification.store;

import java.util.Optional;

/**
 * Receives the full current state of a watched document after each change. An empty
 * value means the document does not exist.
 */
@FunctionalInterface
public interface DocumentListener {

    void onChange(Optional<StoredDocument> snapshot);

    default void onError(Throwable error) {
    }
}
