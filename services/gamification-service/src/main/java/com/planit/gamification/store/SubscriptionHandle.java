package com.planit.gamification.store;

/**
 * A live change subscription. {@link #cancel()} is idempotent.
 */
public interface SubscriptionHandle extends AutoCloseable {

    void cancel();

    boolean isActive();

    @Override
    default void close() {
        cancel();
    }
}
