package com.planit.gamification.sync;

import com.planit.gamification.domain.UserXpState;
import com.planit.gamification.ledger.LedgerStoreAdapter;
import com.planit.gamification.store.DocumentListener;
import com.planit.gamification.store.StoredDocument;
import com.planit.gamification.store.SubscriptionHandle;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps one user's local XP state in step with the remote ledger document.
 *
 * <p>Every change notification carries the whole document and replaces the local state
 * wholesale; there is no incremental patching, so two devices watching the same user
 * converge on the last snapshot they receive. If the ledger document does not exist yet
 * the controller writes the zero ledger, at most once at a time.
 */
@Slf4j
public class LiveSyncController implements AutoCloseable {

    public enum State {
        UNSUBSCRIBED,
        SUBSCRIBED
    }

    private final String userId;
    private final LedgerStoreAdapter ledgerStore;
    private final AtomicReference<UserXpState> current;
    private final AtomicBoolean initializing = new AtomicBoolean();
    private final Sinks.Many<UserXpState> snapshots = Sinks.many().replay().latest();

    private volatile State state = State.UNSUBSCRIBED;
    private SubscriptionHandle subscription;
    private boolean closed;

    public LiveSyncController(String userId, LedgerStoreAdapter ledgerStore) {
        this.userId = userId;
        this.ledgerStore = ledgerStore;
        this.current = new AtomicReference<>(UserXpState.empty(userId));
    }

    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("Live sync for user " + userId + " is closed");
        }
        if (state == State.SUBSCRIBED) {
            return;
        }
        state = State.SUBSCRIBED;
        subscription = ledgerStore.watchLedger(userId, new LedgerListener());
        log.debug("Live XP sync started: userId={}", userId);
    }

    public synchronized void stop() {
        if (state == State.UNSUBSCRIBED) {
            return;
        }
        state = State.UNSUBSCRIBED;
        if (subscription != null) {
            subscription.cancel();
            subscription = null;
        }
        log.debug("Live XP sync stopped: userId={}", userId);
    }

    /**
     * Stops the subscription and completes {@link #snapshots()}.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            stop();
            closed = true;
        }
        synchronized (snapshots) {
            snapshots.tryEmitComplete();
        }
    }

    public UserXpState currentState() {
        return current.get();
    }

    /**
     * Local state snapshots, starting with the latest one for late subscribers.
     */
    public Flux<UserXpState> snapshots() {
        return snapshots.asFlux();
    }

    public State getState() {
        return state;
    }

    public String getUserId() {
        return userId;
    }

    void apply(Optional<StoredDocument> document) {
        UserXpState next = ledgerStore.toState(userId, document);
        synchronized (snapshots) {
            if (!isSubscribed()) {
                return;
            }
            current.set(next);
            Sinks.EmitResult result = snapshots.tryEmitNext(next);
            if (result.isFailure()) {
                log.warn("Dropped XP snapshot: userId={}, version={}, result={}", userId, next.getVersion(), result);
            }
        }
        if (document.isEmpty()) {
            initializeLedger();
        }
    }

    private void initializeLedger() {
        if (!initializing.compareAndSet(false, true)) {
            return;
        }
        try {
            ledgerStore.initializeIfAbsent(userId);
        } catch (RuntimeException e) {
            // retried on the next absent snapshot
            log.warn("Could not initialize XP ledger: userId={}, error={}", userId, e.getMessage());
        } finally {
            initializing.set(false);
        }
    }

    private boolean isSubscribed() {
        return state == State.SUBSCRIBED;
    }

    private class LedgerListener implements DocumentListener {

        @Override
        public void onChange(Optional<StoredDocument> snapshot) {
            apply(snapshot);
        }

        @Override
        public void onError(Throwable error) {
            log.error("XP ledger subscription failed: userId={}", userId, error);
        }
    }
}
