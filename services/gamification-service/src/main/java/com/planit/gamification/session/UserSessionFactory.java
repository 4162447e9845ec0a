package com.planit.gamification.session;

import com.planit.gamification.ledger.LedgerStoreAdapter;
import com.planit.gamification.service.AwardCoordinator;
import com.planit.gamification.sync.LiveSyncController;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
@RequiredArgsConstructor
public class UserSessionFactory {

    private final LedgerStoreAdapter ledgerStore;
    private final AwardCoordinator coordinator;
    private final Clock clock;

    /**
     * Opens a session with live sync already started.
     */
    public UserSession open(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "xp-award-" + userId);
            thread.setDaemon(true);
            return thread;
        });
        UserSession session = new UserSession(userId, new LiveSyncController(userId, ledgerStore), coordinator, executor, clock);
        session.start();
        log.info("User session opened: userId={}", userId);
        return session;
    }
}
