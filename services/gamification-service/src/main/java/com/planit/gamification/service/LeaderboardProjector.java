package com.planit.gamification.service;

import com.planit.gamification.domain.LeaderboardEntry;
import com.planit.gamification.domain.UserProfile;
import com.planit.gamification.domain.UserXpState;
import com.planit.gamification.ledger.LedgerStoreAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Writes the leaderboard projection of a ledger state for one period.
 *
 * <p>Writers race on the entry; an entry already showing more XP than the projection is
 * left alone so a late writer cannot roll the leaderboard back.
 */
@Slf4j
@RequiredArgsConstructor
public class LeaderboardProjector {

    private final LedgerStoreAdapter ledgerStore;

    public LeaderboardEntry entryFor(UserXpState state, UserProfile profile, String periodKey) {
        return LeaderboardEntry.builder()
                .userId(state.getUserId())
                .username(profile.getUsername())
                .displayName(profile.getDisplayName())
                .currentXp(state.getCurrentXp())
                .level(state.getLevel())
                .avatarRef(profile.getPhotoUrl())
                .lastUpdated(state.getLastUpdate())
                .periodKey(periodKey)
                .build();
    }

    /**
     * @return {@code true} if the entry was written, {@code false} if a newer one was kept
     */
    public boolean project(UserXpState state, UserProfile profile, String periodKey) {
        LeaderboardEntry entry = entryFor(state, profile, periodKey);
        Optional<LeaderboardEntry> existing = ledgerStore.findLeaderboardEntry(periodKey, state.getUserId());
        if (existing.isPresent() && existing.get().getCurrentXp() > entry.getCurrentXp()) {
            log.debug("Leaderboard entry already ahead of projection: userId={}, periodKey={}, stored={}, projected={}",
                    state.getUserId(), periodKey, existing.get().getCurrentXp(), entry.getCurrentXp());
            return false;
        }
        ledgerStore.upsertLeaderboardEntry(entry);
        return true;
    }
}
