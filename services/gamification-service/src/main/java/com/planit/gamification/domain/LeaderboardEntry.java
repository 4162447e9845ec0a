package com.planit.gamification.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Denormalized projection of a user's ledger for one leaderboard period.
 *
 * <p>Keyed by {@code periodKey + "_" + userId}. Rank is not part of the entry; it is assigned
 * at query time (see {@link RankedEntry}).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardEntry {

    private String userId;

    private String username;

    private String displayName;

    private long currentXp;

    private int level;

    private String avatarRef;

    private Instant lastUpdated;

    private String periodKey;

    public String documentId() {
        return documentId(periodKey, userId);
    }

    public static String documentId(String periodKey, String userId) {
        return periodKey + "_" + userId;
    }

    public String nameForDisplay() {
        return displayName == null || displayName.isBlank() ? username : displayName;
    }
}
