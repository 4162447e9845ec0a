package com.planit.gamification.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A leaderboard entry with the 1-based rank it was given by one query.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RankedEntry {

    private int rank;

    private LeaderboardEntry entry;

    public String getUserId() {
        return entry.getUserId();
    }
}
