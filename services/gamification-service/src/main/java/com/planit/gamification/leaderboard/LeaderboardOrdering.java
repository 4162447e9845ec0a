package com.planit.gamification.leaderboard;

import com.planit.gamification.domain.LeaderboardEntry;
import com.planit.gamification.domain.RankedEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranking order: XP descending; on equal XP whoever reached it first (earliest
 * {@code lastUpdated}, unknown last); then user id, so the order never depends on the
 * order the store returned rows in.
 */
public final class LeaderboardOrdering {

    public static final Comparator<LeaderboardEntry> ORDER = Comparator
            .comparingLong(LeaderboardEntry::getCurrentXp).reversed()
            .thenComparing(LeaderboardEntry::getLastUpdated, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(LeaderboardEntry::getUserId, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private LeaderboardOrdering() {
    }

    public static List<RankedEntry> rank(List<LeaderboardEntry> entries) {
        List<LeaderboardEntry> sorted = new ArrayList<>(entries);
        sorted.sort(ORDER);
        List<RankedEntry> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            ranked.add(new RankedEntry(i + 1, sorted.get(i)));
        }
        return ranked;
    }
}
