package com.planit.gamification.leaderboard;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Which users a ranking covers: the top of the whole period, or an explicit id set.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class LeaderboardScope {

    public enum Kind {
        GLOBAL,
        FRIENDS
    }

    private final Kind kind;
    private final int limit;
    private final Set<String> userIds;

    public static LeaderboardScope global(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Leaderboard limit must be positive: " + limit);
        }
        return new LeaderboardScope(Kind.GLOBAL, limit, Set.of());
    }

    public static LeaderboardScope friends(Iterable<String> userIds) {
        Set<String> ids = new LinkedHashSet<>();
        for (String userId : userIds) {
            if (userId != null && !userId.isBlank()) {
                ids.add(userId);
            }
        }
        return new LeaderboardScope(Kind.FRIENDS, 0, ids);
    }
}
