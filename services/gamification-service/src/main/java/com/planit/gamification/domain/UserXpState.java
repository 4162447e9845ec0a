package com.planit.gamification.domain;

import com.planit.gamification.level.LevelCalculator;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of one user's XP ledger document.
 *
 * <p>Snapshots are replaced wholesale, never patched field by field. {@code version} is the
 * store version the snapshot was read at and is used as the compare-and-set token for the
 * next write; {@code 0} means the ledger document does not exist yet.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
@EqualsAndHashCode
@ToString(exclude = "history")
public final class UserXpState {

    private final String userId;

    private final long currentXp;

    private final int level;

    /** Newest first. */
    @Builder.Default
    private final List<XpEvent> history = List.of();

    private final long weeklyXp;

    private final Instant lastUpdate;

    private final long version;

    public static UserXpState empty(String userId) {
        return UserXpState.builder()
                .userId(userId)
                .currentXp(0)
                .level(1)
                .history(List.of())
                .weeklyXp(0)
                .version(0)
                .build();
    }

    public boolean exists() {
        return version > 0;
    }

    public boolean containsEvent(String eventId) {
        return history.stream().anyMatch(event -> event.hasId(eventId));
    }

    public long xpToNextLevel() {
        return LevelCalculator.xpToNextLevel(currentXp, level);
    }

    public double progressToNextLevel() {
        return LevelCalculator.progressToNextLevel(currentXp, level);
    }
}
