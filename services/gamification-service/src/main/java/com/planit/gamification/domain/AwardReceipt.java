package com.planit.gamification.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a committed award.
 *
 * <p>{@code duplicate} is set when the event id was already in the ledger; in that case
 * nothing was written and the XP/level fields describe the ledger as found.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AwardReceipt {

    private String eventId;

    private String userId;

    private int amount;

    private String eventKind;

    private long previousXp;

    private long newXp;

    private int newLevel;

    private boolean leveledUp;

    private boolean duplicate;

    private Instant committedAt;

    @Builder.Default
    private List<Milestone> milestones = List.of();
}
