package com.planit.gamification.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A progress threshold crossed by a single award.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Milestone {

    public enum Type {
        /** Every fifth level. */
        LEVEL,
        /** Fixed cumulative XP thresholds. */
        TOTAL_XP,
        /** Trailing-week XP reaching the weekly target. */
        WEEKLY_XP
    }

    private Type type;

    private long threshold;
}
