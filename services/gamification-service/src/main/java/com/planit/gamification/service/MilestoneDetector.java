package com.planit.gamification.service;

import com.planit.gamification.domain.Milestone;
import com.planit.gamification.domain.UserXpState;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the milestones an award crossed. Each threshold is reported by the one award that
 * crosses it, never again.
 */
public class MilestoneDetector {

    static final long[] XP_THRESHOLDS = {100, 500, 1000, 2500, 5000, 10000};
    static final int LEVEL_STEP = 5;
    static final long WEEKLY_TARGET = 1000;

    public List<Milestone> detect(UserXpState before, UserXpState after) {
        List<Milestone> reached = new ArrayList<>();
        for (int level = before.getLevel() + 1; level <= after.getLevel(); level++) {
            if (level % LEVEL_STEP == 0) {
                reached.add(new Milestone(Milestone.Type.LEVEL, level));
            }
        }
        for (long threshold : XP_THRESHOLDS) {
            if (before.getCurrentXp() < threshold && after.getCurrentXp() >= threshold) {
                reached.add(new Milestone(Milestone.Type.TOTAL_XP, threshold));
            }
        }
        if (before.getWeeklyXp() < WEEKLY_TARGET && after.getWeeklyXp() >= WEEKLY_TARGET) {
            reached.add(new Milestone(Milestone.Type.WEEKLY_XP, WEEKLY_TARGET));
        }
        return reached;
    }
}
