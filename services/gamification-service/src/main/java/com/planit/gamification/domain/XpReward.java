package com.planit.gamification.domain;

/**
 * Standard XP amounts for the actions the app rewards.
 */
public enum XpReward {

    VISIT_PLACE(50, "Visited Place"),
    FIRST_VISIT(75, "First Visit"),
    COMPLETE_MISSION(200, "Completed Mission"),
    ADD_REVIEW(30, "Added Review"),
    SHARE_PLACE(25, "Shared Place"),
    CHECK_IN(15, "Checked In"),
    WEEKLY_STREAK(100, "Weekly Streak"),
    MONTHLY_BONUS(500, "Monthly Bonus");

    private final int xp;
    private final String eventKind;

    XpReward(int xp, String eventKind) {
        this.xp = xp;
        this.eventKind = eventKind;
    }

    public int getXp() {
        return xp;
    }

    public String getEventKind() {
        return eventKind;
    }
}
