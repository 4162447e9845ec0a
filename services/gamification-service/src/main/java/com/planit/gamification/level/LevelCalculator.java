package com.planit.gamification.level;

/**
 * Level arithmetic over cumulative XP. Every level spans {@value #XP_PER_LEVEL} XP and
 * level 1 starts at zero.
 */
public final class LevelCalculator {

    public static final int XP_PER_LEVEL = 500;

    private LevelCalculator() {
    }

    public static int level(long xp) {
        requireNonNegative(xp);
        return Math.toIntExact(xp / XP_PER_LEVEL + 1);
    }

    public static long xpToNextLevel(long xp, int level) {
        requireNonNegative(xp);
        return (long) level * XP_PER_LEVEL - xp;
    }

    /**
     * Fraction of the current level already earned, in {@code [0, 1)} when {@code level}
     * is the level of {@code xp}.
     */
    public static double progressToNextLevel(long xp, int level) {
        requireNonNegative(xp);
        long earnedInLevel = xp - (long) (level - 1) * XP_PER_LEVEL;
        return (double) earnedInLevel / XP_PER_LEVEL;
    }

    public static boolean crossesLevel(long previousXp, long newXp) {
        return level(newXp) > level(previousXp);
    }

    private static void requireNonNegative(long xp) {
        if (xp < 0) {
            throw new IllegalArgumentException("XP must be non-negative: " + xp);
        }
    }
}
