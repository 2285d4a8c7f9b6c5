package com.geodash.service;

import com.geodash.model.ProgressionSnapshot;

/**
 * XP and level arithmetic.
 *
 * Level thresholds: level 1 starts at 0 XP, level L (L &ge; 2) starts at
 * {@code floor(100 * (L - 1)^1.5)} XP.
 */
public final class ProgressionModel {

    public static final int DEFAULT_XP_PER_KM = 10;

    /**
     * Highest reachable level; keeps {@code level + 1} representable.
     */
    public static final int MAX_LEVEL = Integer.MAX_VALUE - 1;

    private ProgressionModel() {
    }

    public static long xpThreshold(int level) {
        if (level <= 1) {
            return 0L;
        }
        return (long) Math.floor(100.0 * Math.pow(level - 1, 1.5));
    }

    /**
     * Greatest level whose threshold does not exceed {@code totalXp}. Always at least 1.
     */
    public static int levelFromXp(long totalXp) {
        if (totalXp <= 0) {
            return 1;
        }
        // Start near the inverse of the threshold curve, then correct for floating point drift.
        long estimate = (long) Math.floor(Math.pow(totalXp / 100.0, 2.0 / 3.0)) + 1;
        int level = (int) Math.max(1L, Math.min(MAX_LEVEL, estimate));
        while (level > 1 && xpThreshold(level) > totalXp) {
            level--;
        }
        while (level < MAX_LEVEL && xpThreshold(level + 1) <= totalXp) {
            level++;
        }
        return level;
    }

    public static ProgressionSnapshot snapshot(long totalXp) {
        int level = levelFromXp(totalXp);
        long currentLevelXp = xpThreshold(level);
        long nextLevelXp = xpThreshold(level + 1);
        long inLevelXp = totalXp - currentLevelXp;
        long needed = Math.max(1L, nextLevelXp - currentLevelXp);
        return new ProgressionSnapshot(
                level,
                totalXp,
                currentLevelXp,
                nextLevelXp,
                inLevelXp,
                Math.max(0L, nextLevelXp - totalXp),
                NumericRounding.round((double) inLevelXp / needed, 4)
        );
    }

    /**
     * XP awarded for a confirmed distance gain. Non-positive or non-finite gains award nothing.
     */
    public static long xpForDistance(double deltaKm, int xpPerKm) {
        if (!Double.isFinite(deltaKm) || deltaKm <= 0 || xpPerKm <= 0) {
            return 0L;
        }
        return (long) Math.floor(deltaKm * xpPerKm);
    }
}
