package com.geodash.model;

public record ProgressionSnapshot(
        int level,
        long totalXp,
        long currentLevelXp,
        long nextLevelXp,
        long inLevelXp,
        long xpToNextLevel,
        double progress
) {
}
