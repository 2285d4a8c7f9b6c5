package com.geodash.service;

import com.geodash.model.ProgressionSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProgressionModelTest {

    @Test
    void thresholdsFollowPowerCurve() {
        assertEquals(0L, ProgressionModel.xpThreshold(0));
        assertEquals(0L, ProgressionModel.xpThreshold(1));
        assertEquals(100L, ProgressionModel.xpThreshold(2));
        assertEquals(282L, ProgressionModel.xpThreshold(3));
        assertEquals(519L, ProgressionModel.xpThreshold(4));
        assertEquals(1118L, ProgressionModel.xpThreshold(6));
    }

    @Test
    void levelFromXpHitsBoundariesExactly() {
        assertEquals(1, ProgressionModel.levelFromXp(-5));
        assertEquals(1, ProgressionModel.levelFromXp(0));
        assertEquals(1, ProgressionModel.levelFromXp(99));
        assertEquals(2, ProgressionModel.levelFromXp(100));
        assertEquals(2, ProgressionModel.levelFromXp(281));
        assertEquals(3, ProgressionModel.levelFromXp(282));
        assertEquals(3, ProgressionModel.levelFromXp(518));
        assertEquals(4, ProgressionModel.levelFromXp(519));
    }

    @Test
    void levelIsBracketedByThresholdsAcrossRange() {
        for (long xp = 0; xp <= 50_000; xp += 7) {
            int level = ProgressionModel.levelFromXp(xp);
            assertTrue(ProgressionModel.xpThreshold(level) <= xp, "lower bound at " + xp);
            assertTrue(xp < ProgressionModel.xpThreshold(level + 1), "upper bound at " + xp);
        }
    }

    @Test
    void hugeXpTotalsResolveWithoutWalkingEveryLevel() {
        long xp = 1_000_000_000_000_000L;
        int level = assertTimeoutPreemptively(Duration.ofSeconds(2), () -> ProgressionModel.levelFromXp(xp));
        assertTrue(level > 400_000_000, "level " + level);
        assertTrue(ProgressionModel.xpThreshold(level) <= xp);
        assertTrue(xp < ProgressionModel.xpThreshold(level + 1));

        assertEquals(ProgressionModel.MAX_LEVEL, assertTimeoutPreemptively(Duration.ofSeconds(2),
                () -> ProgressionModel.levelFromXp(Long.MAX_VALUE)));
    }

    @Test
    void snapshotDescribesPositionInsideLevel() {
        ProgressionSnapshot snapshot = ProgressionModel.snapshot(110);

        assertEquals(2, snapshot.level());
        assertEquals(110L, snapshot.totalXp());
        assertEquals(100L, snapshot.currentLevelXp());
        assertEquals(282L, snapshot.nextLevelXp());
        assertEquals(10L, snapshot.inLevelXp());
        assertEquals(172L, snapshot.xpToNextLevel());
        assertEquals(0.0549, snapshot.progress(), 1e-9);
    }

    @Test
    void snapshotAtZeroXp() {
        ProgressionSnapshot snapshot = ProgressionModel.snapshot(0);

        assertEquals(1, snapshot.level());
        assertEquals(0L, snapshot.currentLevelXp());
        assertEquals(100L, snapshot.nextLevelXp());
        assertEquals(100L, snapshot.xpToNextLevel());
        assertEquals(0.0, snapshot.progress(), 1e-9);
    }

    @Test
    void xpForDistanceFloorsAndIgnoresNonPositiveGain() {
        assertEquals(110L, ProgressionModel.xpForDistance(11.0, 10));
        assertEquals(12L, ProgressionModel.xpForDistance(1.29, 10));
        assertEquals(0L, ProgressionModel.xpForDistance(0.0, 10));
        assertEquals(0L, ProgressionModel.xpForDistance(-3.0, 10));
        assertEquals(0L, ProgressionModel.xpForDistance(Double.NaN, 10));
        assertEquals(0L, ProgressionModel.xpForDistance(5.0, 0));
    }
}
