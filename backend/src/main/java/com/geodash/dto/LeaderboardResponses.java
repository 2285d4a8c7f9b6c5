package com.geodash.dto;

import com.geodash.model.ParticipantStatus;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class LeaderboardResponses {

    private LeaderboardResponses() {
    }

    public record RaceRef(
            UUID id,
            String name,
            double distance
    ) {
    }

    public record RaceLeaderboard(
            RaceRef race,
            RaceResponses.FinishState finishState,
            List<RaceEntry> leaderboard
    ) {
    }

    public record RaceEntry(
            int rank,
            UUID userId,
            String displayName,
            String avatarUrl,
            double totalDistance,
            double progress,
            double distanceRemaining,
            ParticipantStatus status,
            OffsetDateTime joinedAt,
            OffsetDateTime completedAt,
            List<RaceResponses.DailyDistance> dailyDistances
    ) {
    }

    public record GlobalLeaderboard(
            List<GlobalEntry> leaderboard
    ) {
    }

    public record GlobalEntry(
            int rank,
            UUID userId,
            String name,
            String email,
            String avatarUrl,
            double totalKm,
            int races,
            int wins
    ) {
    }

    public record UserStats(
            UUID userId,
            String name,
            int racesParticipated,
            int wins,
            double totalKm,
            double winRate
    ) {
    }

    public record UserStatsEnvelope(
            UserStats stats
    ) {
    }
}
