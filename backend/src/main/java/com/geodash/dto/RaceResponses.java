package com.geodash.dto;

import com.geodash.model.FinishStatus;
import com.geodash.model.ParticipantStatus;
import com.geodash.model.RaceStatus;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class RaceResponses {

    private RaceResponses() {
    }

    public record GeoPoint(
            double latitude,
            double longitude,
            String address
    ) {
    }

    public record FinishState(
            FinishStatus status,
            UUID winnerUserId,
            UUID provisionalWinnerUserId,
            OffsetDateTime provisionalAt,
            OffsetDateTime confirmationWindowEndsAt,
            UUID finalWinnerUserId,
            OffsetDateTime finalizedAt,
            long confirmationWindowMs
    ) {
    }

    public record RaceSummary(
            UUID raceId,
            String name,
            String description,
            RaceStatus status,
            GeoPoint startPoint,
            GeoPoint endPoint,
            OffsetDateTime startDate,
            OffsetDateTime endDate,
            double distance,
            int participantCount,
            FinishState finishState,
            UUID createdBy,
            OffsetDateTime createdAt
    ) {
    }

    public record RaceDetail(
            UUID raceId,
            String name,
            String description,
            RaceStatus status,
            GeoPoint startPoint,
            GeoPoint endPoint,
            OffsetDateTime startDate,
            OffsetDateTime endDate,
            double distance,
            List<Participant> participants,
            FinishState finishState,
            UUID createdBy,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {
    }

    public record Participant(
            UUID userId,
            String displayName,
            String avatarUrl,
            OffsetDateTime joinedAt,
            ParticipantStatus status,
            OffsetDateTime completedAt,
            double totalDistance,
            List<DailyDistance> dailyDistances
    ) {
    }

    public record RaceDeleted(
            String message,
            UUID raceId
    ) {
    }

    public record DailyDistance(
            LocalDate date,
            double distance
    ) {
    }
}
