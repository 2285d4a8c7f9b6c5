package com.geodash.service;

import com.geodash.model.ParticipantStatus;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.UUID;

/**
 * Sort keys for leaderboards, as explicit comparator chains. Missing timestamps sort last; the
 * user id closes every chain so equal inputs always produce the same order.
 */
public final class LeaderboardOrdering {

    private static final Comparator<String> NAME_ORDER = Comparator.nullsLast(
            String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder()));

    private static final Comparator<OffsetDateTime> MISSING_LAST = Comparator.nullsLast(OffsetDateTime.timeLineOrder());

    /**
     * Total distance desc, completed first, completion time asc, join time asc, display name asc.
     */
    public static final Comparator<RaceStanding> RACE_ORDER = Comparator
            .comparingDouble(RaceStanding::totalDistance).reversed()
            .thenComparingInt(standing -> standing.status() == ParticipantStatus.COMPLETED ? 0 : 1)
            .thenComparing(RaceStanding::completedAt, MISSING_LAST)
            .thenComparing(RaceStanding::joinedAt, MISSING_LAST)
            .thenComparing(RaceStanding::displayName, NAME_ORDER)
            .thenComparing(standing -> standing.userId().toString());

    /**
     * Total distance desc, final wins desc, name asc.
     */
    public static final Comparator<GlobalStanding> GLOBAL_ORDER = Comparator
            .comparingDouble(GlobalStanding::totalKm).reversed()
            .thenComparing(Comparator.comparingInt(GlobalStanding::wins).reversed())
            .thenComparing(GlobalStanding::name, NAME_ORDER)
            .thenComparing(standing -> standing.userId().toString());

    private LeaderboardOrdering() {
    }

    public record RaceStanding(
            UUID userId,
            String displayName,
            double totalDistance,
            ParticipantStatus status,
            OffsetDateTime completedAt,
            OffsetDateTime joinedAt
    ) {
    }

    public record GlobalStanding(
            UUID userId,
            String name,
            double totalKm,
            int races,
            int wins
    ) {
    }
}
