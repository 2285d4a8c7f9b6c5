package com.geodash.model;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "race_participants")
public class RaceParticipant {

    @Id
    @Column(name = "participant_id", nullable = false, updatable = false)
    private UUID participantId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "race_id", nullable = false)
    private Race race;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "joined_at", nullable = false)
    private OffsetDateTime joinedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private ParticipantStatus status = ParticipantStatus.ACTIVE;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "total_distance", nullable = false)
    private double totalDistance;

    @ElementCollection
    @CollectionTable(
            name = "race_participant_daily_distances",
            joinColumns = @JoinColumn(name = "participant_id")
    )
    @OrderBy("day ASC")
    private List<DailyDistanceEntry> dailyDistances = new ArrayList<>();

    public boolean isCompleted() {
        return status == ParticipantStatus.COMPLETED;
    }

    /**
     * Sets the total to the sum of the daily entries. The stored total is never adjusted in place.
     */
    public double recomputeTotalDistance() {
        totalDistance = dailyDistances.stream()
                .mapToDouble(DailyDistanceEntry::getDistanceKm)
                .sum();
        return totalDistance;
    }
}
