package com.geodash.model;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "races")
public class Race {

    @Id
    @Column(name = "race_id", nullable = false, updatable = false)
    private UUID raceId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "start_latitude", nullable = false)
    private double startLatitude;

    @Column(name = "start_longitude", nullable = false)
    private double startLongitude;

    @Column(name = "start_address")
    private String startAddress;

    @Column(name = "end_latitude", nullable = false)
    private double endLatitude;

    @Column(name = "end_longitude", nullable = false)
    private double endLongitude;

    @Column(name = "end_address")
    private String endAddress;

    @Column(name = "start_date", nullable = false)
    private OffsetDateTime startDate;

    @Column(name = "end_date", nullable = false)
    private OffsetDateTime endDate;

    @Column(name = "created_by")
    private UUID createdBy;

    @Embedded
    private FinishResolution finishResolution = new FinishResolution();

    @OneToMany(mappedBy = "race", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("joinedAt ASC")
    private List<RaceParticipant> participants = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = TimeSupport.utcNow();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = TimeSupport.utcNow();

    /**
     * Hibernate leaves an embedded value null when all of its columns are null.
     */
    public FinishResolution getFinishResolution() {
        if (finishResolution == null) {
            finishResolution = new FinishResolution();
        }
        return finishResolution;
    }

    /**
     * Great-circle distance between the start and end points, in kilometers. This is the
     * completion threshold for every participant.
     */
    public double getDistanceKm() {
        return GeodesicDistance.haversineKm(startLatitude, startLongitude, endLatitude, endLongitude);
    }

    public RaceStatus statusAt(OffsetDateTime now) {
        return RaceStatus.at(startDate, endDate, now);
    }

    public Optional<RaceParticipant> findParticipant(UUID userId) {
        return participants.stream()
                .filter(participant -> participant.getUserId().equals(userId))
                .findFirst();
    }

    public RaceParticipant addParticipant(UUID userId, OffsetDateTime joinedAt) {
        RaceParticipant participant = new RaceParticipant();
        participant.setParticipantId(UUID.randomUUID());
        participant.setRace(this);
        participant.setUserId(userId);
        participant.setJoinedAt(joinedAt);
        participant.setStatus(ParticipantStatus.ACTIVE);
        participant.setTotalDistance(0.0);
        participants.add(participant);
        return participant;
    }
}
