package com.geodash.repository;

import com.geodash.model.ParticipantStatus;
import com.geodash.model.Race;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RaceRepository extends JpaRepository<Race, UUID>, RaceLockingRepository {

    List<Race> findAllByOrderByStartDateDesc();

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from Race r where r.raceId = :raceId")
    Optional<Race> findByRaceIdForUpdate(@Param("raceId") UUID raceId);

    /**
     * Participations other than {@code excludedStatus} in races whose time window contains
     * {@code now}, latest join first. Only scalar columns are selected, so no race enters the
     * persistence context before the caller takes its write lock.
     */
    @Query("""
            select new com.geodash.repository.ParticipationRef(r.raceId, p.joinedAt)
            from Race r join r.participants p
            where p.userId = :userId
              and p.status <> :excludedStatus
              and p.joinedAt is not null
              and r.startDate <= :now
              and r.endDate >= :now
            order by p.joinedAt desc
            """)
    List<ParticipationRef> findInProgressParticipations(
            @Param("userId") UUID userId,
            @Param("excludedStatus") ParticipantStatus excludedStatus,
            @Param("now") OffsetDateTime now
    );

    /**
     * Races that have not ended yet in which the user holds a participation with a status other
     * than {@code excludedStatus}.
     */
    @Query("""
            select distinct r from Race r join r.participants p
            where p.userId = :userId
              and p.status <> :excludedStatus
              and r.endDate >= :now
            order by r.startDate asc
            """)
    List<Race> findOngoingRacesForUser(
            @Param("userId") UUID userId,
            @Param("excludedStatus") ParticipantStatus excludedStatus,
            @Param("now") OffsetDateTime now
    );

    @Query("select distinct r from Race r join r.participants p where p.userId = :userId")
    List<Race> findRacesForUser(@Param("userId") UUID userId);
}
