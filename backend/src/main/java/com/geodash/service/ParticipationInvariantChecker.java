package com.geodash.service;

import com.geodash.model.ParticipantStatus;
import com.geodash.model.Race;
import com.geodash.repository.RaceRepository;
import com.geodash.web.RaceParticipationConflictException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * A user holds at most one ongoing participation: a non-withdrawn entry in a race that has not
 * ended yet. Completed participations still count until their race ends.
 */
@Component
@RequiredArgsConstructor
public class ParticipationInvariantChecker {

    private final RaceRepository raceRepository;

    public Optional<Race> findConflictingRace(UUID userId, UUID joiningRaceId, OffsetDateTime now) {
        return raceRepository.findOngoingRacesForUser(userId, ParticipantStatus.WITHDRAWN, now).stream()
                .filter(race -> !race.getRaceId().equals(joiningRaceId))
                .findFirst();
    }

    public void requireNoOngoingParticipation(UUID userId, UUID joiningRaceId, OffsetDateTime now) {
        Optional<Race> conflicting = findConflictingRace(userId, joiningRaceId, now);
        if (conflicting.isPresent()) {
            Race race = conflicting.get();
            throw RaceParticipationConflictException.concurrentParticipation(
                    new RaceParticipationConflictException.ConflictingRace(
                            race.getRaceId(),
                            race.getName(),
                            race.getStartDate(),
                            race.getEndDate()
                    )
            );
        }
    }
}
