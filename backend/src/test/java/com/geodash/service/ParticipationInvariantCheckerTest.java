package com.geodash.service;

import com.geodash.model.ParticipantStatus;
import com.geodash.model.Race;
import com.geodash.repository.RaceRepository;
import com.geodash.web.RaceParticipationConflictException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ParticipationInvariantCheckerTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000501");
    private static final OffsetDateTime NOW = RaceFixtures.NOW;

    @Mock
    private RaceRepository raceRepository;

    @InjectMocks
    private ParticipationInvariantChecker participationInvariantChecker;

    @Test
    void otherOngoingRaceIsAConflict() {
        Race joining = RaceFixtures.race("Joining", 5.0, NOW.plusDays(1), NOW.plusDays(3));
        Race ongoing = RaceFixtures.activeRace("Ongoing", 8.0);
        when(raceRepository.findOngoingRacesForUser(USER_ID, ParticipantStatus.WITHDRAWN, NOW))
                .thenReturn(List.of(joining, ongoing));

        RaceParticipationConflictException ex = assertThrows(RaceParticipationConflictException.class,
                () -> participationInvariantChecker.requireNoOngoingParticipation(USER_ID, joining.getRaceId(), NOW));

        assertEquals("concurrent_participation", ex.getCode());
        assertEquals(ongoing.getRaceId(), ex.getConflictingRace().id());
        assertEquals("Ongoing", ex.getConflictingRace().name());
        assertEquals(ongoing.getEndDate(), ex.getConflictingRace().endDate());
    }

    @Test
    void joiningRaceItselfIsNotAConflict() {
        Race joining = RaceFixtures.activeRace("Joining", 5.0);
        when(raceRepository.findOngoingRacesForUser(USER_ID, ParticipantStatus.WITHDRAWN, NOW))
                .thenReturn(List.of(joining));

        assertDoesNotThrow(
                () -> participationInvariantChecker.requireNoOngoingParticipation(USER_ID, joining.getRaceId(), NOW));
    }

    @Test
    void noOngoingParticipationMeansNoConflict() {
        when(raceRepository.findOngoingRacesForUser(USER_ID, ParticipantStatus.WITHDRAWN, NOW))
                .thenReturn(List.of());

        assertEquals(Optional.empty(),
                participationInvariantChecker.findConflictingRace(USER_ID, UUID.randomUUID(), NOW));
    }
}
