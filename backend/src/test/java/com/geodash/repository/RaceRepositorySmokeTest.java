package com.geodash.repository;

import com.geodash.model.AppUser;
import com.geodash.model.DailyDistanceEntry;
import com.geodash.model.ParticipantStatus;
import com.geodash.model.Race;
import com.geodash.model.RaceParticipant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE, properties = {
        "spring.jpa.hibernate.ddl-auto=validate",
        "spring.flyway.enabled=true",
        "spring.flyway.locations=classpath:db/migration",
})
@Testcontainers(disabledWithoutDocker = true)
@Transactional
class RaceRepositorySmokeTest {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private RaceRepository raceRepository;

    @Autowired
    private AppUserRepository appUserRepository;

    private OffsetDateTime now;

    @BeforeEach
    void isolateRaceTables() {
        jdbcTemplate.execute("""
                TRUNCATE TABLE
                    race_participant_daily_distances,
                    race_participants,
                    races,
                    app_users
                CASCADE
                """);
        now = OffsetDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
    }

    @Test
    void flywayCreatesRaceTables() {
        Integer tableCount = jdbcTemplate.queryForObject(
                """
                        SELECT COUNT(*)
                        FROM information_schema.tables
                        WHERE table_schema = 'public'
                          AND table_name IN ('app_users', 'races', 'race_participants', 'race_participant_daily_distances')
                        """,
                Integer.class
        );
        assertEquals(4, tableCount);
    }

    @Test
    void participantsDailyDistancesAndFinishResolutionRoundTrip() {
        UUID userId = UUID.randomUUID();
        Race race = race("Round trip", now.minusDays(1), now.plusDays(3));
        RaceParticipant participant = race.addParticipant(userId, now.minusHours(5));
        participant.getDailyDistances().add(new DailyDistanceEntry(LocalDate.of(2026, 5, 1), 4.0));
        participant.getDailyDistances().add(new DailyDistanceEntry(LocalDate.of(2026, 5, 2), 7.0));
        participant.recomputeTotalDistance();
        participant.setStatus(ParticipantStatus.COMPLETED);
        participant.setCompletedAt(now);
        race.getFinishResolution().setProvisionalWinnerUserId(userId);
        race.getFinishResolution().setProvisionalAt(now);
        race.getFinishResolution().setConfirmationWindowEndsAt(now.plusSeconds(90));
        raceRepository.saveAndFlush(race);

        Integer dailyRows = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM race_participant_daily_distances", Integer.class);
        assertEquals(2, dailyRows);
        UUID storedWinner = jdbcTemplate.queryForObject(
                "SELECT provisional_winner_user_id FROM races WHERE race_id = ?", UUID.class, race.getRaceId());
        assertEquals(userId, storedWinner);

        Race locked = raceRepository.findByRaceIdForUpdate(race.getRaceId()).orElseThrow();
        assertEquals(11.0, locked.getParticipants().get(0).getTotalDistance(), 1e-9);
        assertEquals(ParticipantStatus.COMPLETED, locked.getParticipants().get(0).getStatus());
    }

    @Test
    void inProgressAndOngoingQueriesSkipWithdrawnParticipations() {
        UUID userId = UUID.randomUUID();
        Race current = race("Current", now.minusDays(1), now.plusDays(1));
        current.addParticipant(userId, now.minusHours(2));
        Race upcoming = race("Upcoming", now.plusDays(2), now.plusDays(4));
        upcoming.addParticipant(userId, now.minusHours(1));
        Race left = race("Left", now.minusDays(1), now.plusDays(1));
        left.addParticipant(userId, now.minusHours(3)).setStatus(ParticipantStatus.WITHDRAWN);
        Race finished = race("Finished", now.minusDays(5), now.minusDays(2));
        finished.addParticipant(userId, now.minusDays(5));
        raceRepository.saveAllAndFlush(List.of(current, upcoming, left, finished));

        Race rejoined = race("Rejoined", now.minusHours(12), now.plusDays(2));
        rejoined.addParticipant(userId, now.minusMinutes(30));
        raceRepository.saveAndFlush(rejoined);

        List<ParticipationRef> inProgress =
                raceRepository.findInProgressParticipations(userId, ParticipantStatus.WITHDRAWN, now);
        assertEquals(List.of(rejoined.getRaceId(), current.getRaceId()),
                inProgress.stream().map(ParticipationRef::raceId).toList());
        assertEquals(now.minusMinutes(30).toInstant(), inProgress.get(0).joinedAt().toInstant());

        List<Race> ongoing = raceRepository.findOngoingRacesForUser(userId, ParticipantStatus.WITHDRAWN, now);
        assertEquals(List.of(current.getRaceId(), rejoined.getRaceId(), upcoming.getRaceId()),
                ongoing.stream().map(Race::getRaceId).toList());

        assertEquals(5, raceRepository.findRacesForUser(userId).size());
        assertTrue(raceRepository.findRacesForUser(UUID.randomUUID()).isEmpty());
    }

    @Test
    void refreshForUpdateReplacesCachedStateWithCommittedRow() {
        UUID userId = UUID.randomUUID();
        Race draft = race("Refresh", now.minusDays(1), now.plusDays(1));
        draft.addParticipant(userId, now.minusHours(1));
        Race race = raceRepository.saveAndFlush(draft);
        assertEquals(ParticipantStatus.ACTIVE, race.getParticipants().get(0).getStatus());

        jdbcTemplate.update(
                "UPDATE race_participants SET status = 'COMPLETED', completed_at = ?, total_distance = 9.5 WHERE user_id = ?",
                now, userId);
        jdbcTemplate.update("UPDATE races SET provisional_winner_user_id = ? WHERE race_id = ?", userId, race.getRaceId());

        assertTrue(raceRepository.refreshForUpdate(race));

        RaceParticipant reloaded = race.findParticipant(userId).orElseThrow();
        assertEquals(ParticipantStatus.COMPLETED, reloaded.getStatus());
        assertEquals(9.5, reloaded.getTotalDistance(), 1e-9);
        assertEquals(userId, race.getFinishResolution().getProvisionalWinnerUserId());
    }

    @Test
    void refreshForUpdateReportsDeletedRace() {
        Race race = raceRepository.saveAndFlush(race("Gone", now.minusDays(1), now.plusDays(1)));
        jdbcTemplate.update("DELETE FROM races WHERE race_id = ?", race.getRaceId());

        assertFalse(raceRepository.refreshForUpdate(race));
    }

    @Test
    void userLockQueryFindsUser() {
        AppUser user = new AppUser();
        user.setUserId(UUID.randomUUID());
        user.setName("Lock");
        user.setEmail("lock@example.com");
        appUserRepository.saveAndFlush(user);

        assertEquals("Lock", appUserRepository.findByUserIdForUpdate(user.getUserId()).orElseThrow().getName());
        assertTrue(appUserRepository.findByUserIdForUpdate(UUID.randomUUID()).isEmpty());
    }

    @Test
    void duplicateParticipationIsRejectedBySchema() {
        Race race = race("Unique", now.minusDays(1), now.plusDays(1));
        raceRepository.saveAndFlush(race);
        UUID userId = UUID.randomUUID();
        jdbcTemplate.update(
                "INSERT INTO race_participants (participant_id, race_id, user_id, joined_at, status) VALUES (?, ?, ?, ?, 'ACTIVE')",
                UUID.randomUUID(), race.getRaceId(), userId, now);

        assertThrows(DataIntegrityViolationException.class, () -> jdbcTemplate.update(
                "INSERT INTO race_participants (participant_id, race_id, user_id, joined_at, status) VALUES (?, ?, ?, ?, 'ACTIVE')",
                UUID.randomUUID(), race.getRaceId(), userId, now));
    }

    private Race race(String name, OffsetDateTime startDate, OffsetDateTime endDate) {
        Race race = new Race();
        race.setRaceId(UUID.randomUUID());
        race.setName(name);
        race.setStartLatitude(52.52);
        race.setStartLongitude(13.405);
        race.setEndLatitude(52.60);
        race.setEndLongitude(13.405);
        race.setStartDate(startDate);
        race.setEndDate(endDate);
        race.setCreatedAt(now);
        race.setUpdatedAt(now);
        return race;
    }
}
