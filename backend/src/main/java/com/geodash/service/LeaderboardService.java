package com.geodash.service;

import com.geodash.dto.LeaderboardResponses;
import com.geodash.dto.RaceResponses;
import com.geodash.mapper.RaceResponseMapper;
import com.geodash.model.AppUser;
import com.geodash.model.Race;
import com.geodash.model.RaceParticipant;
import com.geodash.model.TimeSupport;
import com.geodash.repository.AppUserRepository;
import com.geodash.repository.RaceRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Per-race and global rankings and per-user stats. Win counts only credit a race's final winner.
 */
@Service
@RequiredArgsConstructor
public class LeaderboardService {

    private static final Logger log = LoggerFactory.getLogger(LeaderboardService.class);

    private final RaceRepository raceRepository;
    private final AppUserRepository appUserRepository;
    private final RaceFinishService raceFinishService;
    private final RaceResponseMapper raceResponseMapper;

    @Transactional
    public LeaderboardResponses.RaceLeaderboard raceLeaderboard(UUID raceId) {
        return raceLeaderboard(raceId, TimeSupport.utcNow());
    }

    @Transactional
    public LeaderboardResponses.RaceLeaderboard raceLeaderboard(UUID raceId, OffsetDateTime now) {
        Race race = raceRepository.findById(raceId).orElseThrow(() -> RaceService.raceNotFound(raceId));
        FinishResolutionState finish = raceFinishService.observeForRead(race, now);
        Map<UUID, AppUser> users = loadUsers(race.getParticipants().stream()
                .map(RaceParticipant::getUserId)
                .collect(Collectors.toSet()));

        double raceDistance = race.getDistanceKm();
        Map<UUID, RaceParticipant> participantsByUser = new LinkedHashMap<>();
        List<LeaderboardOrdering.RaceStanding> standings = new ArrayList<>();
        for (RaceParticipant participant : race.getParticipants()) {
            participantsByUser.put(participant.getUserId(), participant);
            standings.add(new LeaderboardOrdering.RaceStanding(
                    participant.getUserId(),
                    RaceResponseMapper.displayName(users.get(participant.getUserId())),
                    participant.getTotalDistance(),
                    participant.getStatus(),
                    participant.getCompletedAt(),
                    participant.getJoinedAt()
            ));
        }
        standings.sort(LeaderboardOrdering.RACE_ORDER);

        List<LeaderboardResponses.RaceEntry> entries = new ArrayList<>(standings.size());
        for (int i = 0; i < standings.size(); i++) {
            LeaderboardOrdering.RaceStanding standing = standings.get(i);
            RaceParticipant participant = participantsByUser.get(standing.userId());
            AppUser user = users.get(standing.userId());
            entries.add(new LeaderboardResponses.RaceEntry(
                    i + 1,
                    standing.userId(),
                    standing.displayName(),
                    user != null ? user.getAvatarUrl() : null,
                    standing.totalDistance(),
                    progress(standing.totalDistance(), raceDistance),
                    distanceRemaining(standing.totalDistance(), raceDistance),
                    standing.status(),
                    standing.joinedAt(),
                    standing.completedAt(),
                    raceResponseMapper.toDailyDistances(participant.getDailyDistances())
            ));
        }

        log.debug("Race {} leaderboard generated with {} participants", raceId, entries.size());
        RaceResponses.FinishState finishState =
                raceResponseMapper.toFinishState(finish, raceFinishService.confirmationWindowMs());
        return new LeaderboardResponses.RaceLeaderboard(
                new LeaderboardResponses.RaceRef(race.getRaceId(), race.getName(), raceDistance),
                finishState,
                entries
        );
    }

    @Transactional
    public LeaderboardResponses.GlobalLeaderboard globalLeaderboard() {
        return globalLeaderboard(TimeSupport.utcNow());
    }

    @Transactional
    public LeaderboardResponses.GlobalLeaderboard globalLeaderboard(OffsetDateTime now) {
        List<Race> races = raceRepository.findAll().stream()
                .sorted(RaceFinishService.LOCK_ORDER)
                .toList();
        Map<UUID, Tally> tallies = new LinkedHashMap<>();
        for (Race race : races) {
            UUID finalWinner = raceFinishService.observeForRead(race, now).finalWinnerUserId();
            for (RaceParticipant participant : race.getParticipants()) {
                Tally tally = tallies.computeIfAbsent(participant.getUserId(), id -> new Tally());
                tally.totalKm += participant.getTotalDistance();
                tally.races++;
                if (participant.getUserId().equals(finalWinner)) {
                    tally.wins++;
                }
            }
        }

        Map<UUID, AppUser> users = loadUsers(tallies.keySet());
        List<LeaderboardOrdering.GlobalStanding> standings = tallies.entrySet().stream()
                .map(entry -> new LeaderboardOrdering.GlobalStanding(
                        entry.getKey(),
                        RaceResponseMapper.displayName(users.get(entry.getKey())),
                        entry.getValue().totalKm,
                        entry.getValue().races,
                        entry.getValue().wins
                ))
                .sorted(LeaderboardOrdering.GLOBAL_ORDER)
                .toList();

        List<LeaderboardResponses.GlobalEntry> entries = new ArrayList<>(standings.size());
        for (int i = 0; i < standings.size(); i++) {
            LeaderboardOrdering.GlobalStanding standing = standings.get(i);
            AppUser user = users.get(standing.userId());
            entries.add(new LeaderboardResponses.GlobalEntry(
                    i + 1,
                    standing.userId(),
                    standing.name(),
                    user != null ? user.getEmail() : null,
                    user != null ? user.getAvatarUrl() : null,
                    NumericRounding.round(standing.totalKm(), 3),
                    standing.races(),
                    standing.wins()
            ));
        }

        log.info("Global leaderboard generated: {} entries across {} races", entries.size(), races.size());
        return new LeaderboardResponses.GlobalLeaderboard(entries);
    }

    @Transactional
    public LeaderboardResponses.UserStats userStats(UUID userId) {
        return userStats(userId, TimeSupport.utcNow());
    }

    @Transactional
    public LeaderboardResponses.UserStats userStats(UUID userId, OffsetDateTime now) {
        int racesParticipated = 0;
        int wins = 0;
        double totalKm = 0.0;
        List<Race> races = raceRepository.findRacesForUser(userId).stream()
                .sorted(RaceFinishService.LOCK_ORDER)
                .toList();
        for (Race race : races) {
            RaceParticipant mine = race.findParticipant(userId).orElse(null);
            if (mine == null) {
                continue;
            }
            racesParticipated++;
            totalKm += mine.getTotalDistance();
            if (userId.equals(raceFinishService.observeForRead(race, now).finalWinnerUserId())) {
                wins++;
            }
        }

        double winRate = racesParticipated > 0 ? (double) wins / racesParticipated * 100.0 : 0.0;
        String name = RaceResponseMapper.displayName(appUserRepository.findById(userId).orElse(null));
        return new LeaderboardResponses.UserStats(
                userId,
                name,
                racesParticipated,
                wins,
                NumericRounding.round(totalKm, 2),
                NumericRounding.round(winRate, 1)
        );
    }

    static double progress(double totalDistance, double raceDistance) {
        if (raceDistance <= 0) {
            return 1.0;
        }
        double ratio = Math.min(1.0, Math.max(0.0, totalDistance / raceDistance));
        return NumericRounding.round(ratio, 4);
    }

    static double distanceRemaining(double totalDistance, double raceDistance) {
        return NumericRounding.round(Math.max(0.0, raceDistance - totalDistance), 3);
    }

    private Map<UUID, AppUser> loadUsers(Collection<UUID> userIds) {
        if (userIds.isEmpty()) {
            return Map.of();
        }
        return appUserRepository.findAllById(Set.copyOf(userIds)).stream()
                .collect(Collectors.toMap(AppUser::getUserId, Function.identity()));
    }

    private static final class Tally {
        private double totalKm;
        private int races;
        private int wins;
    }
}
