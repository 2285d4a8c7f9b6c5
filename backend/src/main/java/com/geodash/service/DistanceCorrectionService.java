package com.geodash.service;

import com.geodash.dto.RaceRequests;
import com.geodash.dto.RaceResponses;
import com.geodash.mapper.RaceResponseMapper;
import com.geodash.model.DailyDistanceEntry;
import com.geodash.model.Race;
import com.geodash.model.RaceParticipant;
import com.geodash.model.TimeSupport;
import com.geodash.repository.RaceRepository;
import com.geodash.web.RaceParticipationConflictException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Administrative replacement of a participant's daily history. Unlike health sync, values may go
 * down, so completion is re-evaluated in both directions. Lifetime user counters are left alone.
 */
@Service
@RequiredArgsConstructor
public class DistanceCorrectionService {

    private static final Logger log = LoggerFactory.getLogger(DistanceCorrectionService.class);

    private final RaceRepository raceRepository;
    private final RaceService raceService;
    private final RaceFinishService raceFinishService;
    private final RaceResponseMapper raceResponseMapper;

    @Transactional
    public RaceResponses.RaceDetail overrideDailyDistances(
            UUID raceId,
            UUID userId,
            RaceRequests.DistanceCorrectionRequest request
    ) {
        return overrideDailyDistances(raceId, userId, request, TimeSupport.utcNow());
    }

    @Transactional
    public RaceResponses.RaceDetail overrideDailyDistances(
            UUID raceId,
            UUID userId,
            RaceRequests.DistanceCorrectionRequest request,
            OffsetDateTime now
    ) {
        Race race = raceRepository.findByRaceIdForUpdate(raceId)
                .orElseThrow(() -> RaceService.raceNotFound(raceId));
        RaceParticipant participant = race.findParticipant(userId)
                .orElseThrow(() -> RaceParticipationConflictException.notParticipant(
                        "User is not a participant of race " + raceId));

        Map<LocalDate, Double> byDay = new TreeMap<>();
        for (DistanceSample sample : DistanceSampleParser.parse(request.days())) {
            byDay.put(sample.day(), sample.distanceKm());
        }
        List<DailyDistanceEntry> entries = participant.getDailyDistances();
        entries.clear();
        byDay.forEach((day, km) -> entries.add(new DailyDistanceEntry(day, km)));

        double previousTotal = participant.getTotalDistance();
        double total = participant.recomputeTotalDistance();
        double raceDistance = race.getDistanceKm();
        DistanceReconciler.CompletionChange change =
                DistanceReconciler.reevaluateCompletion(participant, raceDistance, now);
        if (change == DistanceReconciler.CompletionChange.COMPLETED) {
            log.info("Correction completed user {} in race {} with {} km", userId, raceId, total);
        } else if (change == DistanceReconciler.CompletionChange.REVERTED) {
            log.info("Correction reverted completion of user {} in race {} ({} km < {} km)",
                    userId, raceId, total, raceDistance);
        }

        raceFinishService.observe(race, now);
        race.setUpdatedAt(now);
        Race saved = raceRepository.save(race);
        log.info("Daily distances of user {} in race {} overridden: {} day(s), total {} -> {} km",
                userId, raceId, entries.size(), previousTotal, total);
        return raceResponseMapper.toRaceDetail(saved, raceService.loadUsers(saved), now,
                raceFinishService.confirmationWindowMs());
    }
}
