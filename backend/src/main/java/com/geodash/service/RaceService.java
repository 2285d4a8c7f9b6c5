package com.geodash.service;

import com.geodash.dto.RaceRequests;
import com.geodash.dto.RaceResponses;
import com.geodash.mapper.RaceResponseMapper;
import com.geodash.model.AppUser;
import com.geodash.model.ParticipantStatus;
import com.geodash.model.Race;
import com.geodash.model.RaceParticipant;
import com.geodash.model.RaceStatus;
import com.geodash.model.TimeSupport;
import com.geodash.repository.AppUserRepository;
import com.geodash.repository.RaceRepository;
import com.geodash.web.RaceParticipationConflictException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class RaceService {

    private static final Logger log = LoggerFactory.getLogger(RaceService.class);

    static final String RACE_DELETED_MESSAGE = "Race deleted successfully";

    private final RaceRepository raceRepository;
    private final AppUserRepository appUserRepository;
    private final RaceFinishService raceFinishService;
    private final ParticipationInvariantChecker participationInvariantChecker;
    private final RaceResponseMapper raceResponseMapper;

    @Transactional
    public RaceResponses.RaceDetail createRace(UUID creatorUserId, RaceRequests.CreateRaceRequest request) {
        if (!request.endDate().isAfter(request.startDate())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "endDate must be after startDate");
        }
        OffsetDateTime now = TimeSupport.utcNow();

        Race race = new Race();
        race.setRaceId(UUID.randomUUID());
        race.setName(request.name().trim());
        race.setDescription(StringUtils.hasText(request.description()) ? request.description().trim() : null);
        race.setStartLatitude(request.startPoint().latitude());
        race.setStartLongitude(request.startPoint().longitude());
        race.setStartAddress(trimToNull(request.startPoint().address()));
        race.setEndLatitude(request.endPoint().latitude());
        race.setEndLongitude(request.endPoint().longitude());
        race.setEndAddress(trimToNull(request.endPoint().address()));
        race.setStartDate(request.startDate());
        race.setEndDate(request.endDate());
        race.setCreatedBy(creatorUserId);
        race.setCreatedAt(now);
        race.setUpdatedAt(now);

        Race saved = raceRepository.save(race);
        log.info("Created race {} '{}' ({} km, {} -> {})", saved.getRaceId(), saved.getName(),
                String.format("%.2f", saved.getDistanceKm()), saved.getStartDate(), saved.getEndDate());
        return raceResponseMapper.toRaceDetail(saved, Map.of(), now, raceFinishService.confirmationWindowMs());
    }

    @Transactional
    public List<RaceResponses.RaceSummary> listRaces(String status) {
        Optional<RaceStatus> filter = RaceStatus.fromCode(status);
        if (StringUtils.hasText(status) && filter.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown race status: " + status);
        }
        OffsetDateTime now = TimeSupport.utcNow();
        long windowMs = raceFinishService.confirmationWindowMs();
        List<Race> races = raceRepository.findAllByOrderByStartDateDesc().stream()
                .filter(race -> filter.map(expected -> race.statusAt(now) == expected).orElse(true))
                .toList();
        // Observing may lock races; id order keeps concurrent readers from deadlocking.
        races.stream()
                .sorted(RaceFinishService.LOCK_ORDER)
                .forEach(race -> raceFinishService.observeForRead(race, now));
        return races.stream()
                .map(race -> raceResponseMapper.toRaceSummary(race, now, windowMs))
                .toList();
    }

    @Transactional
    public RaceResponses.RaceDetail getRace(UUID raceId) {
        OffsetDateTime now = TimeSupport.utcNow();
        Race race = requireRace(raceId);
        raceFinishService.observeForRead(race, now);
        return toDetail(race, now);
    }

    @Transactional
    public RaceResponses.FinishState getFinishState(UUID raceId) {
        return getFinishState(raceId, TimeSupport.utcNow());
    }

    @Transactional
    public RaceResponses.FinishState getFinishState(UUID raceId, OffsetDateTime now) {
        Race race = requireRace(raceId);
        FinishResolutionState state = raceFinishService.observeForRead(race, now);
        return raceResponseMapper.toFinishState(state, raceFinishService.confirmationWindowMs());
    }

    @Transactional
    public RaceResponses.RaceDetail joinRace(UUID raceId, UUID userId) {
        OffsetDateTime now = TimeSupport.utcNow();
        // The user lock makes the ongoing-participation check and the insert below atomic per user.
        appUserRepository.findByUserIdForUpdate(userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "User not found: " + userId));
        Race race = raceRepository.findByRaceIdForUpdate(raceId)
                .orElseThrow(() -> raceNotFound(raceId));

        if (now.isAfter(race.getEndDate())) {
            throw RaceParticipationConflictException.raceEnded("Race has ended: " + raceId);
        }
        if (race.findParticipant(userId).isPresent()) {
            throw RaceParticipationConflictException.alreadyParticipant("User is already a participant");
        }
        participationInvariantChecker.requireNoOngoingParticipation(userId, raceId, now);

        race.addParticipant(userId, now);
        raceFinishService.observe(race, now);
        race.setUpdatedAt(now);
        Race saved = raceRepository.save(race);
        log.info("User {} joined race {}", userId, raceId);
        return toDetail(saved, now);
    }

    @Transactional
    public RaceResponses.RaceDetail withdraw(UUID raceId, UUID userId) {
        OffsetDateTime now = TimeSupport.utcNow();
        Race race = raceRepository.findByRaceIdForUpdate(raceId)
                .orElseThrow(() -> raceNotFound(raceId));
        RaceParticipant participant = race.findParticipant(userId)
                .orElseThrow(() -> RaceParticipationConflictException.notParticipant(
                        "User is not a participant of race " + raceId));

        if (participant.getStatus() == ParticipantStatus.COMPLETED) {
            throw RaceParticipationConflictException.alreadyCompleted("Participant already completed race " + raceId);
        }
        if (participant.getStatus() == ParticipantStatus.WITHDRAWN) {
            return toDetail(race, now);
        }

        participant.setStatus(ParticipantStatus.WITHDRAWN);
        participant.setCompletedAt(null);
        raceFinishService.observe(race, now);
        race.setUpdatedAt(now);
        Race saved = raceRepository.save(race);
        log.info("User {} withdrew from race {}", userId, raceId);
        return toDetail(saved, now);
    }

    @Transactional
    public RaceResponses.RaceDetail updateRace(UUID raceId, UUID userId, RaceRequests.UpdateRaceRequest request) {
        return updateRace(raceId, userId, request, TimeSupport.utcNow());
    }

    /**
     * Moving either point changes the completion threshold, so every participant's completion is
     * re-checked and the finish decision re-run under the race lock.
     */
    @Transactional
    public RaceResponses.RaceDetail updateRace(
            UUID raceId,
            UUID userId,
            RaceRequests.UpdateRaceRequest request,
            OffsetDateTime now
    ) {
        Race race = raceRepository.findByRaceIdForUpdate(raceId)
                .orElseThrow(() -> raceNotFound(raceId));
        requireCreator(race, userId, "Not authorized to update this race");

        if (request.name() != null) {
            race.setName(request.name().trim());
        }
        if (request.description() != null) {
            race.setDescription(trimToNull(request.description()));
        }
        if (request.startPoint() != null) {
            race.setStartLatitude(request.startPoint().latitude());
            race.setStartLongitude(request.startPoint().longitude());
            race.setStartAddress(trimToNull(request.startPoint().address()));
        }
        if (request.endPoint() != null) {
            race.setEndLatitude(request.endPoint().latitude());
            race.setEndLongitude(request.endPoint().longitude());
            race.setEndAddress(trimToNull(request.endPoint().address()));
        }
        if (request.startDate() != null) {
            race.setStartDate(request.startDate());
        }
        if (request.endDate() != null) {
            race.setEndDate(request.endDate());
        }
        if (!race.getEndDate().isAfter(race.getStartDate())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "endDate must be after startDate");
        }

        double raceDistance = race.getDistanceKm();
        for (RaceParticipant participant : race.getParticipants()) {
            DistanceReconciler.CompletionChange change =
                    DistanceReconciler.reevaluateCompletion(participant, raceDistance, now);
            if (change != DistanceReconciler.CompletionChange.UNCHANGED) {
                log.info("Race {} update {} user {} ({} km of {} km)", raceId,
                        change == DistanceReconciler.CompletionChange.COMPLETED ? "completed" : "reopened",
                        participant.getUserId(), participant.getTotalDistance(), String.format("%.3f", raceDistance));
            }
        }

        raceFinishService.observe(race, now);
        race.setUpdatedAt(now);
        Race saved = raceRepository.save(race);
        log.info("Race {} updated by {}", raceId, userId);
        return toDetail(saved, now);
    }

    @Transactional
    public RaceResponses.RaceDeleted deleteRace(UUID raceId, UUID userId) {
        Race race = raceRepository.findByRaceIdForUpdate(raceId)
                .orElseThrow(() -> raceNotFound(raceId));
        requireCreator(race, userId, "Not authorized to delete this race");

        raceRepository.delete(race);
        log.info("Race {} deleted by {} ({} participants)", raceId, userId, race.getParticipants().size());
        return new RaceResponses.RaceDeleted(RACE_DELETED_MESSAGE, raceId);
    }

    Race requireRace(UUID raceId) {
        return raceRepository.findById(raceId).orElseThrow(() -> raceNotFound(raceId));
    }

    Map<UUID, AppUser> loadUsers(Race race) {
        List<UUID> userIds = race.getParticipants().stream()
                .map(RaceParticipant::getUserId)
                .distinct()
                .toList();
        if (userIds.isEmpty()) {
            return Map.of();
        }
        return appUserRepository.findAllById(userIds).stream()
                .collect(Collectors.toMap(AppUser::getUserId, Function.identity()));
    }

    private RaceResponses.RaceDetail toDetail(Race race, OffsetDateTime now) {
        return raceResponseMapper.toRaceDetail(race, loadUsers(race), now, raceFinishService.confirmationWindowMs());
    }

    static ResponseStatusException raceNotFound(UUID raceId) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Race not found: " + raceId);
    }

    private static void requireCreator(Race race, UUID userId, String message) {
        if (race.getCreatedBy() == null || !race.getCreatedBy().equals(userId)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, message);
        }
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
