package com.geodash.service;

import com.geodash.config.GeodashRuntimeProperties;
import com.geodash.dto.HealthSyncRequests;
import com.geodash.dto.HealthSyncResponses;
import com.geodash.model.AppUser;
import com.geodash.model.ParticipantStatus;
import com.geodash.model.ProgressionSnapshot;
import com.geodash.model.Race;
import com.geodash.model.RaceParticipant;
import com.geodash.model.TimeSupport;
import com.geodash.repository.AppUserRepository;
import com.geodash.repository.ParticipationRef;
import com.geodash.repository.RaceRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies a batch of per-day distance totals from a health data source to the user's current
 * race participation and credits the gained distance to the user's progression.
 */
@Service
@RequiredArgsConstructor
public class HealthSyncService {

    private static final Logger log = LoggerFactory.getLogger(HealthSyncService.class);

    private final RaceRepository raceRepository;
    private final AppUserRepository appUserRepository;
    private final RaceFinishService raceFinishService;
    private final GeodashRuntimeProperties geodashRuntimeProperties;

    @Transactional
    public HealthSyncResponses.SyncResult sync(UUID userId, HealthSyncRequests.SyncRequest request) {
        return sync(userId, request, TimeSupport.utcNow());
    }

    @Transactional
    public HealthSyncResponses.SyncResult sync(UUID userId, HealthSyncRequests.SyncRequest request, OffsetDateTime now) {
        List<HealthSyncRequests.DayDistance> days = request.days() == null ? List.of() : request.days();
        int maxBatchSize = geodashRuntimeProperties.getSync().getMaxBatchSize();
        if (days.isEmpty() || days.size() > maxBatchSize) {
            throw new ResponseStatusException(
                    HttpStatus.BAD_REQUEST,
                    "days must contain between 1 and " + maxBatchSize + " items"
            );
        }

        // User before race, the same order as joins, so concurrent syncs of one user queue up here.
        Optional<AppUser> lockedUser = appUserRepository.findByUserIdForUpdate(userId);
        Optional<UUID> selectedRaceId = selectRaceId(userId, now);
        if (selectedRaceId.isEmpty()) {
            log.debug("Health sync for user {} not applied: no race in progress", userId);
            return HealthSyncResponses.SyncResult.notApplied();
        }

        Race race = raceRepository.findByRaceIdForUpdate(selectedRaceId.get()).orElse(null);
        RaceParticipant participant = race == null ? null : race.findParticipant(userId)
                .filter(p -> p.getStatus() != ParticipantStatus.WITHDRAWN)
                .orElse(null);
        if (participant == null) {
            log.debug("Health sync for user {} not applied: participation vanished from race {}",
                    userId, selectedRaceId.get());
            return HealthSyncResponses.SyncResult.notApplied();
        }

        List<DistanceSample> samples = DistanceSampleParser.parse(days);
        DistanceReconciler.MergeOutcome outcome =
                DistanceReconciler.merge(participant, samples, race.getDistanceKm(), now);
        if (outcome.newlyCompleted()) {
            log.info("User {} completed race {} with {} km at {}", userId, race.getRaceId(),
                    outcome.totalDistanceKm(), now);
        }

        raceFinishService.observe(race, now);
        race.setUpdatedAt(now);
        raceRepository.save(race);

        AppUser user = lockedUser.orElse(null);
        ProgressionSnapshot progression = null;
        OffsetDateTime lastHealthSyncAt = null;
        if (user != null) {
            applyToUser(user, outcome.gainedKm(), now);
            appUserRepository.save(user);
            progression = ProgressionModel.snapshot(user.getTotalXp());
            lastHealthSyncAt = user.getLastHealthSyncAt();
        } else {
            log.warn("Health sync for unknown user {}: race {} updated, progression skipped", userId, race.getRaceId());
        }

        log.info("Health sync applied to race {} for user {} (+{} km, {} of {} items usable)",
                race.getRaceId(), userId, String.format("%.3f", outcome.gainedKm()), samples.size(), days.size());

        return new HealthSyncResponses.SyncResult(
                HealthSyncResponses.APPLIED_MESSAGE,
                true,
                race.getRaceId(),
                NumericRounding.round(outcome.gainedKm(), 3),
                lastHealthSyncAt,
                progression
        );
    }

    /**
     * Among races in progress where the user is not withdrawn, the participation joined last.
     */
    Optional<UUID> selectRaceId(UUID userId, OffsetDateTime now) {
        return raceRepository.findInProgressParticipations(userId, ParticipantStatus.WITHDRAWN, now).stream()
                .findFirst()
                .map(ParticipationRef::raceId);
    }

    private void applyToUser(AppUser user, double gainedKm, OffsetDateTime now) {
        if (gainedKm > 0) {
            int xpPerKm = geodashRuntimeProperties.getProgression().getXpPerKm();
            long xpGain = ProgressionModel.xpForDistance(gainedKm, xpPerKm);
            user.setTotalKmLifetime(NumericRounding.round(user.getTotalKmLifetime() + gainedKm, 2));
            user.setTotalXp(user.getTotalXp() + xpGain);
            user.setLevel(ProgressionModel.levelFromXp(user.getTotalXp()));
            log.debug("User {} gained {} XP, now level {}", user.getUserId(), xpGain, user.getLevel());
        }
        // A retry with nothing new still counts as a successful sync.
        user.setLastHealthSyncAt(now);
    }
}
