package com.geodash.service;

import com.geodash.config.GeodashRuntimeProperties;
import com.geodash.model.FinishStatus;
import com.geodash.model.Race;
import com.geodash.model.RaceParticipant;
import com.geodash.repository.RaceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Applies finish arbitration to races. Every path that reads or mutates participant completion
 * state goes through {@link #observe} so the stored resolution never lags behind the data.
 */
@Service
public class RaceFinishService {

    private static final Logger log = LoggerFactory.getLogger(RaceFinishService.class);

    /**
     * Order in which a single transaction observes several races.
     */
    static final Comparator<Race> LOCK_ORDER = Comparator.comparing(Race::getRaceId);

    private final RaceRepository raceRepository;
    private final GeodashRuntimeProperties geodashRuntimeProperties;

    public RaceFinishService(RaceRepository raceRepository, GeodashRuntimeProperties geodashRuntimeProperties) {
        this.raceRepository = raceRepository;
        this.geodashRuntimeProperties = geodashRuntimeProperties;
    }

    /**
     * Recomputes the arbitration outcome and writes it onto the in-memory race. Saving is left to
     * the caller, which must hold the race's write lock.
     */
    public ArbitrationResult observe(Race race, OffsetDateTime now) {
        FinishResolutionState previous = FinishResolutionState.of(race.getFinishResolution());
        ArbitrationResult result = reconcile(race, previous, now);
        if (result.changed()) {
            result.state().copyTo(race.getFinishResolution());
            logTransition(race.getRaceId(), previous, result.state());
        }
        return result;
    }

    /**
     * Observation from a read path, inside the caller's read-write transaction. The race was read
     * without a lock, so a changed outcome is only trusted after the race has been reloaded under
     * its write lock; that serializes the write with syncs and corrections on the same race.
     */
    public FinishResolutionState observeForRead(Race race, OffsetDateTime now) {
        ArbitrationResult unlocked = reconcile(race, FinishResolutionState.of(race.getFinishResolution()), now);
        if (!unlocked.changed()) {
            return unlocked.state();
        }
        if (!raceRepository.refreshForUpdate(race)) {
            return unlocked.state();
        }
        ArbitrationResult locked = observe(race, now);
        if (locked.changed()) {
            race.setUpdatedAt(now);
            raceRepository.save(race);
        }
        return locked.state();
    }

    private ArbitrationResult reconcile(Race race, FinishResolutionState current, OffsetDateTime now) {
        return FinishArbitrator.reconcile(toCandidates(race.getParticipants()), current, now, confirmationWindow());
    }

    public long confirmationWindowMs() {
        return Math.max(0L, geodashRuntimeProperties.getFinish().getConfirmationWindowMs());
    }

    private Duration confirmationWindow() {
        return Duration.ofMillis(confirmationWindowMs());
    }

    static List<FinishCandidate> toCandidates(List<RaceParticipant> participants) {
        return participants.stream()
                .filter(RaceParticipant::isCompleted)
                .filter(participant -> participant.getCompletedAt() != null)
                .map(participant -> new FinishCandidate(participant.getUserId(), participant.getCompletedAt()))
                .toList();
    }

    private static void logTransition(UUID raceId, FinishResolutionState previous, FinishResolutionState next) {
        FinishStatus from = previous.status();
        FinishStatus to = next.status();
        if (to == FinishStatus.NONE) {
            log.info("Race {} finish resolution cleared (was {})", raceId, from);
        } else if (previous.currentWinnerUserId() != null
                && !previous.currentWinnerUserId().equals(next.provisionalWinnerUserId())) {
            log.info(
                    "Race {} finish reopened: {} winner {} replaced by provisional winner {}",
                    raceId,
                    from,
                    previous.currentWinnerUserId(),
                    next.provisionalWinnerUserId()
            );
        } else if (to == FinishStatus.FINAL && from != FinishStatus.FINAL) {
            log.info("Race {} finish finalized: winner={}, finalizedAt={}", raceId,
                    next.finalWinnerUserId(), next.finalizedAt());
        } else if (to == FinishStatus.PROVISIONAL && from == FinishStatus.NONE) {
            log.info("Race {} provisional winner {} (window ends {})", raceId,
                    next.provisionalWinnerUserId(), next.confirmationWindowEndsAt());
        } else {
            log.debug("Race {} finish resolution updated: {} -> {}", raceId, from, to);
        }
    }
}
