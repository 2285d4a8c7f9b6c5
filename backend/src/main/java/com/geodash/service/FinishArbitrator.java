package com.geodash.service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Finish arbitration state machine: NONE, PROVISIONAL, FINAL.
 *
 * <p>{@link #reconcile} is a pure function of the completed participants, the previously stored
 * resolution and the observation time. Callers persist the returned state only when
 * {@link ArbitrationResult#changed()} is set.
 */
public final class FinishArbitrator {

    /**
     * Completion time ascending, then user id string ascending.
     */
    public static final Comparator<FinishCandidate> FINISH_ORDER = Comparator
            .comparing(FinishCandidate::completedAt, OffsetDateTime::compareTo)
            .thenComparing(candidate -> candidate.userId().toString());

    private FinishArbitrator() {
    }

    public static Optional<FinishCandidate> earliestFinisher(Collection<FinishCandidate> candidates) {
        return candidates.stream()
                .filter(Objects::nonNull)
                .filter(candidate -> candidate.userId() != null && candidate.completedAt() != null)
                .min(FINISH_ORDER);
    }

    public static ArbitrationResult reconcile(
            Collection<FinishCandidate> candidates,
            FinishResolutionState current,
            OffsetDateTime now,
            Duration confirmationWindow
    ) {
        FinishResolutionState previous = current == null ? FinishResolutionState.EMPTY : current;
        Optional<FinishCandidate> earliest = earliestFinisher(candidates);
        if (earliest.isEmpty()) {
            return new ArbitrationResult(FinishResolutionState.EMPTY, !previous.sameAs(FinishResolutionState.EMPTY));
        }

        FinishCandidate winner = earliest.get();
        FinishResolutionState next = previous;
        if (!winner.userId().equals(previous.provisionalWinnerUserId())
                || (previous.finalWinnerUserId() != null && !winner.userId().equals(previous.finalWinnerUserId()))
                || previous.confirmationWindowEndsAt() == null) {
            // New earliest finisher: revoke any final decision and restart the window.
            next = new FinishResolutionState(
                    winner.userId(),
                    winner.completedAt(),
                    now.plus(confirmationWindow),
                    null,
                    null
            );
        } else if (previous.provisionalAt() == null || !previous.provisionalAt().isEqual(winner.completedAt())) {
            next = new FinishResolutionState(
                    previous.provisionalWinnerUserId(),
                    winner.completedAt(),
                    previous.confirmationWindowEndsAt(),
                    previous.finalWinnerUserId(),
                    previous.finalizedAt()
            );
        }

        if (next.finalWinnerUserId() == null && !now.isBefore(next.confirmationWindowEndsAt())) {
            next = new FinishResolutionState(
                    next.provisionalWinnerUserId(),
                    next.provisionalAt(),
                    next.confirmationWindowEndsAt(),
                    next.provisionalWinnerUserId(),
                    now
            );
        }

        return new ArbitrationResult(next, !next.sameAs(previous));
    }
}
