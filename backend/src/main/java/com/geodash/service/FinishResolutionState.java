package com.geodash.service;

import com.geodash.model.FinishResolution;
import com.geodash.model.FinishStatus;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable view of a race's arbitration outcome.
 */
public record FinishResolutionState(
        UUID provisionalWinnerUserId,
        OffsetDateTime provisionalAt,
        OffsetDateTime confirmationWindowEndsAt,
        UUID finalWinnerUserId,
        OffsetDateTime finalizedAt
) {

    public static final FinishResolutionState EMPTY = new FinishResolutionState(null, null, null, null, null);

    public static FinishResolutionState of(FinishResolution resolution) {
        if (resolution == null) {
            return EMPTY;
        }
        return new FinishResolutionState(
                resolution.getProvisionalWinnerUserId(),
                resolution.getProvisionalAt(),
                resolution.getConfirmationWindowEndsAt(),
                resolution.getFinalWinnerUserId(),
                resolution.getFinalizedAt()
        );
    }

    public void copyTo(FinishResolution resolution) {
        resolution.setProvisionalWinnerUserId(provisionalWinnerUserId);
        resolution.setProvisionalAt(provisionalAt);
        resolution.setConfirmationWindowEndsAt(confirmationWindowEndsAt);
        resolution.setFinalWinnerUserId(finalWinnerUserId);
        resolution.setFinalizedAt(finalizedAt);
    }

    public FinishStatus status() {
        if (finalWinnerUserId != null) {
            return FinishStatus.FINAL;
        }
        if (provisionalWinnerUserId != null) {
            return FinishStatus.PROVISIONAL;
        }
        return FinishStatus.NONE;
    }

    /**
     * Final winner once decided, otherwise the provisional one.
     */
    public UUID currentWinnerUserId() {
        return finalWinnerUserId != null ? finalWinnerUserId : provisionalWinnerUserId;
    }

    /**
     * Value equality that compares timestamps as instants, so a value re-read from the database
     * with a different offset is not mistaken for a change.
     */
    public boolean sameAs(FinishResolutionState other) {
        return other != null
                && Objects.equals(provisionalWinnerUserId, other.provisionalWinnerUserId)
                && sameInstant(provisionalAt, other.provisionalAt)
                && sameInstant(confirmationWindowEndsAt, other.confirmationWindowEndsAt)
                && Objects.equals(finalWinnerUserId, other.finalWinnerUserId)
                && sameInstant(finalizedAt, other.finalizedAt);
    }

    private static boolean sameInstant(OffsetDateTime left, OffsetDateTime right) {
        if (left == null || right == null) {
            return left == right;
        }
        return left.isEqual(right);
    }
}
