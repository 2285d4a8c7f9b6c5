package com.geodash.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Persisted cache of the last arbitration outcome of a race. All columns null means no finisher.
 */
@Getter
@Setter
@Embeddable
public class FinishResolution {

    @Column(name = "provisional_winner_user_id")
    private UUID provisionalWinnerUserId;

    @Column(name = "provisional_at")
    private OffsetDateTime provisionalAt;

    @Column(name = "confirmation_window_ends_at")
    private OffsetDateTime confirmationWindowEndsAt;

    @Column(name = "final_winner_user_id")
    private UUID finalWinnerUserId;

    @Column(name = "finalized_at")
    private OffsetDateTime finalizedAt;
}
