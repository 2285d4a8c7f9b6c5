package com.geodash.dto;

import com.geodash.model.ProgressionSnapshot;

import java.time.OffsetDateTime;
import java.util.UUID;

public final class HealthSyncResponses {

    public static final String APPLIED_MESSAGE = "Health sync applied";
    public static final String NOT_APPLIED_MESSAGE = "No active race participation found";

    private HealthSyncResponses() {
    }

    public record SyncResult(
            String message,
            boolean applied,
            UUID raceId,
            double deltaKm,
            OffsetDateTime lastHealthSyncAt,
            ProgressionSnapshot progression
    ) {
        public static SyncResult notApplied() {
            return new SyncResult(NOT_APPLIED_MESSAGE, false, null, 0.0, null, null);
        }
    }
}
