package com.geodash.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public final class HealthSyncRequests {

    private HealthSyncRequests() {
    }

    public record SyncRequest(
            @NotNull(message = "days is required")
            @Size(min = 1, max = 60, message = "days must contain between 1 and 60 items")
            List<DayDistance> days
    ) {
    }

    /**
     * One per-day total as reported by the device. Fields stay loosely typed: malformed items are
     * skipped during reconciliation instead of failing the whole batch.
     */
    public record DayDistance(
            String date,
            Double distanceKm
    ) {
    }
}
