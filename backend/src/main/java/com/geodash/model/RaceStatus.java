package com.geodash.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle of a race derived from its time window. Never stored.
 */
public enum RaceStatus {
    UPCOMING,
    ACTIVE,
    COMPLETED;

    public static RaceStatus at(OffsetDateTime startDate, OffsetDateTime endDate, OffsetDateTime now) {
        if (now.isBefore(startDate)) {
            return UPCOMING;
        }
        if (!now.isAfter(endDate)) {
            return ACTIVE;
        }
        return COMPLETED;
    }

    public static Optional<RaceStatus> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim();
        return Arrays.stream(values())
                .filter(status -> status.name().equalsIgnoreCase(normalized))
                .findFirst();
    }

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }
}
