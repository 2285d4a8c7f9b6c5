package com.geodash.repository;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ParticipationRef(UUID raceId, OffsetDateTime joinedAt) {
}
