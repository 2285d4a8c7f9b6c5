package com.geodash.service;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A completed participant as seen by finish arbitration.
 */
public record FinishCandidate(UUID userId, OffsetDateTime completedAt) {
}
