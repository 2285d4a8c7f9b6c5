package com.geodash.dto;

import com.geodash.model.ProgressionSnapshot;

import java.time.OffsetDateTime;
import java.util.UUID;

public final class UserResponses {

    private UserResponses() {
    }

    public record UserProfile(
            UUID userId,
            String name,
            String email,
            String avatarUrl,
            double totalKmLifetime,
            long totalXp,
            int level,
            OffsetDateTime lastHealthSyncAt,
            ProgressionSnapshot progression,
            OffsetDateTime createdAt
    ) {
    }
}
