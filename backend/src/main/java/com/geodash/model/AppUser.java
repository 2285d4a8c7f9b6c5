package com.geodash.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.springframework.util.StringUtils;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "app_users")
public class AppUser {

    public static final String FALLBACK_DISPLAY_NAME = "Participant";

    @Id
    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "name")
    private String name;

    @Column(name = "email", nullable = false, unique = true)
    private String email;

    @Column(name = "avatar_url")
    private String avatarUrl;

    @Column(name = "total_km_lifetime", nullable = false)
    private double totalKmLifetime;

    @Column(name = "total_xp", nullable = false)
    private long totalXp;

    @Column(name = "level", nullable = false)
    private int level = 1;

    @Column(name = "last_health_sync_at")
    private OffsetDateTime lastHealthSyncAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = TimeSupport.utcNow();

    public String getDisplayName() {
        if (StringUtils.hasText(name)) {
            return name;
        }
        if (StringUtils.hasText(email)) {
            return email;
        }
        return FALLBACK_DISPLAY_NAME;
    }
}
