package com.geodash.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.OffsetDateTime;
import java.util.List;

public final class RaceRequests {

    private RaceRequests() {
    }

    public record GeoPointRequest(
            @NotNull(message = "latitude is required")
            @DecimalMin(value = "-90.0", message = "latitude must be >= -90")
            @DecimalMax(value = "90.0", message = "latitude must be <= 90")
            Double latitude,

            @NotNull(message = "longitude is required")
            @DecimalMin(value = "-180.0", message = "longitude must be >= -180")
            @DecimalMax(value = "180.0", message = "longitude must be <= 180")
            Double longitude,

            @Size(max = 255, message = "address must be at most 255 characters")
            String address
    ) {
    }

    public record CreateRaceRequest(
            @NotBlank(message = "name is required")
            @Size(max = 255, message = "name must be at most 255 characters")
            String name,

            @Size(max = 4000, message = "description must be at most 4000 characters")
            String description,

            @NotNull(message = "startPoint is required")
            @Valid
            GeoPointRequest startPoint,

            @NotNull(message = "endPoint is required")
            @Valid
            GeoPointRequest endPoint,

            @NotNull(message = "startDate is required")
            OffsetDateTime startDate,

            @NotNull(message = "endDate is required")
            OffsetDateTime endDate
    ) {
        @AssertTrue(message = "endDate must be after startDate")
        public boolean isEndDateAfterStartDate() {
            if (startDate == null || endDate == null) {
                return true;
            }
            return endDate.isAfter(startDate);
        }
    }

    /**
     * Partial update by the race creator: fields left null keep their current value.
     */
    public record UpdateRaceRequest(
            @Pattern(regexp = "(?s).*\\S.*", message = "name must not be blank")
            @Size(max = 255, message = "name must be at most 255 characters")
            String name,

            @Size(max = 4000, message = "description must be at most 4000 characters")
            String description,

            @Valid
            GeoPointRequest startPoint,

            @Valid
            GeoPointRequest endPoint,

            OffsetDateTime startDate,

            OffsetDateTime endDate
    ) {
        @AssertTrue(message = "endDate must be after startDate")
        public boolean isEndDateAfterStartDate() {
            if (startDate == null || endDate == null) {
                return true;
            }
            return endDate.isAfter(startDate);
        }
    }

    public record DistanceCorrectionRequest(
            @NotNull(message = "days is required")
            @Size(max = 366, message = "days must contain at most 366 items")
            List<HealthSyncRequests.DayDistance> days
    ) {
    }
}
