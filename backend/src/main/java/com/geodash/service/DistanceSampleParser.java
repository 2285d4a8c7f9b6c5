package com.geodash.service;

import com.geodash.dto.HealthSyncRequests;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Turns raw day readings into {@link DistanceSample}s. Items with an unparsable day or a missing,
 * non-finite or negative distance are dropped one by one; the rest of the batch survives.
 */
public final class DistanceSampleParser {

    private static final Logger log = LoggerFactory.getLogger(DistanceSampleParser.class);

    private static final List<Function<String, LocalDate>> DAY_FORMATS = List.of(
            LocalDate::parse,
            text -> OffsetDateTime.parse(text).atZoneSameInstant(ZoneOffset.UTC).toLocalDate(),
            text -> Instant.parse(text).atOffset(ZoneOffset.UTC).toLocalDate()
    );

    private DistanceSampleParser() {
    }

    public static List<DistanceSample> parse(List<HealthSyncRequests.DayDistance> days) {
        List<DistanceSample> samples = new ArrayList<>();
        if (days == null) {
            return samples;
        }
        int skipped = 0;
        for (HealthSyncRequests.DayDistance item : days) {
            Optional<DistanceSample> sample = item == null
                    ? Optional.empty()
                    : toSample(item.date(), item.distanceKm());
            if (sample.isPresent()) {
                samples.add(sample.get());
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} malformed distance item(s) out of {}", skipped, days.size());
        }
        return samples;
    }

    static Optional<DistanceSample> toSample(String date, Double distanceKm) {
        if (distanceKm == null || !Double.isFinite(distanceKm) || distanceKm < 0) {
            return Optional.empty();
        }
        return parseUtcDay(date).map(day -> new DistanceSample(day, distanceKm));
    }

    /**
     * Accepts {@code YYYY-MM-DD} or an ISO-8601 date-time, reduced to its UTC calendar day.
     */
    static Optional<LocalDate> parseUtcDay(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        DateTimeParseException lastFailure = null;
        for (Function<String, LocalDate> format : DAY_FORMATS) {
            try {
                return Optional.of(format.apply(trimmed));
            } catch (DateTimeParseException ex) {
                lastFailure = ex;
            }
        }
        log.debug("Unparsable day '{}': {}", trimmed, lastFailure.getMessage());
        return Optional.empty();
    }
}
