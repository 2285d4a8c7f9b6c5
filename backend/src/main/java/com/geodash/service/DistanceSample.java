package com.geodash.service;

import java.time.LocalDate;

/**
 * A validated per-day distance reading, in kilometers.
 */
public record DistanceSample(LocalDate day, double distanceKm) {
}
