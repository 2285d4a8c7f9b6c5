package com.geodash.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

@Getter
@Setter
@NoArgsConstructor
@Embeddable
public class DailyDistanceEntry {

    @Column(name = "distance_day", nullable = false)
    private LocalDate day;

    @Column(name = "distance_km", nullable = false)
    private double distanceKm;

    public DailyDistanceEntry(LocalDate day, double distanceKm) {
        this.day = day;
        this.distanceKm = distanceKm;
    }
}
