package com.geodash.service;

import com.geodash.model.DailyDistanceEntry;
import com.geodash.model.ParticipantStatus;
import com.geodash.model.RaceParticipant;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Merges per-day distance samples into a participant's history.
 *
 * <p>A day's value only ever grows: {@code new = max(existing, incoming)}. The participant total is
 * recomputed from the daily entries after every merge, so replaying a batch changes nothing.
 */
public final class DistanceReconciler {

    private DistanceReconciler() {
    }

    public record MergeOutcome(double gainedKm, double totalDistanceKm, boolean newlyCompleted) {
    }

    public static MergeOutcome merge(
            RaceParticipant participant,
            Collection<DistanceSample> samples,
            double raceDistanceKm,
            OffsetDateTime now
    ) {
        Map<LocalDate, DailyDistanceEntry> byDay = indexByDay(participant);

        double gained = 0.0;
        for (DistanceSample sample : samples) {
            DailyDistanceEntry existing = byDay.get(sample.day());
            double oldDistance = existing != null ? existing.getDistanceKm() : 0.0;
            double newDistance = Math.max(oldDistance, sample.distanceKm());
            if (existing == null) {
                DailyDistanceEntry created = new DailyDistanceEntry(sample.day(), newDistance);
                participant.getDailyDistances().add(created);
                byDay.put(sample.day(), created);
            } else {
                existing.setDistanceKm(newDistance);
            }
            gained += Math.max(0.0, newDistance - oldDistance);
        }

        participant.getDailyDistances().sort(Comparator.comparing(DailyDistanceEntry::getDay));
        double total = participant.recomputeTotalDistance();
        boolean completed = completeIfReached(participant, raceDistanceKm, now);
        return new MergeOutcome(gained, total, completed);
    }

    /**
     * Active participant at or over the threshold becomes completed, stamped with the observation
     * time rather than the sample day.
     */
    public static boolean completeIfReached(RaceParticipant participant, double raceDistanceKm, OffsetDateTime now) {
        if (participant.getStatus() == ParticipantStatus.ACTIVE && participant.getTotalDistance() >= raceDistanceKm) {
            participant.setStatus(ParticipantStatus.COMPLETED);
            participant.setCompletedAt(now);
            return true;
        }
        return false;
    }

    public enum CompletionChange {
        UNCHANGED,
        COMPLETED,
        REVERTED
    }

    /**
     * Completion check in both directions, for paths where a total or the threshold may go down.
     * Withdrawn participants are left alone.
     */
    public static CompletionChange reevaluateCompletion(
            RaceParticipant participant,
            double raceDistanceKm,
            OffsetDateTime now
    ) {
        if (completeIfReached(participant, raceDistanceKm, now)) {
            return CompletionChange.COMPLETED;
        }
        if (participant.getStatus() == ParticipantStatus.COMPLETED && participant.getTotalDistance() < raceDistanceKm) {
            participant.setStatus(ParticipantStatus.ACTIVE);
            participant.setCompletedAt(null);
            return CompletionChange.REVERTED;
        }
        return CompletionChange.UNCHANGED;
    }

    private static Map<LocalDate, DailyDistanceEntry> indexByDay(RaceParticipant participant) {
        Map<LocalDate, DailyDistanceEntry> byDay = new LinkedHashMap<>();
        for (DailyDistanceEntry entry : participant.getDailyDistances()) {
            if (entry.getDay() != null) {
                byDay.putIfAbsent(entry.getDay(), entry);
            }
        }
        return byDay;
    }
}
