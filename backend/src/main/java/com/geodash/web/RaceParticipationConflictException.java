package com.geodash.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
public class RaceParticipationConflictException extends RuntimeException {

    private final HttpStatus status;
    private final String code;
    private final ConflictingRace conflictingRace;

    public RaceParticipationConflictException(HttpStatus status, String code, String message) {
        this(status, code, message, null);
    }

    public RaceParticipationConflictException(
            HttpStatus status,
            String code,
            String message,
            ConflictingRace conflictingRace
    ) {
        super(message);
        this.status = status;
        this.code = code;
        this.conflictingRace = conflictingRace;
    }

    public static RaceParticipationConflictException raceEnded(String detail) {
        return new RaceParticipationConflictException(HttpStatus.CONFLICT, "race_ended", detail);
    }

    public static RaceParticipationConflictException alreadyParticipant(String detail) {
        return new RaceParticipationConflictException(HttpStatus.CONFLICT, "already_participant", detail);
    }

    public static RaceParticipationConflictException concurrentParticipation(ConflictingRace conflictingRace) {
        return new RaceParticipationConflictException(
                HttpStatus.CONFLICT,
                "concurrent_participation",
                "You can participate in only one race at a time. Leave or finish \""
                        + conflictingRace.name() + "\" first.",
                conflictingRace
        );
    }

    public static RaceParticipationConflictException notParticipant(String detail) {
        return new RaceParticipationConflictException(HttpStatus.NOT_FOUND, "not_participant", detail);
    }

    public static RaceParticipationConflictException alreadyCompleted(String detail) {
        return new RaceParticipationConflictException(HttpStatus.CONFLICT, "already_completed", detail);
    }

    public record ConflictingRace(
            UUID id,
            String name,
            OffsetDateTime startDate,
            OffsetDateTime endDate
    ) {
    }
}
