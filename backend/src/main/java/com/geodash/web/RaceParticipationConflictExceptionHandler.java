package com.geodash.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class RaceParticipationConflictExceptionHandler {

    @ExceptionHandler(RaceParticipationConflictException.class)
    public ResponseEntity<RaceParticipationConflictErrorResponse> handle(RaceParticipationConflictException ex) {
        return ResponseEntity
                .status(ex.getStatus())
                .body(new RaceParticipationConflictErrorResponse(ex.getCode(), ex.getMessage(), ex.getConflictingRace()));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RaceParticipationConflictErrorResponse(
            String code,
            String message,
            RaceParticipationConflictException.ConflictingRace conflictingRace
    ) {
    }
}
