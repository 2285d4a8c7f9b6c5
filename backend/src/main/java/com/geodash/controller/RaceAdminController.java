package com.geodash.controller;

import com.geodash.dto.RaceRequests;
import com.geodash.dto.RaceResponses;
import com.geodash.service.DistanceCorrectionService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/admin/races")
public class RaceAdminController {

    private final DistanceCorrectionService distanceCorrectionService;

    public RaceAdminController(DistanceCorrectionService distanceCorrectionService) {
        this.distanceCorrectionService = distanceCorrectionService;
    }

    @PutMapping("/{raceId}/participants/{userId}/daily-distances")
    public ResponseEntity<RaceResponses.RaceDetail> overrideDailyDistances(
            @PathVariable UUID raceId,
            @PathVariable UUID userId,
            @Valid @RequestBody RaceRequests.DistanceCorrectionRequest request
    ) {
        return ResponseEntity.ok(distanceCorrectionService.overrideDailyDistances(raceId, userId, request));
    }
}
