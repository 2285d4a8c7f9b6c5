package com.geodash.controller;

import com.geodash.dto.HealthSyncRequests;
import com.geodash.dto.HealthSyncResponses;
import com.geodash.service.HealthSyncService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/races/health")
public class HealthSyncController {

    private final HealthSyncService healthSyncService;

    public HealthSyncController(HealthSyncService healthSyncService) {
        this.healthSyncService = healthSyncService;
    }

    @PostMapping("/sync")
    public ResponseEntity<HealthSyncResponses.SyncResult> sync(
            @RequestHeader(RaceController.USER_ID_HEADER) UUID userId,
            @Valid @RequestBody HealthSyncRequests.SyncRequest request
    ) {
        return ResponseEntity.ok(healthSyncService.sync(userId, request));
    }
}
