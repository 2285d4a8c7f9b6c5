package com.geodash.controller;

import com.geodash.dto.LeaderboardResponses;
import com.geodash.dto.RaceRequests;
import com.geodash.dto.RaceResponses;
import com.geodash.service.LeaderboardService;
import com.geodash.service.RaceService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/races")
public class RaceController {

    static final String USER_ID_HEADER = "X-User-Id";

    private final RaceService raceService;
    private final LeaderboardService leaderboardService;

    public RaceController(RaceService raceService, LeaderboardService leaderboardService) {
        this.raceService = raceService;
        this.leaderboardService = leaderboardService;
    }

    @GetMapping
    public ResponseEntity<List<RaceResponses.RaceSummary>> listRaces(
            @RequestParam(required = false) String status
    ) {
        return ResponseEntity.ok(raceService.listRaces(status));
    }

    @PostMapping
    public ResponseEntity<RaceResponses.RaceDetail> createRace(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @Valid @RequestBody RaceRequests.CreateRaceRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(raceService.createRace(userId, request));
    }

    @GetMapping("/{raceId}")
    public ResponseEntity<RaceResponses.RaceDetail> getRace(@PathVariable UUID raceId) {
        return ResponseEntity.ok(raceService.getRace(raceId));
    }

    @PutMapping("/{raceId}")
    public ResponseEntity<RaceResponses.RaceDetail> updateRace(
            @PathVariable UUID raceId,
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @Valid @RequestBody RaceRequests.UpdateRaceRequest request
    ) {
        return ResponseEntity.ok(raceService.updateRace(raceId, userId, request));
    }

    @DeleteMapping("/{raceId}")
    public ResponseEntity<RaceResponses.RaceDeleted> deleteRace(
            @PathVariable UUID raceId,
            @RequestHeader(USER_ID_HEADER) UUID userId
    ) {
        return ResponseEntity.ok(raceService.deleteRace(raceId, userId));
    }

    @PostMapping("/{raceId}/join")
    public ResponseEntity<RaceResponses.RaceDetail> joinRace(
            @PathVariable UUID raceId,
            @RequestHeader(USER_ID_HEADER) UUID userId
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(raceService.joinRace(raceId, userId));
    }

    @PostMapping("/{raceId}/withdraw")
    public ResponseEntity<RaceResponses.RaceDetail> withdraw(
            @PathVariable UUID raceId,
            @RequestHeader(USER_ID_HEADER) UUID userId
    ) {
        return ResponseEntity.ok(raceService.withdraw(raceId, userId));
    }

    /**
     * Distances only enter a race through health sync.
     */
    @PutMapping("/{raceId}/distance")
    public ResponseEntity<Void> updateDistance(@PathVariable UUID raceId) {
        throw new ResponseStatusException(
                HttpStatus.FORBIDDEN,
                "Manual distance updates are disabled. Use health sync."
        );
    }

    @GetMapping("/{raceId}/finish-state")
    public ResponseEntity<RaceResponses.FinishState> getFinishState(@PathVariable UUID raceId) {
        return ResponseEntity.ok(raceService.getFinishState(raceId));
    }

    @GetMapping("/{raceId}/leaderboard")
    public ResponseEntity<LeaderboardResponses.RaceLeaderboard> getRaceLeaderboard(@PathVariable UUID raceId) {
        return ResponseEntity.ok(leaderboardService.raceLeaderboard(raceId));
    }
}
