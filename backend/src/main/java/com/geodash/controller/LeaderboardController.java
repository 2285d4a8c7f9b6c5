package com.geodash.controller;

import com.geodash.dto.LeaderboardResponses;
import com.geodash.service.LeaderboardService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/races")
public class LeaderboardController {

    private final LeaderboardService leaderboardService;

    public LeaderboardController(LeaderboardService leaderboardService) {
        this.leaderboardService = leaderboardService;
    }

    @GetMapping("/leaderboard")
    public ResponseEntity<LeaderboardResponses.GlobalLeaderboard> getGlobalLeaderboard() {
        return ResponseEntity.ok(leaderboardService.globalLeaderboard());
    }

    @GetMapping("/my-stats")
    public ResponseEntity<LeaderboardResponses.UserStatsEnvelope> getMyStats(
            @RequestHeader(RaceController.USER_ID_HEADER) UUID userId
    ) {
        return ResponseEntity.ok(new LeaderboardResponses.UserStatsEnvelope(leaderboardService.userStats(userId)));
    }
}
