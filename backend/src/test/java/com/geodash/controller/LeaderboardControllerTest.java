package com.geodash.controller;

import com.geodash.dto.LeaderboardResponses;
import com.geodash.service.LeaderboardService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(LeaderboardController.class)
class LeaderboardControllerTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000901");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private LeaderboardService leaderboardService;

    @Test
    void globalLeaderboardIsRanked() throws Exception {
        when(leaderboardService.globalLeaderboard()).thenReturn(new LeaderboardResponses.GlobalLeaderboard(List.of(
                new LeaderboardResponses.GlobalEntry(1, USER_ID, "Rui", "rui@example.com", null, 42.5, 3, 2),
                new LeaderboardResponses.GlobalEntry(2, UUID.randomUUID(), "Sam", "sam@example.com", null, 42.5, 3, 0)
        )));

        mockMvc.perform(get("/api/races/leaderboard"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.leaderboard[0].rank").value(1))
                .andExpect(jsonPath("$.leaderboard[0].userId").value(USER_ID.toString()))
                .andExpect(jsonPath("$.leaderboard[0].wins").value(2))
                .andExpect(jsonPath("$.leaderboard[1].totalKm").value(42.5));
    }

    @Test
    void myStatsIsWrappedInEnvelope() throws Exception {
        when(leaderboardService.userStats(USER_ID)).thenReturn(
                new LeaderboardResponses.UserStats(USER_ID, "Rui", 4, 1, 37.25, 25.0));

        mockMvc.perform(get("/api/races/my-stats").header("X-User-Id", USER_ID.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stats.racesParticipated").value(4))
                .andExpect(jsonPath("$.stats.wins").value(1))
                .andExpect(jsonPath("$.stats.winRate").value(25.0));
    }

    @Test
    void myStatsRequiresUserHeader() throws Exception {
        mockMvc.perform(get("/api/races/my-stats"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors['X-User-Id']").value("X-User-Id header is required"));
    }
}
