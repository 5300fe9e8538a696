package com.regatta.controller;

import com.regatta.dto.RankingResponses;
import com.regatta.model.Gender;
import com.regatta.model.RankingEntityType;
import com.regatta.ranking.RankingLayout;
import com.regatta.service.RankingService;
import com.regatta.service.RankingSystemService;
import com.regatta.web.RegattaValidationException;
import com.regatta.web.ResourceNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RankingController.class)
class RankingControllerTest {

    private static final UUID COMPETITION_ID = UUID.fromString("00000000-0000-0000-0000-000000000701");
    private static final UUID SYSTEM_ID = UUID.fromString("00000000-0000-0000-0000-000000000702");
    private static final UUID CLUB_ID = UUID.fromString("00000000-0000-0000-0000-000000000703");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private RankingService rankingService;

    @MockitoBean
    private RankingSystemService rankingSystemService;

    @Test
    void groupRankingPassesSystemAndMastersFlag() throws Exception {
        when(rankingService.getGroupRanking(COMPETITION_ID, "M", SYSTEM_ID, true)).thenReturn(
                new RankingResponses.GroupRanking(COMPETITION_ID, "CLASSIC_CUP", "M", RankingLayout.CLUB_POINTS,
                        RankingLayout.CLUB_POINTS.getBaseColumns(),
                        new RankingResponses.Group("M", Gender.M, null, null,
                                new RankingResponses.Titles("Men", null, null),
                                List.of(new RankingResponses.Entry(1, RankingEntityType.CLUB, CLUB_ID, "South Rowing",
                                        null, 28, 0, 0, 0, 0, 4, 2, 1, 0, 0, 0, 0, List.of()))),
                        OffsetDateTime.parse("2026-06-14T18:00:00Z")));

        mockMvc.perform(get("/api/rankings/competitions/{competitionId}/groups/{groupKey}", COMPETITION_ID, "M")
                        .param("systemId", SYSTEM_ID.toString())
                        .param("includeMasters", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.layout").value("CLUB_POINTS"))
                .andExpect(jsonPath("$.group.entries[0].entityName").value("South Rowing"))
                .andExpect(jsonPath("$.group.entries[0].totalPoints").value(28));
    }

    @Test
    void unknownGroupListsAvailableKeys() throws Exception {
        when(rankingService.getGroupRanking(COMPETITION_ID, "F", null, false)).thenThrow(
                new ResourceNotFoundException("Ranking group not found: F", List.of("M")));

        mockMvc.perform(get("/api/rankings/competitions/{competitionId}/groups/{groupKey}", COMPETITION_ID, "F"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("not_found"))
                .andExpect(jsonPath("$.details[0]").value("M"));
    }

    @Test
    void inactiveSystemReturnsBadRequest() throws Exception {
        when(rankingService.getRankings(COMPETITION_ID, SYSTEM_ID, false)).thenThrow(
                new RegattaValidationException("Ranking system OLD_CUP is inactive"));

        mockMvc.perform(get("/api/rankings/competitions/{competitionId}", COMPETITION_ID)
                        .param("systemId", SYSTEM_ID.toString()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_failed"));
    }

    @Test
    void malformedSystemIdReturnsBadRequest() throws Exception {
        mockMvc.perform(get("/api/rankings/competitions/{competitionId}", COMPETITION_ID)
                        .param("systemId", "classic"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.systemId").exists());
    }

    @Test
    void syncPresetsReportsCreatedAndUpdated() throws Exception {
        when(rankingSystemService.syncPresets()).thenReturn(
                new RankingResponses.PresetSyncResult(List.of("BEACH_CUP"), List.of("CLASSIC_CUP")));

        mockMvc.perform(post("/api/rankings/presets/sync"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.created[0]").value("BEACH_CUP"))
                .andExpect(jsonPath("$.updated[0]").value("CLASSIC_CUP"));
    }
}
