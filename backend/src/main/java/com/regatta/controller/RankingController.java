package com.regatta.controller;

import com.regatta.dto.RankingResponses;
import com.regatta.service.RankingService;
import com.regatta.service.RankingSystemService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/rankings")
public class RankingController {

    private final RankingService rankingService;
    private final RankingSystemService rankingSystemService;

    public RankingController(RankingService rankingService, RankingSystemService rankingSystemService) {
        this.rankingService = rankingService;
        this.rankingSystemService = rankingSystemService;
    }

    @GetMapping("/competitions/{competitionId}")
    public ResponseEntity<RankingResponses.CompetitionRanking> getRankings(
            @PathVariable UUID competitionId,
            @RequestParam(required = false) UUID systemId,
            @RequestParam(defaultValue = "false") boolean includeMasters
    ) {
        return ResponseEntity.ok(rankingService.getRankings(competitionId, systemId, includeMasters));
    }

    @GetMapping("/competitions/{competitionId}/groups/{groupKey}")
    public ResponseEntity<RankingResponses.GroupRanking> getGroupRanking(
            @PathVariable UUID competitionId,
            @PathVariable String groupKey,
            @RequestParam(required = false) UUID systemId,
            @RequestParam(defaultValue = "false") boolean includeMasters
    ) {
        return ResponseEntity.ok(rankingService.getGroupRanking(competitionId, groupKey, systemId, includeMasters));
    }

    @GetMapping("/competitions/{competitionId}/available-systems")
    public ResponseEntity<List<RankingResponses.AvailableSystem>> listAvailableSystems(
            @PathVariable UUID competitionId
    ) {
        return ResponseEntity.ok(rankingService.listAvailableSystems(competitionId));
    }

    @GetMapping("/presets")
    public ResponseEntity<List<RankingResponses.PresetSummary>> listPresets() {
        return ResponseEntity.ok(rankingSystemService.listPresets());
    }

    @PostMapping("/presets/sync")
    public ResponseEntity<RankingResponses.PresetSyncResult> syncPresets() {
        return ResponseEntity.ok(rankingSystemService.syncPresets());
    }
}
