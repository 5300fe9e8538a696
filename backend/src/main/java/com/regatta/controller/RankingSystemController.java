package com.regatta.controller;

import com.regatta.dto.RankingRequests;
import com.regatta.dto.RankingResponses;
import com.regatta.service.RankingSystemService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/rankings/systems")
public class RankingSystemController {

    private final RankingSystemService rankingSystemService;

    public RankingSystemController(RankingSystemService rankingSystemService) {
        this.rankingSystemService = rankingSystemService;
    }

    @GetMapping
    public ResponseEntity<List<RankingResponses.RankingSystemDetail>> listSystems() {
        return ResponseEntity.ok(rankingSystemService.listSystems());
    }

    @PostMapping
    public ResponseEntity<RankingResponses.RankingSystemDetail> createSystem(
            @Valid @RequestBody RankingRequests.RankingSystemRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(rankingSystemService.createSystem(request));
    }

    @GetMapping("/{systemId}")
    public ResponseEntity<RankingResponses.RankingSystemDetail> getSystem(@PathVariable UUID systemId) {
        return ResponseEntity.ok(rankingSystemService.getSystem(systemId));
    }

    @PutMapping("/{systemId}")
    public ResponseEntity<RankingResponses.RankingSystemDetail> updateSystem(
            @PathVariable UUID systemId,
            @Valid @RequestBody RankingRequests.RankingSystemRequest request
    ) {
        return ResponseEntity.ok(rankingSystemService.updateSystem(systemId, request));
    }

    @DeleteMapping("/{systemId}")
    public ResponseEntity<Void> deleteSystem(@PathVariable UUID systemId) {
        rankingSystemService.deleteSystem(systemId);
        return ResponseEntity.noContent().build();
    }
}
