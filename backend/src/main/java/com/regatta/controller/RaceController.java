package com.regatta.controller;

import com.regatta.dto.RaceRequests;
import com.regatta.dto.RaceResponses;
import com.regatta.service.RaceResultService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/races/{raceId}")
public class RaceController {

    private final RaceResultService raceResultService;

    public RaceController(RaceResultService raceResultService) {
        this.raceResultService = raceResultService;
    }

    @GetMapping
    public ResponseEntity<RaceResponses.RaceDetail> getRace(@PathVariable UUID raceId) {
        return ResponseEntity.ok(raceResultService.getRace(raceId));
    }

    @PostMapping("/results")
    public ResponseEntity<RaceResponses.RaceDetail> recordResults(
            @PathVariable UUID raceId,
            @Valid @RequestBody RaceRequests.RecordResultsRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(raceResultService.recordResults(raceId, request));
    }

    @PostMapping("/corrections")
    public ResponseEntity<RaceResponses.RaceDetail> correctResults(
            @PathVariable UUID raceId,
            @Valid @RequestBody RaceRequests.CorrectResultsRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(raceResultService.correctResults(raceId, request));
    }

    @GetMapping("/results/history")
    public ResponseEntity<List<RaceResponses.ResultRevision>> getHistory(@PathVariable UUID raceId) {
        return ResponseEntity.ok(raceResultService.getHistory(raceId));
    }
}
