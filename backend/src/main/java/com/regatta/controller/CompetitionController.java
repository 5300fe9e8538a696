package com.regatta.controller;

import com.regatta.dto.CompetitionRequests;
import com.regatta.dto.CompetitionResponses;
import com.regatta.dto.EventRequests;
import com.regatta.dto.EventResponses;
import com.regatta.dto.RaceRequests;
import com.regatta.dto.RaceResponses;
import com.regatta.service.EntryApprovalService;
import com.regatta.service.EventService;
import com.regatta.service.MedalStandingsService;
import com.regatta.service.StageRaceService;
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
@RequestMapping("/api/competitions/{competitionId}")
public class CompetitionController {

    private final EventService eventService;
    private final StageRaceService stageRaceService;
    private final EntryApprovalService entryApprovalService;
    private final MedalStandingsService medalStandingsService;

    public CompetitionController(
            EventService eventService,
            StageRaceService stageRaceService,
            EntryApprovalService entryApprovalService,
            MedalStandingsService medalStandingsService
    ) {
        this.eventService = eventService;
        this.stageRaceService = stageRaceService;
        this.entryApprovalService = entryApprovalService;
        this.medalStandingsService = medalStandingsService;
    }

    @PostMapping("/events")
    public ResponseEntity<EventResponses.EventSummary> createEvent(
            @PathVariable UUID competitionId,
            @Valid @RequestBody EventRequests.CreateEventRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(eventService.createEvent(competitionId, request));
    }

    @GetMapping("/events")
    public ResponseEntity<List<EventResponses.EventSummary>> listEvents(@PathVariable UUID competitionId) {
        return ResponseEntity.ok(eventService.listEvents(competitionId));
    }

    @PostMapping("/races")
    public ResponseEntity<RaceResponses.RaceDetail> scheduleRace(
            @PathVariable UUID competitionId,
            @Valid @RequestBody RaceRequests.ScheduleRaceRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(stageRaceService.scheduleRace(competitionId, request));
    }

    @PostMapping("/entries/approve")
    public ResponseEntity<CompetitionResponses.ApprovalOutcome> approveEntries(
            @PathVariable UUID competitionId,
            @Valid @RequestBody CompetitionRequests.ApproveEntriesRequest request
    ) {
        return ResponseEntity.ok(entryApprovalService.approveEntries(competitionId, request));
    }

    @GetMapping("/medal-standings")
    public ResponseEntity<List<CompetitionResponses.MedalStanding>> getMedalStandings(
            @PathVariable UUID competitionId
    ) {
        return ResponseEntity.ok(medalStandingsService.getMedalStandings(competitionId));
    }
}
