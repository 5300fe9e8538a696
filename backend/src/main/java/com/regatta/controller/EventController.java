package com.regatta.controller;

import com.regatta.dto.EventRequests;
import com.regatta.dto.EventResponses;
import com.regatta.model.RacePhase;
import com.regatta.service.BracketProgressionService;
import com.regatta.service.EventService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/events/{eventId}")
public class EventController {

    private final EventService eventService;
    private final BracketProgressionService bracketProgressionService;

    public EventController(EventService eventService, BracketProgressionService bracketProgressionService) {
        this.eventService = eventService;
        this.bracketProgressionService = bracketProgressionService;
    }

    @PostMapping("/time-trial")
    public ResponseEntity<EventResponses.TimeTrialSeeded> seedTimeTrial(
            @PathVariable UUID eventId,
            @Valid @RequestBody(required = false) EventRequests.SeedTimeTrialRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(bracketProgressionService.seedTimeTrial(eventId, request));
    }

    @PostMapping("/phases/{phase}/process")
    public ResponseEntity<EventResponses.PhaseProcessed> processPhase(
            @PathVariable UUID eventId,
            @PathVariable RacePhase phase
    ) {
        return ResponseEntity.ok(bracketProgressionService.processPhase(eventId, phase));
    }

    @GetMapping("/bracket")
    public ResponseEntity<EventResponses.Bracket> getBracket(@PathVariable UUID eventId) {
        return ResponseEntity.ok(eventService.getBracket(eventId));
    }
}
