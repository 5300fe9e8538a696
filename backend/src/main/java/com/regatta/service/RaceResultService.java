package com.regatta.service;

import com.regatta.config.RegattaRuntimeProperties;
import com.regatta.dto.RaceRequests;
import com.regatta.dto.RaceResponses;
import com.regatta.mapper.RegattaResponseMapper;
import com.regatta.model.BoatClass;
import com.regatta.model.CompetitionEvent;
import com.regatta.model.EventStatus;
import com.regatta.model.LaneStatus;
import com.regatta.model.Race;
import com.regatta.model.RaceLane;
import com.regatta.model.RacePhase;
import com.regatta.model.RaceResultRecord;
import com.regatta.model.RaceStatus;
import com.regatta.model.RecordedLaneResult;
import com.regatta.repository.BoatClassRepository;
import com.regatta.repository.CompetitionEventRepository;
import com.regatta.repository.RaceRepository;
import com.regatta.scoring.LaneOutcome;
import com.regatta.scoring.PlacedLane;
import com.regatta.scoring.RaceTimeFormat;
import com.regatta.scoring.ScoringPolicy;
import com.regatta.web.RegattaValidationException;
import com.regatta.web.ResourceNotFoundException;
import com.regatta.web.StateConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Service
public class RaceResultService {

    private static final Logger log = LoggerFactory.getLogger(RaceResultService.class);
    private static final String INVALID_RESULTS = "invalid_results";

    private final RaceRepository raceRepository;
    private final CompetitionEventRepository competitionEventRepository;
    private final BoatClassRepository boatClassRepository;
    private final RaceResultLedger raceResultLedger;
    private final RegattaResponseMapper regattaResponseMapper;
    private final RegattaRuntimeProperties regattaRuntimeProperties;

    public RaceResultService(
            RaceRepository raceRepository,
            CompetitionEventRepository competitionEventRepository,
            BoatClassRepository boatClassRepository,
            RaceResultLedger raceResultLedger,
            RegattaResponseMapper regattaResponseMapper,
            RegattaRuntimeProperties regattaRuntimeProperties
    ) {
        this.raceRepository = raceRepository;
        this.competitionEventRepository = competitionEventRepository;
        this.boatClassRepository = boatClassRepository;
        this.raceResultLedger = raceResultLedger;
        this.regattaResponseMapper = regattaResponseMapper;
        this.regattaRuntimeProperties = regattaRuntimeProperties;
    }

    @Transactional(readOnly = true)
    public RaceResponses.RaceDetail getRace(UUID raceId) {
        Race race = raceRepository.findById(raceId)
                .orElseThrow(() -> ResourceNotFoundException.of("Race", raceId));
        return regattaResponseMapper.toRaceDetail(race, effectiveResult(race));
    }

    @Transactional(readOnly = true)
    public List<RaceResponses.ResultRevision> getHistory(UUID raceId) {
        if (!raceRepository.existsById(raceId)) {
            throw ResourceNotFoundException.of("Race", raceId);
        }
        return raceResultLedger.history(raceId).stream()
                .map(regattaResponseMapper::toResultRevision)
                .toList();
    }

    /**
     * Records the first result of a scheduled race and completes it.
     */
    @Transactional
    public RaceResponses.RaceDetail recordResults(UUID raceId, RaceRequests.RecordResultsRequest request) {
        CompetitionEvent event = lockEventOf(raceId);
        Race race = lockRace(raceId);

        if (event != null && event.getStatus() == EventStatus.COMPLETED) {
            throw StateConflictException.eventCompleted("Event " + event.getEventId() + " is already completed");
        }
        if (race.getStatus() == RaceStatus.COMPLETED) {
            throw StateConflictException.raceCompleted(
                    "Race " + race.getRaceCode() + " already has results; submit a correction instead");
        }
        if (race.getStatus() == RaceStatus.CANCELLED) {
            throw new RegattaValidationException("Race " + race.getRaceCode() + " was cancelled");
        }

        OffsetDateTime now = OffsetDateTime.now();
        RaceResultRecord record = raceResultLedger.append(raceId, toRecordedLanes(race, request.lanes()), null, now);
        race.setStatus(RaceStatus.COMPLETED);
        race.setCompletedAt(now);
        race.setUpdatedAt(now);
        raceRepository.save(race);

        log.info("Recorded results for race {} ({} lanes)", race.getRaceCode(), record.getLanes().size());
        return regattaResponseMapper.toRaceDetail(race, record);
    }

    /**
     * Appends a corrected revision. Allowed only while the owning event has not
     * moved past the race's phase.
     */
    @Transactional
    public RaceResponses.RaceDetail correctResults(UUID raceId, RaceRequests.CorrectResultsRequest request) {
        CompetitionEvent event = lockEventOf(raceId);
        Race race = lockRace(raceId);

        if (race.getStatus() != RaceStatus.COMPLETED) {
            throw StateConflictException.raceNotCompleted(
                    "Race " + race.getRaceCode() + " has no results to correct");
        }
        if (event != null) {
            if (event.getStatus() == EventStatus.COMPLETED) {
                throw StateConflictException.eventCompleted("Event " + event.getEventId() + " is already completed");
            }
            if (bracketPhase(race.getPhase()).isBefore(event.getCurrentPhase())) {
                throw StateConflictException.downstreamRacesExist(
                        "Event already advanced to " + event.getCurrentPhase() + "; " + race.getRaceCode()
                                + " can no longer be corrected");
            }
        }

        OffsetDateTime now = OffsetDateTime.now();
        RaceResultRecord record = raceResultLedger.append(
                raceId, toRecordedLanes(race, request.lanes()), request.reason().trim(), now);
        race.setUpdatedAt(now);
        raceRepository.save(race);

        log.info("Corrected race {} to revision {}: {}", race.getRaceCode(), record.getRevision(), record.getReason());
        return regattaResponseMapper.toRaceDetail(race, record);
    }

    private CompetitionEvent lockEventOf(UUID raceId) {
        Race race = raceRepository.findById(raceId)
                .orElseThrow(() -> ResourceNotFoundException.of("Race", raceId));
        if (race.getEventId() == null) {
            return null;
        }
        return competitionEventRepository.findByEventIdForUpdate(race.getEventId())
                .orElseThrow(() -> ResourceNotFoundException.of("Event", race.getEventId()));
    }

    private Race lockRace(UUID raceId) {
        return raceRepository.findByRaceIdForUpdate(raceId)
                .orElseThrow(() -> ResourceNotFoundException.of("Race", raceId));
    }

    private RaceResultRecord effectiveResult(Race race) {
        if (race.getStatus() != RaceStatus.COMPLETED) {
            return null;
        }
        return raceResultLedger.latestByRace(List.of(race)).get(race.getRaceId());
    }

    private List<RecordedLaneResult> toRecordedLanes(Race race, List<RaceRequests.LaneResultRequest> submitted) {
        Set<Integer> assigned = new HashSet<>();
        race.getLanes().stream().map(RaceLane::getLaneNumber).forEach(assigned::add);

        List<String> problems = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        List<LaneOutcome> outcomes = new ArrayList<>(submitted.size());
        for (RaceRequests.LaneResultRequest lane : submitted) {
            int laneNumber = lane.laneNumber();
            if (!seen.add(laneNumber)) {
                problems.add("lane " + laneNumber + " is reported more than once");
                continue;
            }
            if (!assigned.contains(laneNumber)) {
                problems.add("lane " + laneNumber + " is not assigned in " + race.getRaceCode());
                continue;
            }
            Long elapsedMs = null;
            if (lane.status() == LaneStatus.OK) {
                if (lane.timeMs() != null) {
                    elapsedMs = lane.timeMs();
                } else if (lane.time() != null && !lane.time().isBlank()) {
                    elapsedMs = RaceTimeFormat.parseToMillis(lane.time());
                } else {
                    problems.add("lane " + laneNumber + " finished without a time");
                    continue;
                }
            }
            outcomes.add(new LaneOutcome(laneNumber, lane.status(), elapsedMs));
        }
        for (Integer laneNumber : assigned) {
            if (!seen.contains(laneNumber)) {
                problems.add("lane " + laneNumber + " has no result");
            }
        }
        if (!problems.isEmpty()) {
            problems.sort(Comparator.naturalOrder());
            throw new RegattaValidationException(
                    INVALID_RESULTS, "Results for " + race.getRaceCode() + " are incomplete or invalid", problems);
        }

        int laneCapacity = boatClassRepository.findById(race.getBoatClassId())
                .map(BoatClass::getLaneCapacity)
                .map(regattaRuntimeProperties::resolveLaneCapacity)
                .orElseGet(() -> regattaRuntimeProperties.getDefaultLaneCapacity());
        List<RecordedLaneResult> recorded = new ArrayList<>(outcomes.size());
        for (PlacedLane placed : ScoringPolicy.resolveFinishOrder(outcomes, laneCapacity, false)) {
            LaneOutcome lane = placed.lane();
            recorded.add(new RecordedLaneResult(lane.laneNumber(), lane.elapsedMs(), lane.status(), placed.position()));
        }
        recorded.sort(Comparator.comparing(RecordedLaneResult::getLaneNumber));
        return recorded;
    }

    private static RacePhase bracketPhase(RacePhase phase) {
        return phase == RacePhase.FINAL_B ? RacePhase.FINAL_A : phase;
    }
}
