package com.regatta.service;

import com.regatta.config.RegattaRuntimeProperties;
import com.regatta.dto.RaceRequests;
import com.regatta.dto.RaceResponses;
import com.regatta.mapper.RegattaResponseMapper;
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
import com.regatta.web.RegattaValidationException;
import com.regatta.web.ResourceNotFoundException;
import com.regatta.web.StateConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RaceResultServiceTest {

    private static final UUID RACE_ID = UUID.fromString("00000000-0000-0000-0000-000000000901");
    private static final UUID EVENT_ID = UUID.fromString("00000000-0000-0000-0000-000000000902");
    private static final UUID BOAT_CLASS_ID = UUID.fromString("00000000-0000-0000-0000-000000000903");

    @Mock
    private RaceRepository raceRepository;

    @Mock
    private CompetitionEventRepository competitionEventRepository;

    @Mock
    private BoatClassRepository boatClassRepository;

    @Mock
    private RaceResultLedger raceResultLedger;

    private RaceResultService raceResultService;

    @BeforeEach
    void setUp() {
        raceResultService = new RaceResultService(
                raceRepository,
                competitionEventRepository,
                boatClassRepository,
                raceResultLedger,
                new RegattaResponseMapper(),
                new RegattaRuntimeProperties()
        );
    }

    @Test
    void recordResults_completesRaceAndRanksLanes() {
        Race race = race(null, RaceStatus.SCHEDULED, RacePhase.TIME_TRIAL);
        stubRace(race);
        stubAppend();

        RaceResponses.RaceDetail detail = raceResultService.recordResults(RACE_ID, new RaceRequests.RecordResultsRequest(List.of(
                new RaceRequests.LaneResultRequest(1, LaneStatus.OK, "7:05.10", null),
                new RaceRequests.LaneResultRequest(2, LaneStatus.OK, null, 421_000L),
                new RaceRequests.LaneResultRequest(3, LaneStatus.DNF, null, null)
        )));

        assertEquals(RaceStatus.COMPLETED, detail.status());
        assertEquals(1, detail.revision());
        assertEquals(2, detail.lanes().get(0).position());
        assertEquals(1, detail.lanes().get(1).position());
        assertEquals(425_100L, detail.lanes().get(0).elapsedMs());
        assertEquals(LaneStatus.DNF, detail.lanes().get(2).status());
        assertNull(detail.lanes().get(2).position());
        verify(raceRepository).save(race);
        verify(raceResultLedger).append(eq(RACE_ID), anyList(), isNull(), any(OffsetDateTime.class));
    }

    @Test
    void recordResults_preferTimeMsOverTimeString() {
        Race race = race(null, RaceStatus.SCHEDULED, RacePhase.TIME_TRIAL);
        stubRace(race);
        stubAppend();

        RaceResponses.RaceDetail detail = raceResultService.recordResults(RACE_ID, new RaceRequests.RecordResultsRequest(List.of(
                new RaceRequests.LaneResultRequest(1, LaneStatus.OK, "9:59.99", 400_000L),
                new RaceRequests.LaneResultRequest(2, LaneStatus.OK, null, 401_000L),
                new RaceRequests.LaneResultRequest(3, LaneStatus.OK, null, 402_000L)
        )));

        assertEquals(400_000L, detail.lanes().get(0).elapsedMs());
        assertEquals(1, detail.lanes().get(0).position());
    }

    @Test
    void recordResults_rejectsCompletedRace() {
        stubRace(race(null, RaceStatus.COMPLETED, RacePhase.TIME_TRIAL));

        StateConflictException ex = assertThrows(StateConflictException.class,
                () -> raceResultService.recordResults(RACE_ID, threeLanes()));

        assertEquals(StateConflictException.RACE_COMPLETED, ex.getCode());
        verify(raceResultLedger, never()).append(any(), anyList(), any(), any());
    }

    @Test
    void recordResults_rejectsRaceOfCompletedEvent() {
        Race race = race(EVENT_ID, RaceStatus.SCHEDULED, RacePhase.FINAL_A);
        stubRace(race);
        when(competitionEventRepository.findByEventIdForUpdate(EVENT_ID))
                .thenReturn(Optional.of(event(EventStatus.COMPLETED, RacePhase.FINAL_A)));

        StateConflictException ex = assertThrows(StateConflictException.class,
                () -> raceResultService.recordResults(RACE_ID, threeLanes()));

        assertEquals(StateConflictException.EVENT_COMPLETED, ex.getCode());
    }

    @Test
    void recordResults_listsEveryLaneProblem() {
        stubRace(race(null, RaceStatus.SCHEDULED, RacePhase.TIME_TRIAL));

        RegattaValidationException ex = assertThrows(RegattaValidationException.class,
                () -> raceResultService.recordResults(RACE_ID, new RaceRequests.RecordResultsRequest(List.of(
                        new RaceRequests.LaneResultRequest(1, LaneStatus.OK, null, null),
                        new RaceRequests.LaneResultRequest(1, LaneStatus.OK, null, 400_000L),
                        new RaceRequests.LaneResultRequest(5, LaneStatus.OK, null, 401_000L)
                ))));

        assertEquals("invalid_results", ex.getCode());
        assertEquals(List.of(
                "lane 1 finished without a time",
                "lane 1 is reported more than once",
                "lane 2 has no result",
                "lane 3 has no result",
                "lane 5 is not assigned in TT1"
        ), ex.getDetails());
    }

    @Test
    void recordResults_unknownRaceIsNotFound() {
        when(raceRepository.findById(RACE_ID)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class,
                () -> raceResultService.recordResults(RACE_ID, threeLanes()));
    }

    @Test
    void correctResults_appendsRevisionWithReason() {
        Race race = race(EVENT_ID, RaceStatus.COMPLETED, RacePhase.TIME_TRIAL);
        stubRace(race);
        when(competitionEventRepository.findByEventIdForUpdate(EVENT_ID))
                .thenReturn(Optional.of(event(EventStatus.IN_PROGRESS, RacePhase.TIME_TRIAL)));
        when(raceResultLedger.append(eq(RACE_ID), anyList(), eq("photo finish review"), any(OffsetDateTime.class)))
                .thenAnswer(invocation -> record(2, invocation.getArgument(1), invocation.getArgument(2)));

        RaceResponses.RaceDetail detail = raceResultService.correctResults(RACE_ID,
                new RaceRequests.CorrectResultsRequest(threeLanes().lanes(), "  photo finish review "));

        assertEquals(2, detail.revision());
        ArgumentCaptor<List<RecordedLaneResult>> lanes = ArgumentCaptor.forClass(List.class);
        verify(raceResultLedger).append(eq(RACE_ID), lanes.capture(), eq("photo finish review"), any(OffsetDateTime.class));
        assertEquals(3, lanes.getValue().size());
    }

    @Test
    void correctResults_rejectsScheduledRace() {
        stubRace(race(null, RaceStatus.SCHEDULED, RacePhase.TIME_TRIAL));

        StateConflictException ex = assertThrows(StateConflictException.class,
                () -> raceResultService.correctResults(RACE_ID,
                        new RaceRequests.CorrectResultsRequest(threeLanes().lanes(), "typo")));

        assertEquals(StateConflictException.RACE_NOT_COMPLETED, ex.getCode());
    }

    @Test
    void correctResults_rejectsRaceWhoseEventMovedOn() {
        stubRace(race(EVENT_ID, RaceStatus.COMPLETED, RacePhase.TIME_TRIAL));
        when(competitionEventRepository.findByEventIdForUpdate(EVENT_ID))
                .thenReturn(Optional.of(event(EventStatus.IN_PROGRESS, RacePhase.SEMIFINAL)));

        StateConflictException ex = assertThrows(StateConflictException.class,
                () -> raceResultService.correctResults(RACE_ID,
                        new RaceRequests.CorrectResultsRequest(threeLanes().lanes(), "typo")));

        assertEquals(StateConflictException.DOWNSTREAM_RACES_EXIST, ex.getCode());
    }

    @Test
    void correctResults_allowsFinalBWhileFinalsArePending() {
        Race race = race(EVENT_ID, RaceStatus.COMPLETED, RacePhase.FINAL_B);
        stubRace(race);
        when(competitionEventRepository.findByEventIdForUpdate(EVENT_ID))
                .thenReturn(Optional.of(event(EventStatus.IN_PROGRESS, RacePhase.FINAL_A)));
        when(raceResultLedger.append(eq(RACE_ID), anyList(), eq("typo"), any(OffsetDateTime.class)))
                .thenAnswer(invocation -> record(2, invocation.getArgument(1), invocation.getArgument(2)));

        RaceResponses.RaceDetail detail = raceResultService.correctResults(RACE_ID,
                new RaceRequests.CorrectResultsRequest(threeLanes().lanes(), "typo"));

        assertEquals(2, detail.revision());
    }

    private void stubRace(Race race) {
        when(raceRepository.findById(RACE_ID)).thenReturn(Optional.of(race));
        when(raceRepository.findByRaceIdForUpdate(RACE_ID)).thenReturn(Optional.of(race));
    }

    private void stubAppend() {
        when(raceResultLedger.append(eq(RACE_ID), anyList(), isNull(), any(OffsetDateTime.class)))
                .thenAnswer(invocation -> record(1, invocation.getArgument(1), null));
    }

    private static RaceResultRecord record(int revision, List<RecordedLaneResult> lanes, String reason) {
        RaceResultRecord record = new RaceResultRecord();
        record.setRecordId(UUID.randomUUID());
        record.setRaceId(RACE_ID);
        record.setRevision(revision);
        record.setReason(reason);
        record.setLanes(lanes);
        return record;
    }

    private static RaceRequests.RecordResultsRequest threeLanes() {
        return new RaceRequests.RecordResultsRequest(List.of(
                new RaceRequests.LaneResultRequest(1, LaneStatus.OK, null, 400_000L),
                new RaceRequests.LaneResultRequest(2, LaneStatus.OK, null, 401_000L),
                new RaceRequests.LaneResultRequest(3, LaneStatus.OK, null, 402_000L)
        ));
    }

    private static Race race(UUID eventId, RaceStatus status, RacePhase phase) {
        Race race = new Race();
        race.setRaceId(RACE_ID);
        race.setCompetitionId(UUID.fromString("00000000-0000-0000-0000-000000000904"));
        race.setEventId(eventId);
        race.setBoatClassId(BOAT_CLASS_ID);
        race.setPhase(phase);
        race.setRaceCode(phase.raceCode(1));
        race.setStatus(status);
        race.setLanes(List.of(
                new RaceLane(1, new UUID(0L, 1), new UUID(1L, 1), new UUID(2L, 1)),
                new RaceLane(2, new UUID(0L, 2), new UUID(1L, 2), new UUID(2L, 2)),
                new RaceLane(3, new UUID(0L, 3), new UUID(1L, 3), new UUID(2L, 3))
        ));
        return race;
    }

    private static CompetitionEvent event(EventStatus status, RacePhase phase) {
        CompetitionEvent event = new CompetitionEvent();
        event.setEventId(EVENT_ID);
        event.setStatus(status);
        event.setCurrentPhase(phase);
        return event;
    }
}
