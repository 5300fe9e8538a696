package com.regatta.service;

import com.regatta.dto.CompetitionRequests;
import com.regatta.dto.CompetitionResponses;
import com.regatta.dto.EventRequests;
import com.regatta.dto.EventResponses;
import com.regatta.dto.RaceRequests;
import com.regatta.dto.RaceResponses;
import com.regatta.dto.RankingResponses;
import com.regatta.model.Athlete;
import com.regatta.model.AthleteStatus;
import com.regatta.model.BoatClass;
import com.regatta.model.Category;
import com.regatta.model.Club;
import com.regatta.model.Competition;
import com.regatta.model.CompetitionEntry;
import com.regatta.model.Discipline;
import com.regatta.model.EntryStatus;
import com.regatta.model.EventStatus;
import com.regatta.model.Gender;
import com.regatta.model.GenderScope;
import com.regatta.model.LaneStatus;
import com.regatta.model.MedalType;
import com.regatta.model.RacePhase;
import com.regatta.model.RaceStatus;
import com.regatta.repository.AthleteRepository;
import com.regatta.repository.BoatClassRepository;
import com.regatta.repository.CategoryRepository;
import com.regatta.repository.ClubRepository;
import com.regatta.repository.CompetitionEntryRepository;
import com.regatta.repository.CompetitionRepository;
import com.regatta.repository.RankingSystemRepository;
import com.regatta.web.NotEligibleException;
import com.regatta.web.ResourceNotFoundException;
import com.regatta.web.StateConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
@Transactional
class RegattaFlowIntegrationTest {

    @Autowired
    private EventService eventService;

    @Autowired
    private BracketProgressionService bracketProgressionService;

    @Autowired
    private RaceResultService raceResultService;

    @Autowired
    private EntryApprovalService entryApprovalService;

    @Autowired
    private MedalStandingsService medalStandingsService;

    @Autowired
    private RankingService rankingService;

    @Autowired
    private RankingSystemService rankingSystemService;

    @Autowired
    private RankingSystemRepository rankingSystemRepository;

    @Autowired
    private ClubRepository clubRepository;

    @Autowired
    private AthleteRepository athleteRepository;

    @Autowired
    private CategoryRepository categoryRepository;

    @Autowired
    private BoatClassRepository boatClassRepository;

    @Autowired
    private CompetitionRepository competitionRepository;

    @Autowired
    private CompetitionEntryRepository competitionEntryRepository;

    private UUID competitionId;
    private UUID categoryId;
    private UUID boatClassId;
    private UUID northId;
    private UUID southId;
    private final List<UUID> entries = new ArrayList<>();

    @BeforeEach
    void setUpRegatta() {
        northId = club("NOR", "North Rowing").getClubId();
        southId = club("SOU", "South Rowing").getClubId();
        UUID eastId = club("EAS", "East Rowing").getClubId();

        Category category = new Category();
        category.setCategoryId(UUID.randomUUID());
        category.setCode("SENIOR_M");
        category.setGenderScope(GenderScope.MEN);
        category.setAgeMin(18);
        category.setAgeMax(40);
        categoryId = categoryRepository.save(category).getCategoryId();

        BoatClass boatClass = new BoatClass();
        boatClass.setBoatClassId(UUID.randomUUID());
        boatClass.setCode("1x");
        boatClass.setCrewSize(1);
        boatClass.setDiscipline(Discipline.CLASSIC);
        boatClass.setLaneCapacity(4);
        boatClassId = boatClassRepository.save(boatClass).getBoatClassId();

        Competition competition = new Competition();
        competition.setCompetitionId(UUID.randomUUID());
        competition.setCode("NAT-2026");
        competition.setName("National Championships 2026");
        competition.setDiscipline(Discipline.CLASSIC);
        competition.setStartDate(LocalDate.of(2026, 6, 12));
        competitionId = competitionRepository.save(competition).getCompetitionId();

        List<UUID> clubs = List.of(northId, northId, northId, southId, southId, southId, eastId, eastId);
        OffsetDateTime submitted = OffsetDateTime.parse("2026-05-01T08:00:00Z");
        for (int i = 0; i < clubs.size(); i++) {
            Athlete athlete = athlete("Rower" + (i + 1), clubs.get(i));
            CompetitionEntry entry = new CompetitionEntry();
            entry.setEntryId(UUID.randomUUID());
            entry.setCompetitionId(competitionId);
            entry.setCategoryId(categoryId);
            entry.setBoatClassId(boatClassId);
            entry.setClubId(clubs.get(i));
            entry.setCrew(new ArrayList<>(List.of(athlete.getAthleteId())));
            entry.setSubmittedAt(submitted.plusMinutes(i));
            entries.add(competitionEntryRepository.save(entry).getEntryId());
        }
    }

    @Test
    void knockoutEventRunsFromTimeTrialToMedalsAndRankings() {
        CompetitionResponses.ApprovalOutcome approval = entryApprovalService.approveEntries(
                competitionId, new CompetitionRequests.ApproveEntriesRequest(entries));
        assertEquals(8, approval.approved().size());
        assertTrue(approval.failed().isEmpty());

        EventResponses.EventSummary event = eventService.createEvent(competitionId, new EventRequests.CreateEventRequest(
                boatClassId, categoryId, null, null, null,
                new EventRequests.ProgressionRequest(false, 4, 0, null, null, null, null, null)));
        UUID eventId = event.eventId();
        assertEquals(Gender.M, event.gender());
        assertEquals(EventStatus.PENDING, event.status());

        EventResponses.TimeTrialSeeded seeded = bracketProgressionService.seedTimeTrial(eventId, null);
        assertEquals(8, seeded.entryCount());
        assertEquals(EventStatus.IN_PROGRESS, seeded.eventStatus());
        assertEquals(List.of("TT1", "TT2"), seeded.races().stream().map(RaceResponses.RaceDetail::raceCode).toList());

        record(seeded.races().get(0), Map.of(e(1), 400_000L, e(2), 405_000L, e(3), 410_000L));
        StateConflictException notReady = assertThrows(StateConflictException.class,
                () -> bracketProgressionService.processPhase(eventId, RacePhase.TIME_TRIAL));
        assertEquals(StateConflictException.PHASE_NOT_READY, notReady.getCode());
        record(seeded.races().get(1), Map.of(e(5), 402_000L, e(6), 407_000L, e(7), 412_000L));

        EventResponses.PhaseProcessed timeTrial = bracketProgressionService.processPhase(eventId, RacePhase.TIME_TRIAL);
        assertEquals(RacePhase.SEMIFINAL, timeTrial.nextPhase());
        assertEquals(4, timeTrial.advancedCount());
        assertEquals(List.of(e(1), e(6)), lanesOf(timeTrial.races().get(0)));
        assertEquals(List.of(e(5), e(2)), lanesOf(timeTrial.races().get(1)));

        StateConflictException again = assertThrows(StateConflictException.class,
                () -> bracketProgressionService.processPhase(eventId, RacePhase.TIME_TRIAL));
        assertEquals(StateConflictException.ALREADY_PROCESSED, again.getCode());
        StateConflictException lateCorrection = assertThrows(StateConflictException.class,
                () -> raceResultService.correctResults(seeded.races().get(0).raceId(), new RaceRequests.CorrectResultsRequest(
                        lanes(seeded.races().get(0), Map.of(e(1), 400_000L)), "timing error")));
        assertEquals(StateConflictException.DOWNSTREAM_RACES_EXIST, lateCorrection.getCode());

        RaceResponses.RaceDetail semifinalOne = timeTrial.races().get(0);
        record(semifinalOne, Map.of(e(1), 401_000L, e(6), 398_000L));
        RaceResponses.RaceDetail corrected = raceResultService.correctResults(semifinalOne.raceId(),
                new RaceRequests.CorrectResultsRequest(
                        lanes(semifinalOne, Map.of(e(1), 398_000L, e(6), 401_000L)), "transposed lane times"));
        assertEquals(2, corrected.revision());
        assertEquals(2, raceResultService.getHistory(semifinalOne.raceId()).size());
        record(timeTrial.races().get(1), Map.of(e(5), 399_000L, e(2), 400_000L));

        EventResponses.PhaseProcessed semifinals = bracketProgressionService.processPhase(eventId, RacePhase.SEMIFINAL);
        assertEquals(RacePhase.FINAL_A, semifinals.nextPhase());
        assertEquals("FA", semifinals.races().get(0).raceCode());
        assertEquals(List.of(e(1), e(5)), lanesOf(semifinals.races().get(0)));
        assertEquals("FB", semifinals.races().get(1).raceCode());
        assertEquals(List.of(e(2), e(6)), lanesOf(semifinals.races().get(1)));

        record(semifinals.races().get(0), Map.of(e(5), 395_000L, e(1), 396_000L));
        record(semifinals.races().get(1), Map.of(e(6), 399_000L, e(2), 400_000L));

        EventResponses.PhaseProcessed finals = bracketProgressionService.processPhase(eventId, RacePhase.FINAL_A);
        assertEquals(EventStatus.COMPLETED, finals.eventStatus());
        assertEquals(List.of(MedalType.GOLD, MedalType.SILVER, MedalType.BRONZE),
                finals.medals().stream().map(EventResponses.Medal::medalType).toList());
        assertEquals(List.of(e(5), e(1), e(6)),
                finals.medals().stream().map(EventResponses.Medal::entryId).toList());

        StateConflictException afterCompletion = assertThrows(StateConflictException.class,
                () -> raceResultService.correctResults(semifinals.races().get(0).raceId(), new RaceRequests.CorrectResultsRequest(
                        lanes(semifinals.races().get(0), Map.of(e(5), 395_000L, e(1), 396_000L)), "late protest")));
        assertEquals(StateConflictException.EVENT_COMPLETED, afterCompletion.getCode());

        EventResponses.Bracket bracket = eventService.getBracket(eventId);
        assertEquals(2, bracket.phases().get(RacePhase.TIME_TRIAL).size());
        assertEquals(RaceStatus.COMPLETED, bracket.phases().get(RacePhase.FINAL_B).get(0).status());

        List<CompetitionResponses.MedalStanding> standings = medalStandingsService.getMedalStandings(competitionId);
        assertEquals(List.of(southId, northId), standings.stream().map(CompetitionResponses.MedalStanding::clubId).toList());
        assertEquals(1, standings.get(0).gold());
        assertEquals(1, standings.get(0).bronze());
        assertEquals(1, standings.get(1).silver());

        rankingSystemService.syncPresets();
        UUID classicCup = rankingSystemRepository.findByCode("CLASSIC_CUP").orElseThrow().getRankingSystemId();
        RankingResponses.CompetitionRanking ranking = rankingService.getRankings(competitionId, classicCup, false);
        RankingResponses.Group men = ranking.rankings().get("M");
        assertEquals(List.of(southId, northId), men.entries().stream().map(RankingResponses.Entry::entityId).toList());
        assertEquals(28, men.entries().get(0).totalPoints());
        assertEquals(18, men.entries().get(1).totalPoints());
        assertEquals("South Rowing", men.entries().get(0).entityName());

        ResourceNotFoundException missingGroup = assertThrows(ResourceNotFoundException.class,
                () -> rankingService.getGroupRanking(competitionId, "F", classicCup, false));
        assertEquals(List.of("M"), missingGroup.getDetails());
    }

    @Test
    void seedingTwiceIsRejected() {
        entryApprovalService.approveEntries(competitionId, new CompetitionRequests.ApproveEntriesRequest(entries));
        UUID eventId = eventService.createEvent(competitionId, new EventRequests.CreateEventRequest(
                boatClassId, categoryId, null, null, null, null)).eventId();
        bracketProgressionService.seedTimeTrial(eventId, null);

        StateConflictException ex = assertThrows(StateConflictException.class,
                () -> bracketProgressionService.seedTimeTrial(eventId, null));

        assertEquals(StateConflictException.ALREADY_PROCESSED, ex.getCode());
    }

    @Test
    void pendingEntriesCannotBeSeeded() {
        UUID eventId = eventService.createEvent(competitionId, new EventRequests.CreateEventRequest(
                boatClassId, categoryId, null, null, null, null)).eventId();

        assertThrows(NotEligibleException.class, () -> bracketProgressionService.seedTimeTrial(
                eventId, new EventRequests.SeedTimeTrialRequest(entries.subList(0, 2), null)));
        assertEquals(EntryStatus.PENDING, competitionEntryRepository.findById(e(1)).orElseThrow().getStatus());
    }

    private UUID e(int number) {
        return entries.get(number - 1);
    }

    private void record(RaceResponses.RaceDetail race, Map<UUID, Long> times) {
        raceResultService.recordResults(race.raceId(), new RaceRequests.RecordResultsRequest(lanes(race, times)));
    }

    /**
     * Entries without a time did not finish.
     */
    private static List<RaceRequests.LaneResultRequest> lanes(RaceResponses.RaceDetail race, Map<UUID, Long> times) {
        return race.lanes().stream()
                .map(lane -> {
                    Long time = times.get(lane.entryId());
                    return time != null
                            ? new RaceRequests.LaneResultRequest(lane.laneNumber(), LaneStatus.OK, null, time)
                            : new RaceRequests.LaneResultRequest(lane.laneNumber(), LaneStatus.DNF, null, null);
                })
                .toList();
    }

    private static List<UUID> lanesOf(RaceResponses.RaceDetail race) {
        return race.lanes().stream().map(RaceResponses.Lane::entryId).toList();
    }

    private Club club(String code, String name) {
        Club club = new Club();
        club.setClubId(UUID.randomUUID());
        club.setCode(code);
        club.setName(name);
        return clubRepository.save(club);
    }

    private Athlete athlete(String lastName, UUID clubId) {
        Athlete athlete = new Athlete();
        athlete.setAthleteId(UUID.randomUUID());
        athlete.setFirstName("Sam");
        athlete.setLastName(lastName);
        athlete.setGender(Gender.M);
        athlete.setBirthDate(LocalDate.of(1998, 3, 1));
        athlete.setClubId(clubId);
        athlete.setStatus(AthleteStatus.ACTIVE);
        return athleteRepository.save(athlete);
    }
}
