package com.regatta.service;

import com.regatta.config.RegattaRuntimeProperties;
import com.regatta.dto.EventRequests;
import com.regatta.dto.EventResponses;
import com.regatta.dto.RaceResponses;
import com.regatta.mapper.RegattaResponseMapper;
import com.regatta.model.Athlete;
import com.regatta.model.BoatClass;
import com.regatta.model.Category;
import com.regatta.model.Competition;
import com.regatta.model.CompetitionEntry;
import com.regatta.model.CompetitionEvent;
import com.regatta.model.EntryStatus;
import com.regatta.model.EventMedal;
import com.regatta.model.EventStatus;
import com.regatta.model.Gender;
import com.regatta.model.Race;
import com.regatta.model.RaceLane;
import com.regatta.model.RacePhase;
import com.regatta.model.RaceResultRecord;
import com.regatta.model.RaceStatus;
import com.regatta.model.RecordedLaneResult;
import com.regatta.model.SeedingRule;
import com.regatta.progression.BracketStateMachine;
import com.regatta.progression.Entrant;
import com.regatta.progression.EventSnapshot;
import com.regatta.progression.LaneSnapshot;
import com.regatta.progression.PlannedRace;
import com.regatta.progression.ProgressionSettings;
import com.regatta.progression.RaceSnapshot;
import com.regatta.progression.Transition;
import com.regatta.repository.BoatClassRepository;
import com.regatta.repository.CategoryRepository;
import com.regatta.repository.CompetitionEntryRepository;
import com.regatta.repository.CompetitionEventRepository;
import com.regatta.repository.CompetitionRepository;
import com.regatta.repository.RaceRepository;
import com.regatta.web.DataInconsistencyException;
import com.regatta.web.ResourceNotFoundException;
import com.regatta.web.StateConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs the bracket state machine against stored events. Every mutating call
 * holds the event row lock for the whole read-decide-write cycle.
 */
@Service
public class BracketProgressionService {

    private static final Logger log = LoggerFactory.getLogger(BracketProgressionService.class);

    private static final Comparator<CompetitionEntry> SUBMISSION_ORDER = Comparator
            .comparing(CompetitionEntry::getSubmittedAt)
            .thenComparing(CompetitionEntry::getEntryId);

    private static final Comparator<CompetitionEntry> SEED_ORDER = Comparator
            .comparing(CompetitionEntry::getSeed, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(SUBMISSION_ORDER);

    private final CompetitionEventRepository competitionEventRepository;
    private final CompetitionRepository competitionRepository;
    private final CompetitionEntryRepository competitionEntryRepository;
    private final CategoryRepository categoryRepository;
    private final BoatClassRepository boatClassRepository;
    private final RaceRepository raceRepository;
    private final RaceResultLedger raceResultLedger;
    private final EligibilityService eligibilityService;
    private final BracketStateMachine bracketStateMachine;
    private final RegattaResponseMapper regattaResponseMapper;
    private final RegattaRuntimeProperties regattaRuntimeProperties;

    public BracketProgressionService(
            CompetitionEventRepository competitionEventRepository,
            CompetitionRepository competitionRepository,
            CompetitionEntryRepository competitionEntryRepository,
            CategoryRepository categoryRepository,
            BoatClassRepository boatClassRepository,
            RaceRepository raceRepository,
            RaceResultLedger raceResultLedger,
            EligibilityService eligibilityService,
            BracketStateMachine bracketStateMachine,
            RegattaResponseMapper regattaResponseMapper,
            RegattaRuntimeProperties regattaRuntimeProperties
    ) {
        this.competitionEventRepository = competitionEventRepository;
        this.competitionRepository = competitionRepository;
        this.competitionEntryRepository = competitionEntryRepository;
        this.categoryRepository = categoryRepository;
        this.boatClassRepository = boatClassRepository;
        this.raceRepository = raceRepository;
        this.raceResultLedger = raceResultLedger;
        this.eligibilityService = eligibilityService;
        this.bracketStateMachine = bracketStateMachine;
        this.regattaResponseMapper = regattaResponseMapper;
        this.regattaRuntimeProperties = regattaRuntimeProperties;
    }

    @Transactional
    public EventResponses.TimeTrialSeeded seedTimeTrial(UUID eventId, EventRequests.SeedTimeTrialRequest request) {
        CompetitionEvent event = lockEvent(eventId);
        Competition competition = competitionRepository.findById(event.getCompetitionId())
                .orElseThrow(() -> ResourceNotFoundException.of("Competition", event.getCompetitionId()));
        Category category = categoryRepository.findById(event.getCategoryId())
                .orElseThrow(() -> ResourceNotFoundException.of("Category", event.getCategoryId()));
        BoatClass boatClass = boatClassRepository.findById(event.getBoatClassId())
                .orElseThrow(() -> ResourceNotFoundException.of("Boat class", event.getBoatClassId()));

        List<CompetitionEntry> entries = request != null && request.entryIds() != null
                ? loadRequestedEntries(request.entryIds())
                : selectApprovedEntries(event, category, boatClass);
        eligibilityService.requireEligible(entries, competition, category, boatClass, event.getGender());

        SeedingRule rule = request != null && request.seedingRule() != null
                ? request.seedingRule()
                : SeedingRule.SUBMISSION_ORDER;
        List<Entrant> seeded = entries.stream()
                .sorted(rule == SeedingRule.SEED ? SEED_ORDER : SUBMISSION_ORDER)
                .map(BracketProgressionService::toEntrant)
                .toList();

        Transition transition = guarded(event, () -> bracketStateMachine.seedTimeTrial(
                snapshot(event, boatClass, Map.of()), seeded));
        List<Race> races = apply(event, transition);

        log.info("Seeded event {}: {}", eventId, transition.message());
        return new EventResponses.TimeTrialSeeded(
                eventId,
                event.getStatus(),
                event.getCurrentPhase(),
                seeded.size(),
                toRaceDetails(races)
        );
    }

    @Transactional
    public EventResponses.PhaseProcessed processPhase(UUID eventId, RacePhase phase) {
        CompetitionEvent event = lockEvent(eventId);
        BoatClass boatClass = boatClassRepository.findById(event.getBoatClassId())
                .orElseThrow(() -> ResourceNotFoundException.of("Boat class", event.getBoatClassId()));

        List<Race> races = raceRepository.findByEventIdOrderByHeatNumberAsc(eventId);
        Map<UUID, RaceResultRecord> results = raceResultLedger.latestByRace(races);
        Map<UUID, Entrant> entrants = new HashMap<>();
        List<RaceSnapshot> snapshots = new ArrayList<>(races.size());
        for (Race race : races) {
            snapshots.add(toSnapshot(race, results.get(race.getRaceId()), entrants));
        }

        Transition transition = guarded(event, () -> bracketStateMachine.process(
                snapshot(event, boatClass, entrants), phase, snapshots));
        List<Race> created = apply(event, transition);

        log.info("Processed {} of event {}: {}", phase, eventId, transition.message());
        return new EventResponses.PhaseProcessed(
                transition.message(),
                transition.advancedCount(),
                event.getCurrentPhase(),
                event.getStatus(),
                toRaceDetails(created),
                regattaResponseMapper.toMedals(event.getMedals())
        );
    }

    private CompetitionEvent lockEvent(UUID eventId) {
        return competitionEventRepository.findByEventIdForUpdate(eventId)
                .orElseThrow(() -> ResourceNotFoundException.of("Event", eventId));
    }

    private Transition guarded(CompetitionEvent event, TransitionStep step) {
        try {
            return step.run();
        } catch (StateConflictException ex) {
            log.warn("Rejected transition on event {} ({} / {}): {}",
                    event.getEventId(), event.getStatus(), event.getCurrentPhase(), ex.getMessage());
            throw ex;
        }
    }

    private List<Race> apply(CompetitionEvent event, Transition transition) {
        OffsetDateTime now = OffsetDateTime.now();

        List<Race> races = new ArrayList<>(transition.races().size());
        for (PlannedRace planned : transition.races()) {
            races.add(newRace(event, planned, now));
        }
        List<Race> saved = races.isEmpty() ? List.of() : raceRepository.saveAll(races);

        boolean leavingRepechage = event.getCurrentPhase() == RacePhase.REPECHAGE
                && transition.nextPhase() != RacePhase.REPECHAGE;
        if (!transition.heldQualifiers().isEmpty()) {
            event.setDirectQualifiers(new ArrayList<>(
                    transition.heldQualifiers().stream().map(Entrant::entryId).toList()));
        } else if (leavingRepechage) {
            event.getDirectQualifiers().clear();
        }

        if (!transition.medals().isEmpty()) {
            event.getMedals().clear();
            transition.medals().forEach(medal -> event.getMedals().add(new EventMedal(
                    medal.medalType(),
                    medal.entrant().entryId(),
                    medal.entrant().athleteId(),
                    medal.entrant().clubId(),
                    medal.elapsedMs()
            )));
        }

        event.setStatus(transition.nextStatus());
        event.setCurrentPhase(transition.nextPhase());
        if (transition.nextStatus() == EventStatus.COMPLETED) {
            event.setCompletedAt(now);
        }
        event.setUpdatedAt(now);
        competitionEventRepository.save(event);
        return saved;
    }

    private Race newRace(CompetitionEvent event, PlannedRace planned, OffsetDateTime now) {
        Race race = new Race();
        race.setRaceId(UUID.randomUUID());
        race.setCompetitionId(event.getCompetitionId());
        race.setEventId(event.getEventId());
        race.setCategoryId(event.getCategoryId());
        race.setBoatClassId(event.getBoatClassId());
        race.setGender(event.getGender());
        race.setPhase(planned.phase());
        race.setHeatNumber(planned.heatNumber());
        race.setRaceCode(planned.raceCode());
        race.setStageIndex(event.getStageIndex());
        race.setStatus(RaceStatus.SCHEDULED);
        List<RaceLane> lanes = new ArrayList<>(planned.lanes().size());
        int laneNumber = 1;
        for (Entrant entrant : planned.lanes()) {
            lanes.add(new RaceLane(laneNumber++, entrant.entryId(), entrant.athleteId(), entrant.clubId()));
        }
        race.setLanes(lanes);
        race.setCreatedAt(now);
        race.setUpdatedAt(now);
        return race;
    }

    private EventSnapshot snapshot(CompetitionEvent event, BoatClass boatClass, Map<UUID, Entrant> knownEntrants) {
        List<Entrant> held = new ArrayList<>(event.getDirectQualifiers().size());
        for (UUID entryId : event.getDirectQualifiers()) {
            Entrant entrant = knownEntrants.get(entryId);
            if (entrant == null) {
                throw new DataInconsistencyException(
                        "Held qualifier " + entryId + " of event " + event.getEventId() + " never raced");
            }
            held.add(entrant);
        }
        return new EventSnapshot(
                event.getEventId(),
                event.getStatus(),
                event.getCurrentPhase(),
                ProgressionSettings.from(event.getProgressionConfig()),
                regattaRuntimeProperties.resolveLaneCapacity(boatClass.getLaneCapacity()),
                held
        );
    }

    private static RaceSnapshot toSnapshot(Race race, RaceResultRecord result, Map<UUID, Entrant> entrants) {
        Map<Integer, RecordedLaneResult> byLane = new HashMap<>();
        if (result != null) {
            result.getLanes().forEach(lane -> byLane.put(lane.getLaneNumber(), lane));
        }
        List<LaneSnapshot> lanes = new ArrayList<>(race.getLanes().size());
        for (RaceLane lane : race.getLanes()) {
            Entrant entrant = new Entrant(lane.getEntryId(), lane.getAthleteId(), lane.getClubId());
            entrants.putIfAbsent(entrant.entryId(), entrant);
            RecordedLaneResult recorded = byLane.get(lane.getLaneNumber());
            if (result != null && recorded == null) {
                throw new DataInconsistencyException(
                        "Race " + race.getRaceId() + " has no result for lane " + lane.getLaneNumber());
            }
            lanes.add(new LaneSnapshot(
                    lane.getLaneNumber(),
                    entrant,
                    recorded != null ? recorded.getStatus() : null,
                    recorded != null ? recorded.getElapsedMs() : null
            ));
        }
        return new RaceSnapshot(race.getRaceId(), race.getPhase(), race.getHeatNumber(), race.getStatus(), lanes);
    }

    private List<CompetitionEntry> loadRequestedEntries(List<UUID> entryIds) {
        List<CompetitionEntry> found = competitionEntryRepository.findAllById(entryIds);
        if (found.size() != entryIds.size()) {
            List<UUID> foundIds = found.stream().map(CompetitionEntry::getEntryId).toList();
            UUID missing = entryIds.stream().filter(id -> !foundIds.contains(id)).findFirst().orElse(null);
            throw ResourceNotFoundException.of("Entry", missing);
        }
        return found;
    }

    /**
     * Approved entries of the event's category and boat class whose crew fits
     * the event gender. Entries of the other gender in a mixed category belong
     * to a sibling event and are left out here.
     */
    private List<CompetitionEntry> selectApprovedEntries(CompetitionEvent event, Category category, BoatClass boatClass) {
        List<CompetitionEntry> approved = competitionEntryRepository
                .findByCompetitionIdAndCategoryIdAndBoatClassIdAndStatusOrderBySubmittedAtAscEntryIdAsc(
                        event.getCompetitionId(), category.getCategoryId(), boatClass.getBoatClassId(),
                        EntryStatus.APPROVED);
        if (event.getGender() == Gender.MIXED) {
            return approved;
        }
        Map<UUID, Athlete> athletes = eligibilityService.loadCrews(approved);
        return approved.stream()
                .filter(entry -> entry.getCrew().stream()
                        .map(athletes::get)
                        .allMatch(athlete -> athlete == null || athlete.getGender() == event.getGender()))
                .toList();
    }

    private List<RaceResponses.RaceDetail> toRaceDetails(List<Race> races) {
        return races.stream()
                .map(race -> regattaResponseMapper.toRaceDetail(race, null))
                .toList();
    }

    private static Entrant toEntrant(CompetitionEntry entry) {
        return new Entrant(entry.getEntryId(), entry.getPrimaryAthleteId(), entry.getClubId());
    }

    @FunctionalInterface
    private interface TransitionStep {
        Transition run();
    }
}
