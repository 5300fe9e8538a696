package com.regatta.service;

import com.regatta.config.RegattaRuntimeProperties;
import com.regatta.dto.EventRequests;
import com.regatta.dto.EventResponses;
import com.regatta.dto.RaceResponses;
import com.regatta.mapper.RegattaResponseMapper;
import com.regatta.model.BoatClass;
import com.regatta.model.Category;
import com.regatta.model.Competition;
import com.regatta.model.CompetitionEvent;
import com.regatta.model.CompetitionStage;
import com.regatta.model.Gender;
import com.regatta.model.ProgressionConfig;
import com.regatta.model.Race;
import com.regatta.model.RacePhase;
import com.regatta.model.RaceResultRecord;
import com.regatta.progression.BracketStateMachine;
import com.regatta.progression.ProgressionSettings;
import com.regatta.repository.BoatClassRepository;
import com.regatta.repository.CategoryRepository;
import com.regatta.repository.CompetitionEventRepository;
import com.regatta.repository.CompetitionRepository;
import com.regatta.repository.RaceRepository;
import com.regatta.web.RegattaValidationException;
import com.regatta.web.ResourceNotFoundException;
import com.regatta.web.StateConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class EventService {

    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    private final CompetitionRepository competitionRepository;
    private final CompetitionEventRepository competitionEventRepository;
    private final CategoryRepository categoryRepository;
    private final BoatClassRepository boatClassRepository;
    private final RaceRepository raceRepository;
    private final RaceResultLedger raceResultLedger;
    private final RegattaResponseMapper regattaResponseMapper;
    private final RegattaRuntimeProperties regattaRuntimeProperties;

    public EventService(
            CompetitionRepository competitionRepository,
            CompetitionEventRepository competitionEventRepository,
            CategoryRepository categoryRepository,
            BoatClassRepository boatClassRepository,
            RaceRepository raceRepository,
            RaceResultLedger raceResultLedger,
            RegattaResponseMapper regattaResponseMapper,
            RegattaRuntimeProperties regattaRuntimeProperties
    ) {
        this.competitionRepository = competitionRepository;
        this.competitionEventRepository = competitionEventRepository;
        this.categoryRepository = categoryRepository;
        this.boatClassRepository = boatClassRepository;
        this.raceRepository = raceRepository;
        this.raceResultLedger = raceResultLedger;
        this.regattaResponseMapper = regattaResponseMapper;
        this.regattaRuntimeProperties = regattaRuntimeProperties;
    }

    @Transactional
    public EventResponses.EventSummary createEvent(UUID competitionId, EventRequests.CreateEventRequest request) {
        Competition competition = competitionRepository.findById(competitionId)
                .orElseThrow(() -> ResourceNotFoundException.of("Competition", competitionId));
        Category category = categoryRepository.findById(request.categoryId())
                .orElseThrow(() -> ResourceNotFoundException.of("Category", request.categoryId()));
        BoatClass boatClass = boatClassRepository.findById(request.boatClassId())
                .orElseThrow(() -> ResourceNotFoundException.of("Boat class", request.boatClassId()));

        Gender gender = request.gender() != null ? request.gender() : category.getGenderScope().toEventGender();
        if (gender != Gender.MIXED && !category.getGenderScope().admits(gender)) {
            throw new RegattaValidationException(
                    "Category " + category.getCode() + " does not admit gender " + gender);
        }

        int stageIndex = request.stageIndex() != null ? request.stageIndex() : 1;
        requireStage(competition, stageIndex);

        if (competitionEventRepository.existsByCompetitionIdAndBoatClassIdAndCategoryIdAndGenderAndStageIndex(
                competitionId, boatClass.getBoatClassId(), category.getCategoryId(), gender, stageIndex)) {
            throw StateConflictException.duplicateEvent(
                    "An event for " + boatClass.getCode() + " " + category.getCode() + " " + gender
                            + " already exists in stage " + stageIndex);
        }

        ProgressionConfig progression = resolveProgression(request.progression());
        if (!progression.isHasRepechage() && progression.getTimeTrialDirectAdvance() < 1) {
            throw new RegattaValidationException(
                    "invalid_configuration",
                    "timeTrialDirectAdvance must be at least 1 when there is no repechage"
            );
        }
        BracketStateMachine.requireRoundsFit(ProgressionSettings.from(progression),
                regattaRuntimeProperties.resolveLaneCapacity(boatClass.getLaneCapacity()));

        OffsetDateTime now = OffsetDateTime.now();
        CompetitionEvent event = new CompetitionEvent();
        event.setEventId(UUID.randomUUID());
        event.setCompetitionId(competitionId);
        event.setBoatClassId(boatClass.getBoatClassId());
        event.setCategoryId(category.getCategoryId());
        event.setGender(gender);
        event.setName(StringUtils.hasText(request.name())
                ? request.name().trim()
                : boatClass.getCode() + " " + category.getCode() + " " + gender);
        event.setStageIndex(stageIndex);
        event.setProgressionConfig(progression);
        event.setCreatedAt(now);
        event.setUpdatedAt(now);

        CompetitionEvent saved = competitionEventRepository.save(event);
        log.info("Created event {} ({}) in competition {}", saved.getEventId(), saved.getName(), competitionId);
        return regattaResponseMapper.toEventSummary(saved);
    }

    @Transactional(readOnly = true)
    public List<EventResponses.EventSummary> listEvents(UUID competitionId) {
        if (!competitionRepository.existsById(competitionId)) {
            throw ResourceNotFoundException.of("Competition", competitionId);
        }
        return competitionEventRepository.findByCompetitionIdOrderByStageIndexAscCreatedAtAsc(competitionId).stream()
                .map(regattaResponseMapper::toEventSummary)
                .toList();
    }

    @Transactional(readOnly = true)
    public EventResponses.Bracket getBracket(UUID eventId) {
        CompetitionEvent event = competitionEventRepository.findById(eventId)
                .orElseThrow(() -> ResourceNotFoundException.of("Event", eventId));

        List<Race> races = new ArrayList<>(raceRepository.findByEventIdOrderByHeatNumberAsc(eventId));
        races.sort(Comparator.comparing(Race::getPhase).thenComparing(Race::getHeatNumber));
        Map<UUID, RaceResultRecord> results = raceResultLedger.latestByRace(races);

        Map<RacePhase, List<RaceResponses.RaceDetail>> phases = new LinkedHashMap<>();
        for (Race race : races) {
            phases.computeIfAbsent(race.getPhase(), phase -> new ArrayList<>())
                    .add(regattaResponseMapper.toRaceDetail(race, results.get(race.getRaceId())));
        }
        return new EventResponses.Bracket(regattaResponseMapper.toEventSummary(event), phases);
    }

    static void requireStage(Competition competition, int stageIndex) {
        List<CompetitionStage> stages = competition.getStages();
        if (stages == null || stages.isEmpty()) {
            return;
        }
        boolean known = stages.stream().anyMatch(stage -> stage.getStageIndex() == stageIndex);
        if (!known) {
            throw new RegattaValidationException(
                    "Competition " + competition.getCode() + " has no stage " + stageIndex);
        }
    }

    private ProgressionConfig resolveProgression(EventRequests.ProgressionRequest request) {
        ProgressionConfig config = regattaRuntimeProperties.getProgression().toConfig();
        if (request == null) {
            return config;
        }
        if (request.hasRepechage() != null) {
            config.setHasRepechage(request.hasRepechage());
        }
        if (request.timeTrialDirectAdvance() != null) {
            config.setTimeTrialDirectAdvance(request.timeTrialDirectAdvance());
        }
        if (request.timeTrialToRepechage() != null) {
            config.setTimeTrialToRepechage(request.timeTrialToRepechage());
        }
        if (request.repechageAdvance() != null) {
            config.setRepechageAdvance(request.repechageAdvance());
        }
        if (request.quarterfinalAdvance() != null) {
            config.setQuarterfinalAdvance(request.quarterfinalAdvance());
        }
        if (request.semifinalAdvance() != null) {
            config.setSemifinalAdvance(request.semifinalAdvance());
        }
        if (request.semifinalToFinalB() != null) {
            config.setSemifinalToFinalB(request.semifinalToFinalB());
        }
        if (request.repechageLanesPerHeat() != null) {
            config.setRepechageLanesPerHeat(request.repechageLanesPerHeat());
        }
        return config;
    }
}
