package com.regatta.service;

import com.regatta.config.RegattaRuntimeProperties;
import com.regatta.dto.RaceRequests;
import com.regatta.dto.RaceResponses;
import com.regatta.mapper.RegattaResponseMapper;
import com.regatta.model.BoatClass;
import com.regatta.model.Category;
import com.regatta.model.Competition;
import com.regatta.model.CompetitionEntry;
import com.regatta.model.Gender;
import com.regatta.model.Race;
import com.regatta.model.RaceLane;
import com.regatta.model.RaceStatus;
import com.regatta.repository.BoatClassRepository;
import com.regatta.repository.CategoryRepository;
import com.regatta.repository.CompetitionEntryRepository;
import com.regatta.repository.CompetitionRepository;
import com.regatta.repository.RaceRepository;
import com.regatta.web.RegattaValidationException;
import com.regatta.web.ResourceNotFoundException;
import com.regatta.web.StateConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Schedules races outside any knockout event, such as the heats of a
 * multi-stage cup. Lanes follow the order of the submitted entries.
 */
@Service
public class StageRaceService {

    private static final Logger log = LoggerFactory.getLogger(StageRaceService.class);

    private final CompetitionRepository competitionRepository;
    private final CategoryRepository categoryRepository;
    private final BoatClassRepository boatClassRepository;
    private final CompetitionEntryRepository competitionEntryRepository;
    private final RaceRepository raceRepository;
    private final EligibilityService eligibilityService;
    private final RegattaResponseMapper regattaResponseMapper;
    private final RegattaRuntimeProperties regattaRuntimeProperties;

    public StageRaceService(
            CompetitionRepository competitionRepository,
            CategoryRepository categoryRepository,
            BoatClassRepository boatClassRepository,
            CompetitionEntryRepository competitionEntryRepository,
            RaceRepository raceRepository,
            EligibilityService eligibilityService,
            RegattaResponseMapper regattaResponseMapper,
            RegattaRuntimeProperties regattaRuntimeProperties
    ) {
        this.competitionRepository = competitionRepository;
        this.categoryRepository = categoryRepository;
        this.boatClassRepository = boatClassRepository;
        this.competitionEntryRepository = competitionEntryRepository;
        this.raceRepository = raceRepository;
        this.eligibilityService = eligibilityService;
        this.regattaResponseMapper = regattaResponseMapper;
        this.regattaRuntimeProperties = regattaRuntimeProperties;
    }

    @Transactional
    public RaceResponses.RaceDetail scheduleRace(UUID competitionId, RaceRequests.ScheduleRaceRequest request) {
        Competition competition = competitionRepository.findById(competitionId)
                .orElseThrow(() -> ResourceNotFoundException.of("Competition", competitionId));
        Category category = categoryRepository.findById(request.categoryId())
                .orElseThrow(() -> ResourceNotFoundException.of("Category", request.categoryId()));
        BoatClass boatClass = boatClassRepository.findById(request.boatClassId())
                .orElseThrow(() -> ResourceNotFoundException.of("Boat class", request.boatClassId()));

        int stageIndex = request.stageIndex() != null ? request.stageIndex() : 1;
        EventService.requireStage(competition, stageIndex);
        String raceCode = request.raceCode().trim();
        if (raceRepository.existsByCompetitionIdAndRaceCodeAndStageIndex(competitionId, raceCode, stageIndex)) {
            throw StateConflictException.duplicateCode(
                    "Race " + raceCode + " already exists in stage " + stageIndex);
        }

        Gender gender = request.gender() != null ? request.gender() : category.getGenderScope().toEventGender();
        if (!category.getGenderScope().admits(gender)) {
            throw new RegattaValidationException(
                    "Category " + category.getCode() + " does not admit gender " + gender);
        }

        if (new HashSet<>(request.entryIds()).size() != request.entryIds().size()) {
            throw new RegattaValidationException("entryIds must not repeat");
        }
        int laneCapacity = regattaRuntimeProperties.resolveLaneCapacity(boatClass.getLaneCapacity());
        if (request.entryIds().size() > laneCapacity) {
            throw new RegattaValidationException(
                    boatClass.getCode() + " races hold at most " + laneCapacity + " lanes");
        }

        Map<UUID, CompetitionEntry> found = competitionEntryRepository.findAllById(request.entryIds()).stream()
                .collect(Collectors.toMap(CompetitionEntry::getEntryId, Function.identity()));
        List<CompetitionEntry> entries = new ArrayList<>(request.entryIds().size());
        for (UUID entryId : request.entryIds()) {
            CompetitionEntry entry = found.get(entryId);
            if (entry == null) {
                throw ResourceNotFoundException.of("Entry", entryId);
            }
            entries.add(entry);
        }
        eligibilityService.requireEligible(entries, competition, category, boatClass, gender);

        OffsetDateTime now = OffsetDateTime.now();
        Race race = new Race();
        race.setRaceId(UUID.randomUUID());
        race.setCompetitionId(competitionId);
        race.setCategoryId(category.getCategoryId());
        race.setBoatClassId(boatClass.getBoatClassId());
        race.setGender(gender);
        race.setHeatNumber(1);
        race.setRaceCode(raceCode);
        race.setStageIndex(stageIndex);
        race.setStatus(RaceStatus.SCHEDULED);
        List<RaceLane> lanes = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            CompetitionEntry entry = entries.get(i);
            lanes.add(new RaceLane(i + 1, entry.getEntryId(), entry.getPrimaryAthleteId(), entry.getClubId()));
        }
        race.setLanes(lanes);
        race.setCreatedAt(now);
        race.setUpdatedAt(now);

        Race saved = raceRepository.save(race);
        log.info("Scheduled stage race {} (stage {}) with {} lanes", raceCode, stageIndex, lanes.size());
        return regattaResponseMapper.toRaceDetail(saved, null);
    }
}
