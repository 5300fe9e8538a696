package com.regatta.service;

import com.regatta.config.RegattaRuntimeProperties;
import com.regatta.dto.RankingResponses;
import com.regatta.mapper.RegattaResponseMapper;
import com.regatta.model.Athlete;
import com.regatta.model.BoatClass;
import com.regatta.model.Category;
import com.regatta.model.Club;
import com.regatta.model.Competition;
import com.regatta.model.CompetitionEvent;
import com.regatta.model.EventMedal;
import com.regatta.model.EventStatus;
import com.regatta.model.Race;
import com.regatta.model.RaceLane;
import com.regatta.model.RaceResultRecord;
import com.regatta.model.RaceStatus;
import com.regatta.model.RankingSystem;
import com.regatta.model.RecordedLaneResult;
import com.regatta.ranking.CategoryInfo;
import com.regatta.ranking.MedalRecord;
import com.regatta.ranking.RankingAggregator;
import com.regatta.ranking.RankingConfig;
import com.regatta.ranking.RankingInput;
import com.regatta.ranking.RankingResult;
import com.regatta.ranking.ScoredLane;
import com.regatta.ranking.ScoredRace;
import com.regatta.ranking.StageInfo;
import com.regatta.repository.AthleteRepository;
import com.regatta.repository.BoatClassRepository;
import com.regatta.repository.CategoryRepository;
import com.regatta.repository.ClubRepository;
import com.regatta.repository.CompetitionEventRepository;
import com.regatta.repository.CompetitionRepository;
import com.regatta.repository.RaceRepository;
import com.regatta.repository.RankingSystemRepository;
import com.regatta.web.DataInconsistencyException;
import com.regatta.web.RegattaValidationException;
import com.regatta.web.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Loads a consistent snapshot of a competition's completed results and hands
 * it to the {@link RankingAggregator}.
 */
@Service
public class RankingService {

    private static final Logger log = LoggerFactory.getLogger(RankingService.class);

    private final CompetitionRepository competitionRepository;
    private final CompetitionEventRepository competitionEventRepository;
    private final RaceRepository raceRepository;
    private final CategoryRepository categoryRepository;
    private final BoatClassRepository boatClassRepository;
    private final AthleteRepository athleteRepository;
    private final ClubRepository clubRepository;
    private final RankingSystemRepository rankingSystemRepository;
    private final RaceResultLedger raceResultLedger;
    private final RankingAggregator rankingAggregator;
    private final RegattaResponseMapper regattaResponseMapper;
    private final RegattaRuntimeProperties regattaRuntimeProperties;

    public RankingService(
            CompetitionRepository competitionRepository,
            CompetitionEventRepository competitionEventRepository,
            RaceRepository raceRepository,
            CategoryRepository categoryRepository,
            BoatClassRepository boatClassRepository,
            AthleteRepository athleteRepository,
            ClubRepository clubRepository,
            RankingSystemRepository rankingSystemRepository,
            RaceResultLedger raceResultLedger,
            RankingAggregator rankingAggregator,
            RegattaResponseMapper regattaResponseMapper,
            RegattaRuntimeProperties regattaRuntimeProperties
    ) {
        this.competitionRepository = competitionRepository;
        this.competitionEventRepository = competitionEventRepository;
        this.raceRepository = raceRepository;
        this.categoryRepository = categoryRepository;
        this.boatClassRepository = boatClassRepository;
        this.athleteRepository = athleteRepository;
        this.clubRepository = clubRepository;
        this.rankingSystemRepository = rankingSystemRepository;
        this.raceResultLedger = raceResultLedger;
        this.rankingAggregator = rankingAggregator;
        this.regattaResponseMapper = regattaResponseMapper;
        this.regattaRuntimeProperties = regattaRuntimeProperties;
    }

    @Transactional(readOnly = true)
    public RankingResponses.CompetitionRanking getRankings(UUID competitionId, UUID systemId, boolean includeMasters) {
        RankingResult result = compute(competitionId, systemId, includeMasters);
        return regattaResponseMapper.toCompetitionRanking(result, OffsetDateTime.now());
    }

    @Transactional(readOnly = true)
    public RankingResponses.GroupRanking getGroupRanking(
            UUID competitionId,
            String groupKey,
            UUID systemId,
            boolean includeMasters
    ) {
        RankingResult result = compute(competitionId, systemId, includeMasters);
        if (!result.groups().containsKey(groupKey)) {
            throw new ResourceNotFoundException(
                    "Ranking group not found: " + groupKey,
                    List.copyOf(result.groups().keySet()));
        }
        return regattaResponseMapper.toGroupRanking(result, groupKey, OffsetDateTime.now());
    }

    /**
     * Active systems usable for the competition: those without a discipline
     * and those matching the competition's discipline.
     */
    @Transactional(readOnly = true)
    public List<RankingResponses.AvailableSystem> listAvailableSystems(UUID competitionId) {
        Competition competition = competitionRepository.findById(competitionId)
                .orElseThrow(() -> ResourceNotFoundException.of("Competition", competitionId));
        return rankingSystemRepository.findByActiveTrueOrderBySortOrderAscCodeAsc().stream()
                .filter(system -> system.getDiscipline() == null
                        || system.getDiscipline() == competition.getDiscipline())
                .map(regattaResponseMapper::toAvailableSystem)
                .toList();
    }

    RankingResult compute(UUID competitionId, UUID systemId, boolean includeMasters) {
        Competition competition = competitionRepository.findById(competitionId)
                .orElseThrow(() -> ResourceNotFoundException.of("Competition", competitionId));
        RankingConfig config = resolveConfig(systemId);
        RankingInput input = loadInput(competition);

        RankingResult result = rankingAggregator.computeRankings(input, config, includeMasters);
        log.debug("Ranked competition {} with {}: {} group(s) from {} race(s)",
                competition.getCode(), config.code(), result.groups().size(), input.races().size());
        return result;
    }

    private RankingConfig resolveConfig(UUID systemId) {
        if (systemId == null) {
            RegattaRuntimeProperties.Ranking defaults = regattaRuntimeProperties.getRanking();
            return RankingConfig.defaults(
                    defaults.toPointTable(),
                    defaults.isDnfGetsPointsIfFewFinishers(),
                    defaults.getDefaultGroupBy());
        }
        RankingSystem system = rankingSystemRepository.findById(systemId)
                .orElseThrow(() -> ResourceNotFoundException.of("Ranking system", systemId));
        if (!system.isActive()) {
            throw new RegattaValidationException("Ranking system " + system.getCode() + " is not active");
        }
        return RankingConfig.from(system);
    }

    private RankingInput loadInput(Competition competition) {
        UUID competitionId = competition.getCompetitionId();

        Map<UUID, CompetitionEvent> completedEvents = competitionEventRepository
                .findByCompetitionIdAndStatus(competitionId, EventStatus.COMPLETED).stream()
                .collect(Collectors.toMap(CompetitionEvent::getEventId, Function.identity()));

        List<Race> races = raceRepository
                .findByCompetitionIdAndStatusOrderByStageIndexAscRaceCodeAsc(competitionId, RaceStatus.COMPLETED)
                .stream()
                .filter(race -> race.getEventId() == null || completedEvents.containsKey(race.getEventId()))
                .toList();
        Map<UUID, RaceResultRecord> results = raceResultLedger.latestByRace(races);

        Set<UUID> boatClassIds = new HashSet<>();
        Set<UUID> categoryIds = new HashSet<>();
        races.forEach(race -> {
            boatClassIds.add(race.getBoatClassId());
            categoryIds.add(race.getCategoryId());
        });
        completedEvents.values().forEach(event -> {
            boatClassIds.add(event.getBoatClassId());
            categoryIds.add(event.getCategoryId());
        });
        Map<UUID, BoatClass> boatClasses = boatClassRepository.findAllById(boatClassIds).stream()
                .collect(Collectors.toMap(BoatClass::getBoatClassId, Function.identity()));

        Set<UUID> athleteIds = new HashSet<>();
        Set<UUID> clubIds = new HashSet<>();
        List<ScoredRace> scoredRaces = new ArrayList<>(races.size());
        for (Race race : races) {
            BoatClass boatClass = requireBoatClass(boatClasses, race.getBoatClassId());
            List<ScoredLane> lanes = joinLanes(race, results.get(race.getRaceId()));
            lanes.forEach(lane -> {
                athleteIds.add(lane.athleteId());
                clubIds.add(lane.clubId());
            });
            scoredRaces.add(new ScoredRace(
                    race.getRaceId(),
                    race.getEventId() != null
                            ? race.getEventId().toString()
                            : ScoredRace.stageRaceKey(race.getCategoryId(), race.getBoatClassId(), race.getGender()),
                    race.getEventId(),
                    race.getCategoryId(),
                    race.getGender(),
                    race.getBoatClassId(),
                    boatClass.getCrewSize(),
                    regattaRuntimeProperties.resolveLaneCapacity(boatClass.getLaneCapacity()),
                    race.getStageIndex(),
                    race.getPhase(),
                    lanes
            ));
        }

        List<MedalRecord> medals = new ArrayList<>();
        for (CompetitionEvent event : completedEvents.values()) {
            BoatClass boatClass = requireBoatClass(boatClasses, event.getBoatClassId());
            for (EventMedal medal : event.getMedals()) {
                athleteIds.add(medal.getAthleteId());
                clubIds.add(medal.getClubId());
                medals.add(new MedalRecord(
                        event.getEventId(),
                        event.getCategoryId(),
                        event.getGender(),
                        event.getBoatClassId(),
                        boatClass.getCrewSize(),
                        event.getStageIndex(),
                        medal.getMedalType(),
                        medal.getAthleteId(),
                        medal.getClubId()
                ));
            }
        }
        medals.sort(Comparator.comparing((MedalRecord medal) -> medal.eventId())
                .thenComparing(MedalRecord::medalType));

        Map<UUID, CategoryInfo> categories = new HashMap<>();
        for (Category category : categoryRepository.findAllById(categoryIds)) {
            categories.put(category.getCategoryId(), new CategoryInfo(
                    category.getCategoryId(), category.getCode(), category.getTitles(), category.isMasters()));
        }

        athleteIds.remove(null);
        clubIds.remove(null);
        Map<UUID, String> athleteNames = athleteRepository.findAllById(athleteIds).stream()
                .collect(Collectors.toMap(Athlete::getAthleteId, Athlete::getDisplayName));
        Map<UUID, String> clubNames = clubRepository.findAllById(clubIds).stream()
                .collect(Collectors.toMap(Club::getClubId, Club::getName));

        List<StageInfo> stages = competition.getStages().stream()
                .map(stage -> new StageInfo(stage.getStageIndex(), stage.getLabel(), stage.isFinalDay()))
                .sorted(Comparator.comparingInt(StageInfo::stageIndex))
                .toList();

        return new RankingInput(
                competitionId,
                stages,
                scoredRaces,
                medals,
                categories,
                athleteNames,
                clubNames
        );
    }

    private static BoatClass requireBoatClass(Map<UUID, BoatClass> boatClasses, UUID boatClassId) {
        BoatClass boatClass = boatClasses.get(boatClassId);
        if (boatClass == null) {
            throw new DataInconsistencyException("Boat class " + boatClassId + " referenced by results does not exist");
        }
        return boatClass;
    }

    private static List<ScoredLane> joinLanes(Race race, RaceResultRecord result) {
        Map<Integer, RecordedLaneResult> byLane = new HashMap<>();
        result.getLanes().forEach(lane -> byLane.put(lane.getLaneNumber(), lane));

        List<ScoredLane> lanes = new ArrayList<>(race.getLanes().size());
        for (RaceLane lane : race.getLanes()) {
            RecordedLaneResult recorded = byLane.get(lane.getLaneNumber());
            if (recorded == null) {
                throw new DataInconsistencyException(
                        "Race " + race.getRaceId() + " has no result for lane " + lane.getLaneNumber());
            }
            lanes.add(new ScoredLane(
                    lane.getLaneNumber(),
                    lane.getAthleteId(),
                    lane.getClubId(),
                    recorded.getStatus(),
                    recorded.getElapsedMs()
            ));
        }
        return lanes;
    }
}
