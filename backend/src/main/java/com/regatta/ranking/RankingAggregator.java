package com.regatta.ranking;

import com.regatta.model.Gender;
import com.regatta.model.GroupBy;
import com.regatta.model.JourneyMode;
import com.regatta.model.LaneStatus;
import com.regatta.model.MedalType;
import com.regatta.model.PointMode;
import com.regatta.model.RacePhase;
import com.regatta.model.RankingEntityType;
import com.regatta.model.ScoringMode;
import com.regatta.model.TieBreaker;
import com.regatta.scoring.LaneOutcome;
import com.regatta.scoring.MedalTally;
import com.regatta.scoring.PlacedLane;
import com.regatta.scoring.ScoringPolicy;
import com.regatta.web.DataInconsistencyException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Turns completed race results into grouped standings. Stateless: every call
 * works on the input it is given and either returns a full result or fails.
 */
@Component
public class RankingAggregator {

    static final String UNKNOWN_NAME = "Unknown";

    public RankingResult computeRankings(RankingInput input, RankingConfig config, boolean includeMasters) {
        List<StageInfo> stages = resolveStages(input);
        StageFilter stageFilter = StageFilter.of(config.journeyMode(), stages, input);

        Map<String, GroupAccumulator> groups = new TreeMap<>();
        if (config.scoringMode() == ScoringMode.MEDALS) {
            collectMedals(input, config, includeMasters, stageFilter, groups);
        } else {
            collectPoints(input, config, includeMasters, stageFilter, groups);
        }

        Map<String, RankingGroup> ranked = new LinkedHashMap<>();
        for (Map.Entry<String, GroupAccumulator> group : groups.entrySet()) {
            List<RankingEntry> entries = rankGroup(group.getValue(), config, stages, input);
            if (!entries.isEmpty()) {
                ranked.put(group.getKey(), new RankingGroup(group.getValue().metadata, entries));
            }
        }

        return new RankingResult(
                input.competitionId(),
                config.rankingSystemId(),
                config.code(),
                config.groupBy(),
                config.scoringMode(),
                config.journeyMode(),
                stages,
                ranked,
                RankingView.of(resolveLayout(config, stages), stages)
        );
    }

    static RankingLayout resolveLayout(RankingConfig config, List<StageInfo> stages) {
        if (config.scoringMode() == ScoringMode.MEDALS) {
            return RankingLayout.CLUB_MEDALS;
        }
        boolean athleteAxis = config.entityType() == RankingEntityType.ATHLETE
                || config.pointMode() == PointMode.SKIFF_ATHLETE;
        if (!athleteAxis) {
            return RankingLayout.CLUB_POINTS;
        }
        return config.journeyMode() == JourneyMode.ALL && stages.size() > 1
                ? RankingLayout.ATHLETE_MULTI_STAGE
                : RankingLayout.ATHLETE_SINGLE_STAGE;
    }

    private void collectPoints(
            RankingInput input,
            RankingConfig config,
            boolean includeMasters,
            StageFilter stageFilter,
            Map<String, GroupAccumulator> groups
    ) {
        // Knockout events score their final classification only: Final B places continue after Final A.
        Map<UUID, Integer> finalALanes = new HashMap<>();
        for (ScoredRace race : input.races()) {
            if (race.phase() == RacePhase.FINAL_A) {
                finalALanes.put(race.eventId(), race.lanes().size());
            }
        }

        for (ScoredRace race : input.races()) {
            if (!admits(input, config, includeMasters, race.categoryId(), race.boatClassId())
                    || !stageFilter.counts(race.eventKey(), race.stageIndex())) {
                continue;
            }
            if (race.isKnockout() && (race.phase() == null || !race.phase().isFinal())) {
                continue;
            }
            int offset = race.phase() == RacePhase.FINAL_B ? finalALanes.getOrDefault(race.eventId(), 0) : 0;

            GroupAccumulator group = group(groups, input, config.groupBy(), race.categoryId(), race);
            for (Placed placed : place(race, config.dnfGetsPointsIfFewFinishers())) {
                EntityKey entity = creditTo(config, race.crewSize(), placed.lane().athleteId(), placed.lane().clubId());
                if (entity == null) {
                    continue;
                }
                Integer position = placed.position() == null ? null : placed.position() + offset;
                group.entity(entity, placed.lane().clubId())
                        .stage(race.stageIndex())
                        .addLane(config.pointTable().pointsFor(position), position, placed.lane());
            }
        }
    }

    private void collectMedals(
            RankingInput input,
            RankingConfig config,
            boolean includeMasters,
            StageFilter stageFilter,
            Map<String, GroupAccumulator> groups
    ) {
        for (ScoredRace race : input.races()) {
            if (race.isKnockout()
                    || !admits(input, config, includeMasters, race.categoryId(), race.boatClassId())
                    || !stageFilter.counts(race.eventKey(), race.stageIndex())) {
                continue;
            }
            GroupAccumulator group = group(groups, input, config.groupBy(), race.categoryId(), race);
            for (Placed placed : place(race, false)) {
                EntityKey entity = creditTo(config, race.crewSize(), placed.lane().athleteId(), placed.lane().clubId());
                if (entity == null) {
                    continue;
                }
                StageAccumulator stage = group.entity(entity, placed.lane().clubId()).stage(race.stageIndex());
                stage.addLane(0, placed.position(), placed.lane());
                MedalType medal = medalFor(placed.position());
                if (medal != null) {
                    stage.addMedal(medal);
                }
            }
        }

        for (MedalRecord medal : input.medals()) {
            if (!admits(input, config, includeMasters, medal.categoryId(), medal.boatClassId())
                    || !stageFilter.counts(medal.eventId().toString(), medal.stageIndex())) {
                continue;
            }
            EntityKey entity = creditTo(config, medal.crewSize(), medal.athleteId(), medal.clubId());
            if (entity == null) {
                continue;
            }
            GroupAccumulator group = group(groups, input, config.groupBy(), medal.categoryId(), medal.gender());
            group.entity(entity, medal.clubId()).stage(medal.stageIndex()).addMedal(medal.medalType());
        }
    }

    private List<RankingEntry> rankGroup(
            GroupAccumulator group,
            RankingConfig config,
            List<StageInfo> stages,
            RankingInput input
    ) {
        boolean breakdown = config.journeyMode() == JourneyMode.ALL && stages.size() > 1;
        List<Standing> unranked = new ArrayList<>(group.entities.size());
        for (EntityAccumulator entity : group.entities.values()) {
            unranked.add(entity.toStanding(config, stages, breakdown, input));
        }

        Comparator<Standing> byScore = Comparator.comparing(Standing::entry, scoreOrder(config.scoringMode()));
        unranked.sort(byScore
                .thenComparing(tieBreakOrder(config.tieBreakers()))
                .thenComparing(Standing::entry, byName()));

        // Tie-breakers only order the list; equal scores keep sharing a rank.
        List<RankingEntry> ranked = new ArrayList<>(unranked.size());
        for (int i = 0; i < unranked.size(); i++) {
            RankingEntry entry = unranked.get(i).entry();
            int rank = i > 0 && byScore.compare(unranked.get(i - 1), unranked.get(i)) == 0
                    ? ranked.get(i - 1).rank()
                    : i + 1;
            ranked.add(withRank(entry, rank));
        }
        return List.copyOf(ranked);
    }

    private static Comparator<Standing> tieBreakOrder(List<TieBreaker> tieBreakers) {
        Comparator<Standing> order = (left, right) -> 0;
        for (TieBreaker tieBreaker : tieBreakers) {
            Comparator<Standing> next = switch (tieBreaker) {
                case MORE_FIRST_PLACES -> Comparator.comparingInt((Standing standing) -> placesAt(standing, 1)).reversed();
                case MORE_SECOND_PLACES -> Comparator.comparingInt((Standing standing) -> placesAt(standing, 2)).reversed();
                case TOTAL_TIME -> Comparator.comparingLong(Standing::totalTimeMs);
                case BEST_TIME -> Comparator.comparingLong(Standing::bestTimeMs);
                case ALPHABETICAL -> Comparator.comparing(Standing::entry, byName());
            };
            order = order.thenComparing(next);
        }
        return order;
    }

    private static int placesAt(Standing standing, int position) {
        return standing.entry().positionCounts().getOrDefault(position, 0);
    }

    private static Comparator<RankingEntry> byName() {
        return Comparator.comparing(RankingEntry::entityName, Comparator.nullsLast(Comparator.<String>naturalOrder()))
                .thenComparing(RankingEntry::entityType)
                .thenComparing(RankingEntry::entityId);
    }

    private static Comparator<RankingEntry> scoreOrder(ScoringMode scoringMode) {
        if (scoringMode == ScoringMode.MEDALS) {
            return Comparator
                    .comparingInt((RankingEntry entry) -> entry.medals().total()).reversed()
                    .thenComparing(Comparator.comparingInt((RankingEntry entry) -> entry.medals().gold()).reversed())
                    .thenComparing(Comparator.comparingInt((RankingEntry entry) -> entry.medals().silver()).reversed())
                    .thenComparing(Comparator.comparingInt((RankingEntry entry) -> entry.medals().bronze()).reversed());
        }
        return Comparator.comparingInt(RankingEntry::totalPoints).reversed();
    }

    private static RankingEntry withRank(RankingEntry entry, int rank) {
        return new RankingEntry(
                rank,
                entry.entityType(),
                entry.entityId(),
                entry.entityName(),
                entry.affiliation(),
                entry.totalPoints(),
                entry.medals(),
                entry.positionCounts(),
                entry.raceCount(),
                entry.statusCounts(),
                entry.stages()
        );
    }

    private static List<Placed> place(ScoredRace race, boolean placeNonFinishers) {
        Map<Integer, ScoredLane> byLane = new HashMap<>();
        List<LaneOutcome> outcomes = new ArrayList<>(race.lanes().size());
        for (ScoredLane lane : race.lanes()) {
            if (byLane.put(lane.laneNumber(), lane) != null) {
                throw new DataInconsistencyException(
                        "Race " + race.raceId() + " has more than one result for lane " + lane.laneNumber());
            }
            outcomes.add(new LaneOutcome(lane.laneNumber(), lane.status(), lane.elapsedMs()));
        }

        int laneCapacity = Math.max(race.laneCapacity(), race.lanes().size());
        List<Placed> placed = new ArrayList<>(outcomes.size());
        for (PlacedLane lane : ScoringPolicy.resolveFinishOrder(outcomes, laneCapacity, placeNonFinishers)) {
            placed.add(new Placed(byLane.get(lane.lane().laneNumber()), lane.position()));
        }
        return placed;
    }

    static EntityKey creditTo(RankingConfig config, int crewSize, UUID athleteId, UUID clubId) {
        boolean athlete;
        if (config.entityType() == RankingEntityType.ATHLETE) {
            athlete = true;
        } else {
            athlete = switch (config.pointMode()) {
                case SKIFF_ATHLETE -> true;
                case CREW_CLUB -> false;
                case MIXED -> crewSize == 1;
            };
        }
        UUID id = athlete ? athleteId : clubId;
        if (id == null) {
            return null;
        }
        return new EntityKey(athlete ? RankingEntityType.ATHLETE : RankingEntityType.CLUB, id);
    }

    private static boolean admits(
            RankingInput input,
            RankingConfig config,
            boolean includeMasters,
            UUID categoryId,
            UUID boatClassId
    ) {
        if (!config.admitsBoatClass(boatClassId)) {
            return false;
        }
        if (includeMasters) {
            return true;
        }
        CategoryInfo category = input.categories().get(categoryId);
        return category == null || !category.masters();
    }

    private static GroupAccumulator group(
            Map<String, GroupAccumulator> groups,
            RankingInput input,
            GroupBy groupBy,
            UUID categoryId,
            ScoredRace race
    ) {
        return group(groups, input, groupBy, categoryId, race.gender());
    }

    private static GroupAccumulator group(
            Map<String, GroupAccumulator> groups,
            RankingInput input,
            GroupBy groupBy,
            UUID categoryId,
            Gender gender
    ) {
        String key = switch (groupBy) {
            case GENDER -> gender.name();
            case CATEGORY -> String.valueOf(categoryId);
            case CATEGORY_GENDER -> categoryId + "_" + gender.name();
        };
        return groups.computeIfAbsent(key, groupKey -> {
            if (groupBy == GroupBy.GENDER) {
                return new GroupAccumulator(new GroupMetadata(groupKey, gender, null, null, null));
            }
            CategoryInfo category = input.categories().get(categoryId);
            return new GroupAccumulator(new GroupMetadata(
                    groupKey,
                    groupBy == GroupBy.CATEGORY_GENDER ? gender : null,
                    categoryId,
                    category == null ? null : category.code(),
                    category == null ? null : category.titles()
            ));
        });
    }

    private static List<StageInfo> resolveStages(RankingInput input) {
        if (input.stages() != null && !input.stages().isEmpty()) {
            return input.stages().stream()
                    .sorted(Comparator.comparingInt(StageInfo::stageIndex))
                    .toList();
        }
        TreeSet<Integer> indexes = new TreeSet<>();
        input.races().forEach(race -> indexes.add(race.stageIndex()));
        input.medals().forEach(medal -> indexes.add(medal.stageIndex()));
        return indexes.stream()
                .map(index -> new StageInfo(index, "Stage " + index, false))
                .toList();
    }

    private static MedalType medalFor(Integer position) {
        if (position == null) {
            return null;
        }
        return switch (position) {
            case 1 -> MedalType.GOLD;
            case 2 -> MedalType.SILVER;
            case 3 -> MedalType.BRONZE;
            default -> null;
        };
    }

    record EntityKey(RankingEntityType type, UUID id) {
    }

    private record Placed(ScoredLane lane, Integer position) {
    }

    /**
     * An unranked entry with the elapsed times its tie-breakers need. Entities
     * without a timed race carry {@link Long#MAX_VALUE}.
     */
    private record Standing(RankingEntry entry, long totalTimeMs, long bestTimeMs) {
    }

    /**
     * Decides which stages count under the journey mode. Best-N selection
     * happens later, per entity.
     */
    private static final class StageFilter {

        private final JourneyMode journeyMode;
        private final Integer finalDayStage;
        private final Map<String, Integer> terminalStageByEvent;

        private StageFilter(JourneyMode journeyMode, Integer finalDayStage, Map<String, Integer> terminalStageByEvent) {
            this.journeyMode = journeyMode;
            this.finalDayStage = finalDayStage;
            this.terminalStageByEvent = terminalStageByEvent;
        }

        static StageFilter of(JourneyMode journeyMode, List<StageInfo> stages, RankingInput input) {
            Integer finalDay = stages.stream()
                    .filter(StageInfo::finalDay)
                    .map(StageInfo::stageIndex)
                    .findFirst()
                    .orElse(null);
            Map<String, Integer> terminal = new HashMap<>();
            for (ScoredRace race : input.races()) {
                terminal.merge(race.eventKey(), race.stageIndex(), Math::max);
            }
            for (MedalRecord medal : input.medals()) {
                terminal.merge(medal.eventId().toString(), medal.stageIndex(), Math::max);
            }
            return new StageFilter(journeyMode, finalDay, terminal);
        }

        boolean counts(String eventKey, int stageIndex) {
            if (journeyMode != JourneyMode.FINAL_ONLY) {
                return true;
            }
            if (finalDayStage != null) {
                return stageIndex == finalDayStage;
            }
            return Objects.equals(terminalStageByEvent.get(eventKey), stageIndex);
        }
    }

    private static final class GroupAccumulator {

        private final GroupMetadata metadata;
        private final Map<EntityKey, EntityAccumulator> entities = new LinkedHashMap<>();

        private GroupAccumulator(GroupMetadata metadata) {
            this.metadata = metadata;
        }

        EntityAccumulator entity(EntityKey key, UUID clubId) {
            EntityAccumulator entity = entities.computeIfAbsent(key, EntityAccumulator::new);
            if (entity.clubId == null) {
                entity.clubId = clubId;
            }
            return entity;
        }
    }

    private static final class EntityAccumulator {

        private final EntityKey key;
        private final Map<Integer, StageAccumulator> stages = new TreeMap<>();
        private UUID clubId;

        private EntityAccumulator(EntityKey key) {
            this.key = key;
        }

        StageAccumulator stage(int stageIndex) {
            return stages.computeIfAbsent(stageIndex, StageAccumulator::new);
        }

        Standing toStanding(RankingConfig config, List<StageInfo> allStages, boolean breakdown, RankingInput input) {
            List<StageAccumulator> counted = new ArrayList<>(stages.values());
            if (config.journeyMode() == JourneyMode.BEST_N) {
                counted.sort(bestFirst(config.scoringMode()));
                counted = counted.subList(0, Math.min(Math.max(config.bestNCount(), 1), counted.size()));
            }

            int points = 0;
            MedalTally medals = MedalTally.EMPTY;
            Map<Integer, Integer> positionCounts = new TreeMap<>();
            Map<LaneStatus, Integer> statusCounts = new EnumMap<>(LaneStatus.class);
            int raceCount = 0;
            long totalTimeMs = 0;
            long bestTimeMs = Long.MAX_VALUE;
            boolean timed = false;
            for (StageAccumulator stage : counted) {
                points += stage.points;
                if (stage.timedRaces > 0) {
                    timed = true;
                    totalTimeMs += stage.totalTimeMs;
                    bestTimeMs = Math.min(bestTimeMs, stage.bestTimeMs);
                }
                medals = medals.plus(stage.medals());
                stage.positionCounts.forEach((position, count) -> positionCounts.merge(position, count, Integer::sum));
                stage.statusCounts.forEach((status, count) -> statusCounts.merge(status, count, Integer::sum));
                raceCount += stage.raceCount;
            }

            List<StagePoints> perStage = List.of();
            if (breakdown) {
                List<StagePoints> rows = new ArrayList<>(allStages.size());
                for (StageInfo info : allStages) {
                    StageAccumulator stage = stages.get(info.stageIndex());
                    rows.add(stage == null
                            ? new StagePoints(info.stageIndex(), 0, MedalTally.EMPTY)
                            : new StagePoints(info.stageIndex(), stage.points, stage.medals()));
                }
                perStage = List.copyOf(rows);
            }

            boolean athlete = key.type() == RankingEntityType.ATHLETE;
            String name = athlete
                    ? input.athleteNames().getOrDefault(key.id(), UNKNOWN_NAME)
                    : input.clubNames().getOrDefault(key.id(), UNKNOWN_NAME);
            String affiliation = athlete && clubId != null ? input.clubNames().get(clubId) : null;

            RankingEntry entry = new RankingEntry(
                    0,
                    key.type(),
                    key.id(),
                    name,
                    affiliation,
                    points,
                    medals,
                    Collections.unmodifiableMap(positionCounts),
                    raceCount,
                    Collections.unmodifiableMap(statusCounts),
                    perStage
            );
            return new Standing(entry, timed ? totalTimeMs : Long.MAX_VALUE, bestTimeMs);
        }

        private static Comparator<StageAccumulator> bestFirst(ScoringMode scoringMode) {
            Comparator<StageAccumulator> score = scoringMode == ScoringMode.MEDALS
                    ? Comparator.comparingInt((StageAccumulator stage) -> stage.gold).reversed()
                            .thenComparing(Comparator.comparingInt((StageAccumulator stage) -> stage.silver).reversed())
                            .thenComparing(Comparator.comparingInt((StageAccumulator stage) -> stage.bronze).reversed())
                    : Comparator.comparingInt((StageAccumulator stage) -> stage.points).reversed();
            return score.thenComparingInt(stage -> stage.stageIndex);
        }
    }

    private static final class StageAccumulator {

        private final int stageIndex;
        private int points;
        private int gold;
        private int silver;
        private int bronze;
        private int raceCount;
        private int timedRaces;
        private long totalTimeMs;
        private long bestTimeMs = Long.MAX_VALUE;
        private final Map<Integer, Integer> positionCounts = new TreeMap<>();
        private final Map<LaneStatus, Integer> statusCounts = new EnumMap<>(LaneStatus.class);

        private StageAccumulator(int stageIndex) {
            this.stageIndex = stageIndex;
        }

        void addLane(int lanePoints, Integer position, ScoredLane lane) {
            points += lanePoints;
            raceCount++;
            if (position != null) {
                positionCounts.merge(position, 1, Integer::sum);
            }
            LaneStatus status = lane.status();
            if (status != null && status != LaneStatus.OK) {
                statusCounts.merge(status, 1, Integer::sum);
            } else if (lane.elapsedMs() != null) {
                timedRaces++;
                totalTimeMs += lane.elapsedMs();
                bestTimeMs = Math.min(bestTimeMs, lane.elapsedMs());
            }
        }

        void addMedal(MedalType medal) {
            switch (medal) {
                case GOLD -> gold++;
                case SILVER -> silver++;
                case BRONZE -> bronze++;
            }
        }

        MedalTally medals() {
            return MedalTally.of(gold, silver, bronze);
        }
    }
}
