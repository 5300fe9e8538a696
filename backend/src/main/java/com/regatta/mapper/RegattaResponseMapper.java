package com.regatta.mapper;

import com.regatta.dto.EventResponses;
import com.regatta.dto.RaceResponses;
import com.regatta.dto.RankingResponses;
import com.regatta.model.CompetitionEvent;
import com.regatta.model.EventMedal;
import com.regatta.model.LaneStatus;
import com.regatta.model.LocalizedTitle;
import com.regatta.model.ProgressionConfig;
import com.regatta.model.Race;
import com.regatta.model.RaceLane;
import com.regatta.model.RaceResultRecord;
import com.regatta.model.RankingSystem;
import com.regatta.model.RecordedLaneResult;
import com.regatta.model.TieBreaker;
import com.regatta.ranking.GroupMetadata;
import com.regatta.ranking.RankingEntry;
import com.regatta.ranking.RankingGroup;
import com.regatta.ranking.RankingPreset;
import com.regatta.ranking.RankingResult;
import com.regatta.ranking.StageInfo;
import com.regatta.ranking.StagePoints;
import com.regatta.scoring.RaceTimeFormat;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Component
public class RegattaResponseMapper {

    public EventResponses.EventSummary toEventSummary(CompetitionEvent event) {
        return new EventResponses.EventSummary(
                event.getEventId(),
                event.getCompetitionId(),
                event.getBoatClassId(),
                event.getCategoryId(),
                event.getGender(),
                event.getName(),
                event.getStageIndex(),
                event.getStatus(),
                event.getCurrentPhase(),
                toProgression(event.getProgressionConfig()),
                List.copyOf(event.getDirectQualifiers()),
                toMedals(event.getMedals()),
                event.getCreatedAt(),
                event.getUpdatedAt(),
                event.getCompletedAt()
        );
    }

    public List<EventResponses.Medal> toMedals(List<EventMedal> medals) {
        return medals.stream()
                .map(medal -> new EventResponses.Medal(
                        medal.getMedalType(),
                        medal.getEntryId(),
                        medal.getAthleteId(),
                        medal.getClubId(),
                        medal.getElapsedMs(),
                        RaceTimeFormat.format(medal.getElapsedMs())
                ))
                .toList();
    }

    /**
     * @param effective latest result revision, null while the race is scheduled
     */
    public RaceResponses.RaceDetail toRaceDetail(Race race, RaceResultRecord effective) {
        Map<Integer, RecordedLaneResult> results = new HashMap<>();
        if (effective != null) {
            effective.getLanes().forEach(lane -> results.put(lane.getLaneNumber(), lane));
        }

        List<RaceResponses.Lane> lanes = race.getLanes().stream()
                .map(lane -> toLane(lane, results.get(lane.getLaneNumber())))
                .toList();

        return new RaceResponses.RaceDetail(
                race.getRaceId(),
                race.getCompetitionId(),
                race.getEventId(),
                race.getCategoryId(),
                race.getBoatClassId(),
                race.getGender(),
                race.getPhase(),
                race.getHeatNumber(),
                race.getRaceCode(),
                race.getStageIndex(),
                race.getStatus(),
                effective != null ? effective.getRevision() : null,
                lanes,
                race.getCompletedAt()
        );
    }

    public RaceResponses.ResultRevision toResultRevision(RaceResultRecord record) {
        return new RaceResponses.ResultRevision(
                record.getRevision(),
                record.getReason(),
                record.getRecordedAt(),
                record.getLanes().stream()
                        .map(lane -> new RaceResponses.LaneResult(
                                lane.getLaneNumber(),
                                lane.getStatus(),
                                lane.getElapsedMs(),
                                RaceTimeFormat.format(lane.getElapsedMs()),
                                lane.getPosition()
                        ))
                        .toList()
        );
    }

    public RankingResponses.CompetitionRanking toCompetitionRanking(RankingResult result, OffsetDateTime generatedAt) {
        Map<String, RankingResponses.Group> groups = new LinkedHashMap<>();
        result.groups().forEach((key, group) -> groups.put(key, toGroup(group)));
        return new RankingResponses.CompetitionRanking(
                result.competitionId(),
                result.rankingSystemId(),
                result.rankingSystemCode(),
                result.groupBy(),
                result.scoringMode(),
                result.journeyMode(),
                result.stages().stream().map(this::toStage).toList(),
                result.view().layout(),
                result.view().columns(),
                groups,
                generatedAt
        );
    }

    public RankingResponses.GroupRanking toGroupRanking(
            RankingResult result,
            String groupKey,
            OffsetDateTime generatedAt
    ) {
        return new RankingResponses.GroupRanking(
                result.competitionId(),
                result.rankingSystemCode(),
                groupKey,
                result.view().layout(),
                result.view().columns(),
                toGroup(result.groups().get(groupKey)),
                generatedAt
        );
    }

    public RankingResponses.RankingSystemDetail toRankingSystemDetail(RankingSystem system) {
        return new RankingResponses.RankingSystemDetail(
                system.getRankingSystemId(),
                system.getCode(),
                toTitles(system.getTitles()),
                system.getDescription(),
                system.getGroupBy(),
                system.getEntityType(),
                system.getScoringMode(),
                system.getJourneyMode(),
                system.getBestNCount(),
                system.getPointMode(),
                new TreeMap<>(system.getPointTable()),
                system.getMaxScoringPosition(),
                system.isDnfGetsPointsIfFewFinishers(),
                system.getDiscipline(),
                new HashSet<>(system.getAllowedBoatClassIds()),
                system.getTieBreakers().isEmpty() ? TieBreaker.DEFAULT_ORDER : List.copyOf(system.getTieBreakers()),
                system.isPreset(),
                system.isActive(),
                system.getSortOrder(),
                system.getCreatedAt(),
                system.getUpdatedAt()
        );
    }

    public RankingResponses.AvailableSystem toAvailableSystem(RankingSystem system) {
        return new RankingResponses.AvailableSystem(
                system.getRankingSystemId(),
                system.getCode(),
                toTitles(system.getTitles()),
                system.getDescription(),
                system.getGroupBy(),
                system.getScoringMode(),
                system.isPreset(),
                system.getSortOrder()
        );
    }

    public RankingResponses.PresetSummary toPresetSummary(RankingPreset preset, boolean installed) {
        return new RankingResponses.PresetSummary(
                preset.code(),
                new RankingResponses.Titles(preset.titleEn(), preset.titleFr(), preset.titleAr()),
                preset.description(),
                preset.groupBy(),
                preset.entityType(),
                preset.scoringMode(),
                preset.journeyMode(),
                preset.pointMode(),
                preset.discipline(),
                preset.tieBreakers(),
                preset.sortOrder(),
                installed
        );
    }

    private RaceResponses.Lane toLane(RaceLane lane, RecordedLaneResult result) {
        return new RaceResponses.Lane(
                lane.getLaneNumber(),
                lane.getEntryId(),
                lane.getAthleteId(),
                lane.getClubId(),
                result != null ? result.getStatus() : null,
                result != null ? result.getElapsedMs() : null,
                result != null ? RaceTimeFormat.format(result.getElapsedMs()) : null,
                result != null ? result.getPosition() : null
        );
    }

    private EventResponses.Progression toProgression(ProgressionConfig config) {
        return new EventResponses.Progression(
                config.isHasRepechage(),
                config.getTimeTrialDirectAdvance(),
                config.getTimeTrialToRepechage(),
                config.getRepechageAdvance(),
                config.getQuarterfinalAdvance(),
                config.getSemifinalAdvance(),
                config.getSemifinalToFinalB(),
                config.getRepechageLanesPerHeat()
        );
    }

    private RankingResponses.Stage toStage(StageInfo stage) {
        return new RankingResponses.Stage(stage.stageIndex(), stage.label(), stage.finalDay());
    }

    private RankingResponses.Group toGroup(RankingGroup group) {
        GroupMetadata metadata = group.metadata();
        return new RankingResponses.Group(
                metadata.groupKey(),
                metadata.gender(),
                metadata.categoryId(),
                metadata.categoryCode(),
                toTitles(metadata.titles()),
                group.entries().stream().map(this::toEntry).toList()
        );
    }

    private RankingResponses.Entry toEntry(RankingEntry entry) {
        return new RankingResponses.Entry(
                entry.rank(),
                entry.entityType(),
                entry.entityId(),
                entry.entityName(),
                entry.affiliation(),
                entry.totalPoints(),
                entry.medals().gold(),
                entry.medals().silver(),
                entry.medals().bronze(),
                entry.medals().total(),
                entry.raceCount(),
                entry.positionCounts().getOrDefault(1, 0),
                entry.positionCounts().getOrDefault(2, 0),
                entry.positionCounts().getOrDefault(3, 0),
                entry.statusCounts().getOrDefault(LaneStatus.DNS, 0),
                entry.statusCounts().getOrDefault(LaneStatus.DNF, 0),
                entry.statusCounts().getOrDefault(LaneStatus.DSQ, 0),
                entry.stages().stream().map(this::toStageScore).toList()
        );
    }

    private RankingResponses.StageScore toStageScore(StagePoints stage) {
        return new RankingResponses.StageScore(
                stage.stageIndex(),
                stage.points(),
                stage.medals().gold(),
                stage.medals().silver(),
                stage.medals().bronze()
        );
    }

    private RankingResponses.Titles toTitles(LocalizedTitle titles) {
        if (titles == null) {
            return null;
        }
        return new RankingResponses.Titles(titles.getEn(), titles.getFr(), titles.getAr());
    }
}
