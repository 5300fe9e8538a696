package com.regatta.dto;

import com.regatta.model.Discipline;
import com.regatta.model.Gender;
import com.regatta.model.GroupBy;
import com.regatta.model.JourneyMode;
import com.regatta.model.PointMode;
import com.regatta.model.RankingEntityType;
import com.regatta.model.ScoringMode;
import com.regatta.model.TieBreaker;
import com.regatta.ranking.RankingLayout;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

public final class RankingResponses {

    private RankingResponses() {
    }

    public record Titles(
            String en,
            String fr,
            String ar
    ) {
    }

    public record CompetitionRanking(
            UUID competitionId,
            UUID rankingSystemId,
            String rankingSystemCode,
            GroupBy groupBy,
            ScoringMode scoringMode,
            JourneyMode journeyMode,
            List<Stage> stages,
            RankingLayout layout,
            List<String> columns,
            Map<String, Group> rankings,
            OffsetDateTime generatedAt
    ) {
    }

    public record GroupRanking(
            UUID competitionId,
            String rankingSystemCode,
            String groupKey,
            RankingLayout layout,
            List<String> columns,
            Group group,
            OffsetDateTime generatedAt
    ) {
    }

    public record Stage(
            int stageIndex,
            String label,
            boolean finalDay
    ) {
    }

    public record Group(
            String groupKey,
            Gender gender,
            UUID categoryId,
            String categoryCode,
            Titles titles,
            List<Entry> entries
    ) {
    }

    public record Entry(
            int rank,
            RankingEntityType entityType,
            UUID entityId,
            String entityName,
            String affiliation,
            int totalPoints,
            int gold,
            int silver,
            int bronze,
            int medalTotal,
            int raceCount,
            int firstPlaces,
            int secondPlaces,
            int thirdPlaces,
            int dnsCount,
            int dnfCount,
            int dsqCount,
            List<StageScore> stages
    ) {
    }

    public record StageScore(
            int stageIndex,
            int points,
            int gold,
            int silver,
            int bronze
    ) {
    }

    public record AvailableSystem(
            UUID rankingSystemId,
            String code,
            Titles titles,
            String description,
            GroupBy groupBy,
            ScoringMode scoringMode,
            boolean preset,
            Integer sortOrder
    ) {
    }

    public record RankingSystemDetail(
            UUID rankingSystemId,
            String code,
            Titles titles,
            String description,
            GroupBy groupBy,
            RankingEntityType entityType,
            ScoringMode scoringMode,
            JourneyMode journeyMode,
            Integer bestNCount,
            PointMode pointMode,
            Map<Integer, Integer> pointTable,
            Integer maxScoringPosition,
            boolean dnfGetsPointsIfFewFinishers,
            Discipline discipline,
            Set<UUID> allowedBoatClassIds,
            List<TieBreaker> tieBreakers,
            boolean preset,
            boolean active,
            Integer sortOrder,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {
    }

    public record PresetSummary(
            String code,
            Titles titles,
            String description,
            GroupBy groupBy,
            RankingEntityType entityType,
            ScoringMode scoringMode,
            JourneyMode journeyMode,
            PointMode pointMode,
            Discipline discipline,
            List<TieBreaker> tieBreakers,
            int sortOrder,
            boolean installed
    ) {
    }

    public record PresetSyncResult(
            List<String> created,
            List<String> updated
    ) {
    }
}
