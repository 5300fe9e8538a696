package com.regatta.ranking;

import com.regatta.model.GroupBy;
import com.regatta.model.JourneyMode;
import com.regatta.model.PointMode;
import com.regatta.model.RankingEntityType;
import com.regatta.model.RankingSystem;
import com.regatta.model.ScoringMode;
import com.regatta.model.TieBreaker;
import com.regatta.scoring.PointTable;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable view of a ranking system for one computation. {@code rankingSystemId}
 * is null for the built-in default. A null tie-breaker list means
 * {@link TieBreaker#DEFAULT_ORDER}; an empty one goes straight to name order.
 */
public record RankingConfig(
        UUID rankingSystemId,
        String code,
        GroupBy groupBy,
        RankingEntityType entityType,
        ScoringMode scoringMode,
        JourneyMode journeyMode,
        int bestNCount,
        PointMode pointMode,
        PointTable pointTable,
        boolean dnfGetsPointsIfFewFinishers,
        Set<UUID> allowedBoatClassIds,
        List<TieBreaker> tieBreakers
) {

    public static final String DEFAULT_CODE = "DEFAULT";

    public RankingConfig {
        allowedBoatClassIds = allowedBoatClassIds == null ? Set.of() : Set.copyOf(allowedBoatClassIds);
        tieBreakers = tieBreakers == null ? TieBreaker.DEFAULT_ORDER : List.copyOf(tieBreakers);
    }

    public static RankingConfig from(RankingSystem system) {
        return new RankingConfig(
                system.getRankingSystemId(),
                system.getCode(),
                system.getGroupBy(),
                system.getEntityType(),
                system.getScoringMode(),
                system.getJourneyMode(),
                system.getBestNCount() == null ? 0 : system.getBestNCount(),
                system.getPointMode(),
                new PointTable(system.getPointTable(), system.getMaxScoringPosition()),
                system.isDnfGetsPointsIfFewFinishers(),
                system.getAllowedBoatClassIds(),
                system.getTieBreakers() == null || system.getTieBreakers().isEmpty() ? null : system.getTieBreakers()
        );
    }

    public static RankingConfig defaults(PointTable pointTable, boolean dnfGetsPointsIfFewFinishers, GroupBy groupBy) {
        return new RankingConfig(
                null,
                DEFAULT_CODE,
                groupBy,
                RankingEntityType.CLUB,
                ScoringMode.POINTS,
                JourneyMode.ALL,
                0,
                PointMode.MIXED,
                pointTable,
                dnfGetsPointsIfFewFinishers,
                Set.of(),
                null
        );
    }

    public boolean admitsBoatClass(UUID boatClassId) {
        return allowedBoatClassIds.isEmpty() || allowedBoatClassIds.contains(boatClassId);
    }
}
