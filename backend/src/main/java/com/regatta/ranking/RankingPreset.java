package com.regatta.ranking;

import com.regatta.model.Discipline;
import com.regatta.model.GroupBy;
import com.regatta.model.JourneyMode;
import com.regatta.model.LocalizedTitle;
import com.regatta.model.PointMode;
import com.regatta.model.RankingEntityType;
import com.regatta.model.RankingSystem;
import com.regatta.model.ScoringMode;
import com.regatta.model.TieBreaker;
import com.regatta.scoring.PointTable;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

/**
 * A built-in ranking system definition. Syncing copies it onto the stored
 * system with the same code.
 */
public record RankingPreset(
        String code,
        String titleEn,
        String titleFr,
        String titleAr,
        String description,
        GroupBy groupBy,
        RankingEntityType entityType,
        ScoringMode scoringMode,
        JourneyMode journeyMode,
        PointMode pointMode,
        Discipline discipline,
        List<TieBreaker> tieBreakers,
        int sortOrder
) {

    public void applyTo(RankingSystem system, OffsetDateTime now) {
        system.setCode(code);
        system.setTitles(new LocalizedTitle(titleEn, titleFr, titleAr));
        system.setDescription(description);
        system.setGroupBy(groupBy);
        system.setEntityType(entityType);
        system.setScoringMode(scoringMode);
        system.setJourneyMode(journeyMode);
        system.setBestNCount(null);
        system.setPointMode(pointMode);
        system.setPointTable(new TreeMap<>(PointTable.DEFAULT_POINTS));
        system.setMaxScoringPosition(PointTable.DEFAULT_MAX_SCORING_POSITION);
        system.setDnfGetsPointsIfFewFinishers(true);
        system.setDiscipline(discipline);
        system.setTieBreakers(new ArrayList<>(tieBreakers));
        system.setPreset(true);
        system.setActive(true);
        system.setSortOrder(sortOrder);
        system.setUpdatedAt(now);
    }

    public boolean appliesTo(Discipline competitionDiscipline) {
        return discipline == null || discipline == competitionDiscipline;
    }
}
