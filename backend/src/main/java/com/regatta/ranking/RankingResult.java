package com.regatta.ranking;

import com.regatta.model.GroupBy;
import com.regatta.model.JourneyMode;
import com.regatta.model.ScoringMode;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Grouped standings of one competition under one ranking configuration.
 * Groups iterate in key order.
 */
public record RankingResult(
        UUID competitionId,
        UUID rankingSystemId,
        String rankingSystemCode,
        GroupBy groupBy,
        ScoringMode scoringMode,
        JourneyMode journeyMode,
        List<StageInfo> stages,
        Map<String, RankingGroup> groups,
        RankingView view
) {

    public boolean isEmpty() {
        return groups.isEmpty();
    }
}
