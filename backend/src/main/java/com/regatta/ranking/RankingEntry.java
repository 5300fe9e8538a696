package com.regatta.ranking;

import com.regatta.model.LaneStatus;
import com.regatta.model.RankingEntityType;
import com.regatta.scoring.MedalTally;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One ranked athlete or club within a group.
 *
 * @param affiliation club name of an athlete entry, null for clubs
 * @param stages      per-stage breakdown, empty unless every stage counts and
 *                    the competition has more than one
 */
public record RankingEntry(
        int rank,
        RankingEntityType entityType,
        UUID entityId,
        String entityName,
        String affiliation,
        int totalPoints,
        MedalTally medals,
        Map<Integer, Integer> positionCounts,
        int raceCount,
        Map<LaneStatus, Integer> statusCounts,
        List<StagePoints> stages
) {
}
