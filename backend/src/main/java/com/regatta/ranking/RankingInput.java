package com.regatta.ranking;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Everything a ranking computation reads, loaded in one read-only transaction.
 */
public record RankingInput(
        UUID competitionId,
        List<StageInfo> stages,
        List<ScoredRace> races,
        List<MedalRecord> medals,
        Map<UUID, CategoryInfo> categories,
        Map<UUID, String> athleteNames,
        Map<UUID, String> clubNames
) {
}
