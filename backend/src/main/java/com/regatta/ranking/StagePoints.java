package com.regatta.ranking;

import com.regatta.scoring.MedalTally;

public record StagePoints(
        int stageIndex,
        int points,
        MedalTally medals
) {
}
