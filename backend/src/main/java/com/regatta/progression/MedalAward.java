package com.regatta.progression;

import com.regatta.model.MedalType;

public record MedalAward(
        MedalType medalType,
        Entrant entrant,
        Long elapsedMs
) {
}
