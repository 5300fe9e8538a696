package com.regatta.ranking;

import com.regatta.model.Gender;
import com.regatta.model.MedalType;

import java.util.UUID;

/**
 * A medal awarded by a completed knockout event.
 */
public record MedalRecord(
        UUID eventId,
        UUID categoryId,
        Gender gender,
        UUID boatClassId,
        int crewSize,
        int stageIndex,
        MedalType medalType,
        UUID athleteId,
        UUID clubId
) {
}
