package com.regatta.ranking;

import com.regatta.model.LaneStatus;

import java.util.UUID;

/**
 * Effective result of one lane together with who it is credited to.
 */
public record ScoredLane(
        int laneNumber,
        UUID athleteId,
        UUID clubId,
        LaneStatus status,
        Long elapsedMs
) {
}
