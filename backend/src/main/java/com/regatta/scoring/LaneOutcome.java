package com.regatta.scoring;

import com.regatta.model.LaneStatus;

/**
 * Recorded outcome of one lane, as the scoring functions see it.
 */
public record LaneOutcome(
        int laneNumber,
        LaneStatus status,
        Long elapsedMs
) {
}
