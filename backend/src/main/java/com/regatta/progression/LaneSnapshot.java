package com.regatta.progression;

import com.regatta.model.LaneStatus;

/**
 * A lane with its effective result; {@code status} is null until recorded.
 */
public record LaneSnapshot(
        int laneNumber,
        Entrant entrant,
        LaneStatus status,
        Long elapsedMs
) {
}
