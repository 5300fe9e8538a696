package com.regatta.progression;

import com.regatta.model.RacePhase;

import java.util.List;

/**
 * A race generated by a transition. Lane numbers follow list order, starting at 1.
 */
public record PlannedRace(
        RacePhase phase,
        int heatNumber,
        String raceCode,
        List<Entrant> lanes
) {
}
