package com.regatta.progression;

import com.regatta.model.RacePhase;
import com.regatta.model.RaceStatus;

import java.util.List;
import java.util.UUID;

public record RaceSnapshot(
        UUID raceId,
        RacePhase phase,
        int heatNumber,
        RaceStatus status,
        List<LaneSnapshot> lanes
) {
}
