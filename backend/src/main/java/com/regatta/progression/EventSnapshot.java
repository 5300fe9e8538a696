package com.regatta.progression;

import com.regatta.model.EventStatus;
import com.regatta.model.RacePhase;

import java.util.List;
import java.util.UUID;

/**
 * State of one event as read under its lock.
 */
public record EventSnapshot(
        UUID eventId,
        EventStatus status,
        RacePhase currentPhase,
        ProgressionSettings settings,
        int laneCapacity,
        List<Entrant> directQualifiers
) {
}
