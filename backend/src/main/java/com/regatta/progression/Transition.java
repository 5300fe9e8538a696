package com.regatta.progression;

import com.regatta.model.EventStatus;
import com.regatta.model.RacePhase;

import java.util.List;

/**
 * Outcome of one guarded step: the event's next state and everything the step
 * produced. Applying it is the caller's job.
 */
public record Transition(
        EventStatus nextStatus,
        RacePhase nextPhase,
        List<PlannedRace> races,
        List<Entrant> advanced,
        List<Entrant> eliminated,
        List<Entrant> heldQualifiers,
        List<MedalAward> medals,
        String message
) {

    public int advancedCount() {
        return advanced.size();
    }
}
