package com.regatta.ranking;

import com.regatta.model.Gender;
import com.regatta.model.RacePhase;

import java.util.List;
import java.util.UUID;

/**
 * A completed race as the aggregator consumes it.
 *
 * @param eventKey   groups the races of one event; the event id for knockout
 *                   events, category/boat class/gender for stage races
 * @param eventId    null for stage races
 * @param phase      null for stage races
 */
public record ScoredRace(
        UUID raceId,
        String eventKey,
        UUID eventId,
        UUID categoryId,
        Gender gender,
        UUID boatClassId,
        int crewSize,
        int laneCapacity,
        int stageIndex,
        RacePhase phase,
        List<ScoredLane> lanes
) {

    public boolean isKnockout() {
        return eventId != null;
    }

    public static String stageRaceKey(UUID categoryId, UUID boatClassId, Gender gender) {
        return categoryId + "/" + boatClassId + "/" + gender;
    }
}
