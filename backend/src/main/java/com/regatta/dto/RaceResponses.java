package com.regatta.dto;

import com.regatta.model.Gender;
import com.regatta.model.LaneStatus;
import com.regatta.model.RacePhase;
import com.regatta.model.RaceStatus;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class RaceResponses {

    private RaceResponses() {
    }

    public record RaceDetail(
            UUID raceId,
            UUID competitionId,
            UUID eventId,
            UUID categoryId,
            UUID boatClassId,
            Gender gender,
            RacePhase phase,
            Integer heatNumber,
            String raceCode,
            Integer stageIndex,
            RaceStatus status,
            Integer revision,
            List<Lane> lanes,
            OffsetDateTime completedAt
    ) {
    }

    /**
     * A lane assignment with its effective result, if any.
     */
    public record Lane(
            Integer laneNumber,
            UUID entryId,
            UUID athleteId,
            UUID clubId,
            LaneStatus status,
            Long elapsedMs,
            String time,
            Integer position
    ) {
    }

    public record ResultRevision(
            Integer revision,
            String reason,
            OffsetDateTime recordedAt,
            List<LaneResult> lanes
    ) {
    }

    public record LaneResult(
            Integer laneNumber,
            LaneStatus status,
            Long elapsedMs,
            String time,
            Integer position
    ) {
    }
}
