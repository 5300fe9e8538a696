package com.regatta.dto;

import com.regatta.model.Gender;
import com.regatta.model.LaneStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

public final class RaceRequests {

    private RaceRequests() {
    }

    /**
     * Either {@code time} ({@code M:SS.cc}) or {@code timeMs} carries the finish
     * time of an OK lane; {@code timeMs} wins when both are sent.
     */
    public record LaneResultRequest(
            @NotNull(message = "laneNumber is required")
            @Min(value = 1, message = "laneNumber must be at least 1")
            Integer laneNumber,

            @NotNull(message = "status is required")
            LaneStatus status,

            String time,

            @Positive(message = "timeMs must be positive")
            Long timeMs
    ) {
    }

    public record RecordResultsRequest(
            @NotEmpty(message = "lanes are required")
            @Valid
            List<LaneResultRequest> lanes
    ) {
    }

    public record CorrectResultsRequest(
            @NotEmpty(message = "lanes are required")
            @Valid
            List<LaneResultRequest> lanes,

            @NotBlank(message = "reason is required")
            @Size(max = 500, message = "reason must be at most 500 characters")
            String reason
    ) {
    }

    public record ScheduleRaceRequest(
            @NotNull(message = "categoryId is required")
            UUID categoryId,

            @NotNull(message = "boatClassId is required")
            UUID boatClassId,

            Gender gender,

            @NotBlank(message = "raceCode is required")
            @Size(max = 32, message = "raceCode must be at most 32 characters")
            String raceCode,

            @Min(value = 1, message = "stageIndex must be at least 1")
            Integer stageIndex,

            @NotEmpty(message = "entryIds are required")
            List<UUID> entryIds
    ) {
    }
}
