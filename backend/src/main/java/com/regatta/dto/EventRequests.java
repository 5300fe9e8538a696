package com.regatta.dto;

import com.regatta.model.Gender;
import com.regatta.model.SeedingRule;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

public final class EventRequests {

    private EventRequests() {
    }

    public record CreateEventRequest(
            @NotNull(message = "boatClassId is required")
            UUID boatClassId,

            @NotNull(message = "categoryId is required")
            UUID categoryId,

            Gender gender,

            @Size(max = 128, message = "name must be at most 128 characters")
            String name,

            @Min(value = 1, message = "stageIndex must be at least 1")
            Integer stageIndex,

            @Valid
            ProgressionRequest progression
    ) {
    }

    /**
     * Any field left null takes the configured default.
     */
    public record ProgressionRequest(
            Boolean hasRepechage,

            @Min(value = 0, message = "timeTrialDirectAdvance must be non-negative")
            Integer timeTrialDirectAdvance,

            @Min(value = 0, message = "timeTrialToRepechage must be non-negative")
            Integer timeTrialToRepechage,

            @Min(value = 1, message = "repechageAdvance must be at least 1")
            Integer repechageAdvance,

            @Min(value = 1, message = "quarterfinalAdvance must be at least 1")
            Integer quarterfinalAdvance,

            @Min(value = 1, message = "semifinalAdvance must be at least 1")
            Integer semifinalAdvance,

            @Min(value = 0, message = "semifinalToFinalB must be non-negative")
            Integer semifinalToFinalB,

            @Min(value = 1, message = "repechageLanesPerHeat must be at least 1")
            Integer repechageLanesPerHeat
    ) {
    }

    public record SeedTimeTrialRequest(
            @Size(min = 1, message = "entryIds must not be empty when given")
            List<UUID> entryIds,

            SeedingRule seedingRule
    ) {
        @AssertTrue(message = "entryIds must not contain duplicates")
        public boolean isEntryIdsDistinct() {
            return entryIds == null || entryIds.stream().distinct().count() == entryIds.size();
        }
    }
}
