package com.regatta.dto;

import com.regatta.model.Discipline;
import com.regatta.model.GroupBy;
import com.regatta.model.JourneyMode;
import com.regatta.model.PointMode;
import com.regatta.model.RankingEntityType;
import com.regatta.model.ScoringMode;
import com.regatta.model.TieBreaker;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

public final class RankingRequests {

    private RankingRequests() {
    }

    public record RankingSystemRequest(
            @NotBlank(message = "code is required")
            @Size(max = 32, message = "code must be at most 32 characters")
            @Pattern(regexp = "[A-Z0-9_]+", message = "code must use upper-case letters, digits and underscores")
            String code,

            @NotBlank(message = "titleEn is required")
            @Size(max = 128, message = "titleEn must be at most 128 characters")
            String titleEn,

            @Size(max = 128, message = "titleFr must be at most 128 characters")
            String titleFr,

            @Size(max = 128, message = "titleAr must be at most 128 characters")
            String titleAr,

            String description,

            @NotNull(message = "groupBy is required")
            GroupBy groupBy,

            RankingEntityType entityType,

            ScoringMode scoringMode,

            JourneyMode journeyMode,

            @Min(value = 1, message = "bestNCount must be at least 1")
            Integer bestNCount,

            PointMode pointMode,

            Map<Integer, Integer> pointTable,

            @Min(value = 0, message = "maxScoringPosition must be non-negative")
            Integer maxScoringPosition,

            Boolean dnfGetsPointsIfFewFinishers,

            Discipline discipline,

            Set<UUID> allowedBoatClassIds,

            List<TieBreaker> tieBreakers,

            Boolean active,

            Integer sortOrder
    ) {
        @AssertTrue(message = "bestNCount is required when journeyMode is BEST_N")
        public boolean isBestNCountPresentForBestN() {
            return journeyMode != JourneyMode.BEST_N || bestNCount != null;
        }

        @AssertTrue(message = "pointTable positions must be at least 1 and points non-negative")
        public boolean isPointTableWellFormed() {
            if (pointTable == null) {
                return true;
            }
            return pointTable.entrySet().stream().allMatch(entry ->
                    entry.getKey() != null && entry.getKey() >= 1
                            && entry.getValue() != null && entry.getValue() >= 0);
        }

        @AssertTrue(message = "tieBreakers must not repeat or contain nulls")
        public boolean isTieBreakerListDistinct() {
            if (tieBreakers == null) {
                return true;
            }
            return !tieBreakers.contains(null) && new HashSet<>(tieBreakers).size() == tieBreakers.size();
        }
    }
}
