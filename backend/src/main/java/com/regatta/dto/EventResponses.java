package com.regatta.dto;

import com.regatta.model.EventStatus;
import com.regatta.model.Gender;
import com.regatta.model.MedalType;
import com.regatta.model.RacePhase;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public final class EventResponses {

    private EventResponses() {
    }

    public record EventSummary(
            UUID eventId,
            UUID competitionId,
            UUID boatClassId,
            UUID categoryId,
            Gender gender,
            String name,
            Integer stageIndex,
            EventStatus status,
            RacePhase currentPhase,
            Progression progression,
            List<UUID> directQualifiers,
            List<Medal> medals,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt,
            OffsetDateTime completedAt
    ) {
    }

    public record Progression(
            boolean hasRepechage,
            int timeTrialDirectAdvance,
            int timeTrialToRepechage,
            int repechageAdvance,
            int quarterfinalAdvance,
            int semifinalAdvance,
            int semifinalToFinalB,
            int repechageLanesPerHeat
    ) {
    }

    public record Medal(
            MedalType medalType,
            UUID entryId,
            UUID athleteId,
            UUID clubId,
            Long elapsedMs,
            String time
    ) {
    }

    public record TimeTrialSeeded(
            UUID eventId,
            EventStatus eventStatus,
            RacePhase currentPhase,
            int entryCount,
            List<RaceResponses.RaceDetail> races
    ) {
    }

    public record PhaseProcessed(
            String message,
            int advancedCount,
            RacePhase nextPhase,
            EventStatus eventStatus,
            List<RaceResponses.RaceDetail> races,
            List<Medal> medals
    ) {
    }

    /**
     * Phases iterate in progression order.
     */
    public record Bracket(
            EventSummary event,
            Map<RacePhase, List<RaceResponses.RaceDetail>> phases
    ) {
    }
}
