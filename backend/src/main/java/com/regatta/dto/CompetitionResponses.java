package com.regatta.dto;

import java.util.List;
import java.util.UUID;

public final class CompetitionResponses {

    private CompetitionResponses() {
    }

    public record ApprovalOutcome(
            List<UUID> approved,
            List<ApprovalFailure> failed
    ) {
    }

    public record ApprovalFailure(
            UUID entryId,
            String code,
            String reason
    ) {
    }

    public record MedalStanding(
            int rank,
            UUID clubId,
            String clubName,
            int gold,
            int silver,
            int bronze,
            int total
    ) {
    }
}
