package com.regatta.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;
import java.util.UUID;

public final class CompetitionRequests {

    private CompetitionRequests() {
    }

    public record ApproveEntriesRequest(
            @NotEmpty(message = "entryIds are required")
            List<UUID> entryIds
    ) {
    }
}
