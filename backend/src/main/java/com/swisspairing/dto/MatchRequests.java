package com.swisspairing.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public final class MatchRequests {

    private MatchRequests() {
    }

    public record ReportMatchRequest(
            @NotNull(message = "winnerId is required")
            Integer winnerId,

            @NotNull(message = "loserId is required")
            Integer loserId,

            @Positive(message = "tournamentId must be positive")
            Integer tournamentId
    ) {
    }
}
