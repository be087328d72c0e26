package com.swisspairing.dto;

import java.time.OffsetDateTime;

public final class PlayerResponses {

    private PlayerResponses() {
    }

    public record PlayerDetail(
            Integer playerId,
            String name,
            OffsetDateTime createdAt
    ) {
    }

    public record PlayerCount(
            Integer tournamentId,
            long count
    ) {
    }
}
