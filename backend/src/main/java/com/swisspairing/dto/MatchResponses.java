package com.swisspairing.dto;

import java.time.OffsetDateTime;

public final class MatchResponses {

    private MatchResponses() {
    }

    public record MatchDetail(
            Integer matchId,
            Integer tournamentId,
            Integer winnerId,
            Integer loserId,
            OffsetDateTime reportedAt
    ) {
    }
}
