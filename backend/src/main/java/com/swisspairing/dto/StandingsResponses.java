package com.swisspairing.dto;

public final class StandingsResponses {

    private StandingsResponses() {
    }

    public record Standing(
            Integer playerId,
            String name,
            int wins,
            int matches,
            int opponentMatchWins
    ) {
    }

    public record Pairing(
            Integer player1Id,
            String player1Name,
            Integer player2Id,
            String player2Name
    ) {
    }
}
