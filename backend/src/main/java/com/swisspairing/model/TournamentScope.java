package com.swisspairing.model;

import java.util.Optional;

/**
 * Grouping key that restricts which matches and players a query considers.
 * The global scope covers matches reported without a tournament and always
 * lists every registered player.
 */
public record TournamentScope(Integer tournamentId) {

    private static final TournamentScope GLOBAL = new TournamentScope(null);

    public TournamentScope {
        if (tournamentId != null && tournamentId <= 0) {
            throw new IllegalArgumentException("tournamentId must be positive: " + tournamentId);
        }
    }

    public static TournamentScope global() {
        return GLOBAL;
    }

    public static TournamentScope of(int tournamentId) {
        return new TournamentScope(tournamentId);
    }

    public static TournamentScope ofNullable(Integer tournamentId) {
        return tournamentId == null ? GLOBAL : new TournamentScope(tournamentId);
    }

    public boolean isGlobal() {
        return tournamentId == null;
    }

    public Optional<Integer> id() {
        return Optional.ofNullable(tournamentId);
    }

    @Override
    public String toString() {
        return isGlobal() ? "global" : "tournament " + tournamentId;
    }
}
