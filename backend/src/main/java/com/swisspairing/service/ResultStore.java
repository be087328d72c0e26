package com.swisspairing.service;

import com.swisspairing.model.Match;
import com.swisspairing.model.Player;
import com.swisspairing.model.TournamentScope;

import java.util.List;

/**
 * Persisted players and match results. Every call runs in its own session,
 * acquired and released by the implementation.
 */
public interface ResultStore {

    Player insertPlayer(String name);

    Match insertMatch(Integer winnerId, Integer loserId, TournamentScope scope);

    default Match insertMatch(Integer winnerId, Integer loserId) {
        return insertMatch(winnerId, loserId, TournamentScope.global());
    }

    /**
     * Registered players for the global scope or for a tournament without
     * matches, distinct participants otherwise.
     */
    long countPlayers(TournamentScope scope);

    long clearMatches();

    /**
     * Deletes every player. Matches that reference them go with them.
     */
    long clearPlayers();

    /**
     * All players in registration order plus the scope's matches, read in a
     * single session.
     */
    ScopeSnapshot snapshot(TournamentScope scope);

    record ScopeSnapshot(
            TournamentScope scope,
            List<Player> players,
            List<Match> matches
    ) {
    }
}
