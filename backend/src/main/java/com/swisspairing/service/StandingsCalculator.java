package com.swisspairing.service;

import com.swisspairing.dto.StandingsResponses;
import com.swisspairing.model.Match;
import com.swisspairing.model.OpponentWinsMode;
import com.swisspairing.model.Player;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pure aggregation of match records into ranked standings.
 */
@Component
public class StandingsCalculator {

    static final Comparator<StandingsResponses.Standing> RANK_ORDER =
            Comparator.comparingInt(StandingsResponses.Standing::wins).reversed()
                    .thenComparing(Comparator.comparingInt(StandingsResponses.Standing::opponentMatchWins).reversed())
                    .thenComparingInt(StandingsResponses.Standing::matches)
                    .thenComparing(StandingsResponses.Standing::playerId, Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * Every player with an empty record, in the order given.
     */
    public List<StandingsResponses.Standing> zeroRecords(List<Player> players) {
        List<StandingsResponses.Standing> standings = new ArrayList<>(players.size());
        for (Player player : players) {
            standings.add(new StandingsResponses.Standing(player.getId(), player.getName(), 0, 0, 0));
        }
        return standings;
    }

    /**
     * Ranks players by wins, then opponent match wins, then fewest matches.
     *
     * @param players registered players in registration order
     * @param matches matches of a single scope
     * @param includeNonParticipants keep players without a match in the scope
     * @param mode how repeated opponents contribute to opponent match wins
     * @return standings, first place first
     */
    public List<StandingsResponses.Standing> rank(
            List<Player> players,
            List<Match> matches,
            boolean includeNonParticipants,
            OpponentWinsMode mode
    ) {
        Map<Integer, Integer> wins = new HashMap<>();
        Map<Integer, Integer> played = new HashMap<>();
        for (Match match : matches) {
            wins.merge(match.getWinnerId(), 1, Integer::sum);
            played.merge(match.getWinnerId(), 1, Integer::sum);
            played.merge(match.getLoserId(), 1, Integer::sum);
        }

        Map<Integer, Integer> opponentWins = mode == OpponentWinsMode.DISTINCT_OPPONENT
                ? distinctOpponentWins(matches, wins)
                : perMatchOpponentWins(matches, wins);

        List<StandingsResponses.Standing> standings = new ArrayList<>();
        for (Player player : players) {
            int matchesPlayed = played.getOrDefault(player.getId(), 0);
            if (matchesPlayed == 0 && !includeNonParticipants) {
                continue;
            }
            standings.add(new StandingsResponses.Standing(
                    player.getId(),
                    player.getName(),
                    wins.getOrDefault(player.getId(), 0),
                    matchesPlayed,
                    opponentWins.getOrDefault(player.getId(), 0)
            ));
        }
        standings.sort(RANK_ORDER);
        return standings;
    }

    private static Map<Integer, Integer> perMatchOpponentWins(List<Match> matches, Map<Integer, Integer> wins) {
        Map<Integer, Integer> opponentWins = new HashMap<>();
        for (Match match : matches) {
            opponentWins.merge(match.getWinnerId(), wins.getOrDefault(match.getLoserId(), 0), Integer::sum);
            opponentWins.merge(match.getLoserId(), wins.getOrDefault(match.getWinnerId(), 0), Integer::sum);
        }
        return opponentWins;
    }

    private static Map<Integer, Integer> distinctOpponentWins(List<Match> matches, Map<Integer, Integer> wins) {
        Map<Integer, Set<Integer>> opponents = new HashMap<>();
        for (Match match : matches) {
            opponents.computeIfAbsent(match.getWinnerId(), id -> new LinkedHashSet<>()).add(match.getLoserId());
            opponents.computeIfAbsent(match.getLoserId(), id -> new LinkedHashSet<>()).add(match.getWinnerId());
        }

        Map<Integer, Integer> opponentWins = new HashMap<>();
        opponents.forEach((playerId, faced) -> {
            int total = 0;
            for (Integer opponentId : faced) {
                total += wins.getOrDefault(opponentId, 0);
            }
            opponentWins.put(playerId, total);
        });
        return opponentWins;
    }
}
