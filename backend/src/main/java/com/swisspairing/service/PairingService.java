package com.swisspairing.service;

import com.swisspairing.dto.StandingsResponses;
import com.swisspairing.model.TournamentScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Swiss pairings for the next round: each player meets the player ranked
 * directly next to them. Rematches are not checked.
 */
@Service
public class PairingService {

    private static final Logger log = LoggerFactory.getLogger(PairingService.class);

    private final StandingsService standingsService;

    public PairingService(StandingsService standingsService) {
        this.standingsService = standingsService;
    }

    public List<StandingsResponses.Pairing> generatePairings(TournamentScope scope) {
        List<StandingsResponses.Standing> standings = standingsService.computeStandings(scope);
        List<StandingsResponses.Pairing> pairings = pairAdjacent(standings);

        if (standings.size() % 2 != 0) {
            StandingsResponses.Standing unpaired = standings.get(standings.size() - 1);
            log.warn("Odd player count ({}) in {}; player {} ({}) left unpaired",
                    standings.size(), scope, unpaired.playerId(), unpaired.name());
        }
        log.debug("Generated {} pairings for {}", pairings.size(), scope);
        return pairings;
    }

    /**
     * Pairs ranks (1,2), (3,4), ... A trailing odd entry is dropped.
     */
    static List<StandingsResponses.Pairing> pairAdjacent(List<StandingsResponses.Standing> standings) {
        List<StandingsResponses.Pairing> pairings = new ArrayList<>(standings.size() / 2);
        for (int i = 1; i < standings.size(); i += 2) {
            StandingsResponses.Standing first = standings.get(i - 1);
            StandingsResponses.Standing second = standings.get(i);
            pairings.add(new StandingsResponses.Pairing(
                    first.playerId(),
                    first.name(),
                    second.playerId(),
                    second.name()
            ));
        }
        return pairings;
    }
}
