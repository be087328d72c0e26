package com.swisspairing.service;

import com.swisspairing.config.SwissPairingProperties;
import com.swisspairing.dto.StandingsResponses;
import com.swisspairing.model.TournamentScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Ranked standings for a tournament scope.
 *
 * A scope without matches yields every registered player with an empty record,
 * so standings and pairings exist before the first round. Tournament scopes
 * with matches list only the players who took part; the global scope always
 * lists everyone.
 */
@Service
public class StandingsService {

    private static final Logger log = LoggerFactory.getLogger(StandingsService.class);

    private final ResultStore resultStore;
    private final StandingsCalculator standingsCalculator;
    private final SwissPairingProperties swissPairingProperties;

    public StandingsService(
            ResultStore resultStore,
            StandingsCalculator standingsCalculator,
            SwissPairingProperties swissPairingProperties
    ) {
        this.resultStore = resultStore;
        this.standingsCalculator = standingsCalculator;
        this.swissPairingProperties = swissPairingProperties;
    }

    public List<StandingsResponses.Standing> computeStandings(TournamentScope scope) {
        ResultStore.ScopeSnapshot snapshot = resultStore.snapshot(scope);

        if (snapshot.matches().isEmpty()) {
            log.debug("No matches in {}, returning {} empty records", scope, snapshot.players().size());
            return standingsCalculator.zeroRecords(snapshot.players());
        }

        List<StandingsResponses.Standing> standings = standingsCalculator.rank(
                snapshot.players(),
                snapshot.matches(),
                scope.isGlobal(),
                swissPairingProperties.getStandings().getOpponentWinsMode()
        );
        log.debug("Computed {} standings from {} matches in {}",
                standings.size(), snapshot.matches().size(), scope);
        return standings;
    }
}
