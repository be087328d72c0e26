package com.swisspairing.service;

import com.swisspairing.config.SwissPairingProperties;
import com.swisspairing.model.Player;
import com.swisspairing.model.TournamentScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Replays a reference tournament on startup and logs counts, standings and
 * pairings. Clears every stored record first, so keep it off outside demos.
 */
@Service
@ConditionalOnProperty(prefix = "swiss.sample", name = "enabled", havingValue = "true")
public class SampleTournamentRunner {

    private static final Logger log = LoggerFactory.getLogger(SampleTournamentRunner.class);

    static final List<String> PLAYER_NAMES = List.of(
            "Dee", "Temur", "Annie", "Adam", "Shikhikhutug",
            "Lakshmi", "Yuji", "Bleda", "Attila", "Marie"
    );

    private final ResultStore resultStore;
    private final StandingsService standingsService;
    private final PairingService pairingService;
    private final SwissPairingProperties swissPairingProperties;

    public SampleTournamentRunner(
            ResultStore resultStore,
            StandingsService standingsService,
            PairingService pairingService,
            SwissPairingProperties swissPairingProperties
    ) {
        this.resultStore = resultStore;
        this.standingsService = standingsService;
        this.pairingService = pairingService;
        this.swissPairingProperties = swissPairingProperties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        run();
    }

    void run() {
        TournamentScope tournament = TournamentScope.of(swissPairingProperties.getSample().getTournamentId());
        log.info("Replaying sample tournament into {}", tournament);

        resultStore.clearMatches();
        resultStore.clearPlayers();

        List<Integer> ids = new ArrayList<>();
        for (String name : PLAYER_NAMES) {
            Player player = resultStore.insertPlayer(name);
            ids.add(player.getId());
        }

        report(tournament, ids, new int[][]{{0, 3}, {6, 3}, {6, 1}, {0, 4}, {4, 1}});
        logRound(tournament);

        report(tournament, ids, new int[][]{{0, 6}, {4, 3}, {6, 1}, {2, 5}, {0, 4}, {2, 8}});
        logRound(tournament);

        TournamentScope global = TournamentScope.global();
        logRound(global);
        report(global, ids, new int[][]{{0, 1}, {2, 3}, {3, 1}, {0, 2}});
        logRound(global);
    }

    private void report(TournamentScope scope, List<Integer> ids, int[][] results) {
        for (int[] result : results) {
            resultStore.insertMatch(ids.get(result[0]), ids.get(result[1]), scope);
        }
    }

    private void logRound(TournamentScope scope) {
        log.info("Players in {}: {}", scope, resultStore.countPlayers(scope));
        log.info("Standings in {}: {}", scope, standingsService.computeStandings(scope));
        log.info("Pairings in {}: {}", scope, pairingService.generatePairings(scope));
    }
}
