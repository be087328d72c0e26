package com.swisspairing.controller;

import com.swisspairing.dto.StandingsResponses;
import com.swisspairing.model.TournamentScope;
import com.swisspairing.service.PairingService;
import com.swisspairing.service.StandingsService;
import jakarta.validation.constraints.Positive;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Standings and next-round pairings. Omitting {@code tournamentId} selects the global scope.
 */
@RestController
@RequestMapping("/api")
public class StandingsController {

    private final StandingsService standingsService;
    private final PairingService pairingService;

    public StandingsController(StandingsService standingsService, PairingService pairingService) {
        this.standingsService = standingsService;
        this.pairingService = pairingService;
    }

    @GetMapping("/standings")
    public ResponseEntity<List<StandingsResponses.Standing>> getStandings(
            @RequestParam(required = false) @Positive Integer tournamentId
    ) {
        return ResponseEntity.ok(standingsService.computeStandings(TournamentScope.ofNullable(tournamentId)));
    }

    @GetMapping("/pairings")
    public ResponseEntity<List<StandingsResponses.Pairing>> getPairings(
            @RequestParam(required = false) @Positive Integer tournamentId
    ) {
        return ResponseEntity.ok(pairingService.generatePairings(TournamentScope.ofNullable(tournamentId)));
    }
}
