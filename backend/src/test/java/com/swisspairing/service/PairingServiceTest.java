package com.swisspairing.service;

import com.swisspairing.dto.StandingsResponses;
import com.swisspairing.model.TournamentScope;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PairingServiceTest {

    @Mock
    private StandingsService standingsService;

    @InjectMocks
    private PairingService pairingService;

    @Test
    void generatePairings_pairsAdjacentRanks() {
        TournamentScope scope = TournamentScope.of(16);
        when(standingsService.computeStandings(scope)).thenReturn(standings(
                standing(1, "Dee"), standing(7, "Yuji"), standing(5, "Shikhikhutug"), standing(4, "Adam")
        ));

        List<StandingsResponses.Pairing> pairings = pairingService.generatePairings(scope);

        assertEquals(List.of(
                new StandingsResponses.Pairing(1, "Dee", 7, "Yuji"),
                new StandingsResponses.Pairing(5, "Shikhikhutug", 4, "Adam")
        ), pairings);
    }

    @Test
    void generatePairings_oddCountDropsLastPlayer() {
        TournamentScope scope = TournamentScope.of(16);
        when(standingsService.computeStandings(scope)).thenReturn(standings(
                standing(1, "Dee"), standing(7, "Yuji"), standing(5, "Shikhikhutug"),
                standing(4, "Adam"), standing(2, "Temur")
        ));

        List<StandingsResponses.Pairing> pairings = pairingService.generatePairings(scope);

        assertEquals(2, pairings.size());
        assertTrue(pairings.stream().noneMatch(pairing ->
                pairing.player1Id() == 2 || pairing.player2Id() == 2));
    }

    @Test
    void generatePairings_noStandingsYieldsNoPairings() {
        TournamentScope scope = TournamentScope.global();
        when(standingsService.computeStandings(scope)).thenReturn(List.of());

        assertTrue(pairingService.generatePairings(scope).isEmpty());
    }

    @Test
    void pairAdjacent_coversEveryPlayerOnceForEvenCounts() {
        List<StandingsResponses.Standing> standings = new ArrayList<>();
        for (int id = 1; id <= 10; id++) {
            standings.add(standing(id, "P" + id));
        }

        List<StandingsResponses.Pairing> pairings = PairingService.pairAdjacent(standings);

        assertEquals(5, pairings.size());
        Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < pairings.size(); i++) {
            StandingsResponses.Pairing pairing = pairings.get(i);
            assertEquals(standings.get(2 * i).playerId(), pairing.player1Id());
            assertEquals(standings.get(2 * i + 1).playerId(), pairing.player2Id());
            assertTrue(seen.add(pairing.player1Id()));
            assertTrue(seen.add(pairing.player2Id()));
        }
    }

    private static List<StandingsResponses.Standing> standings(StandingsResponses.Standing... standings) {
        return List.of(standings);
    }

    private static StandingsResponses.Standing standing(int id, String name) {
        return new StandingsResponses.Standing(id, name, 0, 0, 0);
    }
}
