package com.swisspairing.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TournamentScopeTest {

    @Test
    void absentIdSelectsGlobalScope() {
        assertSame(TournamentScope.global(), TournamentScope.ofNullable(null));
        assertTrue(TournamentScope.global().isGlobal());
        assertEquals(Optional.empty(), TournamentScope.global().id());
    }

    @Test
    void tournamentScopeCarriesItsId() {
        TournamentScope scope = TournamentScope.of(16);

        assertFalse(scope.isGlobal());
        assertEquals(Optional.of(16), scope.id());
        assertEquals(scope, TournamentScope.ofNullable(16));
    }

    @Test
    void zeroIsNotATournament() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> TournamentScope.of(0));

        assertEquals("tournamentId must be positive: 0", ex.getMessage());
    }
}
