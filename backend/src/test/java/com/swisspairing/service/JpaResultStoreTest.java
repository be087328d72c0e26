package com.swisspairing.service;

import com.swisspairing.config.SwissPairingProperties;
import com.swisspairing.model.Player;
import com.swisspairing.model.TournamentScope;
import com.swisspairing.repository.MatchRepository;
import com.swisspairing.repository.PlayerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JpaResultStoreTest {

    @Mock
    private PlayerRepository playerRepository;

    @Mock
    private MatchRepository matchRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private JpaResultStore resultStore;

    @BeforeEach
    void setUp() {
        resultStore = new JpaResultStore(
                playerRepository,
                matchRepository,
                new SwissPairingProperties(),
                transactionManager
        );
    }

    @Test
    void connectionFailureSurfacesAsResultStoreUnavailable() {
        CannotCreateTransactionException cause =
                new CannotCreateTransactionException("Could not open JPA EntityManager for transaction");
        when(transactionManager.getTransaction(any())).thenThrow(cause);

        ResultStoreUnavailableException ex = assertThrows(
                ResultStoreUnavailableException.class,
                () -> resultStore.countPlayers(TournamentScope.global())
        );

        assertEquals("countPlayers", ex.getOperation());
        assertEquals(cause, ex.getCause());
        verify(playerRepository, never()).count();
    }

    @Test
    void resourceFailureInsideSessionSurfacesAsResultStoreUnavailable() {
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        when(playerRepository.save(any(Player.class)))
                .thenThrow(new DataAccessResourceFailureException("connection reset"));

        ResultStoreUnavailableException ex = assertThrows(
                ResultStoreUnavailableException.class,
                () -> resultStore.insertPlayer("Dee")
        );

        assertEquals("insertPlayer", ex.getOperation());
        assertInstanceOf(DataAccessResourceFailureException.class, ex.getCause());
    }

    @Test
    void insertPlayerTrimsName() {
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        when(playerRepository.save(any(Player.class))).thenAnswer(inv -> {
            Player player = inv.getArgument(0);
            player.setId(11);
            return player;
        });

        Player player = resultStore.insertPlayer("  Marie  ");

        assertEquals(11, player.getId());
        assertEquals("Marie", player.getName());
    }

    @Test
    void countPlayers_tournamentWithoutMatchesCountsEveryone() {
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        when(matchRepository.countByTournamentId(7)).thenReturn(0L);
        when(playerRepository.count()).thenReturn(10L);

        assertEquals(10L, resultStore.countPlayers(TournamentScope.of(7)));
        verify(matchRepository, never()).countDistinctParticipants(any());
    }

    @Test
    void countPlayers_tournamentWithMatchesCountsParticipants() {
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        when(matchRepository.countByTournamentId(16)).thenReturn(5L);
        when(matchRepository.countDistinctParticipants(16)).thenReturn(5L);

        assertEquals(5L, resultStore.countPlayers(TournamentScope.of(16)));
        verify(playerRepository, never()).count();
    }
}
