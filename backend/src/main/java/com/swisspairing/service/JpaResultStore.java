package com.swisspairing.service;

import com.swisspairing.config.SwissPairingProperties;
import com.swisspairing.model.Match;
import com.swisspairing.model.Player;
import com.swisspairing.model.TournamentScope;
import com.swisspairing.repository.MatchRepository;
import com.swisspairing.repository.PlayerRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Result store backed by Spring Data JPA. Each operation runs inside its own
 * transaction template, so the connection is acquired and released per call.
 */
@Service
public class JpaResultStore implements ResultStore {

    private static final Logger log = LoggerFactory.getLogger(JpaResultStore.class);

    private final PlayerRepository playerRepository;
    private final MatchRepository matchRepository;
    private final SwissPairingProperties swissPairingProperties;
    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;

    public JpaResultStore(
            PlayerRepository playerRepository,
            MatchRepository matchRepository,
            SwissPairingProperties swissPairingProperties,
            PlatformTransactionManager transactionManager
    ) {
        this.playerRepository = playerRepository;
        this.matchRepository = matchRepository;
        this.swissPairingProperties = swissPairingProperties;
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
    }

    @PostConstruct
    void logBinding() {
        log.info("Result store bound to dataset '{}'", swissPairingProperties.getStore().getDatabase());
    }

    @Override
    public Player insertPlayer(String name) {
        Player saved = inSession(writeTemplate, "insertPlayer", status -> {
            Player player = new Player();
            player.setName(name.trim());
            player.setCreatedAt(OffsetDateTime.now());
            return playerRepository.save(player);
        });
        log.info("Registered player {} ({})", saved.getId(), saved.getName());
        return saved;
    }

    @Override
    public Match insertMatch(Integer winnerId, Integer loserId, TournamentScope scope) {
        Match saved = inSession(writeTemplate, "insertMatch", status -> {
            Match match = new Match();
            match.setTournamentId(scope.tournamentId());
            match.setWinnerId(winnerId);
            match.setLoserId(loserId);
            match.setReportedAt(OffsetDateTime.now());
            return matchRepository.save(match);
        });
        log.info("Reported match {}: winner={}, loser={}, scope={}",
                saved.getMatchId(), winnerId, loserId, scope);
        return saved;
    }

    @Override
    public long countPlayers(TournamentScope scope) {
        return inSession(readTemplate, "countPlayers", status -> {
            if (scope.isGlobal()) {
                return playerRepository.count();
            }
            Integer tournamentId = scope.tournamentId();
            if (matchRepository.countByTournamentId(tournamentId) == 0) {
                return playerRepository.count();
            }
            return matchRepository.countDistinctParticipants(tournamentId);
        });
    }

    @Override
    public long clearMatches() {
        long deleted = inSession(writeTemplate, "clearMatches", status -> {
            long existing = matchRepository.count();
            matchRepository.deleteAllInBatch();
            return existing;
        });
        log.info("Cleared {} matches", deleted);
        return deleted;
    }

    @Override
    public long clearPlayers() {
        long[] deleted = inSession(writeTemplate, "clearPlayers", status -> {
            long matches = matchRepository.count();
            long players = playerRepository.count();
            // matches.winner_id/loser_id cascade on delete
            playerRepository.deleteAllInBatch();
            return new long[]{players, matches};
        });
        log.info("Cleared {} players (cascaded {} matches)", deleted[0], deleted[1]);
        return deleted[0];
    }

    @Override
    public ScopeSnapshot snapshot(TournamentScope scope) {
        return inSession(readTemplate, "snapshot", status -> {
            List<Player> players = playerRepository.findAllByOrderByIdAsc();
            List<Match> matches = scope.isGlobal()
                    ? matchRepository.findByTournamentIdIsNullOrderByMatchIdAsc()
                    : matchRepository.findByTournamentIdOrderByMatchIdAsc(scope.tournamentId());
            return new ScopeSnapshot(scope, List.copyOf(players), List.copyOf(matches));
        });
    }

    private <T> T inSession(TransactionTemplate template, String operation, TransactionCallback<T> work) {
        try {
            return template.execute(work);
        } catch (CannotCreateTransactionException | DataAccessResourceFailureException ex) {
            log.error("Result store unavailable during {}", operation, ex);
            throw new ResultStoreUnavailableException(operation, ex);
        }
    }
}
