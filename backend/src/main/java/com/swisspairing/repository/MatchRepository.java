package com.swisspairing.repository;

import com.swisspairing.model.Match;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MatchRepository extends JpaRepository<Match, Integer> {
    List<Match> findByTournamentIdOrderByMatchIdAsc(Integer tournamentId);

    List<Match> findByTournamentIdIsNullOrderByMatchIdAsc();

    long countByTournamentId(Integer tournamentId);

    @Query(value = """
            SELECT COUNT(*)
            FROM (
                SELECT winner_id AS player_id FROM matches WHERE tournament_id = :tournamentId
                UNION
                SELECT loser_id AS player_id FROM matches WHERE tournament_id = :tournamentId
            ) participants
            """, nativeQuery = true)
    long countDistinctParticipants(@Param("tournamentId") Integer tournamentId);
}
