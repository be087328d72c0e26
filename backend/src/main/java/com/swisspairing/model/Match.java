package com.swisspairing.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * A reported match result. A null {@code tournamentId} places the match in the
 * global scope.
 */
@Getter
@Setter
@Entity
@Table(name = "matches")
public class Match {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "match_id", nullable = false, updatable = false)
    private Integer matchId;

    @Column(name = "tournament_id", updatable = false)
    private Integer tournamentId;

    @Column(name = "winner_id", nullable = false, updatable = false)
    private Integer winnerId;

    @Column(name = "loser_id", nullable = false, updatable = false)
    private Integer loserId;

    @Column(name = "reported_at", nullable = false, updatable = false)
    private OffsetDateTime reportedAt = OffsetDateTime.now();
}
