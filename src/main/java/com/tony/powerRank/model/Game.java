package com.tony.powerRank.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

/**
 * Match joué entre deux équipes résolues.
 * Un match produit deux GameRecord (un par perspective) au moment du calcul.
 */
@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "game", indexes = {
        @Index(name = "idx_game_date", columnList = "game_date")
})
public class Game {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Identifiant stable fourni par le provider (clé d'idempotence)
    @Column(name = "game_uid", nullable = false, unique = true)
    private String gameUid;

    @ManyToOne
    @JoinColumn(name = "home_team_id")
    private Team homeTeam;

    @ManyToOne
    @JoinColumn(name = "away_team_id")
    private Team awayTeam;

    @Column(name = "game_date")
    private LocalDate gameDate;

    private Integer homeScore;
    private Integer awayScore;

    private String provider;

    // Résidu ML côté domicile (diagnostic)
    @Column(name = "ml_overperformance")
    private Double mlOverperformance;

    public Game(String gameUid, Team homeTeam, Team awayTeam, LocalDate gameDate) {
        this.gameUid = gameUid;
        this.homeTeam = homeTeam;
        this.awayTeam = awayTeam;
        this.gameDate = gameDate;
    }

    public boolean isPlayed() {
        return homeScore != null && awayScore != null;
    }
}
