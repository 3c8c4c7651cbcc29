package com.tony.powerRank.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Classement courant d'une équipe (une ligne par équipe, mise à jour à chaque calcul).
 */
@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "team_ranking",
        uniqueConstraints = @UniqueConstraint(columnNames = {"team_id"}),
        indexes = @Index(name = "idx_ranking_cohort", columnList = "age, gender, rank_in_cohort"))
public class TeamRanking {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "team_id", nullable = false, length = 64)
    private String teamId;

    private Integer age;
    private String gender;

    // --- Échantillon ---
    private Integer gamesPlayed;
    private Integer gamesLast180Days;
    private LocalDate lastGameDate;

    @Enumerated(EnumType.STRING)
    private TeamStatus status;

    @Enumerated(EnumType.STRING)
    private SampleFlag sampleFlag;

    // --- Attaque / Défense ---
    private Double offRaw;
    private Double defRaw;
    private Double offShrunk;
    private Double defShrunk;
    private Double offNorm;
    private Double defNorm;
    private Double absStrength;

    // --- SOS ---
    private Double sosRaw;
    private Double sos;
    private Double sosNorm;
    private Integer sosRank;
    private Double scf;
    private Integer bridgeGames;
    private Boolean isolated;
    private Integer componentId;
    private Integer componentSize;

    // --- Scores ---
    private Double perfCentered;
    private Double powerscoreCore;
    private Double provisionalMult;
    private Double powerscoreAdj;
    private Double powerScoreFinal;
    private Double mlOverperf;
    private Double mlNorm;
    private Double powerscoreMl;

    @Column(name = "rank_in_cohort")
    private Integer rankInCohort;
    private Integer rankInCohortMl;
    private Integer rankChange7d;
    private Integer rankChange30d;

    private LocalDateTime lastCalculated;

    public TeamRanking(String teamId) {
        this.teamId = teamId;
    }
}
