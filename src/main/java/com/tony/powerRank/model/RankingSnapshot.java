package com.tony.powerRank.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

/**
 * Photo quotidienne du rang d'une équipe, base du calcul des deltas 7j/30j.
 */
@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "ranking_snapshot",
        uniqueConstraints = @UniqueConstraint(columnNames = {"team_id", "snapshot_date"}),
        indexes = @Index(name = "idx_snapshot_date", columnList = "snapshot_date"))
public class RankingSnapshot {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "team_id", nullable = false, length = 64)
    private String teamId;

    @Column(name = "snapshot_date", nullable = false)
    private LocalDate snapshotDate;

    private Integer age;
    private String gender;

    private Integer rankInCohort;
    private Integer rankInCohortMl;
    private Double powerScoreFinal;
    private Double powerscoreMl;

    public RankingSnapshot(String teamId, LocalDate snapshotDate) {
        this.teamId = teamId;
        this.snapshotDate = snapshotDate;
    }

    /**
     * Rang de référence : rang ML s'il existe, sinon rang de cohorte.
     */
    public Integer effectiveRank() {
        return rankInCohortMl != null ? rankInCohortMl : rankInCohort;
    }
}
