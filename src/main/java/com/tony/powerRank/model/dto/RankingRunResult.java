package com.tony.powerRank.model.dto;

import com.tony.powerRank.model.TeamCohortStat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Sortie complète d'un passage du moteur.
 */
@Value
@Builder
public class RankingRunResult {
    LocalDate today;
    List<TeamCohortStat> teams;
    // Lignes perspective retenues pour le SOS (après plafonds)
    int gamesUsed;
    List<GameResidual> gameResiduals;
    IngestionReport ingestion;
    boolean mlApplied;
    String mlStatus;
    int mlTrainingRows;
    boolean fromCache;
}
