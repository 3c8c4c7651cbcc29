package com.tony.powerRank.engine;

import com.tony.powerRank.model.TeamCohortStat;
import com.tony.powerRank.model.dto.IngestionReport;

import java.util.List;

/**
 * Sortie de l'agrégation : une ligne par équipe × cohorte, les matchs retenus,
 * et le comptage des lignes perspective ignorées.
 */
public record AggregationResult(List<TeamCohortStat> teams, List<WeightedGame> games, IngestionReport report) {
}
