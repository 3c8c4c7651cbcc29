package com.tony.powerRank.engine;

import com.tony.powerRank.model.TeamCohortStat;
import com.tony.powerRank.model.dto.IngestionReport;

import java.util.List;

/**
 * Sortie déterministe des étapes 1 à 4 (mise en cache). La couche ML n'en fait pas partie.
 */
public record StageOutput(List<TeamCohortStat> teams,
                          List<WeightedGame> games,
                          IngestionReport report,
                          int sosEdges) {
}
