package com.tony.powerRank.engine.ml;

import com.tony.powerRank.model.TeamCohortStat;
import com.tony.powerRank.model.dto.GameResidual;

import java.util.List;

/**
 * @param applied false quand la couche est désactivée (config ou entraînement insuffisant)
 */
public record MlLayerResult(List<TeamCohortStat> teams,
                           List<GameResidual> gameResiduals,
                           boolean applied,
                           String status,
                           int trainingRows) {
}
