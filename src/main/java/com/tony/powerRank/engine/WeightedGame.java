package com.tony.powerRank.engine;

import com.tony.powerRank.model.CohortKey;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Match retenu pour une équipe après fenêtre, plafond et écrêtage.
 * rankRecency = 1 pour le plus récent.
 */
@Value
@Builder(toBuilder = true)
public class WeightedGame {
    String gameId;
    LocalDate date;
    String teamId;
    String opponentId;
    CohortKey cohort;
    Integer opponentAge;
    String opponentGender;
    String homeTeamId;

    int rawGoalsFor;
    int rawGoalsAgainst;
    // Après écrêtage des outliers
    double goalsFor;
    double goalsAgainst;
    // Plafonné à ± goalDiffCap
    double goalDiff;

    int rankRecency;
    // Poids de récence normalisé (somme = 1 par équipe)
    double weight;
    long daysSinceGame;

    public boolean isHomePerspective() {
        return teamId.equals(homeTeamId);
    }

    public int rawMargin() {
        return rawGoalsFor - rawGoalsAgainst;
    }
}
