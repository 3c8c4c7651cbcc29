package com.tony.powerRank.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Un match vu depuis une équipe. Chaque match produit deux enregistrements
 * (domicile et extérieur) partageant le même gameId.
 * Les champs nullables reflètent des données amont incomplètes : ces lignes sont ignorées.
 */
@Value
@Builder(toBuilder = true)
public class GameRecord {
    String gameId;
    LocalDate date;
    String teamId;
    String opponentId;
    Integer age;
    String gender;
    Integer opponentAge;
    String opponentGender;
    Integer goalsFor;
    Integer goalsAgainst;
    String homeTeamId;

    public CohortKey cohort() {
        return new CohortKey(age, gender);
    }

    public boolean isHomePerspective() {
        return teamId != null && teamId.equals(homeTeamId);
    }
}
